/*
 * Copyright 2023 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.tightdb.unittest.reporters;

import org.tightdb.unittest.Reporter;
import org.tightdb.unittest.Summary;
import org.tightdb.unittest.TestDetails;

import javax.annotation.Nullable;
import java.io.Flushable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A reporter that collects the results of all tests in memory
 * and renders them as one document when the run is over.
 * Results are kept in test index order.
 */
public abstract class DocumentReporter implements Reporter {
    public static class Failure {
        public final TestDetails details;
        public final String message;

        Failure(TestDetails details, String message) {
            this.details = details;
            this.message = message;
        }
    }

    public static class TestRecord {
        @Nullable
        public TestDetails details;
        public final List<Failure> failures = new ArrayList<>();
        public double elapsedSeconds;
    }

    private final Map<Long, TestRecord> tests = new TreeMap<>();
    protected final Appendable output;

    protected DocumentReporter(Appendable output) {
        this.output = output;
    }

    TestRecord getRecord(TestDetails details) {
        return this.tests.computeIfAbsent(details.getTestIndex(), k -> new TestRecord());
    }

    @Override
    public void begin(TestDetails details) {
        this.getRecord(details).details = details;
    }

    @Override
    public void fail(TestDetails details, String message) {
        this.getRecord(details).failures.add(new Failure(details, message));
    }

    @Override
    public void end(TestDetails details, double elapsedSeconds) {
        this.getRecord(details).elapsedSeconds = elapsedSeconds;
    }

    protected Collection<TestRecord> getRecords() {
        return this.tests.values();
    }

    /**
     * Produce the document for the collected results.
     */
    protected abstract String render(Summary summary);

    @Override
    public void summary(Summary summary) {
        String document = this.render(summary);
        try {
            this.output.append(document);
            if (this.output instanceof Flushable)
                ((Flushable) this.output).flush();
        } catch (IOException ex) {
            throw new RuntimeException(ex);
        }
    }
}
