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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.tightdb.unittest.Summary;
import org.tightdb.unittest.TestDetails;

/**
 * Writes the results of a run as a JSON document.
 * Carries the same information as the {@link XmlReporter} document,
 * plus the excluded and disabled counts.
 */
public class JsonReporter extends DocumentReporter {
    private final ObjectMapper mapper = new ObjectMapper();

    public JsonReporter(Appendable output) {
        super(output);
    }

    ObjectNode toJson(Summary summary) {
        ObjectNode result = this.mapper.createObjectNode();
        result.put("tests", summary.includedTests);
        result.put("failedtests", summary.failedTests);
        result.put("checks", summary.checks);
        result.put("failures", summary.failedChecks);
        result.put("excluded", summary.excludedTests);
        result.put("disabled", summary.disabledTests);
        result.put("time", summary.elapsedSeconds);
        ArrayNode tests = result.putArray("results");
        for (TestRecord test : this.getRecords()) {
            TestDetails details = test.details;
            if (details == null)
                continue;
            ObjectNode node = tests.addObject();
            node.put("suite", details.suiteName);
            node.put("name", details.testName);
            node.put("time", test.elapsedSeconds);
            ArrayNode failures = node.putArray("failures");
            for (Failure failure : test.failures) {
                ObjectNode f = failures.addObject();
                f.put("file", failure.details.fileName);
                f.put("line", failure.details.lineNumber);
                f.put("message", failure.message);
            }
        }
        return result;
    }

    @Override
    protected String render(Summary summary) {
        try {
            return this.mapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(this.toJson(summary)) + "\n";
        } catch (JsonProcessingException ex) {
            throw new RuntimeException(ex);
        }
    }
}
