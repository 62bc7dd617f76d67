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
import org.tightdb.util.Timer;

import java.io.PrintStream;

/**
 * Reports to the console in a human-readable form.
 * Failures go to the error stream, everything else to the output stream.
 */
public class ConsoleReporter implements Reporter {
    private final boolean reportProgress;
    private final PrintStream out;
    private final PrintStream err;

    public ConsoleReporter(boolean reportProgress) {
        this(reportProgress, System.out, System.err);
    }

    public ConsoleReporter(boolean reportProgress, PrintStream out, PrintStream err) {
        this.reportProgress = reportProgress;
        this.out = out;
        this.err = err;
    }

    @Override
    public void begin(TestDetails details) {
        if (!this.reportProgress)
            return;
        this.out.println(details.fileName + ":" + details.lineNumber + ": Begin " + details.testName);
    }

    @Override
    public void fail(TestDetails details, String message) {
        this.err.println(details.fileName + ":" + details.lineNumber +
                ": ERROR in " + details.testName + ": " + message);
    }

    @Override
    public void summary(Summary summary) {
        this.out.println();
        if (summary.failedTests == 0) {
            this.out.println("Success: All " + summary.includedTests + " tests passed (" +
                    summary.checks + " checks).");
        } else {
            this.err.println("FAILURE: " + summary.failedTests + " out of " + summary.includedTests +
                    " tests failed (" + summary.failedChecks + " out of " + summary.checks +
                    " checks failed).");
        }
        this.out.println("Test time: " + Timer.format(summary.elapsedSeconds));
        if (summary.excludedTests == 1) {
            this.out.println();
            this.out.println("Note: One test was excluded!");
        } else if (summary.excludedTests > 1) {
            this.out.println();
            this.out.println("Note: " + summary.excludedTests + " tests were excluded!");
        }
        this.out.flush();
        this.err.flush();
    }
}
