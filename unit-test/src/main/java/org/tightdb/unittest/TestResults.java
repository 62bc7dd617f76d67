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

package org.tightdb.unittest;

import javax.annotation.Nullable;
import java.math.BigDecimal;

/**
 * Records the outcome of the checks made by a test.
 * A test's results are bound to the worker running it for the duration
 * of its body; recording outside of that window is an error.
 */
public class TestResults {
    private final TestUnit test;
    @Nullable
    private volatile ExecContext context;

    TestResults(TestUnit test) {
        this.test = test;
        this.context = null;
    }

    void setContext(@Nullable ExecContext context) {
        this.context = context;
    }

    private ExecContext getContext() {
        ExecContext result = this.context;
        if (result == null)
            throw new IllegalStateException("Test " + this.test.getDetails().testName + " is not running");
        return result;
    }

    public void checkSucceeded() {
        ExecContext context = this.getContext();
        synchronized (context.lock) {
            context.numChecks++;
        }
    }

    /**
     * Record a failed check.
     * @param file     File containing the check.
     * @param line     Line of the check.
     * @param message  Description of the failure.
     */
    public void checkFailed(String file, long line, String message) {
        ExecContext context = this.getContext();
        synchronized (context.lock) {
            context.numChecks++;
            context.numFailedChecks++;
            context.errorsSeen = true;
        }
        TestDetails details = this.test.getDetails().withLocation(file, line);
        SharedContext shared = context.shared;
        synchronized (shared.lock) {
            shared.reporter.fail(details, message);
        }
    }

    /**
     * Record a failure that is not tied to a check, such as an exception
     * escaping the test body.  It is reported at the test's declaration.
     */
    public void testFailed(String message) {
        ExecContext context = this.getContext();
        synchronized (context.lock) {
            context.errorsSeen = true;
        }
        SharedContext shared = context.shared;
        synchronized (shared.lock) {
            shared.reporter.fail(this.test.getDetails(), message);
        }
    }

    public void condFailed(String file, long line, String macroName, String condText) {
        String message = macroName + "(" + condText + ") failed";
        this.checkFailed(file, line, message);
    }

    public void compareFailed(String file, long line, String macroName,
                              String aText, String bText, String aValue, String bValue) {
        String message = macroName + "(" + aText + ", " + bText + ") failed with (" +
                aValue + ", " + bValue + ")";
        this.checkFailed(file, line, message);
    }

    /**
     * Comparison with a tolerance failed.
     * The values are printed exactly, so that the reader can see how far off they are.
     */
    public void inexactCompareFailed(String file, long line, String macroName,
                                     String aText, String bText, String epsText,
                                     double a, double b, double eps) {
        String message = macroName + "(" + aText + ", " + bText + ", " + epsText + ") failed with (" +
                exact(a) + ", " + exact(b) + ", " + exact(eps) + ")";
        this.checkFailed(file, line, message);
    }

    static String exact(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value))
            return Double.toString(value);
        return new BigDecimal(value).toPlainString();
    }

    public void throwFailed(String file, long line, String exprText, String exceptionName) {
        String message = "CHECK_THROW(" + exprText + ", " + exceptionName + ") failed: Did not throw";
        this.checkFailed(file, line, message);
    }

    public void throwWrongTypeFailed(String file, long line, String macroName, String exprText,
                                     String exceptionName, String thrownName) {
        String message = macroName + "(" + exprText + ", " + exceptionName + ") failed: Threw " + thrownName;
        this.checkFailed(file, line, message);
    }

    public void throwExFailed(String file, long line, String exprText, String exceptionName,
                              String exceptionCondText) {
        String message = "CHECK_THROW_EX(" + exprText + ", " + exceptionName + ", " +
                exceptionCondText + ") failed: Did not throw";
        this.checkFailed(file, line, message);
    }

    public void throwExCondFailed(String file, long line, String exprText, String exceptionName,
                                  String exceptionCondText) {
        String message = "CHECK_THROW_EX(" + exprText + ", " + exceptionName + ", " +
                exceptionCondText + ") failed: Did throw, but condition failed";
        this.checkFailed(file, line, message);
    }

    public void throwAnyFailed(String file, long line, String exprText) {
        String message = "CHECK_THROW_ANY(" + exprText + ") failed: Did not throw";
        this.checkFailed(file, line, message);
    }
}
