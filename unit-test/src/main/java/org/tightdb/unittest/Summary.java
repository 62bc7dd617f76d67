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

/**
 * Aggregate statistics of one test run.
 */
public class Summary {
    public final long includedTests;
    public final long failedTests;
    public final long excludedTests;
    public final long disabledTests;
    public final long checks;
    public final long failedChecks;
    public final double elapsedSeconds;

    public Summary(long includedTests, long failedTests, long excludedTests, long disabledTests,
                   long checks, long failedChecks, double elapsedSeconds) {
        this.includedTests = includedTests;
        this.failedTests = failedTests;
        this.excludedTests = excludedTests;
        this.disabledTests = disabledTests;
        this.checks = checks;
        this.failedChecks = failedChecks;
        this.elapsedSeconds = elapsedSeconds;
    }

    public boolean isSuccess() {
        return this.failedTests == 0;
    }

    @Override
    public String toString() {
        return "Summary{" +
                "included=" + this.includedTests +
                ", failed=" + this.failedTests +
                ", excluded=" + this.excludedTests +
                ", disabled=" + this.disabledTests +
                ", checks=" + this.checks +
                ", failedChecks=" + this.failedChecks +
                ", elapsed=" + this.elapsedSeconds +
                '}';
    }
}
