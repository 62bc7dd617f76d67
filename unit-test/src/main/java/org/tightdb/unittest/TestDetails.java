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
 * Identity of a registered test: where it was declared and its position in the registry.
 * Everything but the index is fixed at registration; the index changes only
 * when the registry renumbers its tests.
 */
public class TestDetails {
    public final String suiteName;
    public final String testName;
    public final String fileName;
    public final long lineNumber;
    long testIndex;

    public TestDetails(String suiteName, String testName, String fileName, long lineNumber, long testIndex) {
        this.suiteName = suiteName;
        this.testName = testName;
        this.fileName = fileName;
        this.lineNumber = lineNumber;
        this.testIndex = testIndex;
    }

    public long getTestIndex() {
        return this.testIndex;
    }

    /**
     * A copy of these details pointing at a different source location.
     * Used to report a failed check at the place where the check was made.
     */
    public TestDetails withLocation(String fileName, long lineNumber) {
        return new TestDetails(this.suiteName, this.testName, fileName, lineNumber, this.testIndex);
    }

    @Override
    public String toString() {
        return "TestDetails{" +
                "suite=" + this.suiteName +
                ", name=" + this.testName +
                ", location=" + this.fileName + ":" + this.lineNumber +
                ", index=" + this.testIndex +
                '}';
    }
}
