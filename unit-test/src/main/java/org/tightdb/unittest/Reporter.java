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
 * Receives the events of a test run.
 * All methods do nothing by default.
 *
 * <p>Calls made while tests are running come from the worker threads,
 * but never concurrently: the runner serializes them.
 * Implementations do not need to be thread-safe.
 */
public interface Reporter {
    /**
     * A reporter that ignores every event.
     */
    Reporter NONE = new Reporter() {};

    /**
     * A test is about to start.
     */
    default void begin(TestDetails details) {}

    /**
     * A check failed, or the test failed as a whole.
     * @param details  Details of the test; file and line are those of the failure.
     * @param message  Description of the failure.
     */
    default void fail(TestDetails details, String message) {}

    /**
     * A test completed.
     * @param details         Details of the test.
     * @param elapsedSeconds  Time taken by the test.
     */
    default void end(TestDetails details, double elapsedSeconds) {}

    /**
     * Called once, after all tests completed.
     */
    default void summary(Summary summary) {}
}
