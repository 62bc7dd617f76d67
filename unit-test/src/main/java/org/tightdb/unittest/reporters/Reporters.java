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
import org.tightdb.util.Linq;

import java.util.List;

/**
 * Helpers for building reporters.
 */
public class Reporters {
    private Reporters() {}

    /**
     * A reporter that forwards every event to each of the given reporters, in order.
     */
    public static Reporter combine(Reporter... reporters) {
        return combine(Linq.list(reporters));
    }

    public static Reporter combine(List<Reporter> reporters) {
        return new Reporter() {
            @Override
            public void begin(TestDetails details) {
                for (Reporter reporter : reporters)
                    reporter.begin(details);
            }

            @Override
            public void fail(TestDetails details, String message) {
                for (Reporter reporter : reporters)
                    reporter.fail(details, message);
            }

            @Override
            public void end(TestDetails details, double elapsedSeconds) {
                for (Reporter reporter : reporters)
                    reporter.end(details, elapsedSeconds);
            }

            @Override
            public void summary(Summary summary) {
                for (Reporter reporter : reporters)
                    reporter.summary(summary);
            }
        };
    }
}
