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
 * Registered through META-INF/services; populates the default test list.
 */
public class SampleRegistration implements TestRegistration {
    @Override
    public void register(TestList list) {
        list.add(TestUnit.of(t -> t.checkEqual(4, 2 + 2)), "sample", "Sample_Arithmetic", "Sample.java", 10);
        list.add(TestUnit.of(t -> t.check("abc".startsWith("a"), "startsWith")),
                "sample", "Sample_Strings", "Sample.java", 20);
        list.add(new TestUnit() {
            @Override
            public boolean isEnabled() {
                return false;
            }

            @Override
            public void run() {
                this.check(false, "never runs");
            }
        }, "sample", "Sample_Disabled", "Sample.java", 30);
    }
}
