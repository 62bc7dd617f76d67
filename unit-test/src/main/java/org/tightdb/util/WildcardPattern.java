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

package org.tightdb.util;

/**
 * Glob-style pattern matched against a whole string.
 * '*' matches any (possibly empty) run of characters,
 * '?' matches exactly one character, anything else matches itself.
 */
public class WildcardPattern {
    private final String pattern;

    public WildcardPattern(String pattern) {
        this.pattern = pattern;
    }

    /**
     * True if the pattern matches the complete text.
     */
    public boolean match(String text) {
        int p = 0;
        int t = 0;
        // Position of the last '*' seen in the pattern, and the text position it was tried at.
        int star = -1;
        int starText = 0;
        while (t < text.length()) {
            if (p < this.pattern.length()) {
                char c = this.pattern.charAt(p);
                if (c == '*') {
                    star = p++;
                    starText = t;
                    continue;
                }
                if (c == '?' || c == text.charAt(t)) {
                    p++;
                    t++;
                    continue;
                }
            }
            if (star < 0)
                return false;
            // Let the last star swallow one more character.
            p = star + 1;
            t = ++starText;
        }
        while (p < this.pattern.length() && this.pattern.charAt(p) == '*')
            p++;
        return p == this.pattern.length();
    }

    @Override
    public String toString() {
        return this.pattern;
    }
}
