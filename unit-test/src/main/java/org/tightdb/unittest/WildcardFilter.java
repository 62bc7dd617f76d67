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

import org.tightdb.util.WildcardPattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Selects tests by name using wildcard patterns.
 *
 * <p>The filter string is a whitespace-separated list of patterns.
 * A token consisting of a single '-' makes every following pattern an
 * exclusion pattern.  A test is included if its name matches none of the
 * exclusion patterns and at least one of the inclusion patterns.
 * If there are no inclusion patterns, every name is included.
 * For example "Table_* -Table_Big*" runs all the table tests except the big ones.
 */
public class WildcardFilter implements Filter {
    private final List<WildcardPattern> include = new ArrayList<>();
    private final List<WildcardPattern> exclude = new ArrayList<>();

    public WildcardFilter(String filter) {
        boolean excluding = false;
        int i = 0;
        int end = filter.length();
        while (true) {
            while (i < end && Character.isWhitespace(filter.charAt(i)))
                i++;
            if (i == end)
                break;
            int wordStart = i;
            while (i < end && !Character.isWhitespace(filter.charAt(i)))
                i++;
            String word = filter.substring(wordStart, i);
            if (word.equals("-")) {
                excluding = true;
                continue;
            }
            List<WildcardPattern> patterns = excluding ? this.exclude : this.include;
            patterns.add(new WildcardPattern(word));
        }

        if (this.include.isEmpty())
            this.include.add(new WildcardPattern("*"));
    }

    public List<WildcardPattern> getIncludePatterns() {
        return Collections.unmodifiableList(this.include);
    }

    public List<WildcardPattern> getExcludePatterns() {
        return Collections.unmodifiableList(this.exclude);
    }

    @Override
    public boolean include(TestDetails details) {
        String name = details.testName;
        for (WildcardPattern pattern : this.exclude) {
            if (pattern.match(name))
                return false;
        }
        for (WildcardPattern pattern : this.include) {
            if (pattern.match(name))
                return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "WildcardFilter{include=" + this.include + ", exclude=" + this.exclude + "}";
    }
}
