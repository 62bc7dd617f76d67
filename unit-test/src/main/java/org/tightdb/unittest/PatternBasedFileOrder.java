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

import org.tightdb.util.Linq;
import org.tightdb.util.WildcardPattern;

import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders tests by the file that declares them.
 * Files are grouped in bands by a list of patterns: a file belongs to the band of
 * the first pattern it matches, and files that match no pattern come last.
 * Within a band tests are ordered by file name and then by their index in the registry.
 *
 * <p>The band of each test is computed once and cached in the comparator,
 * so a comparator should be used for one sort only.
 */
public class PatternBasedFileOrder implements Comparator<TestDetails> {
    private final List<WildcardPattern> patterns;
    private final Map<TestDetails, Integer> majorKeys = new IdentityHashMap<>();

    public PatternBasedFileOrder(String... patterns) {
        this(Linq.list(patterns));
    }

    public PatternBasedFileOrder(List<String> patterns) {
        this.patterns = Linq.map(patterns, WildcardPattern::new);
    }

    int getMajor(TestDetails details) {
        Integer major = this.majorKeys.get(details);
        if (major != null)
            return major;
        int index = 0;
        while (index < this.patterns.size() && !this.patterns.get(index).match(details.fileName))
            index++;
        this.majorKeys.put(details, index);
        return index;
    }

    @Override
    public int compare(TestDetails a, TestDetails b) {
        int majorA = this.getMajor(a);
        int majorB = this.getMajor(b);
        if (majorA != majorB)
            return Integer.compare(majorA, majorB);
        int byFile = a.fileName.compareTo(b.fileName);
        if (byFile != 0)
            return byFile;
        return Long.compare(a.testIndex, b.testIndex);
    }
}
