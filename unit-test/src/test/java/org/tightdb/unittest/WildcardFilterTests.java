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

import org.junit.Assert;
import org.junit.Test;

public class WildcardFilterTests {
    static boolean accepts(Filter filter, String name) {
        return filter.include(new TestDetails("suite", name, "file.cpp", 1, 0));
    }

    @Test
    public void includeAndExclude() {
        Filter filter = new WildcardFilter("foo* -bar*");
        Assert.assertTrue(accepts(filter, "foo1"));
        Assert.assertFalse(accepts(filter, "bar1"));
        Assert.assertFalse(accepts(filter, "baz"));
    }

    @Test
    public void literalPatterns() {
        Filter filter = new WildcardFilter("foo -bar");
        Assert.assertTrue(accepts(filter, "foo"));
        Assert.assertFalse(accepts(filter, "foo1"));
        Assert.assertFalse(accepts(filter, "bar"));
        Assert.assertFalse(accepts(filter, "baz"));
    }

    @Test
    public void emptyFilterIncludesEverything() {
        Filter filter = new WildcardFilter("");
        Assert.assertTrue(accepts(filter, "anything"));
        Assert.assertTrue(accepts(filter, ""));
        Assert.assertTrue(accepts(new WildcardFilter("   "), "x"));
        Assert.assertTrue(accepts(Filter.acceptAll(), "x"));
    }

    @Test
    public void onlyExclusions() {
        WildcardFilter filter = new WildcardFilter("- *_Slow Big?");
        Assert.assertEquals(1, filter.getIncludePatterns().size());
        Assert.assertEquals(2, filter.getExcludePatterns().size());
        Assert.assertTrue(accepts(filter, "Table_Fast"));
        Assert.assertFalse(accepts(filter, "Table_Slow"));
        Assert.assertFalse(accepts(filter, "Big1"));
        Assert.assertTrue(accepts(filter, "Big12"));
    }

    @Test
    public void excludeWins() {
        Filter filter = new WildcardFilter("Table_* - Table_*");
        Assert.assertFalse(accepts(filter, "Table_Insert"));
    }

    @Test
    public void dashIsOneWay() {
        // A second dash changes nothing.
        WildcardFilter filter = new WildcardFilter("a* - b* c* - d*");
        Assert.assertEquals(1, filter.getIncludePatterns().size());
        Assert.assertEquals(3, filter.getExcludePatterns().size());
        Assert.assertTrue(accepts(filter, "a1"));
        Assert.assertFalse(accepts(filter, "c1"));
    }

    @Test
    public void tabsSeparatePatterns() {
        Filter filter = new WildcardFilter("x*\t-\ty*");
        Assert.assertTrue(accepts(filter, "x1"));
        Assert.assertFalse(accepts(filter, "y1"));
    }

    @Test
    public void onlyTheNameMatters() {
        Filter filter = new WildcardFilter("Table_*");
        Assert.assertFalse(filter.include(new TestDetails("Table_suite", "Query", "Table_file.cpp", 1, 0)));
    }
}
