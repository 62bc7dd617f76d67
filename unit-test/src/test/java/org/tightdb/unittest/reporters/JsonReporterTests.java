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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Assert;
import org.junit.Test;
import org.tightdb.unittest.Summary;
import org.tightdb.unittest.TestDetails;

public class JsonReporterTests {
    @Test
    public void documentContents() throws Exception {
        StringBuilder output = new StringBuilder();
        JsonReporter reporter = new JsonReporter(output);
        TestDetails ok = new TestDetails("query", "Query_Find", "query.cpp", 3, 0);
        TestDetails bad = new TestDetails("query", "Query_<Sort>", "query.cpp", 9, 1);
        reporter.begin(ok);
        reporter.end(ok, 0.125);
        reporter.begin(bad);
        reporter.fail(bad.withLocation("query.cpp", 11), "CHECK_EQUAL(a, b) failed with (\"1\", 2)");
        reporter.end(bad, 0.5);
        reporter.summary(new Summary(2, 1, 3, 4, 10, 1, 2.0));

        JsonNode root = new ObjectMapper().readTree(output.toString());
        Assert.assertEquals(2, root.get("tests").asLong());
        Assert.assertEquals(1, root.get("failedtests").asLong());
        Assert.assertEquals(10, root.get("checks").asLong());
        Assert.assertEquals(1, root.get("failures").asLong());
        Assert.assertEquals(3, root.get("excluded").asLong());
        Assert.assertEquals(4, root.get("disabled").asLong());
        Assert.assertEquals(2.0, root.get("time").asDouble(), 0);

        JsonNode results = root.get("results");
        Assert.assertEquals(2, results.size());
        Assert.assertEquals("Query_Find", results.get(0).get("name").asText());
        Assert.assertEquals(0, results.get(0).get("failures").size());
        JsonNode failure = results.get(1).get("failures").get(0);
        Assert.assertEquals("Query_<Sort>", results.get(1).get("name").asText());
        Assert.assertEquals("query.cpp", failure.get("file").asText());
        Assert.assertEquals(11, failure.get("line").asLong());
        Assert.assertEquals("CHECK_EQUAL(a, b) failed with (\"1\", 2)", failure.get("message").asText());
    }
}
