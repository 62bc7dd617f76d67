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

import org.junit.Assert;
import org.junit.Test;
import org.tightdb.unittest.Reporter;
import org.tightdb.unittest.Summary;
import org.tightdb.unittest.TestDetails;
import org.tightdb.unittest.TestList;
import org.tightdb.unittest.TestUnit;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class XmlReporterTests {
    @Test
    public void documentLayout() {
        StringBuilder output = new StringBuilder();
        XmlReporter reporter = new XmlReporter(output);
        TestDetails second = new TestDetails("table", "Table_Delete", "table.cpp", 20, 1);
        TestDetails first = new TestDetails("table", "Table_Insert", "table.cpp", 10, 0);
        // Events arrive out of order from different workers.
        reporter.begin(second);
        reporter.begin(first);
        reporter.fail(second.withLocation("table.cpp", 25), "CHECK(ok) failed");
        reporter.end(first, 0.5);
        reporter.end(second, 0.25);
        reporter.summary(new Summary(2, 1, 0, 0, 7, 1, 1.5));

        Assert.assertEquals(
                "<?xml version=\"1.0\"?>\n" +
                "<unittest-results tests=\"2\" failedtests=\"1\" checks=\"7\" failures=\"1\" time=\"1.5\">\n" +
                "  <test suite=\"table\" name=\"Table_Insert\" time=\"0.5\"/>\n" +
                "  <test suite=\"table\" name=\"Table_Delete\" time=\"0.25\">\n" +
                "    <failure message=\"table.cpp(25) : CHECK(ok) failed\"/>\n" +
                "  </test>\n" +
                "</unittest-results>\n", output.toString());
    }

    @Test
    public void reservedCharactersAreEscaped() {
        StringBuilder output = new StringBuilder();
        XmlReporter reporter = new XmlReporter(output);
        TestDetails details = new TestDetails("a&b", "<name>", "file.cpp", 1, 0);
        reporter.begin(details);
        reporter.fail(details, "'x' != \"y\"");
        reporter.end(details, 0);
        reporter.summary(new Summary(1, 1, 0, 0, 1, 1, 0));
        String xml = output.toString();
        Assert.assertTrue(xml, xml.contains("suite=\"a&amp;b\""));
        Assert.assertTrue(xml, xml.contains("name=\"&lt;name&gt;\""));
        Assert.assertTrue(xml, xml.contains("message=\"file.cpp(1) : &apos;x&apos; != &quot;y&quot;\""));
    }

    static long attribute(String xml, String name) {
        Matcher matcher = Pattern.compile(" " + name + "=\"(\\d+)\"").matcher(xml);
        Assert.assertTrue(name, matcher.find());
        return Long.parseLong(matcher.group(1));
    }

    @Test
    public void countsMatchTheSummary() {
        TestList list = new TestList();
        for (int i = 0; i < 20; i++) {
            int id = i;
            list.add(TestUnit.of(t -> {
                t.check(true);
                t.check(id % 3 != 0, "id % 3 != 0");
                if (id % 5 == 0)
                    throw new IllegalStateException("five");
            }), "suite", "T" + i, "f.cpp", i);
        }
        StringBuilder output = new StringBuilder();
        XmlReporter xml = new XmlReporter(output);
        Summary[] summary = new Summary[1];
        list.run(Reporters.combine(xml, new Reporter() {
            @Override
            public void summary(Summary s) {
                summary[0] = s;
            }
        }), null, 4, true);

        String document = output.toString();
        Assert.assertNotNull(summary[0]);
        Assert.assertEquals(summary[0].includedTests, attribute(document, "tests"));
        Assert.assertEquals(summary[0].failedTests, attribute(document, "failedtests"));
        Assert.assertEquals(summary[0].checks, attribute(document, "checks"));
        Assert.assertEquals(summary[0].failedChecks, attribute(document, "failures"));
        Assert.assertEquals(20, summary[0].includedTests);
        // ids 0, 3, 6, 9, 12, 15, 18 fail a check; 0, 5, 10, 15 throw.
        Assert.assertEquals(9, summary[0].failedTests);
        Assert.assertEquals(40, summary[0].checks);
        Assert.assertEquals(7, summary[0].failedChecks);

        int elements = document.split("<test ", -1).length - 1;
        Assert.assertEquals(20, elements);
        int failures = document.split("<failure ", -1).length - 1;
        Assert.assertEquals(11, failures);
        // Tests are listed by index even though they ran shuffled.
        Assert.assertTrue(document.indexOf("name=\"T1\"") < document.indexOf("name=\"T2\""));
    }
}
