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

import org.tightdb.unittest.Summary;
import org.tightdb.unittest.TestDetails;

import static org.tightdb.util.Utilities.xmlEscape;

/**
 * Writes the results of a run as an XML document, for consumption by build servers.
 *
 * <pre>
 * &lt;unittest-results tests="2" failedtests="1" checks="5" failures="1" time="0.25"&gt;
 *   &lt;test suite="table" name="Table_Insert" time="0.1"/&gt;
 *   &lt;test suite="table" name="Table_Delete" time="0.15"&gt;
 *     &lt;failure message="table.cpp(12) : CHECK(ok) failed"/&gt;
 *   &lt;/test&gt;
 * &lt;/unittest-results&gt;
 * </pre>
 */
public class XmlReporter extends DocumentReporter {
    public XmlReporter(Appendable output) {
        super(output);
    }

    @Override
    protected String render(Summary summary) {
        StringBuilder builder = new StringBuilder();
        builder.append("<?xml version=\"1.0\"?>\n")
                .append("<unittest-results ")
                .append("tests=\"").append(summary.includedTests).append("\" ")
                .append("failedtests=\"").append(summary.failedTests).append("\" ")
                .append("checks=\"").append(summary.checks).append("\" ")
                .append("failures=\"").append(summary.failedChecks).append("\" ")
                .append("time=\"").append(summary.elapsedSeconds).append("\">\n");
        for (TestRecord test : this.getRecords()) {
            TestDetails details = test.details;
            if (details == null)
                continue;
            builder.append("  <test suite=\"").append(xmlEscape(details.suiteName)).append("\" ")
                    .append("name=\"").append(xmlEscape(details.testName)).append("\" ")
                    .append("time=\"").append(test.elapsedSeconds).append("\"");
            if (test.failures.isEmpty()) {
                builder.append("/>\n");
                continue;
            }
            builder.append(">\n");
            for (Failure failure : test.failures) {
                builder.append("    <failure message=\"")
                        .append(xmlEscape(failure.details.fileName))
                        .append("(").append(failure.details.lineNumber).append(") : ")
                        .append(xmlEscape(failure.message))
                        .append("\"/>\n");
            }
            builder.append("  </test>\n");
        }
        builder.append("</unittest-results>\n");
        return builder.toString();
    }
}
