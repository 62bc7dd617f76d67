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

package org.tightdb.unittest.cli;

import com.beust.jcommander.ParameterException;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.tightdb.unittest.TestList;
import org.tightdb.unittest.TestUnit;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

public class MainTests {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    final ByteArrayOutputStream err = new ByteArrayOutputStream();
    final Map<String, String> environment = new HashMap<>();

    int execute(TestList list, String... argv) {
        Main main = new Main(
                new PrintStream(this.out, true, StandardCharsets.UTF_8),
                new PrintStream(this.err, true, StandardCharsets.UTF_8));
        return main.execute(list, this.environment, argv);
    }

    String out() {
        return this.out.toString(StandardCharsets.UTF_8);
    }

    String err() {
        return this.err.toString(StandardCharsets.UTF_8);
    }

    static TestList list(boolean failing) {
        TestList list = new TestList();
        list.add(TestUnit.of(t -> t.check(true)), "cli", "Cli_Pass", "b_cli.cpp", 1);
        list.add(TestUnit.of(t -> t.check(!failing, "!failing")), "cli", "Cli_Maybe", "a_cli.cpp", 2);
        return list;
    }

    @Test
    public void passingRun() {
        int status = this.execute(list(false), "-t", "4");
        Assert.assertEquals(Main.SUCCESS, status);
        Assert.assertTrue(this.out(), this.out().contains("Success: All 2 tests passed (2 checks)."));
    }

    @Test
    public void failingRun() {
        int status = this.execute(list(true));
        Assert.assertEquals(Main.TESTS_FAILED, status);
        Assert.assertTrue(this.err(), this.err().contains("ERROR in Cli_Maybe: CHECK(!failing) failed"));
        Assert.assertTrue(this.err(), this.err().contains("FAILURE: 1 out of 2 tests failed"));
    }

    @Test
    public void badThreadCount() {
        AtomicInteger runs = new AtomicInteger();
        TestList list = new TestList();
        list.add(TestUnit.of(t -> runs.incrementAndGet()), "cli", "Counted", "f.cpp", 1);
        Assert.assertEquals(Main.CONFIGURATION_ERROR, this.execute(list, "--threads", "2000"));
        Assert.assertEquals(Main.CONFIGURATION_ERROR, this.execute(list, "-t", "0"));
        Assert.assertTrue(this.err(), this.err().contains("Configuration error: Bad number of threads"));
        Assert.assertFalse(this.out().contains("Test time"));
        Assert.assertEquals(0, runs.get());
    }

    @Test
    public void badThreadCountLeavesReportFilesAlone() throws Exception {
        File xml = new File(this.folder.getRoot(), "new.xml");
        File json = this.folder.newFile("old.json");
        Files.write(json.toPath(), "previous".getBytes(StandardCharsets.UTF_8));
        int status = this.execute(list(false), "-t", "0", "-x", xml.getPath(), "-j", json.getPath());
        Assert.assertEquals(Main.CONFIGURATION_ERROR, status);
        Assert.assertFalse(xml.exists());
        Assert.assertEquals("previous", new String(Files.readAllBytes(json.toPath()), StandardCharsets.UTF_8));
    }

    @Test
    public void unknownOption() {
        Assert.assertEquals(Main.CONFIGURATION_ERROR, this.execute(list(false), "--no-such-option"));
        Assert.assertEquals(Main.CONFIGURATION_ERROR, this.execute(list(false), "--debug", "TestList"));
    }

    @Test
    public void help() {
        Assert.assertEquals(Main.SUCCESS, this.execute(list(true), "-h"));
        Assert.assertTrue(this.out(), this.out().contains("--threads"));
        Assert.assertFalse(this.out().contains("Test time"));
    }

    @Test
    public void filterFromTheEnvironment() {
        this.environment.put("UNITTEST_FILTER", "- Cli_Maybe");
        Assert.assertEquals(Main.SUCCESS, this.execute(list(true)));
        Assert.assertTrue(this.out(), this.out().contains("Success: All 1 tests passed"));
        Assert.assertTrue(this.out(), this.out().contains("Note: One test was excluded!"));
    }

    @Test
    public void argumentsOverrideTheEnvironment() {
        this.environment.put("UNITTEST_FILTER", "- Cli_Maybe");
        Assert.assertEquals(Main.TESTS_FAILED, this.execute(list(true), "-f", "Cli_*"));
    }

    @Test
    public void environmentDefaults() {
        this.environment.put("UNITTEST_THREADS", "3");
        this.environment.put("UNITTEST_SHUFFLE", "1");
        this.environment.put("UNITTEST_PROGRESS", "yes");
        this.environment.put("UNITTEST_XML", "1");
        ExecutionOptions options = new ExecutionOptions(this.environment);
        Assert.assertEquals(3, options.threads);
        Assert.assertTrue(options.shuffle);
        Assert.assertTrue(options.progress);
        Assert.assertEquals(ExecutionOptions.DEFAULT_XML_FILE, options.xmlFile);
        Assert.assertNull(options.getFilter());

        this.environment.put("UNITTEST_THREADS", "many");
        Assert.assertThrows(ParameterException.class, () -> new ExecutionOptions(this.environment));
    }

    @Test
    public void progressLines() {
        Assert.assertEquals(Main.SUCCESS, this.execute(list(false), "-p"));
        Assert.assertTrue(this.out(), this.out().contains("b_cli.cpp:1: Begin Cli_Pass"));
    }

    @Test
    public void reportsAreWritten() throws Exception {
        File xml = new File(this.folder.getRoot(), "report.xml");
        File json = new File(this.folder.getRoot(), "report.json");
        int status = this.execute(list(true), "-x", xml.getPath(), "-j", json.getPath());
        Assert.assertEquals(Main.TESTS_FAILED, status);
        String xmlText = Files.readString(xml.toPath());
        Assert.assertTrue(xmlText, xmlText.startsWith("<?xml version=\"1.0\"?>\n<unittest-results tests=\"2\""));
        Assert.assertTrue(xmlText, xmlText.contains("failure message=\"MainTests.java("));
        String jsonText = Files.readString(json.toPath());
        Assert.assertTrue(jsonText, jsonText.contains("\"failedtests\" : 1"));
    }

    @Test
    public void orderSortsTheList() {
        TestList list = list(false);
        Assert.assertEquals(Main.SUCCESS, this.execute(list, "-o", "a_*", "-o", "b_*", "-p"));
        Assert.assertEquals("a_cli.cpp", list.get(0).getDetails().fileName);
        Assert.assertEquals(0, list.get(0).getDetails().getTestIndex());
        Assert.assertEquals(1, list.get(1).getDetails().getTestIndex());
        String output = this.out();
        Assert.assertTrue(output, output.indexOf("Begin Cli_Maybe") < output.indexOf("Begin Cli_Pass"));
    }
}
