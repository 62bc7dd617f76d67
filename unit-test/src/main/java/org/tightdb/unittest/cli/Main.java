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
import org.tightdb.unittest.ConfigurationException;
import org.tightdb.unittest.PatternBasedFileOrder;
import org.tightdb.unittest.Reporter;
import org.tightdb.unittest.TestList;
import org.tightdb.unittest.reporters.ConsoleReporter;
import org.tightdb.unittest.reporters.JsonReporter;
import org.tightdb.unittest.reporters.Reporters;
import org.tightdb.unittest.reporters.XmlReporter;
import org.tightdb.util.IModule;
import org.tightdb.util.Logger;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the registered tests from the command line.
 * The exit status is 0 if all tests passed, 1 if some failed,
 * and 2 if the run could not be started.
 */
public class Main implements IModule {
    public static final int SUCCESS = 0;
    public static final int TESTS_FAILED = 1;
    public static final int CONFIGURATION_ERROR = 2;

    private final PrintStream out;
    private final PrintStream err;

    public Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Nullable
    static Writer open(@Nullable String file) throws IOException {
        if (file == null)
            return null;
        return Files.newBufferedWriter(Paths.get(file), StandardCharsets.UTF_8);
    }

    /**
     * Run the tests in a list.
     * @param list         Tests to run.
     * @param environment  Environment variables supplying default options.
     * @param argv         Command line arguments.
     * @return             The exit status.
     */
    public int execute(TestList list, Map<String, String> environment, String... argv) {
        ExecutionOptions options;
        try {
            options = new ExecutionOptions(environment);
            options.parse(argv);
        } catch (ParameterException ex) {
            this.err.println(ex.getMessage());
            return CONFIGURATION_ERROR;
        }
        if (options.help) {
            this.out.println(options.usage());
            return SUCCESS;
        }
        options.applyDebugLevels();
        Logger.INSTANCE.from(this, 1)
                .appendLine(options.toString());

        if (!options.order.isEmpty()) {
            list.sort(new PatternBasedFileOrder(options.order));
            list.reassignIndexes();
        }

        try {
            // No report file may be created or truncated for a run that cannot start.
            TestList.validateThreads(options.threads);
            try (Writer xml = open(options.xmlFile);
                 Writer json = open(options.jsonFile)) {
                List<Reporter> reporters = new ArrayList<>();
                reporters.add(new ConsoleReporter(options.progress, this.out, this.err));
                if (xml != null)
                    reporters.add(new XmlReporter(xml));
                if (json != null)
                    reporters.add(new JsonReporter(json));
                boolean success = list.run(Reporters.combine(reporters), options.getFilter(),
                        options.threads, options.shuffle, options.seed);
                return success ? SUCCESS : TESTS_FAILED;
            }
        } catch (ConfigurationException ex) {
            this.err.println("Configuration error: " + ex.getMessage());
            return CONFIGURATION_ERROR;
        } catch (IOException ex) {
            this.err.println("Cannot write report: " + ex.getMessage());
            return CONFIGURATION_ERROR;
        }
    }

    public static void main(String[] argv) {
        Main main = new Main(System.out, System.err);
        int status = main.execute(TestList.getDefault(), System.getenv(), argv);
        System.exit(status);
    }
}
