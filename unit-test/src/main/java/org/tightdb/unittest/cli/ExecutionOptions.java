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

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import org.tightdb.unittest.Filter;
import org.tightdb.unittest.WildcardFilter;
import org.tightdb.util.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Options of a test run.
 * Defaults come from the UNITTEST_* environment variables;
 * command line arguments take precedence over them.
 */
@SuppressWarnings("CanBeFinal")
public class ExecutionOptions {
    public static final String DEFAULT_XML_FILE = "unit-test-report.xml";

    public static class DebugLevelValidator implements IParameterValidator {
        @Override
        public void validate(String name, String value) throws ParameterException {
            if (value.matches("[^=]+=\\d{1,9}"))
                return;
            throw new ParameterException("Illegal value for " + name + ": " + value + "\n"
                + "Expected module=level, e.g. TestList=1");
        }
    }

    @Parameter(names = {"-t", "--threads"}, description = "Number of worker threads")
    public int threads = 1;
    @Parameter(names = {"-s", "--shuffle"}, description = "Run the tests in random order")
    public boolean shuffle = false;
    @Parameter(names = "--seed", description = "Seed for the random order used by --shuffle")
    @Nullable
    public Long seed = null;
    @Parameter(names = {"-f", "--filter"},
            description = "Wildcard patterns selecting tests by name; patterns after '-' exclude tests")
    @Nullable
    public String filter = null;
    @Parameter(names = {"-x", "--xml"}, description = "Write an XML report to this file")
    @Nullable
    public String xmlFile = null;
    @Parameter(names = {"-j", "--json"}, description = "Write a JSON report to this file")
    @Nullable
    public String jsonFile = null;
    @Parameter(names = {"-p", "--progress"}, description = "Print a line when each test begins")
    public boolean progress = false;
    @Parameter(names = {"-o", "--order"},
            description = "File name pattern; tests from files matching earlier patterns run first")
    public List<String> order = new ArrayList<>();
    @Parameter(names = "--debug", validateWith = DebugLevelValidator.class,
            description = "Set the debug level of a module, as module=level")
    public List<String> debug = new ArrayList<>();
    @Parameter(names = {"-h", "--help"}, help = true, description = "Show this message and exit")
    public boolean help = false;

    final JCommander commander;

    public ExecutionOptions() {
        this.commander = JCommander.newBuilder()
                .addObject(this)
                .build();
        this.commander.setProgramName("unit-test");
    }

    /**
     * Create options with defaults taken from the environment.
     * @param environment  Usually {@link System#getenv()}.
     */
    public ExecutionOptions(Map<String, String> environment) {
        this();
        String threads = environment.get("UNITTEST_THREADS");
        if (threads != null && !threads.isEmpty()) {
            try {
                this.threads = Integer.parseInt(threads.trim());
            } catch (NumberFormatException ex) {
                throw new ParameterException("Illegal value for UNITTEST_THREADS: " + threads);
            }
        }
        this.shuffle = isSet(environment, "UNITTEST_SHUFFLE");
        this.progress = isSet(environment, "UNITTEST_PROGRESS");
        if (isSet(environment, "UNITTEST_XML"))
            this.xmlFile = DEFAULT_XML_FILE;
        String filter = environment.get("UNITTEST_FILTER");
        if (filter != null)
            this.filter = filter;
    }

    static boolean isSet(Map<String, String> environment, String variable) {
        String value = environment.get(variable);
        return value != null && !value.isEmpty();
    }

    public void parse(String... argv) {
        this.commander.parse(argv);
    }

    public String usage() {
        StringBuilder builder = new StringBuilder();
        this.commander.getUsageFormatter().usage(builder);
        return builder.toString();
    }

    /**
     * The filter described by the options; null if all tests should run.
     */
    @Nullable
    public Filter getFilter() {
        if (this.filter == null)
            return null;
        return new WildcardFilter(this.filter);
    }

    public void applyDebugLevels() {
        for (String setting : this.debug) {
            int eq = setting.indexOf('=');
            Logger.INSTANCE.setDebugLevel(setting.substring(0, eq), Integer.parseInt(setting.substring(eq + 1)));
        }
    }

    @Override
    public String toString() {
        return "ExecutionOptions{" +
                "threads=" + this.threads +
                ", shuffle=" + this.shuffle +
                ", seed=" + this.seed +
                ", filter=" + this.filter +
                ", xml=" + this.xmlFile +
                ", json=" + this.jsonFile +
                ", progress=" + this.progress +
                ", order=" + this.order +
                '}';
    }
}
