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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logging class which can output nicely indented strings.
 * Output for a module is emitted only when the module's debug level
 * is at least the level of the message.
 */
public class Logger extends IndentStream implements IDebuggable {
    private final Map<String, Integer> debugLevel = new ConcurrentHashMap<>();

    /**
     * Swallows everything written to it.
     */
    static class NullStream implements Appendable {
        @Override
        public Appendable append(CharSequence csq) {
            return this;
        }

        @Override
        public Appendable append(CharSequence csq, int start, int end) {
            return this;
        }

        @Override
        public Appendable append(char c) {
            return this;
        }
    }

    private static final IndentStream NULL = new IndentStream(new NullStream());

    /**
     * There is only one instance of the logger for the whole program.
     */
    public static final Logger INSTANCE = new Logger();

    private Logger() {
        super(System.err);
    }

    /**
     * Debug level is controlled per module and can be changed dynamically.
     * @param module  Module name.
     * @param level   Debugging level.
     */
    @Override
    public void setDebugLevel(String module, int level) {
        this.debugLevel.put(module, level);
    }

    public void setDebugLevel(Class<?> module, int level) {
        this.setDebugLevel(module.getSimpleName(), level);
    }

    /**
     * The current debug level for the specified module.
     */
    public int getDebugLevel(String module) {
        return this.debugLevel.getOrDefault(module, 0);
    }

    /**
     * Where logging should be redirected.
     * Notice that the indentation is *not* reset when the stream is changed.
     */
    @Override
    public Appendable setDebugStream(Appendable writer) {
        return super.setOutputStream(writer);
    }

    /**
     * The stream to write a message of the given level for a module;
     * a stream that discards its input if the level is not enabled.
     */
    public IndentStream from(String module, int level) {
        if (this.getDebugLevel(module) < level)
            return NULL;
        return this;
    }

    public IndentStream from(IModule module, int level) {
        return this.from(module.getModule(), level);
    }
}
