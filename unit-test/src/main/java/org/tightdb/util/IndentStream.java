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

import java.io.IOException;

/**
 * A stream that indents the lines it emits.
 * Indentation is applied lazily, when the first character of a line is written.
 */
public class IndentStream {
    private Appendable stream;
    int indent = 0;
    final int amount = 4;
    boolean emitIndent = false;

    public IndentStream(Appendable appendable) {
        this.stream = appendable;
    }

    /**
     * Change the destination.
     * @return the previous destination.
     */
    public synchronized Appendable setOutputStream(Appendable appendable) {
        Appendable result = this.stream;
        this.stream = appendable;
        return result;
    }

    public synchronized IndentStream appendChar(char c) {
        try {
            if (this.emitIndent && c != '\n') {
                for (int in = 0; in < this.indent; in++)
                    this.stream.append(' ');
                this.emitIndent = false;
            }
            this.stream.append(c);
            if (c == '\n') {
                this.emitIndent = true;
                if (this.stream instanceof java.io.Flushable)
                    ((java.io.Flushable) this.stream).flush();
            }
        } catch (IOException ex) {
            throw new RuntimeException(ex);
        }
        return this;
    }

    public synchronized IndentStream append(String string) {
        for (int i = 0; i < string.length(); i++)
            this.appendChar(string.charAt(i));
        return this;
    }

    public IndentStream newline() {
        return this.appendChar('\n');
    }

    /**
     * Emit a complete line; lines written concurrently by several threads are not interleaved.
     */
    public synchronized IndentStream appendLine(String line) {
        this.append(line);
        return this.newline();
    }

    public synchronized IndentStream increase() {
        this.indent += this.amount;
        return this;
    }

    public synchronized IndentStream decrease() {
        this.indent -= this.amount;
        if (this.indent < 0)
            throw new IllegalStateException("Negative indentation");
        return this;
    }
}
