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

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Measures wall-clock time and formats durations for humans.
 */
public class Timer {
    private long start;

    public Timer() {
        this.reset();
    }

    public void reset() {
        this.start = System.nanoTime();
    }

    /**
     * Seconds elapsed since construction or the last reset.
     */
    public double getElapsedTime() {
        return (System.nanoTime() - this.start) / 1e9;
    }

    static String decimals(double value) {
        BigDecimal decimal = BigDecimal.valueOf(value)
                .setScale(2, RoundingMode.HALF_UP)
                .stripTrailingZeros();
        return decimal.toPlainString();
    }

    /**
     * Format a duration given in seconds, choosing the unit from the magnitude:
     * hours and minutes, minutes and seconds, seconds, milliseconds,
     * microseconds, or nanoseconds.
     */
    public static String format(double seconds) {
        long roundedMinutes = Math.round(seconds / 60);
        if (roundedMinutes > 60) {
            return (roundedMinutes / 60) + "h" + (roundedMinutes % 60) + "m";
        }
        long roundedSeconds = Math.round(seconds);
        if (roundedSeconds > 60) {
            return (roundedSeconds / 60) + "m" + (roundedSeconds % 60) + "s";
        }
        long centiSeconds = Math.round(seconds * 1e2);
        if (centiSeconds > 100)
            return decimals(centiSeconds / 1e2) + "s";
        long centiMillis = Math.round(seconds * 1e5);
        if (centiMillis > 100)
            return decimals(centiMillis / 1e2) + "ms";
        long centiMicros = Math.round(seconds * 1e8);
        if (centiMicros > 100)
            return decimals(centiMicros / 1e2) + "us";
        return Math.round(seconds * 1e9) + "ns";
    }
}
