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

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A test that can be registered in a {@link TestList} and executed by it.
 *
 * <p>Subclasses implement {@link #run()}; the body records its checks with the
 * {@code check*} methods, which report failures at the line that made the check.
 * Anything thrown out of the body fails the test, but not the run.
 */
public abstract class TestUnit {
    private static final StackWalker WALKER = StackWalker.getInstance();

    /**
     * Body of a test built from a lambda.
     */
    @FunctionalInterface
    public interface Body {
        void run(TestUnit test) throws Exception;
    }

    /**
     * Code that is expected to throw.
     */
    @FunctionalInterface
    public interface Executable {
        void execute() throws Throwable;
    }

    private final TestResults results;
    @Nullable
    private TestDetails details;

    protected TestUnit() {
        this.results = new TestResults(this);
        this.details = null;
    }

    public static TestUnit of(Body body) {
        return new TestUnit() {
            @Override
            public void run() throws Exception {
                body.run(this);
            }
        };
    }

    /**
     * Disabled tests are counted, but never run.
     */
    public boolean isEnabled() {
        return true;
    }

    public abstract void run() throws Exception;

    public TestDetails getDetails() {
        if (this.details == null)
            throw new IllegalStateException("Test has not been registered");
        return this.details;
    }

    boolean isRegistered() {
        return this.details != null;
    }

    void setDetails(TestDetails details) {
        this.details = details;
    }

    public TestResults getResults() {
        return this.results;
    }

    /**
     * File and line of the code that called into this class.
     */
    private TestDetails callSite() {
        TestDetails declared = this.getDetails();
        Optional<StackWalker.StackFrame> frame = WALKER.walk(frames -> frames
                .filter(f -> !f.getClassName().equals(TestUnit.class.getName()))
                .findFirst());
        if (frame.isEmpty() || frame.get().getFileName() == null || frame.get().getLineNumber() < 0)
            return declared;
        return declared.withLocation(frame.get().getFileName(), frame.get().getLineNumber());
    }

    public boolean check(boolean condition) {
        return this.check(condition, "condition");
    }

    public boolean check(boolean condition, String condText) {
        if (condition) {
            this.results.checkSucceeded();
            return true;
        }
        TestDetails site = this.callSite();
        this.results.condFailed(site.fileName, site.lineNumber, "CHECK", condText);
        return false;
    }

    private boolean compare(boolean holds, String macroName, @Nullable String aText, @Nullable String bText,
                            @Nullable Object a, @Nullable Object b) {
        if (holds) {
            this.results.checkSucceeded();
            return true;
        }
        TestDetails site = this.callSite();
        String aValue = String.valueOf(a);
        String bValue = String.valueOf(b);
        this.results.compareFailed(site.fileName, site.lineNumber, macroName,
                aText != null ? aText : aValue, bText != null ? bText : bValue, aValue, bValue);
        return false;
    }

    /**
     * Check that two values are equal.
     * @param aText  Source text of the first value; the failure message shows it next to the value.
     * @param bText  Source text of the second value.
     */
    public boolean checkEqual(String aText, String bText, @Nullable Object a, @Nullable Object b) {
        return this.compare(Objects.equals(a, b), "CHECK_EQUAL", aText, bText, a, b);
    }

    public boolean checkEqual(@Nullable Object a, @Nullable Object b) {
        return this.compare(Objects.equals(a, b), "CHECK_EQUAL", null, null, a, b);
    }

    public boolean checkNotEqual(String aText, String bText, @Nullable Object a, @Nullable Object b) {
        return this.compare(!Objects.equals(a, b), "CHECK_NOT_EQUAL", aText, bText, a, b);
    }

    public boolean checkNotEqual(@Nullable Object a, @Nullable Object b) {
        return this.compare(!Objects.equals(a, b), "CHECK_NOT_EQUAL", null, null, a, b);
    }

    public <T extends Comparable<? super T>> boolean checkLess(String aText, String bText, T a, T b) {
        return this.compare(a.compareTo(b) < 0, "CHECK_LESS", aText, bText, a, b);
    }

    public <T extends Comparable<? super T>> boolean checkLess(T a, T b) {
        return this.compare(a.compareTo(b) < 0, "CHECK_LESS", null, null, a, b);
    }

    public <T extends Comparable<? super T>> boolean checkLessEqual(String aText, String bText, T a, T b) {
        return this.compare(a.compareTo(b) <= 0, "CHECK_LESS_EQUAL", aText, bText, a, b);
    }

    public <T extends Comparable<? super T>> boolean checkLessEqual(T a, T b) {
        return this.compare(a.compareTo(b) <= 0, "CHECK_LESS_EQUAL", null, null, a, b);
    }

    public <T extends Comparable<? super T>> boolean checkGreater(String aText, String bText, T a, T b) {
        return this.compare(a.compareTo(b) > 0, "CHECK_GREATER", aText, bText, a, b);
    }

    public <T extends Comparable<? super T>> boolean checkGreater(T a, T b) {
        return this.compare(a.compareTo(b) > 0, "CHECK_GREATER", null, null, a, b);
    }

    public <T extends Comparable<? super T>> boolean checkGreaterEqual(String aText, String bText, T a, T b) {
        return this.compare(a.compareTo(b) >= 0, "CHECK_GREATER_EQUAL", aText, bText, a, b);
    }

    public <T extends Comparable<? super T>> boolean checkGreaterEqual(T a, T b) {
        return this.compare(a.compareTo(b) >= 0, "CHECK_GREATER_EQUAL", null, null, a, b);
    }

    /**
     * Check that two numbers differ by at most 'epsilon' relative to the larger of them.
     */
    public boolean checkApproximatelyEqual(double a, double b, double epsilon) {
        return this.checkApproximatelyEqual(
                String.valueOf(a), String.valueOf(b), String.valueOf(epsilon), a, b, epsilon);
    }

    public boolean checkApproximatelyEqual(String aText, String bText, String epsText,
                                           double a, double b, double epsilon) {
        if (Math.abs(a - b) <= Math.max(Math.abs(a), Math.abs(b)) * epsilon) {
            this.results.checkSucceeded();
            return true;
        }
        TestDetails site = this.callSite();
        this.results.inexactCompareFailed(site.fileName, site.lineNumber, "CHECK_APPROXIMATELY_EQUAL",
                aText, bText, epsText, a, b, epsilon);
        return false;
    }

    /**
     * Check that 'expr' throws an exception of the given type.
     * @param exprText  Text describing the expression, used in the failure message.
     */
    public <E extends Throwable> boolean checkThrow(String exprText, Class<E> type, Executable expr) {
        try {
            expr.execute();
        } catch (Throwable ex) {
            if (type.isInstance(ex)) {
                this.results.checkSucceeded();
                return true;
            }
            TestDetails site = this.callSite();
            this.results.throwWrongTypeFailed(site.fileName, site.lineNumber, "CHECK_THROW",
                    exprText, type.getSimpleName(), ex.getClass().getName());
            return false;
        }
        TestDetails site = this.callSite();
        this.results.throwFailed(site.fileName, site.lineNumber, exprText, type.getSimpleName());
        return false;
    }

    /**
     * Check that 'expr' throws an exception of the given type which satisfies a condition.
     */
    public <E extends Throwable> boolean checkThrowEx(String exprText, Class<E> type, Executable expr,
                                                      String condText, Predicate<? super E> condition) {
        try {
            expr.execute();
        } catch (Throwable ex) {
            TestDetails site;
            if (!type.isInstance(ex)) {
                site = this.callSite();
                this.results.throwWrongTypeFailed(site.fileName, site.lineNumber, "CHECK_THROW_EX",
                        exprText, type.getSimpleName(), ex.getClass().getName());
                return false;
            }
            if (condition.test(type.cast(ex))) {
                this.results.checkSucceeded();
                return true;
            }
            site = this.callSite();
            this.results.throwExCondFailed(site.fileName, site.lineNumber, exprText, type.getSimpleName(), condText);
            return false;
        }
        TestDetails site = this.callSite();
        this.results.throwExFailed(site.fileName, site.lineNumber, exprText, type.getSimpleName(), condText);
        return false;
    }

    public boolean checkThrowAny(String exprText, Executable expr) {
        try {
            expr.execute();
        } catch (Throwable ex) {
            this.results.checkSucceeded();
            return true;
        }
        TestDetails site = this.callSite();
        this.results.throwAnyFailed(site.fileName, site.lineNumber, exprText);
        return false;
    }
}
