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

import org.tightdb.util.IModule;
import org.tightdb.util.Logger;
import org.tightdb.util.Timer;
import org.tightdb.util.Utilities;

import javax.annotation.Nullable;

/**
 * One worker of a test run.
 * Takes tests from the shared context until none are left and
 * keeps its own statistics, which are merged after all workers are done.
 */
class ExecContext implements Runnable, IModule {
    final SharedContext shared;
    final int workerIndex;
    /**
     * Protects the counters below; check results may be recorded
     * from threads started by a test body.
     */
    final Object lock = new Object();
    long numChecks;
    long numFailedChecks;
    long numFailedTests;
    boolean errorsSeen;
    /**
     * What stopped this worker, if it did not run to completion.
     * Read by the thread that started the run after the worker has been joined.
     */
    @Nullable
    Throwable failure;

    ExecContext(SharedContext shared, int workerIndex) {
        this.shared = shared;
        this.workerIndex = workerIndex;
    }

    @Override
    public void run() {
        try {
            this.runTests();
        } catch (Throwable ex) {
            this.failure = ex;
            Logger.INSTANCE.from(this, 1)
                    .appendLine("Worker " + this.workerIndex + " failed: " +
                            Utilities.typeName(ex) + ": " + ex.getMessage());
        }
    }

    /**
     * Take tests from the shared list until it is exhausted.
     */
    void runTests() {
        Logger.INSTANCE.from(this, 2)
                .appendLine("Worker " + this.workerIndex + " started");
        Timer timer = new Timer();
        double time = 0;
        @Nullable
        TestUnit test = null;
        long executed = 0;
        while (true) {
            double previousTime = time;
            time = timer.getElapsedTime();

            synchronized (this.shared.lock) {
                Reporter reporter = this.shared.reporter;
                if (test != null)
                    reporter.end(test.getDetails(), time - previousTime);
                if (this.shared.nextTest == this.shared.tests.size())
                    break;
                test = this.shared.tests.get(this.shared.nextTest++);
                reporter.begin(test.getDetails());
            }

            synchronized (this.lock) {
                this.errorsSeen = false;
            }
            this.execute(test);
            executed++;
            synchronized (this.lock) {
                if (this.errorsSeen)
                    this.numFailedTests++;
            }
        }
        Logger.INSTANCE.from(this, 2)
                .appendLine("Worker " + this.workerIndex + " stopped after " + executed + " tests");
    }

    /**
     * Run one test body; whatever it throws is reported as a failure of the test.
     */
    void execute(TestUnit test) {
        TestResults results = test.getResults();
        results.setContext(this);
        try {
            test.run();
        } catch (Exception ex) {
            results.testFailed("Unhandled exception " + Utilities.typeName(ex) + ": " + ex.getMessage());
        } catch (Throwable ex) {
            results.testFailed("Unhandled exception of unknown type " +
                    Utilities.typeName(ex) + ": " + ex.getMessage());
        } finally {
            results.setContext(null);
        }
    }

    @Override
    public String getModule() {
        return "TestList";
    }
}
