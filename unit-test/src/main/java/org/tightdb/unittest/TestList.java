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
import org.tightdb.util.Linq;
import org.tightdb.util.Logger;
import org.tightdb.util.Timer;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.ServiceLoader;

/**
 * A registry of tests, and the runner that executes them.
 *
 * <p>Tests are appended during registration and receive consecutive indexes.
 * A run selects the enabled tests accepted by a filter, optionally shuffles them,
 * and executes them on a number of worker threads.  Each selected test is executed
 * exactly once; its events are delivered to a {@link Reporter}, followed by a
 * single {@link Summary} once all workers are done.
 */
public class TestList implements IModule {
    public static final int MAX_THREADS = 1024;

    /**
     * Seeds the shuffles that do not supply their own seed.
     */
    private static final Random SEED_SOURCE = new Random();

    private final List<TestUnit> tests = new ArrayList<>();

    private static class DefaultHolder {
        static final TestList INSTANCE = createDefault();
    }

    static TestList createDefault() {
        TestList list = new TestList();
        for (TestRegistration registration : ServiceLoader.load(TestRegistration.class))
            registration.register(list);
        return list;
    }

    /**
     * The process-wide test list.
     * Created on first use and populated by all the {@link TestRegistration}
     * services visible to the class loader.
     */
    public static TestList getDefault() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * Register a test.
     * @param test   Test to register; a test can be registered only once.
     * @param suite  Name of the suite the test belongs to.
     * @param name   Name of the test.
     * @param file   File declaring the test.
     * @param line   Line of the declaration.
     */
    public void add(TestUnit test, String suite, String name, String file, long line) {
        if (test.isRegistered())
            throw new IllegalStateException("Test " + name + " is already registered");
        long index = this.tests.size();
        test.setDetails(new TestDetails(suite, name, file, line, index));
        this.tests.add(test);
    }

    public int size() {
        return this.tests.size();
    }

    public TestUnit get(int index) {
        return this.tests.get(index);
    }

    public List<TestDetails> getDetails() {
        return Collections.unmodifiableList(Linq.map(this.tests, TestUnit::getDetails));
    }

    /**
     * Reorder the tests.  The indexes are not changed; call
     * {@link #reassignIndexes()} to renumber the tests in their new order.
     */
    public void sort(Comparator<? super TestDetails> order) {
        this.tests.sort((a, b) -> order.compare(a.getDetails(), b.getDetails()));
    }

    /**
     * Set the index of every test to its position in the list.
     */
    public void reassignIndexes() {
        for (int i = 0; i < this.tests.size(); i++)
            this.tests.get(i).getDetails().testIndex = i;
    }

    public boolean run() {
        return this.run(null, null, 1, false);
    }

    public boolean run(@Nullable Reporter reporter) {
        return this.run(reporter, null, 1, false);
    }

    public boolean run(@Nullable Reporter reporter, @Nullable Filter filter, int numThreads, boolean shuffle) {
        return this.run(reporter, filter, numThreads, shuffle, null);
    }

    /**
     * Run the tests.
     * @param reporter    Receives the events of the run; may be null.
     * @param filter      Selects the tests to run; if null all enabled tests run.
     * @param numThreads  Number of worker threads, between 1 and {@link #MAX_THREADS}.
     * @param shuffle     If true the tests run in a random order.
     * @param seed        Seed for the shuffle; if null a different order is used every time.
     * @return            True if no test failed.
     * @throws ConfigurationException if the number of threads is out of range.
     * An exception thrown by the reporter stops the worker that called it;
     * it is rethrown here once all workers have stopped, whatever the number of threads.
     */
    public boolean run(@Nullable Reporter reporter, @Nullable Filter filter,
                       int numThreads, boolean shuffle, @Nullable Long seed) {
        Timer timer = new Timer();
        validateThreads(numThreads);
        Reporter actualReporter = reporter != null ? reporter : Reporter.NONE;
        Filter actualFilter = filter != null ? filter : Filter.acceptAll();

        SharedContext shared = new SharedContext(actualReporter);
        List<TestUnit> enabled = Linq.where(this.tests, TestUnit::isEnabled);
        long numDisabled = this.tests.size() - enabled.size();
        for (TestUnit test : enabled) {
            if (actualFilter.include(test.getDetails()))
                shared.tests.add(test);
        }

        if (shuffle) {
            long actualSeed = seed != null ? seed : SEED_SOURCE.nextLong();
            Collections.shuffle(shared.tests, new Random(actualSeed));
            Logger.INSTANCE.from(this, 1)
                    .appendLine("Shuffled with seed " + actualSeed);
        }
        Logger.INSTANCE.from(this, 1)
                .appendLine("Running " + shared.tests.size() + " of " + this.tests.size() +
                        " tests on " + numThreads + (numThreads == 1 ? " thread" : " threads"));

        List<ExecContext> contexts = new ArrayList<>(numThreads);
        for (int i = 0; i < numThreads; i++)
            contexts.add(new ExecContext(shared, i));

        if (numThreads == 1) {
            contexts.get(0).run();
        } else {
            List<Thread> threads = new ArrayList<>(numThreads);
            for (ExecContext context : contexts) {
                Thread thread = new Thread(context, "unit-test-worker-" + context.workerIndex);
                threads.add(thread);
                thread.start();
            }
            joinAll(threads);
        }
        rethrowFailure(contexts);

        // All workers are done, so their counters can be read without locking.
        long numFailedTests = 0;
        long numChecks = 0;
        long numFailedChecks = 0;
        for (ExecContext context : contexts) {
            numFailedTests += context.numFailedTests;
            numChecks += context.numChecks;
            numFailedChecks += context.numFailedChecks;
        }

        long numIncluded = shared.tests.size();
        Summary summary = new Summary(
                numIncluded,
                numFailedTests,
                enabled.size() - numIncluded,
                numDisabled,
                numChecks,
                numFailedChecks,
                timer.getElapsedTime());
        actualReporter.summary(summary);
        Logger.INSTANCE.from(this, 1)
                .appendLine(summary.toString());
        return numFailedTests == 0;
    }

    /**
     * @throws ConfigurationException if a run cannot use this many worker threads.
     */
    public static void validateThreads(int numThreads) {
        if (numThreads < 1 || numThreads > MAX_THREADS)
            throw new ConfigurationException("Bad number of threads " + numThreads +
                    "; must be between 1 and " + MAX_THREADS);
    }

    /**
     * If a worker stopped because a reporter (or the runner itself) threw,
     * rethrow what it threw on the calling thread.
     * Failures of further workers are attached as suppressed exceptions.
     */
    static void rethrowFailure(List<ExecContext> contexts) {
        @Nullable
        Throwable failure = null;
        for (ExecContext context : contexts) {
            if (context.failure == null)
                continue;
            if (failure == null)
                failure = context.failure;
            else if (failure != context.failure)
                failure.addSuppressed(context.failure);
        }
        if (failure == null)
            return;
        if (failure instanceof RuntimeException)
            throw (RuntimeException) failure;
        if (failure instanceof Error)
            throw (Error) failure;
        throw new RuntimeException(failure);
    }

    /**
     * Wait for all threads to terminate.
     * Interrupts are deferred until every thread has been joined.
     */
    static void joinAll(List<Thread> threads) {
        boolean interrupted = false;
        for (Thread thread : threads) {
            while (true) {
                try {
                    thread.join();
                    break;
                } catch (InterruptedException ex) {
                    interrupted = true;
                }
            }
        }
        if (interrupted)
            Thread.currentThread().interrupt();
    }
}
