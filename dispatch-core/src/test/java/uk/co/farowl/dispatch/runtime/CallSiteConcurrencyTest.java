// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CyclicBarrier;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.dispatch.runtime.kernel.CacheEntry;

/**
 * This test executes fresh call sites from several threads at once, so
 * that the threads miss together, bind together and install their
 * bindings in a race. It looks for (and fails on) outcomes we deem
 * impossible: a wrong result, an exception, more than one entry for
 * one tuple of shapes, or counts that do not add up.
 * <p>
 * As in a "litmus test", the intense processing takes place during
 * {@link #setUpClass()}, and the individual JUnit tests are predicates
 * on the list of failing trials collected during that time. If the
 * list is empty, that's a pass.
 */
@DisplayName("When multiple threads execute a call site")
@TestMethodOrder(MethodOrderer.MethodName.class)
class CallSiteConcurrencyTest {

    /** Logger for the test. */
    static final Logger logger =
            LoggerFactory.getLogger(CallSiteConcurrencyTest.class);

    /** Trials run concurrently in each batch. */
    static final int BATCH_SIZE = 10;

    /** Number of batches. */
    static final int BATCH_COUNT = 50;

    /** Threads racing on the site in each trial. */
    static final int THREADS = 4;

    /** Executions by each thread in a trial. */
    static final int REPEATS = 20;

    /** Curtail the test when we have found this many failures. */
    static final int FAILURE_LIMIT = BATCH_SIZE + 5;

    /** Failing trials. */
    static List<Trial> failures = new LinkedList<>();

    /** Engine for all trials (the binder is shared). */
    static final DispatchEngine engine =
            new DispatchEngine(new DispatchOptions(2, 4, true));

    /** The fixture class whose member we get. */
    public static class Cell {
        public final int value;

        Cell(int value) { this.value = value; }
    }

    /** A second fixture class with a member of the same name. */
    public static class Other {
        public int getValue() { return -1; }
    }

    @BeforeAll
    static void setUpClass() throws Throwable {
        Trial[] trials = new Trial[BATCH_SIZE];
        Thread[] threads = new Thread[BATCH_SIZE];

        logger.debug("CallSiteConcurrencyTest begun");

        for (int batch = 0; batch < BATCH_COUNT; batch++) {
            for (int i = 0; i < BATCH_SIZE; i++) {
                trials[i] = (i % 2 == 0) ? new SameShapeTrial()
                        : new MixedShapeTrial();
                threads[i] = new Thread(trials[i]);
            }
            for (Thread t : threads) { t.start(); }

            for (int i = 0; i < BATCH_SIZE; i++) {
                try {
                    threads[i].join(5000);
                } catch (InterruptedException e) {
                    // Check completion later
                }
                if (trials[i].failed()) { failures.add(trials[i]); }
            }

            boolean allStopped = true;
            for (Thread t : threads) { allStopped &= hasStopped(t); }
            assertTrue(allStopped, "Threads were still running");

            if (failures.size() >= FAILURE_LIMIT) { break; }
        }
    }

    @AfterAll
    static void tearDownClass() {
        logger.debug("CallSiteConcurrencyTest complete");
    }

    private static boolean hasStopped(Thread t) {
        if (t.isAlive()) {
            logger.warn("Still running {}", t.getName());
            return false;
        }
        return true;
    }

    @SuppressWarnings("static-method")
    @Test
    @DisplayName("No exceptions were thrown")
    void checkException() {
        for (Trial t : failures) {
            assertNull(t.exc, () -> String.format("%s threw %s", t, t.exc));
        }
    }

    @SuppressWarnings("static-method")
    @Test
    @DisplayName("Only allowed states were reached")
    void checkAllowed() {
        for (Trial t : failures) {
            if (!t.allowed()) { fail(t.toString()); }
        }
    }

    /**
     * A trial runs {@link #THREADS} threads that wait at a barrier, then
     * execute a fresh call site in a race. A subclass defines what each
     * thread does and determines whether the outcome is allowed.
     */
    abstract static class Trial implements Runnable {

        final DynamicCallSite site =
                engine.site(Operation.getMember("value"));
        private final CyclicBarrier barrier = new CyclicBarrier(THREADS);

        /** Any exception thrown by a racing thread. */
        volatile Throwable exc;

        /** Wrong answers seen by the racing threads. */
        final List<String> wrong =
                Collections.synchronizedList(new LinkedList<>());

        /** The actions of racing thread {@code k}. */
        abstract void race(int k) throws Throwable;

        /** Whether the state of the site afterwards is allowed. */
        abstract boolean allowed();

        @Override
        public void run() {
            Thread[] threads = new Thread[THREADS];
            for (int k = 0; k < THREADS; k++) {
                final int id = k;
                threads[k] = new Thread(() -> {
                    try {
                        barrier.await();
                        race(id);
                    } catch (Throwable t) {
                        exc = t;
                    }
                });
            }
            for (Thread t : threads) { t.start(); }
            for (Thread t : threads) {
                try {
                    t.join(5000);
                } catch (InterruptedException e) {
                    exc = e;
                }
            }
        }

        boolean failed() { return exc != null || !allowed(); }

        /** Executions accounted for by the statistics. */
        boolean countsAddUp() {
            DynamicCallSite.Stats s = site.stats();
            return s.hits() + s.misses() == (long)THREADS * REPEATS
                    && s.binds() == s.misses();
        }

        /** Each tuple of shapes has at most one entry. */
        boolean entriesDistinct() {
            Set<List<Shape>> seen = new HashSet<>();
            for (CacheEntry e : site.entries()) {
                if (!seen.add(e.shapes())) { return false; }
            }
            return true;
        }

        @Override
        public String toString() {
            return String.format("%s [%s, %s, wrong=%s]",
                    getClass().getSimpleName(), site, site.stats(), wrong);
        }
    }

    /** Every thread gets the same member of objects of one class. */
    static class SameShapeTrial extends Trial {

        @Override
        void race(int k) throws Throwable {
            for (int i = 0; i < REPEATS; i++) {
                Object r = site.execute(new Cell(k * 1000 + i));
                if (!Integer.valueOf(k * 1000 + i).equals(r)) {
                    wrong.add(k + ":" + r);
                }
            }
        }

        @Override
        boolean allowed() {
            return wrong.isEmpty() && countsAddUp() && entriesDistinct()
                    && site.entries().size() == 1;
        }
    }

    /**
     * Threads alternate between objects of two classes, so that entries
     * for both shapes are installed in a race.
     */
    static class MixedShapeTrial extends Trial {

        @Override
        void race(int k) throws Throwable {
            for (int i = 0; i < REPEATS; i++) {
                if ((i + k) % 2 == 0) {
                    Object r = site.execute(new Cell(i));
                    if (!Integer.valueOf(i).equals(r)) { wrong.add("C" + r); }
                } else {
                    Object r = site.execute(new Other());
                    if (!Integer.valueOf(-1).equals(r)) { wrong.add("O" + r); }
                }
            }
        }

        @Override
        boolean allowed() {
            return wrong.isEmpty() && countsAddUp() && entriesDistinct()
                    && site.entries().size() == 2;
        }
    }
}
