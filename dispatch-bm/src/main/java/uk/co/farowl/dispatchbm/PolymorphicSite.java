// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatchbm;

import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import uk.co.farowl.dispatch.runtime.DispatchEngine;
import uk.co.farowl.dispatch.runtime.DispatchOptions;
import uk.co.farowl.dispatch.runtime.DynamicCallSite;
import uk.co.farowl.dispatch.runtime.Operation;

/**
 * This is a JMH benchmark for a site that sees more shapes than its
 * inline cache will hold. We compare a site that keeps evicting
 * (promotion disabled) with one that is promoted to its polymorphic
 * table.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)

@Fork(2)
@Warmup(iterations = 20, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 10, time = 1, timeUnit = TimeUnit.SECONDS)

@State(Scope.Thread)
public class PolymorphicSite {

    /** Operands of distinct shapes, all having a {@code toString()}. */
    Object[] values = {1, 2L, 3.0, 4.0f, "five", 'c', (short)7,
            (byte)8, true, new StringBuilder("ten")};

    int i;

    DynamicCallSite thrashing, promoted;

    @Setup
    public void setUp() throws Throwable {
        Operation op = Operation.invokeMember("toString", 0);
        thrashing = new DispatchEngine(new DispatchOptions(4, 0, true))
                .site(op);
        promoted = new DispatchEngine(new DispatchOptions(4, 1, true))
                .site(op);
        for (Object v : values) {
            thrashing.execute(v);
            promoted.execute(v);
        }
    }

    private Object next() {
        Object v = values[i];
        i = (i + 1) % values.length;
        return v;
    }

    @Benchmark
    public String tostring_java() { return next().toString(); }

    @Benchmark
    public Object tostring_thrashing() throws Throwable {
        return thrashing.execute(next());
    }

    @Benchmark
    public Object tostring_promoted() throws Throwable {
        return promoted.execute(next());
    }

    /*
     * main() is useful for following the code path in the debugger, but
     * is not material to the benchmark.
     */
    public static void main(String[] args) throws Throwable {
        PolymorphicSite bm = new PolymorphicSite();
        bm.setUp();
        for (int k = 0; k < 20; k++) { bm.tostring_promoted(); }
        System.out.println(bm.promoted.stats());
        for (int k = 0; k < 20; k++) { bm.tostring_thrashing(); }
        System.out.println(bm.thrashing.stats());
    }
}
