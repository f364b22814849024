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
import uk.co.farowl.dispatch.runtime.DynamicCallSite;
import uk.co.farowl.dispatch.runtime.Operation;
import uk.co.farowl.dispatch.runtime.Operator;

/**
 * This is a JMH benchmark for binary operations on boxed numbers
 * through a warm {@link DynamicCallSite}, where every execution hits in
 * the inline cache.
 *
 * Comparison is with the time for an in-line use in Java of the
 * operation the site eventually binds.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)

@Fork(2)
@Warmup(iterations = 20, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 10, time = 1, timeUnit = TimeUnit.SECONDS)

@State(Scope.Thread)
public class BinaryOpSite {

    int v = 6, w = 7;
    double x = 6.5;

    // Copies of type Object to avoid any static specialisation
    Object vo = v, wo = w, xo = x, so = "six";

    DynamicCallSite add, mul;

    @Setup
    public void setUp() throws Throwable {
        DispatchEngine engine = new DispatchEngine();
        add = engine.site(Operation.binaryOp(Operator.ADD));
        mul = engine.site(Operation.binaryOp(Operator.MULTIPLY));
        // Bind the shapes we shall use
        add.execute(vo, wo);
        add.execute(xo, wo);
        add.execute(so, wo);
        mul.execute(vo, wo);
    }

    @Benchmark
    public int add_java() { return v + w; }

    @Benchmark
    public Object add() throws Throwable { return add.execute(vo, wo); }

    @Benchmark
    public double addmixed_java() { return x + w; }

    @Benchmark
    public Object addmixed() throws Throwable { return add.execute(xo, wo); }

    @Benchmark
    public Object concat() throws Throwable { return add.execute(so, wo); }

    @Benchmark
    public int mul_java() { return v * w; }

    @Benchmark
    public Object mul() throws Throwable { return mul.execute(vo, wo); }

    /*
     * main() is useful for following the code path in the debugger, but
     * is not material to the benchmark.
     */
    public static void main(String[] args) throws Throwable {
        BinaryOpSite bm = new BinaryOpSite();
        bm.setUp();
        System.out.println(bm.add());
        System.out.println(bm.addmixed());
        System.out.println(bm.concat());
        System.out.println(bm.add.stats());
    }
}
