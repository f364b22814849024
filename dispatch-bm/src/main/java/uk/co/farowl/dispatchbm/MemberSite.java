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
import uk.co.farowl.dispatch.runtime.ExpandoObject;
import uk.co.farowl.dispatch.runtime.Operation;

/**
 * This is a JMH benchmark for getting a member and invoking a method
 * through a warm {@link DynamicCallSite}, for an ordinary Java object
 * (bound by reflection) and for an {@link ExpandoObject} (bound by its
 * meta-object).
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)

@Fork(2)
@Warmup(iterations = 20, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 10, time = 1, timeUnit = TimeUnit.SECONDS)

@State(Scope.Thread)
public class MemberSite {

    /** A plain Java class for the benchmark. */
    public static class Account {
        private long balance = 100;

        public long getBalance() { return balance; }

        public long deposit(int amount) { return balance += amount; }
    }

    Account account = new Account();
    ExpandoObject expando = new ExpandoObject();

    // Copies of type Object to avoid any static specialisation
    Object ao = account, eo = expando, amount = 1;

    DynamicCallSite getBalance, deposit;

    @Setup
    public void setUp() throws Throwable {
        DispatchEngine engine = new DispatchEngine();
        engine.setMember(expando, "balance", 100L);
        getBalance = engine.site(Operation.getMember("balance"));
        deposit = engine.site(Operation.invokeMember("deposit", 1));
        getBalance.execute(ao);
        getBalance.execute(eo);
        deposit.execute(ao, amount);
    }

    @Benchmark
    public long get_java() { return account.getBalance(); }

    @Benchmark
    public Object get() throws Throwable { return getBalance.execute(ao); }

    @Benchmark
    public Object get_expando() throws Throwable {
        return getBalance.execute(eo);
    }

    @Benchmark
    public long invoke_java() { return account.deposit(1); }

    @Benchmark
    public Object invoke() throws Throwable {
        return deposit.execute(ao, amount);
    }

    /*
     * main() is useful for following the code path in the debugger, but
     * is not material to the benchmark.
     */
    public static void main(String[] args) throws Throwable {
        MemberSite bm = new MemberSite();
        bm.setUp();
        System.out.println(bm.get());
        System.out.println(bm.get_expando());
        System.out.println(bm.invoke());
        System.out.println(bm.getBalance.stats());
    }
}
