// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import uk.co.farowl.dispatch.runtime.DynamicCallSite.State;
import uk.co.farowl.dispatch.runtime.DynamicCallSite.Stats;
import uk.co.farowl.dispatch.runtime.kernel.CacheEntry;

/**
 * Test the caching behaviour of {@link DynamicCallSite}: that cached
 * bindings give the same results as fresh ones, are used only for the
 * shapes they were made for, and that failures, eviction and promotion
 * work as advertised.
 */
@DisplayName("A DynamicCallSite")
class DynamicCallSiteTest {

    /** An object with a property {@code content}. */
    public static class Box {
        private final Object content;

        public Box(Object content) { this.content = content; }

        public Object getContent() { return content; }
    }

    /** An object with a field {@code content}. */
    public static class Tin {
        public String content = "beans";
    }

    static DispatchEngine engine(int capacity, int threshold,
            boolean cacheFailures) {
        return new DispatchEngine(
                new DispatchOptions(capacity, threshold, cacheFailures));
    }

    @Nested
    @DisplayName("used with one shape")
    class OneShape {

        final DispatchEngine engine = engine(4, 8, true);
        final Operation op = Operation.getMember("content");

        @Test
        @DisplayName("gives the same result as a fresh bind every time")
        void cacheTransparency() throws Throwable {
            DynamicCallSite site = engine.site(op);
            for (int i = 0; i < 10; i++) {
                Box b = new Box(i);
                Object fresh = engine.execute(op, b);
                assertEquals(fresh, site.execute(b));
                assertEquals(i, site.execute(b));
            }
        }

        @Test
        @DisplayName("binds once then hits")
        void bindsOnce() throws Throwable {
            DynamicCallSite site = engine.site(op);
            Box b = new Box("x");
            assertEquals(State.UNBOUND, site.state(b));
            for (int i = 0; i < 5; i++) { site.execute(b); }
            assertEquals(State.BOUND, site.state(b));
            Stats stats = site.stats();
            assertEquals(1, stats.misses());
            assertEquals(1, stats.binds());
            assertEquals(4, stats.hits());
            assertEquals(0, stats.evictions());
            assertFalse(stats.promoted());
        }

        @Test
        @DisplayName("lets exceptions from the bound method through")
        void boundMethodThrows() throws Throwable {
            DynamicCallSite site =
                    engine.site(Operation.invokeMember("charAt", 1));
            assertEquals('b', site.execute("abc", 1));
            assertThrows(StringIndexOutOfBoundsException.class,
                    () -> site.execute("abc", 10));
            // The binding is still good
            assertEquals(State.BOUND, site.state("abc", 10));
        }

        @Test
        @DisplayName("rejects the wrong number of operands")
        void wrongArity() {
            DynamicCallSite site = engine.site(op);
            assertThrows(IllegalArgumentException.class,
                    () -> site.execute(new Box(1), 2));
            assertThrows(IllegalArgumentException.class,
                    () -> site.execute());
        }

        @Test
        @DisplayName("can be invalidated")
        void invalidate() throws Throwable {
            DynamicCallSite site = engine.site(op);
            Box b = new Box(1);
            site.execute(b);
            assertEquals(State.BOUND, site.state(b));
            site.invalidate();
            assertEquals(State.UNBOUND, site.state(b));
            assertEquals(1, site.execute(b));
            assertEquals(2, site.stats().binds());
        }

        @Test
        @DisplayName("provides a method handle to itself")
        void dynamicInvoker() throws Throwable {
            DynamicCallSite site = engine.site(op);
            MethodHandle mh = site.dynamicInvoker();
            assertEquals(MethodType.genericMethodType(1), mh.type());
            assertEquals(site.type(), mh.type());
            Object r = mh.invokeExact((Object)new Box("in"));
            assertEquals("in", r);
            assertEquals("beans", mh.invoke(new Tin()));
        }
    }

    @Nested
    @DisplayName("used with several shapes")
    class SeveralShapes {

        final Operation op = Operation.getMember("content");

        @Test
        @DisplayName("does not reuse a binding for another shape")
        void rebindOnShapeChange() throws Throwable {
            DispatchEngine engine = engine(4, 8, true);
            DynamicCallSite site = engine.site(op);
            assertEquals(42, site.execute(new Box(42)));
            // Same name, different shape, different kind of member
            assertEquals("beans", site.execute(new Tin()));
            assertEquals(43, site.execute(new Box(43)));
            assertEquals(State.BOUND, site.state(new Box(0)));
            assertEquals(State.BOUND, site.state(new Tin()));
            assertEquals(2, site.entries().size());
            assertEquals(2, site.stats().binds());
            assertEquals(1, site.stats().hits());
        }

        @Test
        @DisplayName("evicts the least recently used entry")
        void evictsLRU() throws Throwable {
            DispatchEngine engine = engine(2, 0, true);
            DynamicCallSite site =
                    engine.site(Operation.invokeMember("toString", 0));
            assertEquals("1", site.execute(1));
            assertEquals("2", site.execute(2L));
            // Integer becomes most recently used
            assertEquals("3", site.execute(3));
            // So Long is evicted
            assertEquals("s", site.execute("s"));
            assertEquals(State.BOUND, site.state(0));
            assertEquals(State.UNBOUND, site.state(0L));
            assertEquals(State.BOUND, site.state(""));
            Stats stats = site.stats();
            assertEquals(1, stats.evictions());
            assertFalse(stats.promoted());
        }

        @Test
        @DisplayName("advances the clock only when the recent entry changes")
        void touchesOnChange() throws Throwable {
            DispatchEngine engine = engine(4, 8, true);
            DynamicCallSite site =
                    engine.site(Operation.invokeMember("toString", 0));
            assertEquals("1", site.execute(1));
            CacheEntry ints = site.entries().get(0);
            long stamp = ints.lastUsed();
            for (int i = 0; i < 5; i++) { site.execute(i); }
            assertEquals(stamp, ints.lastUsed());
            assertEquals(5, site.stats().hits());
            // Another shape intervenes, so the next hit is a new use
            assertEquals("2", site.execute(2L));
            assertEquals("3", site.execute(3));
            assertTrue(ints.lastUsed() > stamp);
        }

        @Test
        @DisplayName("promotes to a polymorphic table under pressure")
        void promotes() throws Throwable {
            DispatchEngine engine = engine(1, 2, true);
            DynamicCallSite site =
                    engine.site(Operation.invokeMember("toString", 0));
            Object[] samples = {1, 2L, "three", 4.0, 'F', (short)6};
            String[] expected = {"1", "2", "three", "4.0", "F", "6"};
            for (int i = 0; i < samples.length; i++) {
                assertEquals(expected[i], site.execute(samples[i]));
            }
            Stats stats = site.stats();
            assertTrue(stats.promoted());
            assertEquals(2, stats.evictions());
            // Evicted before promotion, so they bind again
            assertEquals(State.UNBOUND, site.state(1));
            assertEquals(State.UNBOUND, site.state(2L));
            // Frozen in the inline cache, or in the table
            for (int i = 2; i < samples.length; i++) {
                assertEquals(State.BOUND, site.state(samples[i]));
            }
            // Everything still works and is now in the table
            for (int i = 0; i < samples.length; i++) {
                assertEquals(expected[i], site.execute(samples[i]));
                assertEquals(State.BOUND, site.state(samples[i]));
            }
            assertEquals(samples.length, site.entries().size());
            assertEquals(2, site.stats().evictions());
        }

        @Test
        @DisplayName("holds one entry per shape after invalidation")
        void entriesAfterInvalidate() throws Throwable {
            DispatchEngine engine = engine(4, 8, true);
            DynamicCallSite site = engine.site(op);
            site.execute(new Box(1));
            site.invalidate();
            site.execute(new Box(2));
            site.execute(new Tin());
            assertEquals(2, site.entries().size());
        }
    }

    @Nested
    @DisplayName("when binding fails")
    class Failures {

        final Operation op = Operation.getMember("missing");

        @Test
        @DisplayName("caches a permanent failure")
        void cachesPermanentFailure() throws Throwable {
            DynamicCallSite site = engine(4, 8, true).site(op);
            Box b = new Box(1);
            DispatchError e1 =
                    assertThrows(DispatchError.class, () -> site.execute(b));
            assertEquals(DispatchError.Kind.MEMBER_NOT_FOUND, e1.getKind());
            assertEquals("missing", e1.getMemberName());
            assertEquals(State.PERMANENTLY_FAILING, site.state(b));

            DispatchError e2 =
                    assertThrows(DispatchError.class, () -> site.execute(b));
            assertEquals(e1.getMessage(), e2.getMessage());
            Stats stats = site.stats();
            assertEquals(1, stats.misses());
            assertEquals(1, stats.hits());
            assertEquals(0, stats.binds());

            // Other shapes are unaffected
            Tin t = new Tin();
            assertEquals(State.UNBOUND, site.state(t));
        }

        @Test
        @DisplayName("forgets failures when asked")
        void clearFailures() throws Throwable {
            DynamicCallSite site =
                    engine(4, 8, true).site(Operation.getMember("content"));
            assertThrows(DispatchError.class,
                    () -> site.execute(new Object()));
            assertEquals("beans", site.execute(new Tin()));
            assertEquals(State.PERMANENTLY_FAILING,
                    site.state(new Object()));
            site.clearFailures();
            assertEquals(State.UNBOUND, site.state(new Object()));
            assertEquals(State.BOUND, site.state(new Tin()));
        }

        @Test
        @DisplayName("does not cache failures if told not to")
        void noFailureCaching() throws Throwable {
            DynamicCallSite site = engine(4, 8, false).site(op);
            Box b = new Box(1);
            assertThrows(DispatchError.class, () -> site.execute(b));
            assertEquals(State.UNBOUND, site.state(b));
            assertThrows(DispatchError.class, () -> site.execute(b));
            assertEquals(2, site.stats().misses());
        }

        @Test
        @DisplayName("reports the shapes of the operands")
        void reportsShapes() {
            DynamicCallSite site =
                    engine(4, 8, true).site(Operation.invokeMember("frob", 1));
            DispatchError e = assertThrows(DispatchError.class,
                    () -> site.execute(new Box(1), "x"));
            assertEquals(2, e.getShapes().size());
            assertSame(Shape.of(Box.class), e.getShapes().get(0));
            assertSame(Shape.of(String.class), e.getShapes().get(1));
            assertTrue(e.getMessage().contains("frob"), e.getMessage());
        }
    }
}
