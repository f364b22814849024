// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import uk.co.farowl.dispatch.runtime.DispatchError.Kind;

/**
 * Test the {@link ExpandoObject}, a meta-object provider whose members
 * are created by setting them.
 */
@DisplayName("An ExpandoObject")
class ExpandoObjectTest {

    final DispatchEngine engine =
            new DispatchEngine(new DispatchOptions(4, 8, true));

    @Nested
    @DisplayName("when members are set")
    class Members {

        @Test
        @DisplayName("returns the value last set")
        void setThenGet() throws Throwable {
            ExpandoObject e = new ExpandoObject();
            assertEquals(5, engine.setMember(e, "a", 5));
            assertEquals(5, engine.getMember(e, "a"));
            engine.setMember(e, "a", "five");
            assertEquals("five", engine.getMember(e, "a"));
            assertEquals(Set.of("a"), e.memberNames());
        }

        @Test
        @DisplayName("holds a null value")
        void nullValue() throws Throwable {
            ExpandoObject e = new ExpandoObject();
            engine.setMember(e, "z", null);
            assertTrue(e.has("z"));
            assertNull(engine.getMember(e, "z"));
        }

        @Test
        @DisplayName("fails to get a member never set")
        void missing() throws Throwable {
            ExpandoObject e = new ExpandoObject();
            DispatchError err = assertThrows(DispatchError.class,
                    () -> engine.getMember(e, "nothing"));
            assertEquals(Kind.MEMBER_NOT_FOUND, err.getKind());
            // Not cached: the member may be set later
            engine.setMember(e, "nothing", 0);
            assertEquals(0, engine.getMember(e, "nothing"));
        }

        @Test
        @DisplayName("fails to get a member after removal")
        void removed() throws Throwable {
            ExpandoObject e = new ExpandoObject();
            DynamicCallSite get = engine.site(Operation.getMember("a"));
            engine.setMember(e, "a", 1);
            assertEquals(1, get.execute(e));
            assertTrue(e.remove("a"));
            assertFalse(e.remove("a"));
            DispatchError err = assertThrows(DispatchError.class,
                    () -> get.execute(e));
            assertEquals(Kind.MEMBER_NOT_FOUND, err.getKind());
        }

        @Test
        @DisplayName("still exposes its Java methods")
        void javaMembers() throws Throwable {
            ExpandoObject e = new ExpandoObject();
            engine.setMember(e, "a", 1);
            assertEquals(true, engine.invokeMember(e, "has", "a"));
            assertEquals(false, engine.invokeMember(e, "has", "b"));
        }
    }

    @Nested
    @DisplayName("shape")
    class Shapes {

        @Test
        @DisplayName("is the same for the same member names")
        void sameMembers() throws Throwable {
            ExpandoObject e = new ExpandoObject(), f = new ExpandoObject();
            engine.setMember(e, "a", 1);
            engine.setMember(e, "b", 2);
            engine.setMember(f, "b", "x");
            engine.setMember(f, "a", "y");
            assertEquals(Envelope.shapeOf(e), Envelope.shapeOf(f));

            DynamicCallSite get = engine.site(Operation.getMember("a"));
            assertEquals(1, get.execute(e));
            assertEquals("y", get.execute(f));
            assertEquals(1, get.stats().binds());
            assertEquals(1, get.stats().hits());
        }

        @Test
        @DisplayName("changes when a member is added")
        void newMember() throws Throwable {
            ExpandoObject e = new ExpandoObject();
            engine.setMember(e, "a", 1);
            Shape before = Envelope.shapeOf(e);
            engine.setMember(e, "a", 2);
            assertEquals(before, Envelope.shapeOf(e));
            engine.setMember(e, "b", 3);
            assertNotEquals(before, Envelope.shapeOf(e));
        }
    }

    @Nested
    @DisplayName("when a member is invoked")
    class Invocation {

        @Test
        @DisplayName("calls a Fragment with the arguments")
        void fragment() throws Throwable {
            ExpandoObject e = new ExpandoObject();
            Fragment twice = args -> (Integer)args[0] * 2;
            engine.setMember(e, "twice", twice);
            assertEquals(42, engine.invokeMember(e, "twice", 21));
        }

        @Test
        @DisplayName("calls a MethodHandle with the arguments")
        void methodHandle() throws Throwable {
            ExpandoObject e = new ExpandoObject();
            MethodHandle max = MethodHandles.lookup().findStatic(Math.class,
                    "max", MethodType.methodType(int.class, int.class,
                            int.class));
            engine.setMember(e, "max", max);
            assertEquals(9, engine.invokeMember(e, "max", 3, 9));
        }

        @Test
        @DisplayName("fails if the member is not invocable")
        void notInvocable() throws Throwable {
            ExpandoObject e = new ExpandoObject();
            engine.setMember(e, "n", 5);
            DispatchError err = assertThrows(DispatchError.class,
                    () -> engine.invokeMember(e, "n"));
            assertEquals(Kind.META_OBJECT_ERROR, err.getKind());
        }
    }

    @Nested
    @DisplayName("when indexed")
    class Indexing {

        @Test
        @DisplayName("treats a string index as a member name")
        void byName() throws Throwable {
            ExpandoObject e = new ExpandoObject();
            assertEquals(7, engine.setIndex(e, "k", 7));
            assertEquals(7, engine.getMember(e, "k"));
            engine.setMember(e, "m", "v");
            assertEquals("v", engine.getIndex(e, "m"));
        }

        @Test
        @DisplayName("rejects other indexes")
        void otherIndex() {
            ExpandoObject e = new ExpandoObject();
            DispatchError err = assertThrows(DispatchError.class,
                    () -> engine.getIndex(e, 0));
            assertEquals(Kind.MEMBER_NOT_FOUND, err.getKind());
        }
    }
}
