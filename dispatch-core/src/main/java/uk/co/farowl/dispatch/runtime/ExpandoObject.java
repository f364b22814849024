// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

import java.lang.invoke.MethodHandle;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import uk.co.farowl.dispatch.runtime.Operation.GetIndex;
import uk.co.farowl.dispatch.runtime.Operation.GetMember;
import uk.co.farowl.dispatch.runtime.Operation.InvokeMember;
import uk.co.farowl.dispatch.runtime.Operation.SetIndex;
import uk.co.farowl.dispatch.runtime.Operation.SetMember;

/**
 * An object to which members may be added simply by setting them
 * dynamically. Getting a member returns the value last set. Invoking a
 * member calls the value set, if that is a {@link Fragment} or a
 * {@code MethodHandle}, with the arguments of the invocation. An
 * expando may also be indexed by member name.
 * <p>
 * The shape of an expando is the set of its member names, so that
 * expandos with the same members share bindings, and adding or removing
 * a member makes a new shape. Members not present are looked for as Java
 * members of this class (for example {@link #memberNames()}).
 */
public class ExpandoObject implements MetaObjectProvider, MetaObject {

    /** Stands for {@code null} in {@link #members}. */
    private static final Object NONE = new Object();

    private final Map<String, Object> members = new ConcurrentHashMap<>();
    /** Current member names, which is the shape key. */
    private volatile Set<String> layout = Set.of();

    /** Create an expando with no members. */
    public ExpandoObject() {}

    @Override
    public MetaObject metaObject() { return this; }

    @Override
    public Object shapeKey() { return layout; }

    /** @return the names of the members present */
    public Set<String> memberNames() { return layout; }

    /**
     * Whether a member is present.
     *
     * @param name of member
     * @return {@code true} if present
     */
    public boolean has(String name) { return members.containsKey(name); }

    /**
     * Remove a member (changing the shape of this object).
     *
     * @param name of member
     * @return whether it was present
     */
    public boolean remove(String name) {
        synchronized (members) {
            if (members.remove(name) == null) { return false; }
            layout = Set.copyOf(members.keySet());
            return true;
        }
    }

    @Override
    public BindResult tryGetMember(GetMember op, Envelope self) {
        String name = op.name();
        if (!has(name)) { return BindResult.notApplicable(); }
        return BindResult.resolved(ops -> expando(ops).load(op, name));
    }

    @Override
    public BindResult trySetMember(SetMember op, Envelope self,
            Envelope value) {
        String name = op.name();
        return BindResult.resolved(ops -> expando(ops).store(name, ops[1]));
    }

    @Override
    public BindResult tryInvokeMember(InvokeMember op, Envelope self,
            Envelope[] args) {
        String name = op.name();
        if (!has(name)) { return BindResult.notApplicable(); }
        Object v = members.get(name);
        if (!(v instanceof Fragment || v instanceof MethodHandle)) {
            return BindResult.error(String.format(
                    "member '%s' is not invocable", name));
        }
        return BindResult.resolved(ops -> expando(ops).call(op, name,
                Arrays.copyOfRange(ops, 1, ops.length)));
    }

    @Override
    public BindResult tryGetIndex(GetIndex op, Envelope self,
            Envelope[] indexes) {
        if (indexes.length != 1 || !(indexes[0].value() instanceof String)) {
            return BindResult.notApplicable();
        }
        return BindResult
                .resolved(ops -> expando(ops).load(op, (String)ops[1]));
    }

    @Override
    public BindResult trySetIndex(SetIndex op, Envelope self,
            Envelope[] indexes, Envelope value) {
        if (indexes.length != 1 || !(indexes[0].value() instanceof String)) {
            return BindResult.notApplicable();
        }
        return BindResult.resolved(
                ops -> expando(ops).store((String)ops[1], ops[2]));
    }

    private static ExpandoObject expando(Object[] operands) {
        return (ExpandoObject)operands[0];
    }

    private Object load(Operation op, String name) {
        Object v = members.get(name);
        if (v == null) {
            // Removed since the binding was made (or never there)
            throw new DispatchError(DispatchError.Kind.MEMBER_NOT_FOUND, op,
                    List.of(Envelope.shapeOf(this)),
                    "expando has no member '" + name + "'");
        }
        return v == NONE ? null : v;
    }

    private Object store(String name, Object value) {
        Object v = value == null ? NONE : value;
        if (members.replace(name, v) == null) {
            synchronized (members) {
                members.put(name, v);
                layout = Set.copyOf(members.keySet());
            }
        }
        return value;
    }

    private Object call(Operation op, String name, Object[] args)
            throws Throwable {
        Object v = load(op, name);
        if (v instanceof Fragment f) {
            return f.invoke(args);
        } else if (v instanceof MethodHandle mh) {
            return mh.invokeWithArguments(args);
        }
        throw new DispatchError(DispatchError.Kind.META_OBJECT_ERROR, op,
                List.of(Envelope.shapeOf(this)),
                "member '" + name + "' is not invocable");
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ExpandoObject{");
        String sep = "";
        for (String name : layout) {
            Object v = members.get(name);
            sb.append(sep).append(name).append('=').append(v == NONE ? null : v);
            sep = ", ";
        }
        return sb.append('}').toString();
    }
}
