// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime.kernel;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.dispatch.runtime.Exposed.Hidden;
import uk.co.farowl.dispatch.runtime.Exposed.Implicit;
import uk.co.farowl.dispatch.runtime.Exposed.Member;
import uk.co.farowl.dispatch.runtime.Exposed.OperatorMethod;
import uk.co.farowl.dispatch.runtime.Operator;
import uk.co.farowl.dispatch.support.internal.Util;

/**
 * The {@link TypeSurface} of a Java class, found by reflection when the
 * class is first used and then immutable. Surfaces are held in a
 * {@code ClassValue}, so each is computed at most once per class
 * (give or take a race that is resolved by the {@code ClassValue}).
 */
final class ReflectedSurface implements TypeSurface {

    /** Logger for surface construction. */
    static final Logger logger =
            LoggerFactory.getLogger(ReflectedSurface.class);

    /** Surfaces by class, computed on demand. */
    private static final ClassValue<ReflectedSurface> REGISTRY =
            new ClassValue<>() {

                @Override
                protected ReflectedSurface computeValue(Class<?> c) {
                    return new ReflectedSurface(c);
                }
            };

    /** Used for members the public lookup cannot reach. */
    private static final Lookup LOOKUP = MethodHandles.lookup();

    /** Methods of {@code Object} that never make an interface SAM. */
    private static final Set<String> OBJECT_METHODS =
            Set.of("equals(Object)", "hashCode()", "toString()");

    private final Class<?> javaClass;
    private final Map<String, Candidate> getters;
    private final Map<String, List<Candidate>> setters;
    private final Map<String, List<Candidate>> methods;
    private final List<Candidate> callables;
    private final Map<Operator, List<Candidate>> operators;
    private final List<Candidate> implicits;

    private ReflectedSurface(Class<?> c) {
        logger.atTrace().addArgument(c.getName())
                .log("Reflecting on {}");
        this.javaClass = c;
        Builder b = new Builder(c);
        b.scanFields();
        b.scanMethods();
        b.scanFunctionalInterfaces();
        this.getters = Map.copyOf(b.getters);
        this.setters = freeze(b.setters);
        this.methods = freeze(b.methods);
        this.callables = List.copyOf(b.callables.values());
        this.operators = new EnumMap<>(Operator.class);
        b.operators.forEach((op, list) -> operators.put(op, List.copyOf(list)));
        this.implicits = List.copyOf(b.implicits);
    }

    /**
     * Return the surface of the given class, computing it if necessary.
     *
     * @param c class to describe
     * @return its surface
     */
    static ReflectedSurface forClass(Class<?> c) { return REGISTRY.get(c); }

    @Override
    public Class<?> javaClass() { return javaClass; }

    @Override
    public Candidate getter(String name) { return lookup(getters, name); }

    @Override
    public List<Candidate> setters(String name) {
        return orEmpty(lookup(setters, name));
    }

    @Override
    public List<Candidate> methods(String name) {
        return orEmpty(lookup(methods, name));
    }

    @Override
    public List<Candidate> callables() { return callables; }

    @Override
    public List<Candidate> operators(Operator op) {
        return operators.getOrDefault(op, Collections.emptyList());
    }

    @Override
    public List<Candidate> implicitConversions() { return implicits; }

    @Override
    public String toString() {
        return String.format("TypeSurface[%s: %d getters, %d methods]",
                javaClass.getSimpleName(), getters.size(), methods.size());
    }

    /**
     * Look up a name exactly, then with the case of its initial letter
     * changed.
     */
    private static <T> T lookup(Map<String, T> map, String name) {
        T v = map.get(name);
        if (v == null && !name.isEmpty()) {
            String alt = Character.isUpperCase(name.charAt(0))
                    ? Util.decapitalise(name) : Util.capitalise(name);
            v = map.get(alt);
        }
        return v;
    }

    private static List<Candidate> orEmpty(List<Candidate> list) {
        return list == null ? Collections.emptyList() : list;
    }

    private static Map<String, List<Candidate>> freeze(
            Map<String, ? extends Map<String, Candidate>> m) {
        Map<String, List<Candidate>> frozen = new HashMap<>();
        m.forEach((k, v) -> frozen.put(k, List.copyOf(v.values())));
        return Map.copyOf(frozen);
    }

    /**
     * Holds the tables under construction. Overloads are held in a map
     * by signature, since {@code getMethods()} may return the same
     * signature from more than one declaring type.
     */
    private static class Builder {

        final Class<?> c;
        final Map<String, Candidate> getters = new HashMap<>();
        /** Names whose getter is a field (a method may replace it). */
        final Set<String> fieldGetters = new HashSet<>();
        /** Names whose setter is a field (a method may replace it). */
        final Set<String> fieldSetters = new HashSet<>();
        final Map<String, Map<String, Candidate>> setters = new HashMap<>();
        final Map<String, Map<String, Candidate>> methods = new HashMap<>();
        final Map<String, Candidate> callables = new LinkedHashMap<>();
        final Map<Operator, List<Candidate>> operators =
                new EnumMap<>(Operator.class);
        final List<Candidate> implicits = new ArrayList<>();
        final Set<String> recordComponents;

        Builder(Class<?> c) {
            this.c = c;
            RecordComponent[] rc = c.getRecordComponents();
            this.recordComponents = rc == null ? Set.of()
                    : Arrays.stream(rc).map(RecordComponent::getName)
                            .collect(Collectors.toSet());
        }

        void scanFields() {
            for (Field f : c.getFields()) {
                if (Modifier.isStatic(f.getModifiers())
                        || f.isAnnotationPresent(Hidden.class)) {
                    continue;
                }
                Member m = f.getAnnotation(Member.class);
                String name = m != null ? m.value() : f.getName();
                try {
                    MethodHandle g = unreflectGetter(f);
                    getters.put(name, new Candidate(name, g, 1, false,
                            "field " + f.getType().getSimpleName() + " "
                                    + name));
                    fieldGetters.add(name);
                    if (!Modifier.isFinal(f.getModifiers())) {
                        MethodHandle s = unreflectSetter(f);
                        addTo(setters, name, new Candidate(name, s, 1, false,
                                "field " + f.getType().getSimpleName() + " "
                                        + name));
                        fieldSetters.add(name);
                    }
                } catch (IllegalAccessException e) {
                    logger.atDebug().addArgument(f).addArgument(e)
                            .log("Field {} not accessible: {}");
                }
            }
        }

        void scanMethods() {
            for (Method m : c.getMethods()) {
                if (m.isBridge() || m.isSynthetic()
                        || m.isAnnotationPresent(Hidden.class)) {
                    continue;
                }
                MethodHandle mh = handleFor(m);
                if (mh == null) { continue; }
                if (Modifier.isStatic(m.getModifiers())) {
                    scanStatic(m, mh);
                } else {
                    scanInstance(m, mh);
                }
            }
        }

        private void scanStatic(Method m, MethodHandle mh) {
            OperatorMethod om = m.getAnnotation(OperatorMethod.class);
            if (om != null) {
                Operator op = om.value();
                int n = op.isBinary() ? 2 : 1;
                if (m.getParameterCount() != n
                        || m.getReturnType() == void.class) {
                    logger.atWarn().addArgument(m).addArgument(op)
                            .log("Ignoring {}: wrong signature for {}");
                } else {
                    operators.computeIfAbsent(op, k -> new ArrayList<>())
                            .add(new Candidate(op.symbol, mh, 0,
                                    m.isVarArgs(), signature(m)));
                }
            }
            if (m.isAnnotationPresent(Implicit.class)) {
                if (m.getParameterCount() != 1
                        || m.getReturnType() == void.class) {
                    logger.atWarn().addArgument(m)
                            .log("Ignoring {}: not a conversion");
                } else {
                    implicits.add(new Candidate(m.getName(), mh, 0, false,
                            signature(m)));
                }
            }
        }

        private void scanInstance(Method m, MethodHandle mh) {
            Member alias = m.getAnnotation(Member.class);
            String javaName = m.getName();
            String name = alias != null ? alias.value() : javaName;
            Candidate cand =
                    new Candidate(name, mh, 1, m.isVarArgs(), signature(m));
            addTo(methods, name, cand);

            int n = m.getParameterCount();
            boolean returns = m.getReturnType() != void.class;
            String property = null;
            if (n == 0 && returns) {
                if (alias != null) {
                    property = name;
                } else if (recordComponents.contains(javaName)) {
                    property = javaName;
                } else if (javaName.length() > 3
                        && javaName.startsWith("get")) {
                    property = Util.decapitalise(javaName.substring(3));
                } else if (javaName.length() > 2 && javaName.startsWith("is")
                        && m.getReturnType() == boolean.class) {
                    property = Util.decapitalise(javaName.substring(2));
                }
                if (property != null) { addGetter(property, cand); }
            } else if (n == 1 && javaName.length() > 3
                    && javaName.startsWith("set")) {
                property = Util.decapitalise(javaName.substring(3));
                addSetter(property, cand);
            }
        }

        /** A setter method replaces a field of the same name. */
        private void addSetter(String property, Candidate cand) {
            if (fieldSetters.remove(property)) { setters.remove(property); }
            addTo(setters, property, cand);
        }

        /** A getter method replaces a field of the same name. */
        private void addGetter(String property, Candidate cand) {
            if (!getters.containsKey(property)
                    || fieldGetters.remove(property)) {
                getters.put(property, cand);
            }
        }

        void scanFunctionalInterfaces() {
            for (Class<?> i : allInterfaces(c)) {
                Method sam = singleAbstractMethod(i);
                if (sam == null) { continue; }
                try {
                    MethodHandle mh = MethodHandles.publicLookup()
                            .unreflect(sam);
                    callables.putIfAbsent(key(sam), new Candidate(
                            sam.getName(), mh, 1, sam.isVarArgs(),
                            i.getSimpleName() + "." + signature(sam)));
                } catch (IllegalAccessException e) {
                    logger.atDebug().addArgument(sam).addArgument(e)
                            .log("Interface method {} not accessible: {}");
                }
            }
        }

        /**
         * Find a handle for the method, through a public declaring type
         * if possible, otherwise by making the method itself accessible.
         * Return {@code null} if that is not possible.
         */
        private MethodHandle handleFor(Method m) {
            try {
                return MethodHandles.publicLookup().unreflect(m);
            } catch (IllegalAccessException e) {
                // Fall through to other ways.
            }
            if (!Modifier.isStatic(m.getModifiers())) {
                Method pm = publicVersion(m.getDeclaringClass(), m);
                if (pm != null) {
                    try {
                        return MethodHandles.publicLookup().unreflect(pm);
                    } catch (IllegalAccessException e) {
                        // Fall through to other ways.
                    }
                }
            }
            if (m.trySetAccessible()) {
                try {
                    return LOOKUP.unreflect(m);
                } catch (IllegalAccessException e) {
                    logger.atDebug().addArgument(m).addArgument(e)
                            .log("Method {} not accessible: {}");
                }
            }
            return null;
        }

        private MethodHandle unreflectGetter(Field f)
                throws IllegalAccessException {
            try {
                return MethodHandles.publicLookup().unreflectGetter(f);
            } catch (IllegalAccessException e) {
                if (!f.trySetAccessible()) { throw e; }
                return LOOKUP.unreflectGetter(f);
            }
        }

        private MethodHandle unreflectSetter(Field f)
                throws IllegalAccessException {
            try {
                return MethodHandles.publicLookup().unreflectSetter(f);
            } catch (IllegalAccessException e) {
                if (!f.trySetAccessible()) { throw e; }
                return LOOKUP.unreflectSetter(f);
            }
        }

        private static void addTo(Map<String, Map<String, Candidate>> map,
                String name, Candidate cand) {
            map.computeIfAbsent(name, k -> new LinkedHashMap<>())
                    .putIfAbsent(cand.description(), cand);
        }
    }

    /**
     * Search the public supertypes of a class for the same method as
     * {@code m}, so that it may be invoked through the public lookup.
     */
    private static Method publicVersion(Class<?> c, Method m) {
        for (Class<?> s = c; s != null; s = s.getSuperclass()) {
            Method pm = publicMethodIn(s, m);
            if (pm != null) { return pm; }
        }
        for (Class<?> i : allInterfaces(c)) {
            Method pm = publicMethodIn(i, m);
            if (pm != null) { return pm; }
        }
        return null;
    }

    private static Method publicMethodIn(Class<?> s, Method m) {
        if (!Modifier.isPublic(s.getModifiers())) { return null; }
        try {
            return s.getMethod(m.getName(), m.getParameterTypes());
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    /** All interfaces of a class and its superclasses, nearest first. */
    private static Set<Class<?>> allInterfaces(Class<?> c) {
        Set<Class<?>> result = new LinkedHashSet<>();
        List<Class<?>> pending = new ArrayList<>();
        for (Class<?> s = c; s != null; s = s.getSuperclass()) {
            if (s.isInterface()) { pending.add(s); }
            pending.addAll(Arrays.asList(s.getInterfaces()));
        }
        while (!pending.isEmpty()) {
            Class<?> i = pending.remove(0);
            if (result.add(i)) {
                pending.addAll(Arrays.asList(i.getInterfaces()));
            }
        }
        return result;
    }

    /**
     * The one abstract method of a functional interface, or
     * {@code null} if the interface is not declared functional (or not
     * public).
     */
    private static Method singleAbstractMethod(Class<?> i) {
        if (!Modifier.isPublic(i.getModifiers())
                || !i.isAnnotationPresent(FunctionalInterface.class)) {
            return null;
        }
        Method sam = null;
        Set<String> seen = new HashSet<>();
        for (Method m : i.getMethods()) {
            if (!Modifier.isAbstract(m.getModifiers())) { continue; }
            String k = key(m);
            if (OBJECT_METHODS.contains(k) || !seen.add(k)) { continue; }
            if (sam != null) { return null; }
            sam = m;
        }
        return sam;
    }

    private static String key(Method m) {
        return m.getName() + Arrays.stream(m.getParameterTypes())
                .map(Class::getSimpleName)
                .collect(Collectors.joining(",", "(", ")"));
    }

    private static String signature(Method m) {
        return m.getReturnType().getSimpleName() + " " + key(m);
    }
}
