// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime.kernel;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import uk.co.farowl.dispatch.runtime.kernel.Conversion.Rank;

/**
 * Choose among candidate members the one best fitted to the classes of
 * a set of arguments. The rules are these:
 * <ol>
 * <li>A candidate is applicable if every argument converts to the
 * corresponding parameter. A variable arity candidate is applicable in
 * its normal form if that works, otherwise in its expanded form, where
 * the trailing arguments convert to the array component type.</li>
 * <li>One conversion is better than another for the same argument if
 * its {@link Rank} is lower. At equal rank, a parameter that is exactly
 * the argument class is better, then a parameter more specific than the
 * other (a subtype, a narrower primitive or anything but
 * {@code Object}).</li>
 * <li>A candidate in normal form is better than one in expanded form.
 * Otherwise a candidate is better than another if its conversion is
 * better for at least one argument and worse for none.</li>
 * <li>The result is the candidate better than all other applicable
 * ones. If there is no such candidate, the match is ambiguous.</li>
 * </ol>
 * The outcome depends only on the candidates and the argument classes.
 */
public final class OverloadResolver {

    private OverloadResolver() {} // no instances

    /**
     * A candidate found applicable to particular argument classes, with
     * the conversion for each argument.
     *
     * @param candidate the member
     * @param conversions one for each argument
     * @param expanded whether applicable only in expanded (varargs) form
     */
    public record Applicable(Candidate candidate, Conversion[] conversions,
            boolean expanded) {

        /**
         * Create a handle that invokes the candidate with the
         * conversions applied, taking each argument as {@code Object}
         * (and any receiver with its original type).
         *
         * @return the adapted handle
         */
        public MethodHandle adapt() {
            MethodHandle mh = candidate.handle().asFixedArity();
            int r = candidate.receivers();
            if (expanded) {
                Class<?>[] p = candidate.parameterTypes();
                Class<?> arrayType = p[p.length - 1];
                int trailing = conversions.length - (p.length - 1);
                mh = mh.asCollector(arrayType, trailing);
            }
            for (int i = 0; i < conversions.length; i++) {
                MethodHandle filter = conversions[i].filter();
                if (filter != null) {
                    mh = MethodHandles.filterArguments(mh, r + i, filter);
                }
            }
            return mh;
        }

        Class<?> parameterType(int i) { return conversions[i].target(); }
    }

    /**
     * The result of resolution: either a single best candidate, or a
     * list of mutually indistinguishable ones, or neither (nothing
     * applicable).
     *
     * @param best the chosen candidate or {@code null}
     * @param tied the best candidates if ambiguous, otherwise empty
     */
    public record Outcome(Applicable best, List<Candidate> tied) {

        /** @return whether a unique best candidate was found */
        public boolean resolved() { return best != null; }

        /** @return whether several candidates were equally good */
        public boolean ambiguous() { return !tied.isEmpty(); }

        /**
         * Describe the tied candidates (in a stable order).
         *
         * @return descriptions, comma separated
         */
        public String describeTied() {
            return String.join(", ",
                    tied.stream().map(Candidate::description).toList());
        }
    }

    private static final Outcome NONE =
            new Outcome(null, Collections.emptyList());

    /**
     * Choose the best of the candidates for the given argument classes.
     *
     * @param candidates to choose from
     * @param args classes of the arguments ({@code null} for a null
     *     argument)
     * @return the outcome
     */
    public static Outcome resolve(List<Candidate> candidates,
            Class<?>[] args) {
        List<Applicable> applicable = new ArrayList<>();
        for (Candidate c : candidates) {
            Applicable a = applicable(c, args);
            if (a != null) { applicable.add(a); }
        }

        if (applicable.isEmpty()) {
            return NONE;
        } else if (applicable.size() == 1) {
            return new Outcome(applicable.get(0), Collections.emptyList());
        }

        // Look for a candidate better than every other
        for (Applicable a : applicable) {
            boolean beatsAll = true;
            for (Applicable b : applicable) {
                if (a != b && compare(a, b, args) >= 0) {
                    beatsAll = false;
                    break;
                }
            }
            if (beatsAll) { return new Outcome(a, Collections.emptyList()); }
        }

        // Ambiguous: report those not beaten by any other
        List<Candidate> tied = new ArrayList<>();
        for (Applicable a : applicable) {
            boolean beaten = false;
            for (Applicable b : applicable) {
                if (a != b && compare(b, a, args) < 0) {
                    beaten = true;
                    break;
                }
            }
            if (!beaten) { tied.add(a.candidate()); }
        }
        tied.sort(Comparator.comparing(Candidate::description));
        return new Outcome(null, List.copyOf(tied));
    }

    /**
     * Test whether a candidate accepts the argument classes, in normal
     * form or, failing that, in expanded form.
     *
     * @param c candidate
     * @param args classes of the arguments
     * @return the applicable form or {@code null}
     */
    static Applicable applicable(Candidate c, Class<?>[] args) {
        Class<?>[] p = c.parameterTypes();
        int n = args.length;
        if (p.length == n) {
            Conversion[] conv = convert(args, p, p.length, null);
            if (conv != null) { return new Applicable(c, conv, false); }
        }
        if (c.varargs() && n >= p.length - 1) {
            int fixed = p.length - 1;
            Class<?> component = p[fixed].getComponentType();
            Conversion[] conv = convert(args, p, fixed, component);
            if (conv != null) { return new Applicable(c, conv, true); }
        }
        return null;
    }

    /**
     * Convert {@code args[i]} to {@code p[i]} for {@code i<fixed}, and
     * the rest to {@code rest}.
     */
    private static Conversion[] convert(Class<?>[] args, Class<?>[] p,
            int fixed, Class<?> rest) {
        Conversion[] conv = new Conversion[args.length];
        for (int i = 0; i < args.length; i++) {
            Class<?> to = i < fixed ? p[i] : rest;
            if ((conv[i] = Conversion.find(args[i], to)) == null) {
                return null;
            }
        }
        return conv;
    }

    /**
     * Compare two applicable candidates for the same arguments.
     *
     * @return negative if {@code a} is better, positive if {@code b} is
     *     better, zero if neither
     */
    static int compare(Applicable a, Applicable b, Class<?>[] args) {
        if (a.expanded() != b.expanded()) { return a.expanded() ? 1 : -1; }
        boolean aBetter = false, bBetter = false;
        for (int i = 0; i < args.length; i++) {
            int c = compare(args[i], a.conversions()[i], a.parameterType(i),
                    b.conversions()[i], b.parameterType(i));
            if (c < 0) {
                aBetter = true;
            } else if (c > 0) {
                bBetter = true;
            }
        }
        return aBetter == bBetter ? 0 : aBetter ? -1 : 1;
    }

    /** Compare two conversions of one argument. */
    private static int compare(Class<?> arg, Conversion ca, Class<?> pa,
            Conversion cb, Class<?> pb) {
        int r = ca.rank().compareTo(cb.rank());
        if (r != 0 || pa == pb) {
            return r;
        } else if (arg != null && (pa == arg) != (pb == arg)) {
            return pa == arg ? -1 : 1;
        } else if (moreSpecific(pa, pb)) {
            return -1;
        } else if (moreSpecific(pb, pa)) {
            return 1;
        } else {
            return 0;
        }
    }

    /** Whether parameter type {@code p} is more specific than {@code q}. */
    private static boolean moreSpecific(Class<?> p, Class<?> q) {
        if (q == Object.class) {
            return true;
        } else if (!p.isPrimitive() && !q.isPrimitive()
                && q.isAssignableFrom(p)) {
            return true;
        } else {
            return Conversion.narrowerThan(p, q);
        }
    }
}
