package org.broadinstitute.genbank.utils;

import java.util.Arrays;

/**
 * BaseUtils contains some basic utilities for manipulating nucleotides.
 */
public final class BaseUtils {

    private BaseUtils() {}

    /**
     * What to do with a character that has no Watson-Crick complement (ambiguity codes, gaps, anything else).
     */
    public enum UnmappedBasePolicy {
        /** the character is its own complement */
        PASS_THROUGH,
        /** complementing the character is an error */
        ERROR
    }

    private static final char UNMAPPED = '\0';

    private static final char[] complementMap = new char[128];
    static {
        Arrays.fill(complementMap, UNMAPPED);
        complementMap['A'] = 'T';
        complementMap['a'] = 't';
        complementMap['C'] = 'G';
        complementMap['c'] = 'g';
        complementMap['G'] = 'C';
        complementMap['g'] = 'c';
        complementMap['T'] = 'A';
        complementMap['t'] = 'a';
    }

    /**
     * @return true if the base is one of [AaCcGgTt]
     */
    public static boolean isRegularBase(final char base) {
        return base < complementMap.length && complementMap[base] != UNMAPPED;
    }

    /**
     * Return the complement (A <-> T or C <-> G) of a base, preserving its case.
     *
     * @param base the base
     * @param policy what to do when {@code base} is not one of [AaCcGgTt]
     * @return the complementary base, or the input base under {@link UnmappedBasePolicy#PASS_THROUGH}
     * @throws IllegalArgumentException if the base cannot be complemented under {@link UnmappedBasePolicy#ERROR}
     */
    public static char simpleComplement(final char base, final UnmappedBasePolicy policy) {
        if (isRegularBase(base)) {
            return complementMap[base];
        }
        if (policy == UnmappedBasePolicy.ERROR) {
            throw new IllegalArgumentException("base must be one of A, C, G or T in either case. '" + base + "' cannot be complemented.");
        }
        return base;
    }

    /**
     * Reverse complement a string of bases.
     *
     * @param bases the bases, never {@code null}
     * @param policy what to do with characters other than [AaCcGgTt]
     * @return the reverse complement of the bases, same length as the input
     */
    public static String simpleReverseComplement(final String bases, final UnmappedBasePolicy policy) {
        Utils.nonNull(bases, "the bases cannot be null");
        Utils.nonNull(policy, "the policy cannot be null");
        final int length = bases.length();
        final char[] rcbases = new char[length];

        for (int i = 0; i < length; i++) {
            rcbases[i] = simpleComplement(bases.charAt(length - 1 - i), policy);
        }

        return new String(rcbases);
    }
}
