package com.keystone.core.memory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Normalized term set of a goal plus its content address.
 * <p>
 * Goals are lower-cased, split on anything that is not a letter or digit, and stripped of
 * stop words. Two goals with the same term set share a fingerprint regardless of word order.
 *
 * @param value SHA-256 hex over the sorted terms
 * @param terms the normalized terms
 */
public record GoalFingerprint(String value, Set<String> terms) {

    private static final Pattern SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "and", "or", "of", "to", "in", "on", "for", "with", "at", "by",
            "from", "into", "is", "it", "this", "that", "please", "my", "me");

    public static GoalFingerprint of(String goal) {
        TreeSet<String> terms = new TreeSet<>();
        if (goal != null) {
            for (String token : SPLIT.split(goal.toLowerCase(Locale.ROOT))) {
                if (!token.isEmpty() && !STOP_WORDS.contains(token)) {
                    terms.add(token);
                }
            }
        }
        return new GoalFingerprint(sha256(String.join(" ", terms)), Set.copyOf(terms));
    }

    /** Token-set Jaccard similarity in [0, 1]. */
    public double similarity(GoalFingerprint other) {
        if (terms.isEmpty() && other.terms.isEmpty()) {
            return value.equals(other.value) ? 1.0 : 0.0;
        }
        Set<String> union = new TreeSet<>(terms);
        union.addAll(other.terms);
        long shared = terms.stream().filter(other.terms::contains).count();
        return (double) shared / union.size();
    }

    private static String sha256(String text) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
