package com.keyhive.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Normalization of the key identifiers callers hand to {@link Storage}.
 */
public final class Fingerprints {
    /**
     * Hex length of a v4 fingerprint. Shorter identifiers are treated as prefixes.
     */
    public static final int LENGTH = 40;

    private Fingerprints() {
    }

    /**
     * Identifiers split by how they are resolved.
     *
     * @param resolved full-length identifiers, passed through without a lookup
     * @param prefixes shorter hex identifiers to be expanded against the store
     */
    public record Resolution(List<String> resolved, List<String> prefixes) {}

    public static String reverse(String id) {
        return new StringBuilder(id).reverse().toString();
    }

    public static List<String> lowercase(List<String> values) {
        List<String> result = new ArrayList<>(values.size());
        for (String value : values) {
            result.add(value.toLowerCase(Locale.ROOT));
        }
        return result;
    }

    /**
     * Lowercases the identifiers and sorts them into full-length fingerprints and
     * prefixes. Empty and non-hex prefixes cannot match a stored fingerprint and are
     * dropped. Only v4 identifiers are handled; v3 key ids will not resolve.
     */
    public static Resolution split(List<String> ids) {
        List<String> resolved = new ArrayList<>();
        List<String> prefixes = new ArrayList<>();
        for (String id : lowercase(ids)) {
            if (id.length() >= LENGTH) {
                resolved.add(id);
            } else if (isHex(id)) {
                prefixes.add(id);
            }
        }
        return new Resolution(resolved, prefixes);
    }

    static boolean isHex(String id) {
        if (id.isEmpty()) {
            return false;
        }
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                return false;
            }
        }
        return true;
    }
}
