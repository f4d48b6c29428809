package com.keyhive.core;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Search tokens derived from user id strings.
 */
public final class Keywords {
    private Keywords() {
    }

    public static Set<String> of(Pubkey key) {
        return of(key.userIds());
    }

    /**
     * Splits every user id on anything that is not a letter or a number, lowercases
     * the pieces and collects them into a set.
     */
    public static Set<String> of(Collection<String> userIds) {
        Set<String> result = new LinkedHashSet<>();
        for (String userId : userIds) {
            StringBuilder token = new StringBuilder();
            userId.codePoints().forEach(cp -> {
                if (isTokenChar(cp)) {
                    token.appendCodePoint(cp);
                } else if (token.length() > 0) {
                    result.add(token.toString().toLowerCase(Locale.ROOT));
                    token.setLength(0);
                }
            });
            if (token.length() > 0) {
                result.add(token.toString().toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }

    private static boolean isTokenChar(int cp) {
        if (Character.isLetter(cp)) {
            return true;
        }
        switch (Character.getType(cp)) {
            case Character.DECIMAL_DIGIT_NUMBER:
            case Character.LETTER_NUMBER:
            case Character.OTHER_NUMBER:
                return true;
            default:
                return false;
        }
    }
}
