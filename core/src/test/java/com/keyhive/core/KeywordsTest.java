package com.keyhive.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class KeywordsTest {

    @Test
    public void shouldSplitOnPunctuationAndLowercase() {
        Set<String> keywords = Keywords.of(List.of("Alice <alice@example.com>"));

        assertEquals(Set.of("alice", "example", "com"), keywords);
    }

    @Test
    public void shouldKeepDigitsAndNonAsciiLetters() {
        Set<String> keywords = Keywords.of(List.of("Jürgen Müller (Büro 42) <jm@b2b.de>"));

        assertTrue(keywords.contains("jürgen"));
        assertTrue(keywords.contains("müller"));
        assertTrue(keywords.contains("büro"));
        assertTrue(keywords.contains("42"));
        assertTrue(keywords.contains("b2b"));
        assertFalse(keywords.contains("(büro"));
    }

    @Test
    public void shouldTreatInvalidEncodingAsSeparator() {
        byte[] raw = {'b', 'o', 'b', (byte) 0xC3, 'x', 'y'};
        Set<String> keywords = Keywords.of(List.of(new String(raw, StandardCharsets.UTF_8)));

        assertEquals(Set.of("bob", "xy"), keywords);
    }

    @Test
    public void shouldDeduplicateAcrossUserIds() {
        Set<String> keywords = Keywords.of(List.of("Bob <bob@example.com>", "BOB <bob@example.org>"));

        assertEquals(Set.of("bob", "example", "com", "org"), keywords);
    }

    @Test
    public void shouldBeEmptyWithoutUserIds() {
        assertTrue(Keywords.of(List.of()).isEmpty());
        assertTrue(Keywords.of(List.of("<@>")).isEmpty());
    }

    @Test
    public void identicalUserIdsOnDifferentKeysGiveIdenticalKeywords() {
        Pubkey first = TestKeys.pubkey("Alice <alice@example.com>");
        Pubkey second = TestKeys.pubkey("Alice <alice@example.com>");

        assertNotEquals(first.fingerprint(), second.fingerprint());
        assertEquals(Keywords.of(first), Keywords.of(second));
    }
}
