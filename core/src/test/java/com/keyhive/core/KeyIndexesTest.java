package com.keyhive.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class KeyIndexesTest {

    @Test
    public void shouldDeclareOneIndexPerQueriedField() {
        assertEquals(List.of(
                new KeyIndexes.IndexSpec("rfingerprint", true, false),
                new KeyIndexes.IndexSpec("md5", true, false),
                new KeyIndexes.IndexSpec("mtime", false, false),
                new KeyIndexes.IndexSpec("keywords", false, true)), KeyIndexes.ALL);
    }
}
