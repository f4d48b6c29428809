package com.keyhive.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class KeyRecordTest {

    @Test
    public void packetsShouldBeCopiedInAndOut() {
        byte[] packets = {1, 2, 3};
        KeyRecord record = new KeyRecord("abc", 1L, 2L, "d1", packets, List.of("alice"));

        packets[0] = 9;
        record.packets()[1] = 9;

        assertArrayEquals(new byte[]{1, 2, 3}, record.packets());
    }

    @Test
    public void recordsWithTheSameContentShouldBeEqual() {
        KeyRecord first = new KeyRecord("abc", 1L, 2L, "d1", new byte[]{1, 2, 3}, List.of("alice"));
        KeyRecord second = new KeyRecord("abc", 1L, 2L, "d1", new byte[]{1, 2, 3}, List.of("alice"));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, new KeyRecord("abc", 1L, 2L, "d1", new byte[]{1, 2}, List.of("alice")));
        assertEquals(first.withCreatedAt(5L).withCreatedAt(1L), first);
    }
}
