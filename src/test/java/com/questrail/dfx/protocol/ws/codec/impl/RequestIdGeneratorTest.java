package com.questrail.dfx.protocol.ws.codec.impl;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RequestIdGeneratorTest
{
    @Test
    void idsAreTenLowercaseHexCharacters() {
        RequestIdGenerator ids = RequestIdGenerator.random();
        for (int i = 0; i < 1000; i++) {
            String id = ids.nextId();
            assertEquals(10, id.length(), id);
            assertTrue(id.matches("[0-9a-f]{10}"), id);
        }
    }

    @Test
    void consecutiveIdsDoNotCollide() {
        RequestIdGenerator ids = RequestIdGenerator.random();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            seen.add(ids.nextId());
        }
        assertEquals(1000, seen.size());
    }
}
