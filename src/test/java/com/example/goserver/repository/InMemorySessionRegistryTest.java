package com.example.goserver.repository;

import com.example.goserver.model.domain.GameSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collection;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySessionRegistryTest {

    private InMemorySessionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemorySessionRegistry();
    }

    private static GameSession session(String id, String code) {
        GameSession session = new GameSession();
        session.setId(id);
        session.setCode(code);
        return session;
    }

    @Test
    void testInsertAndLookup() {
        GameSession session = session("g1", "ABC123");
        registry.insert(session);

        assertSame(session, registry.lookup("g1").orElseThrow());
        assertTrue(registry.lookup("g2").isEmpty());
        assertTrue(registry.lookup(null).isEmpty());
    }

    @Test
    void testDuplicateIdRejected() {
        GameSession first = session("g1", "ABC123");
        registry.insert(first);

        assertSame(first, registry.insert(first));
        assertThrows(IllegalStateException.class, () -> registry.insert(session("g1", "XYZ789")));
    }

    @Test
    void testLookupByCodeIgnoresCase() {
        registry.insert(session("g1", "ABC123"));

        assertEquals("g1", registry.lookupByCode("abc123").orElseThrow().getId());
        assertTrue(registry.lookupByCode("ZZZ999").isEmpty());
        assertTrue(registry.lookupByCode(null).isEmpty());
    }

    @Test
    void testRemove() {
        registry.insert(session("g1", "ABC123"));

        assertTrue(registry.remove("g1").isPresent());
        assertTrue(registry.remove("g1").isEmpty());
        assertTrue(registry.lookup("g1").isEmpty());
    }

    @Test
    void testSnapshotIsDetached() {
        registry.insert(session("g1", "ABC123"));
        registry.insert(session("g2", "DEF456"));

        Collection<GameSession> snapshot = registry.snapshot();
        registry.remove("g1");

        assertEquals(2, snapshot.size());
        assertEquals(1, registry.snapshot().size());
    }
}
