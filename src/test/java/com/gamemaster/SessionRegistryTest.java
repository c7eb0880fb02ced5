package com.gamemaster;

import com.gamemaster.models.SessionState;
import com.gamemaster.resolver.ActionResolver;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class SessionRegistryTest {

    private final WorldGraph world = TestWorlds.brinmere();
    private final GameSessionService sessions = new GameSessionService(world, ActionResolver.deterministic(),
        new EffectEngine(), new NarrativeComposer(world), Clock.systemUTC());
    private final SessionRegistry registry = new SessionRegistry(sessions);

    @Test
    void sameKeyReturnsSameState() {
        SessionState first = registry.getOrCreate("conv");
        assertSame(first, registry.getOrCreate(" conv "));
        assertEquals("intro", first.getCurrentSceneId());
        assertEquals(1, registry.activeCount());
    }

    @Test
    void keysAreIsolated() {
        SessionState a = registry.getOrCreate("a");
        SessionState b = registry.getOrCreate("b");
        sessions.playerAction(a, "inspect_box");

        assertEquals("box", a.getCurrentSceneId());
        assertEquals("intro", b.getCurrentSceneId());
        assertTrue(b.getHistory().isEmpty());
    }

    @Test
    void endDropsState() {
        SessionState before = registry.getOrCreate("conv");
        assertTrue(registry.end("conv"));
        assertFalse(registry.end("conv"));
        assertFalse(registry.end(null));
        assertNotSame(before, registry.getOrCreate("conv"));
    }

    @Test
    void blankKeyIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.getOrCreate("  "));
        assertThrows(IllegalArgumentException.class, () -> registry.getOrCreate(null));
    }
}
