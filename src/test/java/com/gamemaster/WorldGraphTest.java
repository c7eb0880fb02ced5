package com.gamemaster;

import com.gamemaster.models.Choice;
import com.gamemaster.models.Scene;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorldGraphTest {

    @Test
    void lookupOfUnknownSceneIsEmpty() {
        WorldGraph world = TestWorlds.brinmere();
        assertTrue(world.getScene("attic").isEmpty());
        assertTrue(world.getScene(null).isEmpty());
        assertThrows(IllegalStateException.class, () -> world.requireScene("attic"));
    }

    @Test
    void exposesNoMutationPaths() {
        WorldGraph world = TestWorlds.brinmere();
        Scene intro = world.requireScene("intro");
        assertThrows(UnsupportedOperationException.class, () -> world.getScenes().clear());
        assertThrows(UnsupportedOperationException.class, () -> world.getOverrideRules().clear());
        assertThrows(UnsupportedOperationException.class, () -> intro.getChoiceMap().clear());
        assertThrows(UnsupportedOperationException.class,
            () -> world.requireScene("box").getChoice("take_map").getEffects().clear());
    }

    @Test
    void allowsSelfLoopsAndCycles() {
        Scene a = new Scene("a", "A", "Room A.", List.of(new Choice("wait", "Wait here.", "a"),
            new Choice("forward", "Go forward.", "b")));
        Scene b = new Scene("b", "B", "Room B.", List.of(new Choice("back", "Go back.", "a")));
        WorldGraph world = new WorldGraph("loop", "a", List.of(a, b), null);
        assertEquals(2, world.size());
        assertEquals("a", world.getEntryScene().getId());
    }

    @Test
    void rejectsDuplicateSceneIds() {
        Scene first = new Scene("a", "A", "one", null);
        Scene second = new Scene("a", "A again", "two", null);
        assertThrows(WorldGraphException.class, () -> new WorldGraph("dup", "a", List.of(first, second), null));
    }

    @Test
    void rejectsEmptyWorld() {
        assertThrows(WorldGraphException.class, () -> new WorldGraph("empty", "a", List.of(), null));
    }
}
