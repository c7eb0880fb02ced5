package com.gamemaster.resolver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamemaster.WorldGraph;
import com.gamemaster.WorldLoader;
import com.gamemaster.models.Choice;
import com.gamemaster.models.Scene;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ActionResolverTest {

    private final WorldGraph world = new WorldLoader(new ObjectMapper())
        .loadResource(WorldLoader.DEFAULT_WORLD_RESOURCE);
    private final ActionResolver resolver = ActionResolver.deterministic();

    @Test
    void everyChoiceIdResolvesExactlyInItsScene() {
        for (Scene scene : world.getScenes()) {
            for (String choiceId : scene.getChoiceIds()) {
                Resolution resolution = resolver.resolve(scene, choiceId);
                assertTrue(resolution.isResolved(), scene.getId() + "/" + choiceId);
                assertEquals(choiceId, resolution.getChoiceId());
                assertEquals("exact", resolution.getStage());
            }
        }
    }

    @Test
    void exactMatchIgnoresCaseAndWhitespace() {
        Resolution resolution = resolver.resolve(world.requireScene("intro"), "  INSPECT_BOX ");
        assertEquals("inspect_box", resolution.getChoiceId());
        assertEquals("exact", resolution.getStage());
    }

    @Test
    void stagesRunInFixedOrder() {
        List<String> names = new ArrayList<>();
        for (ResolutionStage stage : resolver.getStages()) {
            names.add(stage.getName());
        }
        assertEquals(List.of("exact", "description", "verb"), names);

        List<String> withFallback = new ArrayList<>();
        SemanticFallbackStage fallback = new SemanticFallbackStage(request -> SemanticResolver.NONE, 500);
        for (ResolutionStage stage : ActionResolver.withFallback(fallback).getStages()) {
            withFallback.add(stage.getName());
        }
        fallback.shutdown();
        assertEquals(List.of("exact", "description", "verb", "semantic"), withFallback);
    }

    @Test
    void descriptionWordsResolveNaturalPhrasing() {
        Resolution box = resolver.resolve(world.requireScene("intro"), "inspect the box");
        assertEquals("inspect_box", box.getChoiceId());
        assertEquals("description", box.getStage());

        Resolution inland = resolver.resolve(world.requireScene("intro"), "go inland");
        assertEquals("approach_tower", inland.getChoiceId());
        assertEquals("description", inland.getStage());
    }

    @Test
    void actionVerbResolvesWhenDescriptionWordsDoNot() {
        Resolution resolution = resolver.resolve(world.requireScene("cellar"), "I'd like to close it up");
        assertEquals("leave_quietly", resolution.getChoiceId());
        assertEquals("verb", resolution.getStage());
    }

    @Test
    void firstDeclaredChoiceWinsTies() {
        Scene scene = new Scene("gate", "Gate", "A gate.", List.of(
            new Choice("north_gate", "Open the north gate.", "gate"),
            new Choice("south_gate", "Open the south gate.", "gate")
        ));
        Resolution resolution = resolver.resolve(scene, "open the gate please");
        assertEquals("north_gate", resolution.getChoiceId());
        assertEquals("description", resolution.getStage());
    }

    @Test
    void choicesOfOtherScenesAreNeverMatched() {
        assertFalse(resolver.resolve(world.requireScene("intro"), "take_map").isResolved());
        assertFalse(resolver.resolve(world.requireScene("tower"), "open_hatch").isResolved());
        assertTrue(resolver.resolve(world.requireScene("tower_approach"), "open_hatch").isResolved());
    }

    @Test
    void unrelatedOrEmptyUtterancesStayUnresolved() {
        Scene intro = world.requireScene("intro");
        assertFalse(resolver.resolve(intro, "hmm").isResolved());
        assertFalse(resolver.resolve(intro, "xyzzy").isResolved());
        assertFalse(resolver.resolve(intro, "   ").isResolved());
        assertFalse(resolver.resolve(intro, null).isResolved());
        assertFalse(resolver.resolve(world.requireScene("cottages"), "maybe").isResolved());
        assertNull(resolver.resolve(intro, "hmm").getStage());
    }

    @Test
    void fallbackOnlyRunsWhenDeterministicStagesMiss() {
        AtomicInteger calls = new AtomicInteger();
        SemanticFallbackStage fallback = new SemanticFallbackStage(request -> {
            calls.incrementAndGet();
            return "walk_to_cottages";
        }, 1000);
        ActionResolver withFallback = ActionResolver.withFallback(fallback);
        Scene intro = world.requireScene("intro");

        assertEquals("inspect_box", withFallback.resolve(intro, "inspect_box").getChoiceId());
        assertEquals("inspect_box", withFallback.resolve(intro, "inspect the box").getChoiceId());
        assertEquals(0, calls.get());

        Resolution semantic = withFallback.resolve(intro, "I fancy some company");
        assertEquals("walk_to_cottages", semantic.getChoiceId());
        assertEquals("semantic", semantic.getStage());
        assertEquals(1, calls.get());
        fallback.shutdown();
    }
}
