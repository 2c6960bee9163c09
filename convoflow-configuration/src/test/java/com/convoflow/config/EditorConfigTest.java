package com.convoflow.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EditorConfigTest {

    @Test
    void fromEnvironment_usesDefaultsWhenUnset() {
        EditorConfig config = EditorConfig.fromEnvironment(Map.<String, String>of()::get);

        assertEquals(100, config.getUndoLimit());
        assertEquals(250.0, config.getDecisionOffsetX());
        assertEquals(150.0, config.getDecisionOffsetY());
        assertEquals(100.0, config.getDecisionStackY());
        assertEquals(500L, config.getRemoteLoadTimeoutMs());
        assertEquals(Path.of(".convoflow", "current.json"), config.getCachePath());
    }

    @Test
    void fromEnvironment_readsOverrides() {
        Map<String, String> env = Map.of(
                "CONVOFLOW_UNDO_LIMIT", " 20 ",
                "CONVOFLOW_DECISION_OFFSET_X", "300.5",
                "CONVOFLOW_REMOTE_LOAD_TIMEOUT_MS", "1500",
                "CONVOFLOW_CACHE_DIR", "/tmp/flows",
                "CONVOFLOW_CACHE_FILE", "draft.json");

        EditorConfig config = EditorConfig.fromEnvironment(env::get);

        assertEquals(20, config.getUndoLimit());
        assertEquals(300.5, config.getDecisionOffsetX());
        assertEquals(1500L, config.getRemoteLoadTimeoutMs());
        assertEquals(Path.of("/tmp/flows", "draft.json"), config.getCachePath());
    }

    @Test
    void fromEnvironment_fallsBackOnUnparsableValues() {
        Map<String, String> env = Map.of(
                "CONVOFLOW_UNDO_LIMIT", "lots",
                "CONVOFLOW_DECISION_STACK_Y", "tall",
                "CONVOFLOW_CACHE_DIR", "  ");

        EditorConfig config = EditorConfig.fromEnvironment(env::get);

        assertEquals(100, config.getUndoLimit());
        assertEquals(100.0, config.getDecisionStackY());
        assertEquals(".convoflow", config.getCacheDir());
    }

    @Test
    void builder_clampsUndoLimit() {
        assertEquals(1, EditorConfig.builder().undoLimit(0).build().getUndoLimit());
    }
}
