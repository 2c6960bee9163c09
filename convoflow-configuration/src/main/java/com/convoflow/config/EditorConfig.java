package com.convoflow.config;

import java.nio.file.Path;
import java.util.function.Function;

/**
 * Editor configuration from environment variables.
 * <ul>
 *   <li>{@code CONVOFLOW_UNDO_LIMIT} – snapshots kept by the undo history (default 100)</li>
 *   <li>{@code CONVOFLOW_DECISION_OFFSET_X} / {@code CONVOFLOW_DECISION_OFFSET_Y} – where a new decision
 *       node is placed relative to its owning node (default 250 / 150)</li>
 *   <li>{@code CONVOFLOW_DECISION_STACK_Y} – extra vertical offset per further decision on the same node (default 100)</li>
 *   <li>{@code CONVOFLOW_REMOTE_LOAD_TIMEOUT_MS} – how long to wait for a remote document before using the local cache (default 500)</li>
 *   <li>{@code CONVOFLOW_CACHE_DIR} / {@code CONVOFLOW_CACHE_FILE} – location of the local document cache
 *       (default {@code .convoflow/current.json})</li>
 * </ul>
 */
public final class EditorConfig {

    private static final String ENV_UNDO_LIMIT = "CONVOFLOW_UNDO_LIMIT";
    private static final String ENV_DECISION_OFFSET_X = "CONVOFLOW_DECISION_OFFSET_X";
    private static final String ENV_DECISION_OFFSET_Y = "CONVOFLOW_DECISION_OFFSET_Y";
    private static final String ENV_DECISION_STACK_Y = "CONVOFLOW_DECISION_STACK_Y";
    private static final String ENV_REMOTE_LOAD_TIMEOUT_MS = "CONVOFLOW_REMOTE_LOAD_TIMEOUT_MS";
    private static final String ENV_CACHE_DIR = "CONVOFLOW_CACHE_DIR";
    private static final String ENV_CACHE_FILE = "CONVOFLOW_CACHE_FILE";

    private static final int DEFAULT_UNDO_LIMIT = 100;
    private static final double DEFAULT_DECISION_OFFSET_X = 250;
    private static final double DEFAULT_DECISION_OFFSET_Y = 150;
    private static final double DEFAULT_DECISION_STACK_Y = 100;
    private static final long DEFAULT_REMOTE_LOAD_TIMEOUT_MS = 500;
    private static final String DEFAULT_CACHE_DIR = ".convoflow";
    private static final String DEFAULT_CACHE_FILE = "current.json";

    private static final EditorConfig DEFAULTS = builder().build();

    private final int undoLimit;
    private final double decisionOffsetX;
    private final double decisionOffsetY;
    private final double decisionStackY;
    private final long remoteLoadTimeoutMs;
    private final String cacheDir;
    private final String cacheFile;

    private EditorConfig(Builder b) {
        this.undoLimit = b.undoLimit;
        this.decisionOffsetX = b.decisionOffsetX;
        this.decisionOffsetY = b.decisionOffsetY;
        this.decisionStackY = b.decisionStackY;
        this.remoteLoadTimeoutMs = b.remoteLoadTimeoutMs;
        this.cacheDir = b.cacheDir;
        this.cacheFile = b.cacheFile;
    }

    /** Configuration with every value at its default. */
    public static EditorConfig defaults() {
        return DEFAULTS;
    }

    public int getUndoLimit() {
        return undoLimit;
    }

    public double getDecisionOffsetX() {
        return decisionOffsetX;
    }

    public double getDecisionOffsetY() {
        return decisionOffsetY;
    }

    public double getDecisionStackY() {
        return decisionStackY;
    }

    public long getRemoteLoadTimeoutMs() {
        return remoteLoadTimeoutMs;
    }

    public String getCacheDir() {
        return cacheDir;
    }

    public String getCacheFile() {
        return cacheFile;
    }

    /** Cache directory joined with the cache file name. */
    public Path getCachePath() {
        return Path.of(cacheDir).resolve(cacheFile);
    }

    public static EditorConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /** Reads the variables through the given lookup; unset, blank or unparsable values fall back to defaults. */
    public static EditorConfig fromEnvironment(Function<String, String> env) {
        return builder()
                .undoLimit(parseInt(env.apply(ENV_UNDO_LIMIT), DEFAULT_UNDO_LIMIT))
                .decisionOffsetX(parseDouble(env.apply(ENV_DECISION_OFFSET_X), DEFAULT_DECISION_OFFSET_X))
                .decisionOffsetY(parseDouble(env.apply(ENV_DECISION_OFFSET_Y), DEFAULT_DECISION_OFFSET_Y))
                .decisionStackY(parseDouble(env.apply(ENV_DECISION_STACK_Y), DEFAULT_DECISION_STACK_Y))
                .remoteLoadTimeoutMs(parseLong(env.apply(ENV_REMOTE_LOAD_TIMEOUT_MS), DEFAULT_REMOTE_LOAD_TIMEOUT_MS))
                .cacheDir(getEnv(env, ENV_CACHE_DIR, DEFAULT_CACHE_DIR))
                .cacheFile(getEnv(env, ENV_CACHE_FILE, DEFAULT_CACHE_FILE))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static double parseDouble(String value, double defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private int undoLimit = DEFAULT_UNDO_LIMIT;
        private double decisionOffsetX = DEFAULT_DECISION_OFFSET_X;
        private double decisionOffsetY = DEFAULT_DECISION_OFFSET_Y;
        private double decisionStackY = DEFAULT_DECISION_STACK_Y;
        private long remoteLoadTimeoutMs = DEFAULT_REMOTE_LOAD_TIMEOUT_MS;
        private String cacheDir = DEFAULT_CACHE_DIR;
        private String cacheFile = DEFAULT_CACHE_FILE;

        /** Values below 1 are raised to 1. */
        public Builder undoLimit(int undoLimit) {
            this.undoLimit = Math.max(1, undoLimit);
            return this;
        }

        public Builder decisionOffsetX(double decisionOffsetX) {
            this.decisionOffsetX = decisionOffsetX;
            return this;
        }

        public Builder decisionOffsetY(double decisionOffsetY) {
            this.decisionOffsetY = decisionOffsetY;
            return this;
        }

        public Builder decisionStackY(double decisionStackY) {
            this.decisionStackY = decisionStackY;
            return this;
        }

        public Builder remoteLoadTimeoutMs(long remoteLoadTimeoutMs) {
            this.remoteLoadTimeoutMs = Math.max(0, remoteLoadTimeoutMs);
            return this;
        }

        public Builder cacheDir(String cacheDir) {
            this.cacheDir = cacheDir != null ? cacheDir : DEFAULT_CACHE_DIR;
            return this;
        }

        public Builder cacheFile(String cacheFile) {
            this.cacheFile = cacheFile != null ? cacheFile : DEFAULT_CACHE_FILE;
            return this;
        }

        public EditorConfig build() {
            return new EditorConfig(this);
        }
    }
}
