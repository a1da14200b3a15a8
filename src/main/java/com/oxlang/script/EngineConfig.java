package com.oxlang.script;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.oxlang.debug.Debug;

/**
 * Immutable engine settings.
 *
 * JSON form (every key optional):
 * <pre>
 * { "maxRecursionDepth": 256, "preloadStdlib": false, "traceCalls": false, "modulePrefix": "ox/" }
 * </pre>
 */
public final class EngineConfig {
    public static final String RESOURCE = "ox-engine.json";
    public static final int DEFAULT_MAX_RECURSION_DEPTH = 256;
    public static final String DEFAULT_MODULE_PREFIX = "ox/";

    private static final ObjectMapper om = new ObjectMapper();
    private static final String TAG = "ox.config";

    private final int maxRecursionDepth;
    private final boolean preloadStdlib;
    private final boolean traceCalls;
    private final String modulePrefix;

    private EngineConfig(Builder b) {
        this.maxRecursionDepth = b.maxRecursionDepth;
        this.preloadStdlib = b.preloadStdlib;
        this.traceCalls = b.traceCalls;
        this.modulePrefix = b.modulePrefix;
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxRecursionDepth(maxRecursionDepth)
                .preloadStdlib(preloadStdlib)
                .traceCalls(traceCalls)
                .modulePrefix(modulePrefix);
    }

    public int maxRecursionDepth() { return maxRecursionDepth; }
    public boolean preloadStdlib() { return preloadStdlib; }
    public boolean traceCalls() { return traceCalls; }
    public String modulePrefix() { return modulePrefix; }

    /** Reads {@value #RESOURCE} from the classpath, falling back to defaults when absent. */
    public static EngineConfig load() {
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                Debug.get().d(TAG, RESOURCE + " not found, using defaults");
                return defaults();
            }
            return fromJson(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE + ": " + e.getMessage(), e);
        }
    }

    public static EngineConfig fromJson(InputStream in) throws IOException {
        if (in == null) throw new IllegalArgumentException("in is null");
        return fromJson(om.readTree(in));
    }

    public static EngineConfig fromJson(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return fromJson(om.readTree(json));
    }

    private static EngineConfig fromJson(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("engine config must be a JSON object");
        }
        Builder b = builder();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode v = e.getValue();
            switch (e.getKey()) {
                case "maxRecursionDepth":
                    if (!v.canConvertToInt() || !v.isIntegralNumber()) {
                        throw new IllegalArgumentException("maxRecursionDepth must be an integer, got " + v);
                    }
                    b.maxRecursionDepth(v.intValue());
                    break;
                case "preloadStdlib":
                    b.preloadStdlib(requireBool(e.getKey(), v));
                    break;
                case "traceCalls":
                    b.traceCalls(requireBool(e.getKey(), v));
                    break;
                case "modulePrefix":
                    if (!v.isTextual()) throw new IllegalArgumentException("modulePrefix must be a string, got " + v);
                    b.modulePrefix(v.asText());
                    break;
                default:
                    Debug.get().w(TAG, "ignoring unknown config key '" + e.getKey() + "'");
            }
        }
        return b.build();
    }

    private static boolean requireBool(String key, JsonNode v) {
        if (!v.isBoolean()) throw new IllegalArgumentException(key + " must be a boolean, got " + v);
        return v.booleanValue();
    }

    public ObjectNode toJson() {
        ObjectNode n = om.createObjectNode();
        n.put("maxRecursionDepth", maxRecursionDepth);
        n.put("preloadStdlib", preloadStdlib);
        n.put("traceCalls", traceCalls);
        n.put("modulePrefix", modulePrefix);
        return n;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }

    public static final class Builder {
        private int maxRecursionDepth = DEFAULT_MAX_RECURSION_DEPTH;
        private boolean preloadStdlib = false;
        private boolean traceCalls = false;
        private String modulePrefix = DEFAULT_MODULE_PREFIX;

        private Builder() {}

        public Builder maxRecursionDepth(int depth) {
            if (depth < 1) throw new IllegalArgumentException("maxRecursionDepth must be >= 1, got " + depth);
            this.maxRecursionDepth = depth;
            return this;
        }

        public Builder preloadStdlib(boolean preload) {
            this.preloadStdlib = preload;
            return this;
        }

        public Builder traceCalls(boolean trace) {
            this.traceCalls = trace;
            return this;
        }

        public Builder modulePrefix(String prefix) {
            if (prefix == null) throw new IllegalArgumentException("modulePrefix is null");
            this.modulePrefix = prefix;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
