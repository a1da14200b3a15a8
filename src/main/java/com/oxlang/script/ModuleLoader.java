package com.oxlang.script;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Supplies module source text for {@code import} statements.
 *
 * Module names are dotted ("std.math"); how a name maps to text is up to
 * the loader. Returning {@code null} means the module does not exist.
 */
@FunctionalInterface
public interface ModuleLoader {

    String load(String module) throws IOException;

    /**
     * Resolves "a.b" to the classpath resource {@code prefix + "a/b.ox"}.
     */
    static ModuleLoader classpath(String prefix) {
        final String base = (prefix == null) ? "" : prefix;
        final ClassLoader cl = ModuleLoader.class.getClassLoader();
        return module -> {
            String path = base + module.replace('.', '/') + ".ox";
            try (InputStream in = cl.getResourceAsStream(path)) {
                if (in == null) return null;
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        };
    }

    /** In-memory modules keyed by dotted name; the map is copied. */
    static ModuleLoader ofMap(Map<String, String> sources) {
        if (sources == null) throw new IllegalArgumentException("sources is null");
        final Map<String, String> copy = new LinkedHashMap<>(sources);
        return copy::get;
    }

    /** Tries {@code this} first, then {@code other}. */
    default ModuleLoader orElse(ModuleLoader other) {
        if (other == null) throw new IllegalArgumentException("other is null");
        return module -> {
            String src = load(module);
            return (src != null) ? src : other.load(module);
        };
    }
}
