package com.memclaw.memory.embedding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Lazy, shared access to the embedding function. The loader runs at most once: if it
 * fails, the gate reports "unavailable" for the rest of the process lifetime.
 * Vectors come back normalised to unit length, so similarity is a plain dot product.
 */
public class EmbeddingGate {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingGate.class);

    private final String configuredModel;
    private final Callable<EmbeddingFunction> loader;
    private final Object lock = new Object();

    private volatile EmbeddingFunction function;
    private volatile boolean failed;

    public EmbeddingGate(String configuredModel, Callable<EmbeddingFunction> loader) {
        this.configuredModel = configuredModel;
        this.loader = loader;
    }

    /** A gate with nothing behind it; every call returns empty. */
    public static EmbeddingGate disabled() {
        return new EmbeddingGate(null, null);
    }

    public static EmbeddingGate of(EmbeddingFunction function) {
        return new EmbeddingGate(function.modelName(), () -> function);
    }

    public Optional<float[]> embed(String text) {
        var fn = function();
        if (fn == null || text == null || text.isBlank()) return Optional.empty();
        try {
            var vec = fn.embed(text);
            return Optional.ofNullable(normalize(vec));
        } catch (Exception e) {
            log.warn("Embedding failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public boolean isAvailable() {
        return loader != null && !failed;
    }

    /** Configured model name while the gate is usable, null once it is known to be unavailable. */
    public String modelName() {
        if (!isAvailable()) return null;
        var fn = function;
        return fn != null ? fn.modelName() : configuredModel;
    }

    private EmbeddingFunction function() {
        var fn = function;
        if (fn != null || failed || loader == null) return fn;
        synchronized (lock) {
            if (function == null && !failed) {
                try {
                    function = loader.call();
                    if (function == null) {
                        failed = true;
                    } else {
                        log.info("Embedding model ready: {}", function.modelName());
                    }
                } catch (Exception e) {
                    failed = true;
                    log.warn("Embedding model unavailable, semantic recall falls back to topics: {}", e.getMessage());
                }
            }
            return function;
        }
    }

    static float[] normalize(float[] vec) {
        if (vec == null || vec.length == 0) return null;
        double norm = 0;
        for (float v : vec) norm += (double) v * v;
        if (norm == 0 || !Double.isFinite(norm)) return null;
        var scale = (float) (1.0 / Math.sqrt(norm));
        var out = new float[vec.length];
        for (int i = 0; i < vec.length; i++) out[i] = vec[i] * scale;
        return out;
    }

    /** Dot product of two unit vectors; 0 when the dimensions disagree. */
    public static double similarity(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length) return 0.0;
        double dot = 0;
        for (int i = 0; i < a.length; i++) dot += (double) a[i] * b[i];
        return dot;
    }
}
