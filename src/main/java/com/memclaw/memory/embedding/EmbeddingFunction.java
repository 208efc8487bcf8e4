package com.memclaw.memory.embedding;

import java.io.IOException;

public interface EmbeddingFunction {
    String modelName();
    float[] embed(String text) throws IOException;
}
