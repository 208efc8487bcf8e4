package com.memclaw.memory.store;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/** float32 little-endian, the layout of the {@code memories.embedding} column. */
final class VectorCodec {

    private VectorCodec() {}

    static byte[] encode(float[] vector) {
        var buf = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float v : vector) buf.putFloat(v);
        return buf.array();
    }

    static float[] decode(byte[] bytes) {
        if (bytes == null || bytes.length % Float.BYTES != 0) return null;
        var buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        var vector = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < vector.length; i++) vector[i] = buf.getFloat();
        return vector;
    }
}
