package br.edu.ifba.meetingrag.embedding;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Binary form of embedding vectors: consecutive IEEE 754 float32 values, little-endian.
 * Decoding recovers bit-identical values, NaN payloads included.
 */
public final class VectorCodec {

    private VectorCodec() {
        throw new UnsupportedOperationException("Utility class");
    }

    @NotNull
    public static byte[] encode(@NotNull final float[] vector) {
        final ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (final float value : vector) {
            buffer.putInt(Float.floatToRawIntBits(value));
        }
        return buffer.array();
    }

    /**
     * @throws IllegalArgumentException if the length is not a multiple of four
     */
    @NotNull
    public static float[] decode(@NotNull final byte[] bytes) {
        if (bytes.length % Float.BYTES != 0) {
            throw new IllegalArgumentException("Vector blob length " + bytes.length + " is not a multiple of " + Float.BYTES);
        }
        final ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        final float[] vector = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = Float.intBitsToFloat(buffer.getInt());
        }
        return vector;
    }
}
