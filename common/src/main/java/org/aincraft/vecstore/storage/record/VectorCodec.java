package org.aincraft.vecstore.storage.record;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import org.aincraft.vecstore.api.IntegrityException;

/**
 * Little-endian float32 encoding used by sqlite-vec for vector columns.
 */
public final class VectorCodec {
    private VectorCodec() {
    }

    public static byte[] encode(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float v : vector) {
            buffer.putFloat(v);
        }
        return buffer.array();
    }

    public static float[] decode(byte[] blob, int dimension) {
        if (blob == null || blob.length != dimension * Float.BYTES) {
            int length = blob == null ? 0 : blob.length;
            throw new IntegrityException("Stored vector has " + length + " bytes, expected " + dimension * Float.BYTES);
        }
        ByteBuffer buffer = ByteBuffer.wrap(blob).order(ByteOrder.LITTLE_ENDIAN);
        float[] vector = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            vector[i] = buffer.getFloat();
        }
        return vector;
    }

    /**
     * Euclidean distance between two encoded vectors of equal length.
     */
    public static double l2(byte[] a, byte[] b) {
        ByteBuffer left = ByteBuffer.wrap(a).order(ByteOrder.LITTLE_ENDIAN);
        ByteBuffer right = ByteBuffer.wrap(b).order(ByteOrder.LITTLE_ENDIAN);
        double sum = 0;
        int n = a.length / Float.BYTES;
        for (int i = 0; i < n; i++) {
            double d = left.getFloat() - right.getFloat();
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    public static double l2(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }
}
