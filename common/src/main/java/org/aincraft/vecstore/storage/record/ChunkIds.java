package org.aincraft.vecstore.storage.record;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.logging.Logger;
import org.aincraft.vecstore.api.ValidationException;

/**
 * Normalizes caller supplied chunk ids to the INTEGER column type.
 */
public final class ChunkIds {
    // 2^63, one past Long.MAX_VALUE
    private static final double LONG_LIMIT = 0x1p63;

    private ChunkIds() {
    }

    /**
     * Converts to a long. Fractional values are truncated toward zero and logged.
     */
    public static long toIntegral(Number chunkId, Logger logger) {
        if (chunkId == null) {
            throw new ValidationException("chunkId is required");
        }
        if (chunkId instanceof Long || chunkId instanceof Integer
            || chunkId instanceof Short || chunkId instanceof Byte) {
            return chunkId.longValue();
        }
        if (chunkId instanceof BigInteger big) {
            try {
                return big.longValueExact();
            } catch (ArithmeticException e) {
                throw new ValidationException("chunkId out of range: " + big);
            }
        }
        if (chunkId instanceof BigDecimal decimal) {
            long truncated;
            try {
                truncated = decimal.setScale(0, RoundingMode.DOWN).longValueExact();
            } catch (ArithmeticException e) {
                throw new ValidationException("chunkId out of range: " + decimal);
            }
            if (decimal.compareTo(BigDecimal.valueOf(truncated)) != 0) {
                logger.warning("Truncating fractional chunk id " + decimal + " to " + truncated);
            }
            return truncated;
        }
        double value = chunkId.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ValidationException("chunkId must be finite, got " + value);
        }
        if (value >= LONG_LIMIT || value < -LONG_LIMIT) {
            throw new ValidationException("chunkId out of range: " + value);
        }
        long truncated = (long) value;
        if (truncated != value) {
            logger.warning("Truncating fractional chunk id " + value + " to " + truncated);
        }
        return truncated;
    }
}
