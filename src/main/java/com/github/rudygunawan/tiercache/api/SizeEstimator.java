package com.github.rudygunawan.tiercache.api;

import java.io.IOException;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;

/**
 * Estimates the serialized size of a value, in bytes, for the fast tier's byte budget.
 *
 * <p>The estimator runs on every write before the cache lock is taken. Keep it cheap and
 * deterministic; the estimate only has to be proportional to the real footprint.
 *
 * <pre>{@code
 * TieredCache<byte[]> cache = TieredCacheBuilder.newBuilder()
 *     .maximumBytes(64 * 1024 * 1024)
 *     .sizeEstimator(SizeEstimator.byteArrayEstimator())
 *     .build();
 * }</pre>
 *
 * @param <V> the type of values
 */
@FunctionalInterface
public interface SizeEstimator<V> {

    /**
     * Size assumed for values the default estimator cannot measure.
     */
    long FALLBACK_SIZE_BYTES = 1024;

    /**
     * Returns the estimated size of {@code value}.
     *
     * @param value the value being stored (never null)
     * @return the size in bytes, must be non-negative
     */
    long estimate(V value);

    /**
     * Returns the default estimator:
     * <ul>
     *   <li>{@code CharSequence}: UTF-8 length</li>
     *   <li>{@code Number}, {@code Boolean}, {@code Character}: 8</li>
     *   <li>{@code byte[]}: array length</li>
     *   <li>other {@code Serializable}: length of its Java serialization</li>
     *   <li>anything else, or a value that fails to serialize: {@value #FALLBACK_SIZE_BYTES}</li>
     * </ul>
     *
     * @param <V> the type of values
     * @return the default estimator
     */
    static <V> SizeEstimator<V> defaultEstimator() {
        return value -> {
            if (value instanceof CharSequence) {
                return value.toString().getBytes(StandardCharsets.UTF_8).length;
            }
            if (value instanceof Number || value instanceof Boolean || value instanceof Character) {
                return 8;
            }
            if (value instanceof byte[]) {
                return ((byte[]) value).length;
            }
            if (value instanceof Serializable) {
                return serializedLength((Serializable) value);
            }
            return FALLBACK_SIZE_BYTES;
        };
    }

    /**
     * Returns an estimator that measures byte arrays by their length.
     */
    static SizeEstimator<byte[]> byteArrayEstimator() {
        return value -> value.length;
    }

    /**
     * Returns an estimator that assigns the same size to every value.
     */
    static <V> SizeEstimator<V> fixed(long sizeBytes) {
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("size must not be negative");
        }
        return value -> sizeBytes;
    }

    private static long serializedLength(Serializable value) {
        CountingOutputStream counter = new CountingOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(counter)) {
            out.writeObject(value);
        } catch (IOException e) {
            return FALLBACK_SIZE_BYTES;
        }
        return counter.count;
    }

    /**
     * Discards bytes, keeping only their number.
     */
    final class CountingOutputStream extends OutputStream {
        private long count;

        @Override
        public void write(int b) {
            count++;
        }

        @Override
        public void write(byte[] b, int off, int len) {
            count += len;
        }
    }
}
