package net.seoedge.domain.cache;

import java.util.Objects;

/**
 * Stored form of a cached value, decided once at write time.
 */
public sealed interface CacheValue permits CacheValue.Plain, CacheValue.Compressed {

    /**
     * Value kept exactly as the caller supplied it.
     */
    record Plain(Object value) implements CacheValue {
    }

    /**
     * Gzip-compressed UTF-8 payload of a large string value.
     *
     * @param gzipBytes compressed bytes
     * @param originalLength character length of the uncompressed string
     */
    record Compressed(byte[] gzipBytes, int originalLength) implements CacheValue {

        public Compressed {
            Objects.requireNonNull(gzipBytes, "gzipBytes must not be null");
        }
    }
}
