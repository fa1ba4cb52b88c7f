package com.lbg.markets.surveillance.docsync.entity;

import java.io.IOException;

/**
 * Binary encoding of one entity type, plus the stand-in used when content is missing.
 */
public interface EntityCodec<T> {

    byte[] toBytes(T entity) throws IOException;

    T fromBytes(byte[] bytes) throws IOException;

    /**
     * Entity to show for a key whose content cannot be resolved.
     */
    T missingPlaceholder(String key);
}
