package com.lbg.markets.surveillance.docsync.entity;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;

import java.io.IOException;

/**
 * Codec that writes entities as CBOR through Jackson.
 */
public abstract class CborEntityCodec<T> implements EntityCodec<T> {

    private static final ObjectMapper MAPPER = new CBORMapper();

    private final Class<T> type;

    protected CborEntityCodec(Class<T> type) {
        this.type = type;
    }

    @Override
    public byte[] toBytes(T entity) throws IOException {
        return MAPPER.writeValueAsBytes(entity);
    }

    @Override
    public T fromBytes(byte[] bytes) throws IOException {
        return MAPPER.readValue(bytes, type);
    }
}
