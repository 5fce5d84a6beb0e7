/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.codec;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Decodes newline-delimited JSON objects lazily. Blank lines are ignored.
 */
public final class JsonLinesCodec implements RecordCodec {

    private final ObjectReader reader;

    public JsonLinesCodec() {
        this(new ObjectMapper());
    }

    public JsonLinesCodec(ObjectMapper mapper) {
        this.reader = Objects.requireNonNull(mapper, "mapper").readerFor(JsonRecordCodec.MAP_TYPE);
    }

    @Override
    public String id() {
        return "JSON_LINES";
    }

    @Override
    public Iterator<Map<String, Object>> decode(byte[] body) throws IOException {
        MappingIterator<Map<String, Object>> it = reader.readValues(body);
        return it;
    }
}
