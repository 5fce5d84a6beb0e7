/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.codec;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Decodes a JSON array of objects, or a single JSON object, with a streaming parser.
 *
 * <p>Array elements are read one at a time as the iterator advances, so records ahead of a
 * syntax error are still delivered. Errors after the first token surface from
 * {@link Iterator#hasNext()} as {@link UncheckedIOException}.</p>
 */
public final class JsonRecordCodec implements RecordCodec {

    private static final Logger log = LoggerFactory.getLogger(JsonRecordCodec.class);

    static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public JsonRecordCodec() {
        this(new ObjectMapper());
    }

    public JsonRecordCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public String id() {
        return "JSON";
    }

    @Override
    public Iterator<Map<String, Object>> decode(byte[] body) throws IOException {
        JsonParser parser = mapper.getFactory().createParser(body);
        try {
            JsonToken first = parser.nextToken();
            if (first == null) {
                parser.close();
                return Collections.emptyIterator();
            }
            if (first == JsonToken.START_OBJECT) {
                Map<String, Object> single = mapper.readValue(parser, MAP_TYPE);
                parser.close();
                return Collections.singletonList(single).iterator();
            }
            if (first == JsonToken.START_ARRAY) {
                return new ArrayElements(parser);
            }
            throw new JsonParseException(parser, "Expected a JSON array or object but found " + first);
        } catch (IOException | RuntimeException e) {
            parser.close();
            throw e;
        }
    }

    private final class ArrayElements implements Iterator<Map<String, Object>> {

        private final JsonParser parser;
        private Map<String, Object> next;
        private boolean done;

        private ArrayElements(JsonParser parser) {
            this.parser = parser;
        }

        @Override
        public boolean hasNext() {
            if (next != null) return true;
            if (done) return false;
            try {
                while (true) {
                    JsonToken token = parser.nextToken();
                    if (token == null || token == JsonToken.END_ARRAY) {
                        finish();
                        return false;
                    }
                    if (token == JsonToken.START_OBJECT) {
                        next = mapper.readValue(parser, MAP_TYPE);
                        return true;
                    }
                    log.debug("Skipping non-object array element: {}", token);
                    parser.skipChildren();
                }
            } catch (IOException e) {
                finish();
                throw new UncheckedIOException("Malformed JSON at " + parser.currentLocation(), e);
            }
        }

        @Override
        public Map<String, Object> next() {
            if (!hasNext()) throw new NoSuchElementException();
            Map<String, Object> out = next;
            next = null;
            return out;
        }

        private void finish() {
            done = true;
            try {
                parser.close();
            } catch (IOException e) {
                log.debug("Failed to close JSON parser", e);
            }
        }
    }
}
