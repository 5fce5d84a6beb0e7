/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Activation annotations carry arbitrary JSON values. They are flattened to JSON text so that
 * downstream indexes see one type for {@code annotations[].value}.
 */
final class AnnotationValues {

    static final String ANNOTATIONS = "annotations";
    static final String VALUE = "value";

    private final ObjectMapper mapper;

    AnnotationValues(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Returns a copy of {@code record} with each annotation's value re-serialised as a JSON string. */
    Map<String, Object> normalize(Map<String, Object> record) {
        Object annotations = record.get(ANNOTATIONS);
        if (!(annotations instanceof List<?> list) || list.isEmpty()) return record;

        List<Object> normalized = new ArrayList<>(list.size());
        for (Object entry : list) {
            normalized.add(entry instanceof Map<?, ?> m && m.containsKey(VALUE) ? stringifyValue(m) : entry);
        }

        Map<String, Object> copy = new LinkedHashMap<>(record);
        copy.put(ANNOTATIONS, normalized);
        return copy;
    }

    private Map<String, Object> stringifyValue(Map<?, ?> annotation) {
        Map<String, Object> out = new LinkedHashMap<>();
        annotation.forEach((k, v) -> out.put(String.valueOf(k), VALUE.equals(k) ? toJson(v) : v));
        return out;
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialise annotation value", e);
        }
    }
}
