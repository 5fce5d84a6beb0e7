/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single emitted event: an ordered field map plus a tag list.
 *
 * <p>Events are built on one thread and then handed to a sink; they are not thread-safe.</p>
 */
public final class Event {

    public static final String TAGS_FIELD = "tags";

    private final Map<String, Object> fields;
    private final List<String> tags = new ArrayList<>();

    public Event() {
        this.fields = new LinkedHashMap<>();
    }

    public Event(Map<String, ?> initial) {
        this.fields = new LinkedHashMap<>();
        if (initial != null) {
            initial.forEach((k, v) -> {
                if (k != null) fields.put(k, v);
            });
        }
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public Event set(String field, Object value) {
        fields.put(field, value);
        return this;
    }

    /** Adds {@code tag} once; repeated calls with the same tag are ignored. */
    public Event tag(String tag) {
        if (tag != null && !tag.isBlank() && !tags.contains(tag)) {
            tags.add(tag);
        }
        return this;
    }

    public List<String> tags() {
        return Collections.unmodifiableList(tags);
    }

    public Map<String, Object> fields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * Field map with the tag list merged in under {@value #TAGS_FIELD}, ready for serialisation.
     * A {@value #TAGS_FIELD} value already carried by the fields is kept, followed by the event tags
     * it does not already contain.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>(fields);
        if (tags.isEmpty()) return out;

        List<Object> merged = new ArrayList<>();
        Object own = fields.get(TAGS_FIELD);
        if (own instanceof Collection<?> c) {
            merged.addAll(c);
        } else if (own != null) {
            merged.add(own);
        }
        for (String tag : tags) {
            if (!merged.contains(tag)) merged.add(tag);
        }
        out.put(TAGS_FIELD, Collections.unmodifiableList(merged));
        return out;
    }

    @Override
    public String toString() {
        return "Event" + toMap();
    }
}
