/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventTest {

    @Test
    void tagsAreDeduplicatedAndMergedIntoMap() {
        Event event = new Event(Map.of("activationId", "a1"));
        event.tag("_request_failure").tag("_request_failure").tag(" ").tag(null);

        assertEquals(List.of("_request_failure"), event.tags());
        assertEquals(List.of("_request_failure"), event.toMap().get(Event.TAGS_FIELD));
        assertEquals("a1", event.toMap().get("activationId"));
    }

    @Test
    void recordTagsArePreservedAlongsideEventTags() {
        Event listTags = new Event(Map.of("tags", List.of("user", "_request_failure")));
        listTags.tag("_request_failure").tag("openwhisk");

        assertEquals(List.of("user", "_request_failure", "openwhisk"), listTags.toMap().get(Event.TAGS_FIELD));
        assertEquals(List.of("user", "_request_failure"), listTags.get(Event.TAGS_FIELD));

        Event scalarTag = new Event(Map.of("tags", "nightly")).tag("openwhisk");

        assertEquals(List.of("nightly", "openwhisk"), scalarTag.toMap().get(Event.TAGS_FIELD));
    }

    @Test
    void recordTagsPassThroughWhenEventHasNone() {
        Event event = new Event(Map.of("tags", List.of("user")));

        assertEquals(List.of("user"), event.toMap().get(Event.TAGS_FIELD));
    }

    @Test
    void mapOmitsTagsWhenNoneSet() {
        Event event = new Event().set("end", 10L);

        assertFalse(event.toMap().containsKey(Event.TAGS_FIELD));
        assertTrue(event.has("end"));
        assertEquals(10L, event.get("end"));
    }

    @Test
    void fieldViewIsReadOnly() {
        Event event = new Event().set("a", 1);
        assertThrows(UnsupportedOperationException.class, () -> event.fields().put("b", 2));
    }
}
