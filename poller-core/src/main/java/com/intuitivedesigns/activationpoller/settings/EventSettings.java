/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.settings;

import java.util.List;
import java.util.Map;

/**
 * How decoded records become events.
 *
 * @param name request name reported in metadata and failure events
 * @param target field to nest the record under, or null for top level
 * @param metadataTarget field holding request/response metadata, or null to omit metadata
 * @param tags tags added to every event
 * @param addFields static fields set on every event unless the record already carries them
 */
public record EventSettings(String name,
                            String target,
                            String metadataTarget,
                            List<String> tags,
                            Map<String, String> addFields) {

    public static final String DEFAULT_NAME = "openwhisk";
    public static final String DEFAULT_METADATA_TARGET = "@metadata";

    public EventSettings {
        if (name == null || name.isBlank()) name = DEFAULT_NAME;
        tags = (tags == null) ? List.of() : List.copyOf(tags);
        addFields = (addFields == null) ? Map.of() : Map.copyOf(addFields);
    }

    public static EventSettings defaults() {
        return new EventSettings(DEFAULT_NAME, null, DEFAULT_METADATA_TARGET, List.of(), Map.of());
    }
}
