/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.codec;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;

/**
 * Turns a raw response body into decoded records.
 *
 * <p>The returned iterator is lazy, finite and single-pass. A syntax error found while
 * iterating surfaces as {@link java.io.UncheckedIOException} from {@code hasNext()} or
 * {@code next()}; records already returned stay valid.</p>
 */
public interface RecordCodec {

    /**
     * @param body raw response body, never null
     * @return records in document order
     * @throws IOException if the body cannot even be opened for reading
     */
    Iterator<Map<String, Object>> decode(byte[] body) throws IOException;

    default String id() {
        return getClass().getSimpleName();
    }
}
