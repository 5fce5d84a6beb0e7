/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.codec;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonRecordCodecTest {

    private final JsonRecordCodec codec = new JsonRecordCodec();

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static List<Map<String, Object>> drain(Iterator<Map<String, Object>> it) {
        List<Map<String, Object>> out = new ArrayList<>();
        it.forEachRemaining(out::add);
        return out;
    }

    @Test
    void decodesArrayInOrder() throws IOException {
        List<Map<String, Object>> records = drain(codec.decode(utf8(
                "[{\"activationId\":\"1\",\"end\":1476818509288},{\"activationId\":\"2\",\"annotations\":[{\"key\":\"a\",\"value\":{\"child\":\"val\"}}]}]")));

        assertEquals(2, records.size());
        assertEquals("1", records.get(0).get("activationId"));
        assertEquals(1476818509288L, records.get(0).get("end"));
        assertEquals(List.of(Map.of("key", "a", "value", Map.of("child", "val"))), records.get(1).get("annotations"));
    }

    @Test
    void decodesSingleObject() throws IOException {
        List<Map<String, Object>> records = drain(codec.decode(utf8("{\"error\":\"The requested resource does not exist.\",\"code\":4}")));

        assertEquals(1, records.size());
        assertEquals(4, records.get(0).get("code"));
    }

    @Test
    void emptyBodyAndEmptyArrayYieldNothing() throws IOException {
        assertFalse(codec.decode(new byte[0]).hasNext());
        assertFalse(codec.decode(utf8("[]")).hasNext());
    }

    @Test
    void recordsBeforeSyntaxErrorAreYielded() throws IOException {
        Iterator<Map<String, Object>> it = codec.decode(utf8("[{\"activationId\":\"1\"},{\"activationId\":\"2\"},{\"activationId\":"));

        assertEquals("1", it.next().get("activationId"));
        assertEquals("2", it.next().get("activationId"));
        assertThrows(UncheckedIOException.class, it::hasNext);
        assertFalse(it.hasNext());
    }

    @Test
    void nonObjectElementsAreSkipped() throws IOException {
        List<Map<String, Object>> records = drain(codec.decode(utf8("[1, \"two\", [3], {\"activationId\":\"4\"}]")));

        assertEquals(1, records.size());
        assertEquals("4", records.get(0).get("activationId"));
    }

    @Test
    void scalarBodyIsRejected() {
        assertThrows(IOException.class, () -> codec.decode(utf8("\"just a string\"")));
        assertThrows(IOException.class, () -> codec.decode(utf8("<html>Bad Gateway</html>")));
    }
}
