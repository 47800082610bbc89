/*
 * Copyright 2014 the original author or authors.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package org.streamstore.core;

import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

/**
 * @author Tommy Wassgren
 */
public class StoredEventTest {
    @Test
    public void changingArraysDoesNotChangeTheEvent() {
        // Given
        final byte[] payload = "payload".getBytes(StandardCharsets.UTF_8);
        final byte[] metadata = "metadata".getBytes(StandardCharsets.UTF_8);
        final StoredEvent event =
                new StoredEvent("stream-1", UUID.randomUUID(), 0, 1, Instant.now(), "type", payload, metadata);

        // When
        payload[0] = 'X';
        event.payload()[1] = 'Y';
        metadata[0] = 'X';
        event.metadata()[1] = 'Y';

        // Then
        assertArrayEquals("payload".getBytes(StandardCharsets.UTF_8), event.payload());
        assertArrayEquals("metadata".getBytes(StandardCharsets.UTF_8), event.metadata());
    }

    @Test
    public void missingPayloadAndMetadataAreEmpty() {
        // When
        final StoredEvent event = new StoredEvent("stream-1", UUID.randomUUID(), 0, 1, Instant.now(), "type", null, null);

        // Then
        assertEquals(0, event.payload().length);
        assertEquals(0, event.metadata().length);
    }

    @Test
    public void newEventKeepsItsOwnCopy() {
        // Given
        final byte[] payload = "payload".getBytes(StandardCharsets.UTF_8);
        final NewEvent event = new NewEvent(UUID.randomUUID(), "type", payload);

        // When
        payload[0] = 'X';
        event.payload()[1] = 'Y';

        // Then
        assertArrayEquals("payload".getBytes(StandardCharsets.UTF_8), event.payload());
        assertEquals(0, event.metadata().length);
    }
}
