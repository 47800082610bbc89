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

import java.util.Objects;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * An event that has not yet been appended to a stream. The payload and metadata are opaque byte arrays, the type is used by
 * consumers to tell events apart. The event id is used for idempotency: appending the same ids at the same position twice
 * does not store the events twice. Payload and metadata are copied, changing the arrays afterwards has no effect.
 *
 * @author Tommy Wassgren
 */
public final class NewEvent {
    private static final byte[] EMPTY = new byte[0];
    private static final int MAX_TYPE_LENGTH = 128;
    private final UUID eventId;
    private final byte[] metadata;
    private final byte[] payload;
    private final String type;

    public NewEvent(final UUID eventId, final String type, final byte[] payload) {
        this(eventId, type, payload, null);
    }

    public NewEvent(final UUID eventId, final String type, final byte[] payload, final byte[] metadata) {
        this.eventId = requireNonNull(eventId, "Event id must not be null");
        this.type = requireNonNull(type, "Event type must not be null");
        if (type.isEmpty() || type.length() > MAX_TYPE_LENGTH) {
            throw new IllegalArgumentException(
                    String.format("Event type must be between 1 and %d characters [type=%s]", MAX_TYPE_LENGTH, type));
        }
        this.payload = payload == null ? EMPTY : payload.clone();
        this.metadata = metadata == null ? EMPTY : metadata.clone();
    }

    @Override
    public boolean equals(final Object otherObject) {
        if (otherObject instanceof NewEvent) {
            final NewEvent otherEvent = (NewEvent) otherObject;
            return Objects.equals(eventId, otherEvent.eventId) && Objects.equals(type, otherEvent.type);
        }
        return false;
    }

    public UUID eventId() {
        return eventId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, type);
    }

    public byte[] metadata() {
        return metadata.clone();
    }

    public byte[] payload() {
        return payload.clone();
    }

    @Override
    public String toString() {
        return "NewEvent[eventId=" + eventId + ", type=" + type + "]";
    }

    public String type() {
        return type;
    }
}
