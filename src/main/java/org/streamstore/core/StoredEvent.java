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

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * A committed event. The stream version is the position within the stream, the checkpoint is the position within the whole
 * store. Both are assigned by the backend when the event is committed and never change afterwards. Payload and metadata are
 * copied on construction and on access.
 *
 * @author Tommy Wassgren
 */
public final class StoredEvent {
    private static final byte[] EMPTY = new byte[0];
    private final long checkpoint;
    private final Instant created;
    private final UUID eventId;
    private final byte[] metadata;
    private final byte[] payload;
    private final String streamId;
    private final int streamVersion;
    private final String type;

    public StoredEvent(
            final String streamId,
            final UUID eventId,
            final int streamVersion,
            final long checkpoint,
            final Instant created,
            final String type,
            final byte[] payload,
            final byte[] metadata) {

        this.streamId = requireNonNull(streamId, "Stream id must not be null");
        this.eventId = requireNonNull(eventId, "Event id must not be null");
        this.streamVersion = streamVersion;
        this.checkpoint = checkpoint;
        this.created = requireNonNull(created, "Created must not be null");
        this.type = requireNonNull(type, "Event type must not be null");
        this.payload = payload == null ? EMPTY : payload.clone();
        this.metadata = metadata == null ? EMPTY : metadata.clone();
    }

    public long checkpoint() {
        return checkpoint;
    }

    public Instant created() {
        return created;
    }

    @Override
    public boolean equals(final Object otherObject) {
        if (otherObject instanceof StoredEvent) {
            final StoredEvent otherEvent = (StoredEvent) otherObject;
            return checkpoint == otherEvent.checkpoint && Objects.equals(eventId, otherEvent.eventId);
        }
        return false;
    }

    public UUID eventId() {
        return eventId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, checkpoint);
    }

    public byte[] metadata() {
        return metadata.clone();
    }

    public byte[] payload() {
        return payload.clone();
    }

    public String streamId() {
        return streamId;
    }

    public int streamVersion() {
        return streamVersion;
    }

    @Override
    public String toString() {
        return "StoredEvent[streamId=" + streamId + ", streamVersion=" + streamVersion + ", checkpoint=" + checkpoint
                + ", eventId=" + eventId + ", type=" + type + "]";
    }

    public String type() {
        return type;
    }
}
