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

import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A page of events read from a single stream, ordered by stream version in the direction of the read.
 *
 * @author Tommy Wassgren
 */
public final class ReadStreamPage {
    public enum Status {
        SUCCESS,
        STREAM_NOT_FOUND
    }

    private final ReadDirection direction;
    private final List<StoredEvent> events;
    private final int fromVersion;
    private final boolean isEnd;
    private final long lastCheckpoint;
    private final int lastStreamVersion;
    private final int nextVersion;
    private final Status status;
    private final String streamId;

    public ReadStreamPage(
            final String streamId,
            final Status status,
            final int fromVersion,
            final int nextVersion,
            final int lastStreamVersion,
            final long lastCheckpoint,
            final ReadDirection direction,
            final boolean isEnd,
            final List<StoredEvent> events) {

        this.streamId = requireNonNull(streamId, "Stream id must not be null");
        this.status = requireNonNull(status, "Status must not be null");
        this.fromVersion = fromVersion;
        this.nextVersion = nextVersion;
        this.lastStreamVersion = lastStreamVersion;
        this.lastCheckpoint = lastCheckpoint;
        this.direction = requireNonNull(direction, "Direction must not be null");
        this.isEnd = isEnd;
        this.events = Collections.unmodifiableList(requireNonNull(events, "Events must not be null"));
    }

    public static ReadStreamPage notFound(final String streamId, final int fromVersion, final ReadDirection direction) {
        return new ReadStreamPage(
                streamId,
                Status.STREAM_NOT_FOUND,
                fromVersion,
                StreamVersion.END,
                StreamVersion.END,
                Checkpoint.NONE,
                direction,
                true,
                Collections.emptyList());
    }

    public ReadDirection direction() {
        return direction;
    }

    public List<StoredEvent> events() {
        return events;
    }

    public int fromVersion() {
        return fromVersion;
    }

    public boolean isEnd() {
        return isEnd;
    }

    /**
     * The checkpoint of the last event of the stream at the time of the read.
     */
    public long lastCheckpoint() {
        return lastCheckpoint;
    }

    /**
     * The version of the last event of the stream at the time of the read.
     */
    public int lastStreamVersion() {
        return lastStreamVersion;
    }

    public int nextVersion() {
        return nextVersion;
    }

    public Status status() {
        return status;
    }

    public String streamId() {
        return streamId;
    }

    public ReadStreamPage withEvents(final List<StoredEvent> filtered) {
        return new ReadStreamPage(
                streamId, status, fromVersion, nextVersion, lastStreamVersion, lastCheckpoint, direction, isEnd, filtered);
    }

    @Override
    public String toString() {
        return "ReadStreamPage[streamId=" + streamId + ", status=" + status + ", fromVersion=" + fromVersion
                + ", nextVersion=" + nextVersion + ", lastStreamVersion=" + lastStreamVersion + ", isEnd=" + isEnd
                + ", events=" + events.size() + "]";
    }
}
