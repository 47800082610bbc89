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
 * A page of events read from all streams, ordered by checkpoint in the direction of the read.
 *
 * @author Tommy Wassgren
 */
public final class ReadAllPage {
    private final ReadDirection direction;
    private final List<StoredEvent> events;
    private final long fromCheckpoint;
    private final boolean isEnd;
    private final long nextCheckpoint;

    public ReadAllPage(
            final long fromCheckpoint,
            final long nextCheckpoint,
            final boolean isEnd,
            final ReadDirection direction,
            final List<StoredEvent> events) {

        this.fromCheckpoint = fromCheckpoint;
        this.nextCheckpoint = nextCheckpoint;
        this.isEnd = isEnd;
        this.direction = requireNonNull(direction, "Direction must not be null");
        this.events = Collections.unmodifiableList(requireNonNull(events, "Events must not be null"));
    }

    public ReadDirection direction() {
        return direction;
    }

    public List<StoredEvent> events() {
        return events;
    }

    public long fromCheckpoint() {
        return fromCheckpoint;
    }

    /**
     * True when there were no more events to read when this page was fetched.
     */
    public boolean isEnd() {
        return isEnd;
    }

    /**
     * The checkpoint to pass to the next read in the same direction.
     */
    public long nextCheckpoint() {
        return nextCheckpoint;
    }

    /**
     * Copy of this page with another set of events. Used when events are filtered out after they were read, the paging
     * information stays the same so that readers still advance past the filtered events.
     */
    public ReadAllPage withEvents(final List<StoredEvent> filtered) {
        return new ReadAllPage(fromCheckpoint, nextCheckpoint, isEnd, direction, filtered);
    }

    @Override
    public String toString() {
        return "ReadAllPage[fromCheckpoint=" + fromCheckpoint + ", nextCheckpoint=" + nextCheckpoint + ", isEnd=" + isEnd
                + ", direction=" + direction + ", events=" + events.size() + "]";
    }
}
