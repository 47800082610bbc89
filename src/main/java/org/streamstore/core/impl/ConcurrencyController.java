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

package org.streamstore.core.impl;

import org.streamstore.core.ConcurrencyConflictException;
import org.streamstore.core.ExpectedVersion;
import org.streamstore.core.StreamVersion;

import java.util.List;
import java.util.UUID;

/**
 * Validates the expected version of an append against the state of the stream. It decides between appending, treating the
 * append as an idempotent replay of an already committed batch, and rejecting it with a
 * {@link ConcurrencyConflictException}. It never writes and never retries: the backend commits the decision in the same
 * transaction that read the state.
 *
 * @author Tommy Wassgren
 */
public class ConcurrencyController {
    /**
     * The view of a stream needed to validate an append. Implementations read inside the append transaction.
     */
    public interface StreamState {
        /**
         * @return The version of the last event of the stream, {@link StreamVersion#END} if it has no events.
         */
        int currentVersion();

        /**
         * @return The ids of at most {@code count} events starting with {@code fromVersion}, in version order.
         */
        List<UUID> eventIds(int fromVersion, int count);

        /**
         * @return The version of the event with the given id, {@code null} if the stream does not contain it.
         */
        Integer versionOf(UUID eventId);
    }

    public static final class Decision {
        private final int appendAtVersion;
        private final boolean write;

        private Decision(final boolean write, final int appendAtVersion) {
            this.write = write;
            this.appendAtVersion = appendAtVersion;
        }

        static Decision append(final int appendAtVersion) {
            return new Decision(true, appendAtVersion);
        }

        static Decision alreadyCommitted() {
            return new Decision(false, StreamVersion.END);
        }

        /**
         * The version of the first appended event, only meaningful when {@link #isWrite()}.
         */
        public int appendAtVersion() {
            return appendAtVersion;
        }

        /**
         * False when nothing has to be written, because the batch was empty or was already committed.
         */
        public boolean isWrite() {
            return write;
        }

        @Override
        public String toString() {
            return write ? "Decision[append at " + appendAtVersion + "]" : "Decision[already committed]";
        }
    }

    public Decision decide(
            final String streamId, final int expectedVersion, final List<UUID> eventIds, final StreamState state) {

        if (expectedVersion < ExpectedVersion.ANY) {
            throw new IllegalArgumentException(String.format("Invalid expected version [expectedVersion=%d]", expectedVersion));
        }

        final int currentVersion = state.currentVersion();
        if (eventIds.isEmpty()) {
            return decideEmpty(streamId, expectedVersion, currentVersion);
        }

        if (expectedVersion == ExpectedVersion.ANY) {
            final Integer existing = state.versionOf(eventIds.get(0));
            if (existing == null) {
                return Decision.append(currentVersion + 1);
            }
            return replayOrConflict(streamId, expectedVersion, eventIds, state, existing);
        }

        if (expectedVersion == ExpectedVersion.NO_STREAM) {
            if (currentVersion == StreamVersion.END) {
                return Decision.append(StreamVersion.START);
            }
            return replayOrConflict(streamId, expectedVersion, eventIds, state, StreamVersion.START);
        }

        if (expectedVersion == currentVersion) {
            return Decision.append(currentVersion + 1);
        }
        return replayOrConflict(streamId, expectedVersion, eventIds, state, expectedVersion + 1);
    }

    private Decision decideEmpty(final String streamId, final int expectedVersion, final int currentVersion) {
        final boolean matches;
        if (expectedVersion == ExpectedVersion.ANY) {
            matches = true;
        } else if (expectedVersion == ExpectedVersion.NO_STREAM) {
            matches = currentVersion == StreamVersion.END;
        } else {
            matches = expectedVersion == currentVersion;
        }

        if (!matches) {
            throw new ConcurrencyConflictException(streamId, expectedVersion, currentVersion);
        }
        return Decision.alreadyCommitted();
    }

    /**
     * The batch is a replay if exactly the same ids, in the same order, were committed starting at {@code fromVersion}.
     */
    private Decision replayOrConflict(
            final String streamId,
            final int expectedVersion,
            final List<UUID> eventIds,
            final StreamState state,
            final int fromVersion) {

        final List<UUID> committed = state.eventIds(fromVersion, eventIds.size());
        if (committed.equals(eventIds)) {
            return Decision.alreadyCommitted();
        }
        throw new ConcurrencyConflictException(streamId, expectedVersion, state.currentVersion());
    }
}
