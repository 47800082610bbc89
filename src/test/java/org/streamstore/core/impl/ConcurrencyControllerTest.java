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

import org.junit.Test;
import org.streamstore.core.ConcurrencyConflictException;
import org.streamstore.core.ExpectedVersion;
import org.streamstore.core.StreamVersion;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * @author Tommy Wassgren
 */
public class ConcurrencyControllerTest {
    /**
     * A stream held in memory.
     */
    private static class InMemoryStream implements ConcurrencyController.StreamState {
        private final List<UUID> eventIds = new ArrayList<>();

        InMemoryStream(final UUID... eventIds) {
            this.eventIds.addAll(Arrays.asList(eventIds));
        }

        @Override
        public int currentVersion() {
            return eventIds.size() - 1;
        }

        @Override
        public List<UUID> eventIds(final int fromVersion, final int count) {
            if (fromVersion >= eventIds.size()) {
                return Collections.emptyList();
            }
            return eventIds.subList(fromVersion, Math.min(eventIds.size(), fromVersion + count));
        }

        @Override
        public Integer versionOf(final UUID eventId) {
            final int version = eventIds.indexOf(eventId);
            return version < 0 ? null : version;
        }
    }

    private final ConcurrencyController controller = new ConcurrencyController();
    private final UUID a = UUID.randomUUID();
    private final UUID b = UUID.randomUUID();
    private final UUID c = UUID.randomUUID();

    @Test
    public void anyAppendsAfterCurrentVersion() {
        // Given
        final InMemoryStream stream = new InMemoryStream(a, b);

        // When
        final ConcurrencyController.Decision decision =
                controller.decide("stream", ExpectedVersion.ANY, Collections.singletonList(c), stream);

        // Then
        assertTrue(decision.isWrite());
        assertEquals(2, decision.appendAtVersion());
    }

    @Test
    public void anyWithCommittedBatchIsReplay() {
        // Given
        final InMemoryStream stream = new InMemoryStream(a, b, c);

        // When
        final ConcurrencyController.Decision decision =
                controller.decide("stream", ExpectedVersion.ANY, Arrays.asList(b, c), stream);

        // Then
        assertFalse(decision.isWrite());
    }

    @Test
    public void anyWithPartiallyCommittedBatchConflicts() {
        assertConflict(new InMemoryStream(a, b), ExpectedVersion.ANY, Arrays.asList(b, c));
    }

    @Test
    public void emptyBatchOnlyValidates() {
        // Given
        final InMemoryStream stream = new InMemoryStream(a);

        // When
        final ConcurrencyController.Decision any =
                controller.decide("stream", ExpectedVersion.ANY, Collections.emptyList(), stream);
        final ConcurrencyController.Decision exact = controller.decide("stream", 0, Collections.emptyList(), stream);

        // Then
        assertFalse(any.isWrite());
        assertFalse(exact.isWrite());
        assertConflict(stream, ExpectedVersion.NO_STREAM, Collections.emptyList());
        assertConflict(stream, 3, Collections.emptyList());
    }

    @Test
    public void exactVersionAppends() {
        // Given
        final InMemoryStream stream = new InMemoryStream(a, b);

        // When
        final ConcurrencyController.Decision decision = controller.decide("stream", 1, Collections.singletonList(c), stream);

        // Then
        assertTrue(decision.isWrite());
        assertEquals(2, decision.appendAtVersion());
    }

    @Test
    public void exactVersionWithCommittedBatchIsReplay() {
        // Given
        final InMemoryStream stream = new InMemoryStream(a, b, c);

        // When
        final ConcurrencyController.Decision decision = controller.decide("stream", 0, Arrays.asList(b, c), stream);

        // Then
        assertFalse(decision.isWrite());
    }

    @Test
    public void exactVersionWithDifferentIdsConflicts() {
        assertConflict(new InMemoryStream(a, b, c), 0, Arrays.asList(c, b));
        assertConflict(new InMemoryStream(a), 4, Collections.singletonList(b));
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidExpectedVersion() {
        controller.decide("stream", -3, Collections.singletonList(a), new InMemoryStream());
    }

    @Test
    public void noStreamAppendsAtStart() {
        // When
        final ConcurrencyController.Decision decision =
                controller.decide("stream", ExpectedVersion.NO_STREAM, Arrays.asList(a, b), new InMemoryStream());

        // Then
        assertTrue(decision.isWrite());
        assertEquals(StreamVersion.START, decision.appendAtVersion());
    }

    @Test
    public void noStreamOnExistingStreamConflictsUnlessReplay() {
        // Given
        final InMemoryStream stream = new InMemoryStream(a, b);

        // When
        final ConcurrencyController.Decision replay =
                controller.decide("stream", ExpectedVersion.NO_STREAM, Arrays.asList(a, b), stream);

        // Then
        assertFalse(replay.isWrite());
        assertConflict(stream, ExpectedVersion.NO_STREAM, Arrays.asList(a, c));
        assertConflict(stream, ExpectedVersion.NO_STREAM, Arrays.asList(a, b, c));
    }

    private void assertConflict(final InMemoryStream stream, final int expectedVersion, final List<UUID> eventIds) {
        try {
            controller.decide("stream", expectedVersion, eventIds, stream);
            fail("Expected a conflict [expectedVersion=" + expectedVersion + "]");
        } catch (final ConcurrencyConflictException e) {
            assertEquals("stream", e.streamId());
            assertEquals(expectedVersion, e.expectedVersion());
            assertEquals(stream.currentVersion(), e.actualVersion());
        }
    }
}
