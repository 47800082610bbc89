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
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * An event store keeps events in append-only streams. Every committed event gets a version within its stream and a checkpoint
 * within the whole store, both strictly increasing in commit order. Appends use optimistic concurrency through the expected
 * version, reads page through a single stream or through all streams, and subscriptions replay history and then follow new
 * events as they are committed.
 *
 * <p>All operations block the calling thread while the backend is accessed. Interrupting the thread cancels the operation, it
 * then fails with a {@link java.util.concurrent.CancellationException} and leaves no partial writes behind. Once the store is
 * closed every operation fails with an {@link EventStoreDisposedException}.</p>
 *
 * @author Tommy Wassgren
 */
public interface EventStore extends AutoCloseable {
    /**
     * Appends events to the end of a stream. The stream is created by its first append.
     *
     * <ul>
     * <li>{@link ExpectedVersion#ANY}: no version check. If the batch was already committed it is not stored again.</li>
     * <li>{@link ExpectedVersion#NO_STREAM}: the stream must be empty, or the batch must equal its first events.</li>
     * <li>A version {@code n >= 0}: the stream must be at version {@code n}, or the batch must equal the events following
     * {@code n}.</li>
     * </ul>
     *
     * @param streamId        The stream to append to.
     * @param expectedVersion The version the stream is expected to be at.
     * @param events          The events to append, committed atomically.
     * @return The version and checkpoint of the stream after the append.
     * @throws ConcurrencyConflictException If the expected version did not match and the batch was not a replay.
     */
    AppendResult append(String streamId, int expectedVersion, NewEvent... events);

    /**
     * Closes the store. The notifier is closed if it was ever created and all subscriptions are disposed. Closing twice is a
     * no-op.
     */
    @Override
    void close();

    /**
     * Drops every table of the store.
     *
     * @param ignoreErrors When set, failures are logged and the call completes normally.
     */
    void dropAll(boolean ignoreErrors);

    int getStreamEventCount(String streamId);

    int getStreamEventCount(String streamId, Instant createdBefore);

    /**
     * Finds the metadata of a stream. Results are cached for the configured max age.
     */
    StreamMetadata getStreamMetadata(String streamId);

    /**
     * Creates the schema and the tables of the store.
     *
     * @param ignoreErrors When set, failures are logged and the call completes normally. Useful as "create if not exists".
     */
    void initialize(boolean ignoreErrors);

    String logName();

    ReadAllPage readAllBackwards(long fromCheckpointInclusive, int maxCount);

    ReadAllPage readAllForwards(long fromCheckpointInclusive, int maxCount);

    /**
     * @return The checkpoint of the last committed event or {@link Checkpoint#NONE} if the store is empty.
     */
    long readHeadCheckpoint();

    ReadStreamPage readStreamBackwards(String streamId, int fromVersionInclusive, int maxCount);

    ReadStreamPage readStreamForwards(String streamId, int fromVersionInclusive, int maxCount);

    /**
     * Replays the events of all streams starting with the given checkpoint. The stream is lazy, pages are read as it is
     * consumed.
     */
    Stream<StoredEvent> replayAll(long fromCheckpointInclusive);

    /**
     * Replays the events of one stream starting with the given version. The stream is lazy, pages are read as it is consumed.
     */
    Stream<StoredEvent> replayStream(String streamId, int fromVersionInclusive);

    /**
     * Sets the metadata of a stream.
     *
     * @param streamId                      The stream.
     * @param expectedMetadataVersion       {@link ExpectedVersion#ANY} or the current metadata version.
     * @param maxAge                        Max age of events in seconds, {@code null} for no limit.
     * @param maxCount                      Max number of events kept, {@code null} for no limit.
     * @return The new metadata.
     */
    StreamMetadata setStreamMetadata(String streamId, int expectedMetadataVersion, Integer maxAge, Integer maxCount);

    /**
     * Subscribes to all streams.
     *
     * @param name           Name of the subscription, used in logs.
     * @param lastCheckpoint The last checkpoint already processed, {@code null} to start from the beginning or
     *                       {@link Checkpoint#END} to receive only new events.
     * @param eventReceived  Receives the events in checkpoint order.
     * @param dropped        Invoked once when the subscription stops.
     * @return The running subscription.
     */
    AllStreamSubscription subscribeToAll(
            String name, Long lastCheckpoint, Consumer<StoredEvent> eventReceived, SubscriptionDropped dropped);

    /**
     * Same as {@link #subscribeToAll(String, Long, Consumer, SubscriptionDropped)} with a callback that is invoked each time
     * the subscription has caught up with the head of the store.
     */
    AllStreamSubscription subscribeToAll(
            String name,
            Long lastCheckpoint,
            Consumer<StoredEvent> eventReceived,
            SubscriptionDropped dropped,
            Runnable caughtUp);

    /**
     * Subscribes to one stream.
     *
     * @param streamId      The stream.
     * @param name          Name of the subscription, used in logs.
     * @param lastVersion   The last version already processed, {@code null} to start from the beginning or
     *                      {@link StreamVersion#END} to receive only new events.
     * @param eventReceived Receives the events in version order.
     * @param dropped       Invoked once when the subscription stops.
     * @return The running subscription.
     */
    StreamSubscription subscribeToStream(
            String streamId, String name, Integer lastVersion, Consumer<StoredEvent> eventReceived, SubscriptionDropped dropped);

    StreamSubscription subscribeToStream(
            String streamId,
            String name,
            Integer lastVersion,
            Consumer<StoredEvent> eventReceived,
            SubscriptionDropped dropped,
            Runnable caughtUp);
}
