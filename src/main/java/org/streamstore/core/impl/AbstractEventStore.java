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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.streamstore.core.AllStreamSubscription;
import org.streamstore.core.AppendResult;
import org.streamstore.core.Checkpoint;
import org.streamstore.core.EventStore;
import org.streamstore.core.EventStoreDisposedException;
import org.streamstore.core.EventStoreException;
import org.streamstore.core.EventStoreSettings;
import org.streamstore.core.ExpectedVersion;
import org.streamstore.core.NewEvent;
import org.streamstore.core.NotifierInitializationException;
import org.streamstore.core.ReadAllPage;
import org.streamstore.core.ReadStreamPage;
import org.streamstore.core.StoreNotifier;
import org.streamstore.core.StoredEvent;
import org.streamstore.core.StreamMetadata;
import org.streamstore.core.StreamSubscription;
import org.streamstore.core.StreamVersion;
import org.streamstore.core.SubscriptionDropped;
import org.streamstore.core.support.PageStreams;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * The store facade. It validates arguments, guards against usage after disposal, filters reads by the max age of the stream
 * metadata and runs the subscriptions. Backends implement the {@code *Internal} operations.
 *
 * @author Tommy Wassgren
 */
public abstract class AbstractEventStore implements EventStore {
    protected final Logger log = LoggerFactory.getLogger(getClass());
    private final Clock clock;
    private final Optional<Clock> clientClock;
    private final AtomicBoolean closing = new AtomicBoolean();
    private volatile boolean disposed;
    private final ExecutorService executorService;
    private final String logName;
    private final StreamMetadataCache metadataCache;
    private final NotifierHandle notifierHandle;
    private final boolean ownsExecutorService;
    private final int subscriptionPageSize;
    private final Set<AbstractSubscription> subscriptions = ConcurrentHashMap.newKeySet();

    protected AbstractEventStore(final EventStoreSettings settings) {
        requireNonNull(settings, "Settings must not be null");
        this.logName = settings.logName();
        this.clientClock = settings.clock();
        this.clock = clientClock.orElse(Clock.systemUTC());
        this.subscriptionPageSize = settings.subscriptionPageSize();
        this.metadataCache = new StreamMetadataCache(
                settings.metadataMaxAge(),
                settings.metadataCacheMaxSize(),
                clock,
                this::getStreamMetadataInternal);
        this.notifierHandle = new NotifierHandle(logName, settings.notifierFactory()
                .map(factory -> (Callable<StoreNotifier>) () -> factory.create(this))
                .orElse(null));
        this.ownsExecutorService = !settings.executorService().isPresent();
        this.executorService = settings.executorService().orElseGet(Executors::newCachedThreadPool);
    }

    @Override
    public AppendResult append(final String streamId, final int expectedVersion, final NewEvent... events) {
        checkDisposed();
        validateStreamId(streamId);
        if (expectedVersion < ExpectedVersion.ANY) {
            throw new IllegalArgumentException("Invalid expected version [expectedVersion=" + expectedVersion + "]");
        }
        requireNonNull(events, "Events must not be null");
        final List<NewEvent> batch = Arrays.asList(events);
        batch.forEach(event -> requireNonNull(event, "Event must not be null"));

        final AppendResult result = appendInternal(streamId, expectedVersion, batch);
        log.debug("Appended events [store={}, streamId={}, count={}, result={}]", logName, streamId, batch.size(), result);

        subscriptions.forEach(AbstractSubscription::signal);
        if (notifierHandle.hasFactory()) {
            notifyAppended(result);
        }
        return result;
    }

    /**
     * Disposes all subscriptions, the notifier (if it was created) and the executor service (if it is owned by the store).
     * Calling it again has no effect.
     */
    @Override
    public void close() {
        if (!closing.compareAndSet(false, true)) {
            return;
        }

        log.info("Closing event store [store={}]", logName);
        disposed = true;
        new ArrayList<>(subscriptions).forEach(AbstractSubscription::close);
        notifierHandle.close();
        if (ownsExecutorService) {
            executorService.shutdownNow();
        }
    }

    @Override
    public void dropAll(final boolean ignoreErrors) {
        checkDisposed();
        log.info("Dropping event store [store={}]", logName);
        executeAdministrative("drop", ignoreErrors, this::dropAllInternal);
        metadataCache.clear();
    }

    @Override
    public int getStreamEventCount(final String streamId) {
        checkDisposed();
        validateStreamId(streamId);
        return getStreamEventCountInternal(streamId, null);
    }

    @Override
    public int getStreamEventCount(final String streamId, final Instant createdBefore) {
        checkDisposed();
        validateStreamId(streamId);
        requireNonNull(createdBefore, "Created before must not be null");
        return getStreamEventCountInternal(streamId, createdBefore);
    }

    @Override
    public StreamMetadata getStreamMetadata(final String streamId) {
        checkDisposed();
        validateStreamId(streamId);
        return metadataCache.get(streamId);
    }

    @Override
    public void initialize(final boolean ignoreErrors) {
        checkDisposed();
        log.info("Initializing event store [store={}]", logName);
        executeAdministrative("initialize", ignoreErrors, this::initializeInternal);
    }

    @Override
    public String logName() {
        return logName;
    }

    @Override
    public ReadAllPage readAllBackwards(final long fromCheckpointInclusive, final int maxCount) {
        checkDisposed();
        validateCheckpoint(fromCheckpointInclusive);
        validateMaxCount(maxCount);
        final ReadAllPage page = readAllBackwardsInternal(fromCheckpointInclusive, maxCount);
        return page.withEvents(filterExpired(page.events()));
    }

    @Override
    public ReadAllPage readAllForwards(final long fromCheckpointInclusive, final int maxCount) {
        checkDisposed();
        validateCheckpoint(fromCheckpointInclusive);
        validateMaxCount(maxCount);
        final ReadAllPage page = readAllForwardsInternal(fromCheckpointInclusive, maxCount);
        return page.withEvents(filterExpired(page.events()));
    }

    @Override
    public long readHeadCheckpoint() {
        checkDisposed();
        return readHeadCheckpointInternal();
    }

    @Override
    public ReadStreamPage readStreamBackwards(final String streamId, final int fromVersionInclusive, final int maxCount) {
        checkDisposed();
        validateStreamId(streamId);
        if (fromVersionInclusive < StreamVersion.END) {
            throw new IllegalArgumentException("Invalid from version [fromVersion=" + fromVersionInclusive + "]");
        }
        validateMaxCount(maxCount);
        final ReadStreamPage page = readStreamBackwardsInternal(streamId, fromVersionInclusive, maxCount);
        return page.withEvents(filterExpired(page.events()));
    }

    @Override
    public ReadStreamPage readStreamForwards(final String streamId, final int fromVersionInclusive, final int maxCount) {
        checkDisposed();
        validateStreamId(streamId);
        if (fromVersionInclusive < StreamVersion.START) {
            throw new IllegalArgumentException("Invalid from version [fromVersion=" + fromVersionInclusive + "]");
        }
        validateMaxCount(maxCount);
        final ReadStreamPage page = readStreamForwardsInternal(streamId, fromVersionInclusive, maxCount);
        return page.withEvents(filterExpired(page.events()));
    }

    @Override
    public Stream<StoredEvent> replayAll(final long fromCheckpointInclusive) {
        return PageStreams.createStream(
                readAllForwards(fromCheckpointInclusive, subscriptionPageSize),
                page -> readAllForwards(page.nextCheckpoint(), subscriptionPageSize),
                ReadAllPage::events,
                ReadAllPage::isEnd);
    }

    @Override
    public Stream<StoredEvent> replayStream(final String streamId, final int fromVersionInclusive) {
        return PageStreams.createStream(
                readStreamForwards(streamId, fromVersionInclusive, subscriptionPageSize),
                page -> readStreamForwards(streamId, page.nextVersion(), subscriptionPageSize),
                ReadStreamPage::events,
                ReadStreamPage::isEnd);
    }

    @Override
    public StreamMetadata setStreamMetadata(
            final String streamId, final int expectedMetadataVersion, final Integer maxAge, final Integer maxCount) {

        checkDisposed();
        validateStreamId(streamId);
        if (maxAge != null && maxAge < 0) {
            throw new IllegalArgumentException("Max age must not be negative [maxAge=" + maxAge + "]");
        }
        if (maxCount != null && maxCount <= 0) {
            throw new IllegalArgumentException("Max count must be positive [maxCount=" + maxCount + "]");
        }

        try {
            return setStreamMetadataInternal(streamId, expectedMetadataVersion, maxAge, maxCount);
        } finally {
            metadataCache.invalidate(streamId);
        }
    }

    @Override
    public AllStreamSubscription subscribeToAll(
            final String name,
            final Long lastCheckpoint,
            final Consumer<StoredEvent> eventReceived,
            final SubscriptionDropped dropped) {

        return subscribeToAll(name, lastCheckpoint, eventReceived, dropped, null);
    }

    @Override
    public AllStreamSubscription subscribeToAll(
            final String name,
            final Long lastCheckpoint,
            final Consumer<StoredEvent> eventReceived,
            final SubscriptionDropped dropped,
            final Runnable caughtUp) {

        checkDisposed();
        requireNonNull(name, "Name must not be null");
        requireNonNull(eventReceived, "Event received callback must not be null");
        requireNonNull(dropped, "Dropped callback must not be null");
        if (lastCheckpoint != null && lastCheckpoint < Checkpoint.NONE) {
            throw new IllegalArgumentException("Invalid last checkpoint [lastCheckpoint=" + lastCheckpoint + "]");
        }

        final AllStreamSubscriptionImpl subscription = new AllStreamSubscriptionImpl(
                name,
                lastCheckpoint,
                this,
                notifierHandle,
                subscriptionPageSize,
                eventReceived,
                dropped,
                caughtUp,
                subscriptions::remove);
        return start(subscription);
    }

    @Override
    public StreamSubscription subscribeToStream(
            final String streamId,
            final String name,
            final Integer lastVersion,
            final Consumer<StoredEvent> eventReceived,
            final SubscriptionDropped dropped) {

        return subscribeToStream(streamId, name, lastVersion, eventReceived, dropped, null);
    }

    @Override
    public StreamSubscription subscribeToStream(
            final String streamId,
            final String name,
            final Integer lastVersion,
            final Consumer<StoredEvent> eventReceived,
            final SubscriptionDropped dropped,
            final Runnable caughtUp) {

        checkDisposed();
        validateStreamId(streamId);
        requireNonNull(name, "Name must not be null");
        requireNonNull(eventReceived, "Event received callback must not be null");
        requireNonNull(dropped, "Dropped callback must not be null");
        if (lastVersion != null && lastVersion < StreamVersion.END) {
            throw new IllegalArgumentException("Invalid last version [lastVersion=" + lastVersion + "]");
        }

        final StreamSubscriptionImpl subscription = new StreamSubscriptionImpl(
                streamId,
                name,
                lastVersion,
                this,
                notifierHandle,
                subscriptionPageSize,
                eventReceived,
                dropped,
                caughtUp,
                subscriptions::remove);
        return start(subscription);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[logName=" + logName + "]";
    }

    protected abstract AppendResult appendInternal(String streamId, int expectedVersion, List<NewEvent> events);

    /**
     * The clock configured by the client, empty if the backend assigns creation timestamps.
     */
    protected Optional<Clock> clientClock() {
        return clientClock;
    }

    protected abstract void dropAllInternal();

    /**
     * @param createdBefore Only count events created before this instant, {@code null} to count all events.
     */
    protected abstract int getStreamEventCountInternal(String streamId, Instant createdBefore);

    protected abstract StreamMetadata getStreamMetadataInternal(String streamId);

    protected abstract void initializeInternal();

    protected boolean isDisposed() {
        return disposed;
    }

    protected abstract ReadAllPage readAllBackwardsInternal(long fromCheckpointInclusive, int maxCount);

    protected abstract ReadAllPage readAllForwardsInternal(long fromCheckpointInclusive, int maxCount);

    protected abstract long readHeadCheckpointInternal();

    protected abstract ReadStreamPage readStreamBackwardsInternal(String streamId, int fromVersionInclusive, int maxCount);

    protected abstract ReadStreamPage readStreamForwardsInternal(String streamId, int fromVersionInclusive, int maxCount);

    protected abstract StreamMetadata setStreamMetadataInternal(
            String streamId, int expectedMetadataVersion, Integer maxAge, Integer maxCount);

    private void checkDisposed() {
        if (disposed) {
            throw new EventStoreDisposedException(logName);
        }
    }

    private void executeAdministrative(final String operation, final boolean ignoreErrors, final Runnable action) {
        try {
            action.run();
        } catch (final EventStoreException e) {
            if (!ignoreErrors) {
                throw e;
            }
            log.warn("Ignoring failure [store={}, operation={}]", logName, operation, e);
        }
    }

    private List<StoredEvent> filterExpired(final List<StoredEvent> events) {
        if (events.isEmpty()) {
            return events;
        }

        final Instant now = clock.instant();
        final Map<String, StreamMetadata> metadataOfPage = new HashMap<>();
        return events.stream()
                .filter(event -> !isExpired(event, metadataOfPage.computeIfAbsent(event.streamId(), metadataCache::get), now))
                .collect(Collectors.toList());
    }

    private boolean isExpired(final StoredEvent event, final StreamMetadata metadata, final Instant now) {
        final Integer maxAge = metadata.maxAge();
        return maxAge != null && event.created().plusSeconds(maxAge).isBefore(now);
    }

    private void notifyAppended(final AppendResult result) {
        try {
            notifierHandle.get().appended(result);
        } catch (final NotifierInitializationException e) {
            log.debug("No notifier to notify append [store={}, result={}]", logName, result, e);
        } catch (final RuntimeException e) {
            // The events are committed, subscriptions of other stores catch up on the next signal
            log.warn("Unable to notify append [store={}, result={}]", logName, result, e);
        }
    }

    private <T extends AbstractSubscription> T start(final T subscription) {
        subscriptions.add(subscription);
        if (disposed) {
            // Closed while subscribing, the close may have missed this subscription
            subscription.close();
            return subscription;
        }
        subscription.start(executorService);
        log.debug("Subscription started [store={}, subscription={}]", logName, subscription);
        return subscription;
    }

    private void validateCheckpoint(final long checkpoint) {
        if (checkpoint < Checkpoint.START) {
            throw new IllegalArgumentException("Invalid checkpoint [checkpoint=" + checkpoint + "]");
        }
    }

    private void validateMaxCount(final int maxCount) {
        if (maxCount <= 0) {
            throw new IllegalArgumentException("Max count must be positive [maxCount=" + maxCount + "]");
        }
    }

    private void validateStreamId(final String streamId) {
        requireNonNull(streamId, "Stream id must not be null");
        if (streamId.trim().isEmpty()) {
            throw new IllegalArgumentException("Stream id must not be blank");
        }
    }
}
