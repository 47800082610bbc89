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

package org.streamstore.store.jdbc;

import org.skife.jdbi.v2.DBI;
import org.skife.jdbi.v2.Handle;
import org.skife.jdbi.v2.PreparedBatch;
import org.skife.jdbi.v2.PreparedBatchPart;
import org.skife.jdbi.v2.exceptions.DBIException;
import org.skife.jdbi.v2.tweak.HandleCallback;
import org.skife.jdbi.v2.tweak.ResultSetMapper;
import org.streamstore.core.AppendResult;
import org.streamstore.core.BackendUnavailableException;
import org.streamstore.core.Checkpoint;
import org.streamstore.core.ConcurrencyConflictException;
import org.streamstore.core.EventStoreException;
import org.streamstore.core.EventStoreSettings;
import org.streamstore.core.ExpectedVersion;
import org.streamstore.core.NewEvent;
import org.streamstore.core.ReadAllPage;
import org.streamstore.core.ReadDirection;
import org.streamstore.core.ReadStreamPage;
import org.streamstore.core.StoredEvent;
import org.streamstore.core.StreamMetadata;
import org.streamstore.core.StreamVersion;
import org.streamstore.core.impl.AbstractEventStore;
import org.streamstore.core.impl.ConcurrencyController;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Base class for JDBC-based event stores. Every operation uses its own handle that is released when the operation completes.
 * Appends run in a single transaction that starts by locking the append lock row, so batches are committed one at a time and
 * each batch receives a contiguous range of checkpoints.
 *
 * <p>Dialects override the {@code sql*()} methods where their SQL differs and provide the schema in
 * {@link #doInitialize(Handle)} and {@link #doDropAll(Handle)}.</p>
 *
 * @author Tommy Wassgren
 */
public abstract class AbstractJdbcEventStore extends AbstractEventStore {
    private static final class StreamRow {
        private final int idInternal;
        private final long lastOrdinal;
        private final Integer maxAge;
        private final Integer maxCount;
        private final int metadataVersion;
        private final int version;

        private StreamRow(
                final int idInternal,
                final int version,
                final long lastOrdinal,
                final Integer maxAge,
                final Integer maxCount,
                final int metadataVersion) {

            this.idInternal = idInternal;
            this.version = version;
            this.lastOrdinal = lastOrdinal;
            this.maxAge = maxAge;
            this.maxCount = maxCount;
            this.metadataVersion = metadataVersion;
        }

        private boolean hasEvents() {
            return version > StreamVersion.END;
        }
    }

    private static final String UNIQUE_VIOLATION = "23505";
    private final ConcurrencyController concurrencyController = new ConcurrencyController();
    private final DBI dbi;
    private final ResultSetMapper<StoredEvent> eventResultSetMapper =
            (index, rs, ctx) -> new StoredEvent(
                    rs.getString("ID_ORIGINAL"),
                    rs.getObject("EVENT_ID", UUID.class),
                    rs.getInt("STREAM_VERSION"),
                    rs.getLong("ORDINAL"),
                    rs.getObject("CREATED", OffsetDateTime.class).toInstant(),
                    rs.getString("EVENT_TYPE"),
                    rs.getBytes("EVENT_PAYLOAD"),
                    rs.getBytes("EVENT_METADATA"));
    private final String schema;
    private final ResultSetMapper<StreamRow> streamResultSetMapper =
            (index, rs, ctx) -> new StreamRow(
                    rs.getInt("ID_INTERNAL"),
                    rs.getInt("STREAM_VERSION"),
                    rs.getLong("LAST_ORDINAL"),
                    nullableInt(rs, "MAX_AGE"),
                    nullableInt(rs, "MAX_COUNT"),
                    rs.getInt("METADATA_VERSION"));

    protected AbstractJdbcEventStore(final EventStoreSettings settings) {
        super(settings);
        this.dbi = settings.jdbcUrl()
                .map(DBI::new)
                .orElseGet(() -> new DBI(settings.dataSource().get()));
        this.schema = settings.schema();
    }

    /**
     * The schema that contains the tables of the store.
     */
    public String schema() {
        return schema;
    }

    @Override
    protected AppendResult appendInternal(final String streamId, final int expectedVersion, final List<NewEvent> events) {
        final StreamIdInfo streamIdInfo = new StreamIdInfo(streamId);
        return withHandle(
                handle -> handle.inTransaction((h, status) -> appendInTransaction(h, streamIdInfo, expectedVersion, events)),
                e -> new ConcurrencyConflictException(streamId, expectedVersion, currentVersion(streamIdInfo), e));
    }

    /**
     * Creates the schema objects, invoked by {@link #initialize(boolean)}.
     */
    protected void doInitialize(final Handle handle) {
        // Default to nothing
    }

    /**
     * Drops the schema objects, invoked by {@link #dropAll(boolean)}.
     */
    protected void doDropAll(final Handle handle) {
        // Default to nothing
    }

    @Override
    protected void dropAllInternal() {
        withHandle(handle -> {
            doDropAll(handle);
            return null;
        });
    }

    @Override
    protected int getStreamEventCountInternal(final String streamId, final Instant createdBefore) {
        final StreamIdInfo streamIdInfo = new StreamIdInfo(streamId);
        return withHandle(handle -> {
            if (createdBefore == null) {
                return handle.createQuery(sqlCountStreamEvents())
                        .bind("streamId", streamIdInfo.hashed())
                        .map((index, rs, ctx) -> rs.getInt(1))
                        .first();
            }
            return handle.createQuery(sqlCountStreamEventsCreatedBefore())
                    .bind("streamId", streamIdInfo.hashed())
                    .bind("createdBefore", toTimestamp(createdBefore))
                    .map((index, rs, ctx) -> rs.getInt(1))
                    .first();
        });
    }

    @Override
    protected StreamMetadata getStreamMetadataInternal(final String streamId) {
        final StreamIdInfo streamIdInfo = new StreamIdInfo(streamId);
        final StreamRow stream = withHandle(handle -> findStream(handle, streamIdInfo));
        if (stream == null) {
            return StreamMetadata.none(streamId);
        }
        return new StreamMetadata(streamId, stream.metadataVersion, stream.maxAge, stream.maxCount);
    }

    @Override
    protected void initializeInternal() {
        withHandle(handle -> {
            doInitialize(handle);
            return null;
        });
    }

    @Override
    protected ReadAllPage readAllBackwardsInternal(final long fromCheckpointInclusive, final int maxCount) {
        final List<StoredEvent> events = withHandle(handle ->
                handle.createQuery(sqlSelectAllEventsBackwards())
                        .bind("fromOrdinal", fromCheckpointInclusive)
                        .bind("count", maxCount + 1)
                        .map(eventResultSetMapper)
                        .list());

        final boolean isEnd = events.size() <= maxCount;
        final long nextCheckpoint = isEnd ? Checkpoint.NONE : events.get(maxCount).checkpoint();
        return new ReadAllPage(
                fromCheckpointInclusive, nextCheckpoint, isEnd, ReadDirection.BACKWARD, firstEvents(events, maxCount));
    }

    @Override
    protected ReadAllPage readAllForwardsInternal(final long fromCheckpointInclusive, final int maxCount) {
        final List<StoredEvent> events = withHandle(handle ->
                handle.createQuery(sqlSelectAllEventsForwards())
                        .bind("fromOrdinal", fromCheckpointInclusive)
                        .bind("count", maxCount + 1)
                        .map(eventResultSetMapper)
                        .list());

        final boolean isEnd = events.size() <= maxCount;
        final long nextCheckpoint;
        if (!isEnd) {
            nextCheckpoint = events.get(maxCount).checkpoint();
        } else if (events.isEmpty()) {
            nextCheckpoint = fromCheckpointInclusive;
        } else {
            nextCheckpoint = events.get(events.size() - 1).checkpoint() + 1;
        }
        return new ReadAllPage(
                fromCheckpointInclusive, nextCheckpoint, isEnd, ReadDirection.FORWARD, firstEvents(events, maxCount));
    }

    @Override
    protected long readHeadCheckpointInternal() {
        return withHandle(handle ->
                handle.createQuery(sqlSelectHeadOrdinal())
                        .map((index, rs, ctx) -> {
                            final long ordinal = rs.getLong(1);
                            return rs.wasNull() ? Checkpoint.NONE : ordinal;
                        })
                        .first());
    }

    @Override
    protected ReadStreamPage readStreamBackwardsInternal(
            final String streamId, final int fromVersionInclusive, final int maxCount) {

        final StreamIdInfo streamIdInfo = new StreamIdInfo(streamId);
        return withHandle(handle -> {
            final StreamRow stream = findStream(handle, streamIdInfo);
            if (stream == null || !stream.hasEvents()) {
                return ReadStreamPage.notFound(streamId, fromVersionInclusive, ReadDirection.BACKWARD);
            }

            final int fromVersion = fromVersionInclusive == StreamVersion.END ? stream.version : fromVersionInclusive;
            final List<StoredEvent> events = handle.createQuery(sqlSelectStreamEventsBackwards())
                    .bind("streamIdInternal", stream.idInternal)
                    .bind("fromVersion", fromVersion)
                    .bind("count", maxCount + 1)
                    .map(eventResultSetMapper)
                    .list();

            final boolean isEnd = events.size() <= maxCount;
            final int nextVersion = isEnd ? StreamVersion.END : events.get(maxCount).streamVersion();
            return new ReadStreamPage(
                    streamId,
                    ReadStreamPage.Status.SUCCESS,
                    fromVersionInclusive,
                    nextVersion,
                    stream.version,
                    stream.lastOrdinal,
                    ReadDirection.BACKWARD,
                    isEnd,
                    firstEvents(events, maxCount));
        });
    }

    @Override
    protected ReadStreamPage readStreamForwardsInternal(
            final String streamId, final int fromVersionInclusive, final int maxCount) {

        final StreamIdInfo streamIdInfo = new StreamIdInfo(streamId);
        return withHandle(handle -> {
            final StreamRow stream = findStream(handle, streamIdInfo);
            if (stream == null || !stream.hasEvents()) {
                return ReadStreamPage.notFound(streamId, fromVersionInclusive, ReadDirection.FORWARD);
            }

            final List<StoredEvent> events = handle.createQuery(sqlSelectStreamEventsForwards())
                    .bind("streamIdInternal", stream.idInternal)
                    .bind("fromVersion", fromVersionInclusive)
                    .bind("count", maxCount + 1)
                    .map(eventResultSetMapper)
                    .list();

            final boolean isEnd = events.size() <= maxCount;
            final int nextVersion;
            if (!isEnd) {
                nextVersion = events.get(maxCount).streamVersion();
            } else if (events.isEmpty()) {
                nextVersion = fromVersionInclusive;
            } else {
                nextVersion = events.get(events.size() - 1).streamVersion() + 1;
            }
            return new ReadStreamPage(
                    streamId,
                    ReadStreamPage.Status.SUCCESS,
                    fromVersionInclusive,
                    nextVersion,
                    stream.version,
                    stream.lastOrdinal,
                    ReadDirection.FORWARD,
                    isEnd,
                    firstEvents(events, maxCount));
        });
    }

    @Override
    protected StreamMetadata setStreamMetadataInternal(
            final String streamId, final int expectedMetadataVersion, final Integer maxAge, final Integer maxCount) {

        final StreamIdInfo streamIdInfo = new StreamIdInfo(streamId);
        return withHandle(handle -> handle.inTransaction((h, status) -> {
            lockAppends(h);
            StreamRow stream = findStream(h, streamIdInfo);
            final int currentMetadataVersion = stream == null ? StreamVersion.END : stream.metadataVersion;
            if (expectedMetadataVersion != ExpectedVersion.ANY && expectedMetadataVersion != currentMetadataVersion) {
                throw new ConcurrencyConflictException(streamId, expectedMetadataVersion, currentMetadataVersion);
            }

            if (stream == null) {
                stream = insertStream(h, streamIdInfo);
            }

            final int metadataVersion = currentMetadataVersion + 1;
            h.createStatement(sqlUpdateStreamMetadata())
                    .bind("maxAge", maxAge)
                    .bind("maxCount", maxCount)
                    .bind("metadataVersion", metadataVersion)
                    .bind("streamIdInternal", stream.idInternal)
                    .execute();

            if (maxCount != null) {
                purge(h, streamIdInfo, stream.idInternal, stream.version, maxCount);
            }
            log.debug("Stream metadata updated [streamId={}, metadataVersion={}]", streamId, metadataVersion);
            return new StreamMetadata(streamId, metadataVersion, maxAge, maxCount);
        }));
    }

    protected String sqlCountStreamEvents() {
        return "SELECT COUNT(*) " +
                "FROM " + table("EVENTS") + " E " +
                "JOIN " + table("STREAMS") + " S ON S.ID_INTERNAL = E.STREAM_ID_INTERNAL " +
                "WHERE S.ID = :streamId";
    }

    protected String sqlCountStreamEventsCreatedBefore() {
        return sqlCountStreamEvents() + " AND E.CREATED < :createdBefore";
    }

    protected String sqlDeleteStreamEventsUpToVersion() {
        return "DELETE FROM " + table("EVENTS") + " WHERE STREAM_ID_INTERNAL = :streamIdInternal AND STREAM_VERSION <= :version";
    }

    protected String sqlInsertEvent() {
        return "INSERT INTO " + table("EVENTS") + "(" +
                "STREAM_ID_INTERNAL, STREAM_VERSION, EVENT_ID, EVENT_TYPE, EVENT_PAYLOAD, EVENT_METADATA) " +
                "VALUES(:streamIdInternal, :streamVersion, :eventId, :eventType, :eventPayload, :eventMetadata)";
    }

    protected String sqlInsertEventWithCreated() {
        return "INSERT INTO " + table("EVENTS") + "(" +
                "STREAM_ID_INTERNAL, STREAM_VERSION, EVENT_ID, CREATED, EVENT_TYPE, EVENT_PAYLOAD, EVENT_METADATA) " +
                "VALUES(:streamIdInternal, :streamVersion, :eventId, :created, :eventType, :eventPayload, :eventMetadata)";
    }

    protected String sqlInsertStream() {
        return "INSERT INTO " + table("STREAMS") + "(ID, ID_ORIGINAL) VALUES(:streamId, :streamIdOriginal)";
    }

    protected String sqlLockAppends() {
        return "SELECT ID FROM " + table("APPEND_LOCK") + " WHERE ID = 0 FOR UPDATE";
    }

    protected String sqlSelectAllEventsBackwards() {
        return sqlSelectEvents() +
                "WHERE E.ORDINAL <= :fromOrdinal " +
                "ORDER BY E.ORDINAL DESC " +
                "LIMIT :count";
    }

    protected String sqlSelectAllEventsForwards() {
        return sqlSelectEvents() +
                "WHERE E.ORDINAL >= :fromOrdinal " +
                "ORDER BY E.ORDINAL ASC " +
                "LIMIT :count";
    }

    protected String sqlSelectEvents() {
        return "SELECT S.ID_ORIGINAL, E.EVENT_ID, E.STREAM_VERSION, E.ORDINAL, E.CREATED, E.EVENT_TYPE, " +
                "E.EVENT_PAYLOAD, E.EVENT_METADATA " +
                "FROM " + table("EVENTS") + " E " +
                "JOIN " + table("STREAMS") + " S ON S.ID_INTERNAL = E.STREAM_ID_INTERNAL ";
    }

    protected String sqlSelectHeadOrdinal() {
        return "SELECT MAX(ORDINAL) FROM " + table("EVENTS");
    }

    protected String sqlSelectStream() {
        return "SELECT ID_INTERNAL, STREAM_VERSION, LAST_ORDINAL, MAX_AGE, MAX_COUNT, METADATA_VERSION " +
                "FROM " + table("STREAMS") + " " +
                "WHERE ID = :streamId";
    }

    protected String sqlSelectStreamEventIds() {
        return "SELECT EVENT_ID FROM " + table("EVENTS") + " " +
                "WHERE STREAM_ID_INTERNAL = :streamIdInternal AND STREAM_VERSION >= :fromVersion " +
                "ORDER BY STREAM_VERSION ASC " +
                "LIMIT :count";
    }

    protected String sqlSelectStreamEventsBackwards() {
        return sqlSelectEvents() +
                "WHERE E.STREAM_ID_INTERNAL = :streamIdInternal AND E.STREAM_VERSION <= :fromVersion " +
                "ORDER BY E.STREAM_VERSION DESC " +
                "LIMIT :count";
    }

    protected String sqlSelectStreamEventsForwards() {
        return sqlSelectEvents() +
                "WHERE E.STREAM_ID_INTERNAL = :streamIdInternal AND E.STREAM_VERSION >= :fromVersion " +
                "ORDER BY E.STREAM_VERSION ASC " +
                "LIMIT :count";
    }

    protected String sqlSelectStreamLastOrdinal() {
        return "SELECT MAX(ORDINAL) FROM " + table("EVENTS") + " WHERE STREAM_ID_INTERNAL = :streamIdInternal";
    }

    protected String sqlSelectVersionOfEvent() {
        return "SELECT STREAM_VERSION FROM " + table("EVENTS") + " " +
                "WHERE STREAM_ID_INTERNAL = :streamIdInternal AND EVENT_ID = :eventId";
    }

    protected String sqlUpdateStreamHead() {
        return "UPDATE " + table("STREAMS") + " " +
                "SET STREAM_VERSION = :streamVersion, LAST_ORDINAL = :lastOrdinal " +
                "WHERE ID_INTERNAL = :streamIdInternal";
    }

    protected String sqlUpdateStreamMetadata() {
        return "UPDATE " + table("STREAMS") + " " +
                "SET MAX_AGE = :maxAge, MAX_COUNT = :maxCount, METADATA_VERSION = :metadataVersion " +
                "WHERE ID_INTERNAL = :streamIdInternal";
    }

    /**
     * Qualifies a table name with the schema of the store.
     */
    protected String table(final String name) {
        return schema + "." + name;
    }

    private static List<StoredEvent> firstEvents(final List<StoredEvent> events, final int maxCount) {
        return events.size() > maxCount ? events.subList(0, maxCount) : events;
    }

    private static Integer nullableInt(final ResultSet rs, final String column) throws SQLException {
        final int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static OffsetDateTime toTimestamp(final Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private AppendResult appendInTransaction(
            final Handle handle, final StreamIdInfo streamIdInfo, final int expectedVersion, final List<NewEvent> events) {

        checkNotInterrupted();
        lockAppends(handle);

        final StreamRow existing = findStream(handle, streamIdInfo);
        final List<UUID> eventIds = events.stream().map(NewEvent::eventId).collect(Collectors.toList());
        final ConcurrencyController.Decision decision = concurrencyController.decide(
                streamIdInfo.original(), expectedVersion, eventIds, new HandleStreamState(handle, existing));

        if (!decision.isWrite()) {
            log.debug("Nothing to append [streamId={}, expectedVersion={}, events={}]",
                    streamIdInfo.original(), expectedVersion, events.size());
            return existing == null
                    ? new AppendResult(StreamVersion.END, Checkpoint.NONE)
                    : new AppendResult(existing.version, existing.lastOrdinal);
        }

        checkNotInterrupted();
        final StreamRow stream = existing == null ? insertStream(handle, streamIdInfo) : existing;
        insertEvents(handle, stream.idInternal, decision.appendAtVersion(), events);

        final int streamVersion = decision.appendAtVersion() + events.size() - 1;
        final long lastOrdinal = handle.createQuery(sqlSelectStreamLastOrdinal())
                .bind("streamIdInternal", stream.idInternal)
                .map((index, rs, ctx) -> rs.getLong(1))
                .first();
        handle.createStatement(sqlUpdateStreamHead())
                .bind("streamVersion", streamVersion)
                .bind("lastOrdinal", lastOrdinal)
                .bind("streamIdInternal", stream.idInternal)
                .execute();

        if (stream.maxCount != null) {
            purge(handle, streamIdInfo, stream.idInternal, streamVersion, stream.maxCount);
        }
        return new AppendResult(streamVersion, lastOrdinal);
    }

    private void checkNotInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Operation cancelled [store=" + logName() + "]");
        }
    }

    private int currentVersion(final StreamIdInfo streamIdInfo) {
        try {
            final StreamRow stream = dbi.withHandle(handle -> findStream(handle, streamIdInfo));
            return stream == null ? StreamVersion.END : stream.version;
        } catch (final DBIException e) {
            log.warn("Unable to read current version [streamId={}]", streamIdInfo.original(), e);
            return StreamVersion.END;
        }
    }

    private StreamRow findStream(final Handle handle, final StreamIdInfo streamIdInfo) {
        return handle.createQuery(sqlSelectStream())
                .bind("streamId", streamIdInfo.hashed())
                .map(streamResultSetMapper)
                .first();
    }

    private void insertEvents(
            final Handle handle, final int streamIdInternal, final int fromVersion, final List<NewEvent> events) {

        final OffsetDateTime created = clientClock().map(clock -> toTimestamp(clock.instant())).orElse(null);
        final PreparedBatch batch = handle.prepareBatch(created == null ? sqlInsertEvent() : sqlInsertEventWithCreated());
        int version = fromVersion;
        for (final NewEvent event : events) {
            final PreparedBatchPart part = batch.add()
                    .bind("streamIdInternal", streamIdInternal)
                    .bind("streamVersion", version++)
                    .bind("eventId", event.eventId())
                    .bind("eventType", event.type())
                    .bind("eventPayload", event.payload())
                    .bind("eventMetadata", event.metadata());
            if (created != null) {
                part.bind("created", created);
            }
        }
        batch.execute();
    }

    private StreamRow insertStream(final Handle handle, final StreamIdInfo streamIdInfo) {
        handle.createStatement(sqlInsertStream())
                .bind("streamId", streamIdInfo.hashed())
                .bind("streamIdOriginal", streamIdInfo.original())
                .execute();
        return findStream(handle, streamIdInfo);
    }

    private void lockAppends(final Handle handle) {
        final Integer lock = handle.createQuery(sqlLockAppends())
                .map((index, rs, ctx) -> rs.getInt(1))
                .first();
        if (lock == null) {
            throw new BackendUnavailableException("Append lock row is missing, has the store been initialized?", null);
        }
    }

    private void purge(
            final Handle handle,
            final StreamIdInfo streamIdInfo,
            final int streamIdInternal,
            final int streamVersion,
            final int maxCount) {

        final int purged = handle.createStatement(sqlDeleteStreamEventsUpToVersion())
                .bind("streamIdInternal", streamIdInternal)
                .bind("version", streamVersion - maxCount)
                .execute();
        if (purged > 0) {
            log.debug("Purged events [streamId={}, count={}, maxCount={}]", streamIdInfo.original(), purged, maxCount);
        }
    }

    private RuntimeException translate(final DBIException e, final Function<SQLException, RuntimeException> uniqueViolation) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof EventStoreException) {
                return (EventStoreException) cause;
            }
            if (cause instanceof CancellationException || cause instanceof IllegalArgumentException) {
                return (RuntimeException) cause;
            }
            if (uniqueViolation != null
                    && cause instanceof SQLException
                    && UNIQUE_VIOLATION.equals(((SQLException) cause).getSQLState())) {
                return uniqueViolation.apply((SQLException) cause);
            }
        }
        return new BackendUnavailableException("Backend operation failed [store=" + logName() + "]", e);
    }

    private <T> T withHandle(final HandleCallback<T> callback) {
        return withHandle(callback, null);
    }

    private <T> T withHandle(
            final HandleCallback<T> callback, final Function<SQLException, RuntimeException> uniqueViolation) {

        checkNotInterrupted();
        try {
            return dbi.withHandle(callback);
        } catch (final DBIException e) {
            throw translate(e, uniqueViolation);
        }
    }

    /**
     * Reads the state of a stream with the handle of the append transaction.
     */
    private class HandleStreamState implements ConcurrencyController.StreamState {
        private final Handle handle;
        private final StreamRow stream;

        private HandleStreamState(final Handle handle, final StreamRow stream) {
            this.handle = handle;
            this.stream = stream;
        }

        @Override
        public int currentVersion() {
            return stream == null ? StreamVersion.END : stream.version;
        }

        @Override
        public List<UUID> eventIds(final int fromVersion, final int count) {
            if (stream == null) {
                return Collections.emptyList();
            }
            return handle.createQuery(sqlSelectStreamEventIds())
                    .bind("streamIdInternal", stream.idInternal)
                    .bind("fromVersion", fromVersion)
                    .bind("count", count)
                    .map((index, rs, ctx) -> rs.getObject("EVENT_ID", UUID.class))
                    .list();
        }

        @Override
        public Integer versionOf(final UUID eventId) {
            if (stream == null) {
                return null;
            }
            return handle.createQuery(sqlSelectVersionOfEvent())
                    .bind("streamIdInternal", stream.idInternal)
                    .bind("eventId", eventId)
                    .map((index, rs, ctx) -> rs.getInt(1))
                    .first();
        }
    }
}
