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

import org.skife.jdbi.v2.Handle;
import org.streamstore.core.EventStoreSettings;

/**
 * Event store on H2. When a clock is configured the creation timestamps are supplied by the client and the {@code CREATED}
 * column has no default.
 *
 * @author Tommy Wassgren
 */
public class H2EventStore extends AbstractJdbcEventStore {
    public H2EventStore(final EventStoreSettings settings) {
        super(settings);
    }

    @Override
    protected void doDropAll(final Handle handle) {
        handle.execute("DROP TABLE IF EXISTS " + table("EVENTS"));
        handle.execute("DROP TABLE IF EXISTS " + table("STREAMS"));
        handle.execute("DROP TABLE IF EXISTS " + table("APPEND_LOCK"));
    }

    @Override
    protected void doInitialize(final Handle handle) {
        if (!EventStoreSettings.DEFAULT_SCHEMA.equals(schema())) {
            handle.execute("CREATE SCHEMA IF NOT EXISTS " + schema());
        }

        handle.execute(
                "CREATE TABLE IF NOT EXISTS " +
                        table("STREAMS") + "(" +
                        "ID_INTERNAL INT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
                        "ID CHAR(40) NOT NULL, " +
                        "ID_ORIGINAL VARCHAR(1000) NOT NULL, " +
                        "STREAM_VERSION INT DEFAULT -1 NOT NULL, " +
                        "LAST_ORDINAL BIGINT DEFAULT -1 NOT NULL, " +
                        "MAX_AGE INT, " +
                        "MAX_COUNT INT, " +
                        "METADATA_VERSION INT DEFAULT -1 NOT NULL)");
        handle.execute("CREATE UNIQUE INDEX IF NOT EXISTS " + table("IX_STREAMS_ID") + " ON " + table("STREAMS") + "(ID)");

        final String created = clientClock().isPresent()
                ? "CREATED TIMESTAMP WITH TIME ZONE NOT NULL, "
                : "CREATED TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP NOT NULL, ";
        handle.execute(
                "CREATE TABLE IF NOT EXISTS " +
                        table("EVENTS") + "(" +
                        "ORDINAL BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
                        "STREAM_ID_INTERNAL INT NOT NULL, " +
                        "STREAM_VERSION INT NOT NULL, " +
                        "EVENT_ID UUID NOT NULL, " +
                        created +
                        "EVENT_TYPE VARCHAR(128) NOT NULL, " +
                        "EVENT_PAYLOAD VARBINARY, " +
                        "EVENT_METADATA VARBINARY, " +
                        "CONSTRAINT FK_EVENTS_STREAMS FOREIGN KEY(STREAM_ID_INTERNAL) " +
                        "REFERENCES " + table("STREAMS") + "(ID_INTERNAL))");
        handle.execute("CREATE UNIQUE INDEX IF NOT EXISTS " + table("IX_EVENTS_STREAM_VERSION") +
                " ON " + table("EVENTS") + "(STREAM_ID_INTERNAL, STREAM_VERSION)");
        handle.execute("CREATE UNIQUE INDEX IF NOT EXISTS " + table("IX_EVENTS_STREAM_EVENT_ID") +
                " ON " + table("EVENTS") + "(STREAM_ID_INTERNAL, EVENT_ID)");

        handle.execute("CREATE TABLE IF NOT EXISTS " + table("APPEND_LOCK") + "(ID INT PRIMARY KEY)");
        handle.execute("MERGE INTO " + table("APPEND_LOCK") + " KEY(ID) VALUES(0)");
    }
}
