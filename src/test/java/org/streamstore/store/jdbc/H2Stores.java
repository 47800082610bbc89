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

import org.streamstore.core.EventStoreSettings;

import java.util.UUID;

/**
 * Creates initialized H2 stores on private in-memory databases.
 *
 * @author Tommy Wassgren
 */
public final class H2Stores {
    private H2Stores() {
        // Utility
    }

    public static H2EventStore create(final EventStoreSettings.Builder builder) {
        final H2EventStore eventStore = new H2EventStore(builder.jdbcUrl(uniqueUrl()).build());
        eventStore.initialize(false);
        return eventStore;
    }

    public static String uniqueUrl() {
        return "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000";
    }
}
