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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.regex.Pattern;

/**
 * Settings of an event store. Instances are created via {@link #builder()}, all the relevant settings can be changed or
 * overridden there.
 *
 * <p>The following can be specified:
 *
 * <strong>Connection</strong>: Either a JDBC url or a {@link DataSource}. Every operation of the store obtains its own
 * connection and releases it before returning, so a pooling data source can be plugged in here.
 *
 * <strong>Schema</strong>: The schema containing the tables of the store. A schema other than the default is created by
 * {@link EventStore#initialize(boolean)}.
 *
 * <strong>Metadata cache</strong>: How long (max age) and how many (max size) stream metadata entries are cached. A max age
 * or max size of zero disables the cache.
 *
 * <strong>Clock</strong>: If a clock is provided the creation timestamp of events is supplied by the client, otherwise the
 * database assigns it. The clock is also used to decide whether events have exceeded the max age of their stream.
 *
 * <strong>Notifier</strong>: The factory creating the notifier that wakes up subscriptions. Subscriptions fail if it is
 * missing.
 *
 * <strong>Executor service</strong>: Runs the subscriptions, each subscription occupies one thread while it is running. If
 * none is defined the store creates and owns a cached thread pool. </p>
 *
 * To create a store on an in-memory H2 database that polls for new events:
 * <pre>
 *     EventStoreSettings settings = EventStoreSettings.builder()
 *         .jdbcUrl("jdbc:h2:mem:events")
 *         .notifierFactory(PollingStoreNotifier.factory(Duration.ofSeconds(1)))
 *         .build();
 *
 *     EventStore store = new H2EventStore(settings);
 *     store.initialize(true);
 * </pre>
 *
 * @author Tommy Wassgren
 */
public final class EventStoreSettings {
    public static final class Builder {
        private Clock clock;
        private DataSource dataSource;
        private ExecutorService executorService;
        private String jdbcUrl;
        private final Logger logger = LoggerFactory.getLogger(getClass());
        private String logName;
        private Integer metadataCacheMaxSize;
        private Duration metadataMaxAge;
        private StoreNotifierFactory notifierFactory;
        private String schema;
        private Integer subscriptionPageSize;

        private Builder() {
            // empty
        }

        /**
         * Build the settings based on the values provided in the earlier steps.
         *
         * @return The settings.
         * @throws InvalidConfigurationException If the settings are malformed.
         */
        public EventStoreSettings build() {
            if (jdbcUrl == null && dataSource == null) {
                throw new InvalidConfigurationException("Either a jdbc url or a data source must be provided");
            }
            if (jdbcUrl != null && dataSource != null) {
                throw new InvalidConfigurationException("Only one of jdbc url and data source may be provided");
            }
            if (notifierFactory == null) {
                logger.warn("No notifier factory has been provided. " +
                        "The store can append and read events but every subscription will fail.");
            }

            return new EventStoreSettings(this);
        }

        /**
         * Use a client supplied clock for the creation timestamp of events.
         *
         * @param clock The clock.
         * @return The builder to allow further chaining.
         */
        public Builder clock(final Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Obtain connections from the provided data source.
         *
         * @param dataSource The data source.
         * @return The builder to allow further chaining.
         * @see #jdbcUrl(String)
         */
        public Builder dataSource(final DataSource dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        /**
         * Provide your own thread pool for running subscriptions. The store does not shut it down.
         *
         * @param executorService The thread pool.
         * @return The builder to allow further chaining.
         */
        public Builder executorService(final ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        /**
         * Connect to the database with the provided url.
         *
         * @param jdbcUrl The JDBC url.
         * @return The builder to allow further chaining.
         * @see #dataSource(DataSource)
         */
        public Builder jdbcUrl(final String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
            return this;
        }

        /**
         * The name of the store in log messages.
         *
         * @param logName The name.
         * @return The builder to allow further chaining.
         */
        public Builder logName(final String logName) {
            this.logName = logName;
            return this;
        }

        /**
         * Sets the max number of stream metadata entries kept in the cache.
         *
         * @param maxSize The max size, zero disables the cache.
         * @return The builder to allow further chaining.
         */
        public Builder metadataCacheMaxSize(final int maxSize) {
            if (maxSize < 0) {
                throw new InvalidConfigurationException("Metadata cache max size must not be negative");
            }
            this.metadataCacheMaxSize = maxSize;
            return this;
        }

        /**
         * Sets how long stream metadata is cached.
         *
         * @param maxAge The max age, zero disables the cache.
         * @return The builder to allow further chaining.
         */
        public Builder metadataMaxAge(final Duration maxAge) {
            if (maxAge == null || maxAge.isNegative()) {
                throw new InvalidConfigurationException("Metadata max age must not be negative");
            }
            this.metadataMaxAge = maxAge;
            return this;
        }

        /**
         * Sets the factory that creates the notifier of the store.
         *
         * @param notifierFactory The factory.
         * @return The builder to allow further chaining.
         */
        public Builder notifierFactory(final StoreNotifierFactory notifierFactory) {
            this.notifierFactory = notifierFactory;
            return this;
        }

        /**
         * Sets the schema of the tables. The default is {@link EventStoreSettings#DEFAULT_SCHEMA}.
         *
         * @param schema The schema name, letters, digits and underscores only.
         * @return The builder to allow further chaining.
         */
        public Builder schema(final String schema) {
            if (schema == null || !SCHEMA_PATTERN.matcher(schema).matches()) {
                throw new InvalidConfigurationException(String.format("Invalid schema name [schema=%s]", schema));
            }
            this.schema = schema.toUpperCase();
            return this;
        }

        /**
         * Sets how many events a subscription reads per page.
         *
         * @param pageSize The page size.
         * @return The builder to allow further chaining.
         */
        public Builder subscriptionPageSize(final int pageSize) {
            if (pageSize <= 0) {
                throw new InvalidConfigurationException("Subscription page size must be positive");
            }
            this.subscriptionPageSize = pageSize;
            return this;
        }

        private String logNameOrDefault() {
            return logName == null || logName.isEmpty() ? DEFAULT_LOG_NAME : logName;
        }

        private int metadataCacheMaxSizeOrDefault() {
            return metadataCacheMaxSize == null ? DEFAULT_METADATA_CACHE_MAX_SIZE : metadataCacheMaxSize;
        }

        private Duration metadataMaxAgeOrDefault() {
            return metadataMaxAge == null ? DEFAULT_METADATA_MAX_AGE : metadataMaxAge;
        }

        private String schemaOrDefault() {
            return schema == null ? DEFAULT_SCHEMA : schema;
        }

        private int subscriptionPageSizeOrDefault() {
            return subscriptionPageSize == null ? DEFAULT_SUBSCRIPTION_PAGE_SIZE : subscriptionPageSize;
        }
    }

    public static final String DEFAULT_LOG_NAME = "EventStore";
    public static final int DEFAULT_METADATA_CACHE_MAX_SIZE = 10000;
    public static final Duration DEFAULT_METADATA_MAX_AGE = Duration.ofMinutes(1);
    public static final String DEFAULT_SCHEMA = "PUBLIC";
    public static final int DEFAULT_SUBSCRIPTION_PAGE_SIZE = 100;
    private static final Pattern SCHEMA_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private final Clock clock;
    private final DataSource dataSource;
    private final ExecutorService executorService;
    private final String jdbcUrl;
    private final String logName;
    private final int metadataCacheMaxSize;
    private final Duration metadataMaxAge;
    private final StoreNotifierFactory notifierFactory;
    private final String schema;
    private final int subscriptionPageSize;

    private EventStoreSettings(final Builder builder) {
        this.clock = builder.clock;
        this.dataSource = builder.dataSource;
        this.executorService = builder.executorService;
        this.jdbcUrl = builder.jdbcUrl;
        this.logName = builder.logNameOrDefault();
        this.metadataCacheMaxSize = builder.metadataCacheMaxSizeOrDefault();
        this.metadataMaxAge = builder.metadataMaxAgeOrDefault();
        this.notifierFactory = builder.notifierFactory;
        this.schema = builder.schemaOrDefault();
        this.subscriptionPageSize = builder.subscriptionPageSizeOrDefault();
    }

    /**
     * Creates the builder.
     *
     * @return The builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * The client supplied clock, empty when the database assigns creation timestamps.
     */
    public Optional<Clock> clock() {
        return Optional.ofNullable(clock);
    }

    public Optional<DataSource> dataSource() {
        return Optional.ofNullable(dataSource);
    }

    /**
     * The caller supplied thread pool, empty when the store should create its own.
     */
    public Optional<ExecutorService> executorService() {
        return Optional.ofNullable(executorService);
    }

    public Optional<String> jdbcUrl() {
        return Optional.ofNullable(jdbcUrl);
    }

    public String logName() {
        return logName;
    }

    public int metadataCacheMaxSize() {
        return metadataCacheMaxSize;
    }

    public Duration metadataMaxAge() {
        return metadataMaxAge;
    }

    public Optional<StoreNotifierFactory> notifierFactory() {
        return Optional.ofNullable(notifierFactory);
    }

    public String schema() {
        return schema;
    }

    public int subscriptionPageSize() {
        return subscriptionPageSize;
    }
}
