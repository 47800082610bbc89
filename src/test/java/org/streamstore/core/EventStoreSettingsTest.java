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

import org.junit.Test;

import java.time.Duration;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * @author Tommy Wassgren
 */
public class EventStoreSettingsTest {
    @Test
    public void defaults() {
        // When
        final EventStoreSettings settings = EventStoreSettings.builder().jdbcUrl("jdbc:h2:mem:test").build();

        // Then
        assertEquals(EventStoreSettings.DEFAULT_LOG_NAME, settings.logName());
        assertEquals(EventStoreSettings.DEFAULT_METADATA_CACHE_MAX_SIZE, settings.metadataCacheMaxSize());
        assertEquals(EventStoreSettings.DEFAULT_METADATA_MAX_AGE, settings.metadataMaxAge());
        assertEquals(EventStoreSettings.DEFAULT_SCHEMA, settings.schema());
        assertEquals(EventStoreSettings.DEFAULT_SUBSCRIPTION_PAGE_SIZE, settings.subscriptionPageSize());
        assertFalse(settings.clock().isPresent());
        assertFalse(settings.executorService().isPresent());
        assertFalse(settings.notifierFactory().isPresent());
        assertTrue(settings.jdbcUrl().isPresent());
    }

    @Test(expected = InvalidConfigurationException.class)
    public void invalidSchema() {
        EventStoreSettings.builder().schema("events; DROP TABLE STREAMS");
    }

    @Test(expected = InvalidConfigurationException.class)
    public void negativeMetadataMaxAge() {
        EventStoreSettings.builder().metadataMaxAge(Duration.ofSeconds(-1));
    }

    @Test(expected = InvalidConfigurationException.class)
    public void noBackend() {
        EventStoreSettings.builder().build();
    }

    @Test
    public void schemaIsUpperCased() {
        // When
        final EventStoreSettings settings = EventStoreSettings.builder().jdbcUrl("jdbc:h2:mem:test").schema("events").build();

        // Then
        assertEquals("EVENTS", settings.schema());
    }

    @Test(expected = InvalidConfigurationException.class)
    public void zeroSubscriptionPageSize() {
        EventStoreSettings.builder().subscriptionPageSize(0);
    }
}
