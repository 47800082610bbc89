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

package org.streamstore.notify;

import com.hazelcast.config.Config;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.streamstore.core.AppendResult;
import org.streamstore.core.Checkpoint;
import org.streamstore.core.EventStoreSettings;
import org.streamstore.core.ExpectedVersion;
import org.streamstore.core.NewEvent;
import org.streamstore.core.StoredEvent;
import org.streamstore.core.support.Closeables;
import org.streamstore.store.jdbc.H2EventStore;
import org.streamstore.store.jdbc.H2Stores;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * @author Tommy Wassgren
 */
public class HazelcastStoreNotifierTest {
    private HazelcastInstance hz;

    @Before
    public void startHazelcast() {
        final Config config = new Config("streamstore-" + UUID.randomUUID());
        config.setProperty("hazelcast.phone.home.enabled", "false");
        config.setProperty("hazelcast.logging.type", "slf4j");
        config.getNetworkConfig().getJoin().getMulticastConfig().setEnabled(false);
        hz = Hazelcast.newHazelcastInstance(config);
    }

    @After
    public void stopHazelcast() {
        hz.shutdown();
    }

    @Test
    public void appendPublishesHead() throws Exception {
        // Given
        final HazelcastStoreNotifier notifier = new HazelcastStoreNotifier(hz, "appends");
        final CountDownLatch signalled = new CountDownLatch(1);
        notifier.addListener(signalled::countDown);

        // When
        notifier.appended(new AppendResult(0, 1L));

        // Then
        assertTrue(signalled.await(10, TimeUnit.SECONDS));
        assertTrue(hz.getConfig().getTopicConfig("appends").isGlobalOrderingEnabled());

        // Cleanup
        notifier.close();
    }

    @Test
    public void pushesAppendsToSubscriptionsOfAnotherStore() throws Exception {
        // Given
        final String url = H2Stores.uniqueUrl();
        final H2EventStore writer = new H2EventStore(EventStoreSettings.builder()
                .jdbcUrl(url)
                .logName("shared")
                .notifierFactory(HazelcastStoreNotifier.factory(hz))
                .build());
        writer.initialize(false);
        final H2EventStore reader = new H2EventStore(EventStoreSettings.builder()
                .jdbcUrl(url)
                .logName("shared")
                .notifierFactory(HazelcastStoreNotifier.factory(hz))
                .build());
        final List<StoredEvent> received = new CopyOnWriteArrayList<>();
        final CountDownLatch caughtUp = new CountDownLatch(1);
        final CountDownLatch allReceived = new CountDownLatch(2);
        reader.subscribeToAll(
                "subscription",
                Checkpoint.END,
                event -> {
                    received.add(event);
                    allReceived.countDown();
                },
                (subscription, reason, exception) -> { },
                caughtUp::countDown);
        assertTrue(caughtUp.await(10, TimeUnit.SECONDS));

        // When
        writer.append("stream-1", ExpectedVersion.NO_STREAM, new NewEvent(UUID.randomUUID(), "a", null));
        writer.append("stream-2", ExpectedVersion.NO_STREAM, new NewEvent(UUID.randomUUID(), "b", null));

        // Then
        assertTrue(allReceived.await(10, TimeUnit.SECONDS));
        assertEquals("a", received.get(0).type());
        assertEquals("b", received.get(1).type());

        // Cleanup
        Closeables.closeSilently(reader, writer);
    }
}
