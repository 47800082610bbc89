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

import com.hazelcast.config.TopicConfig;
import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.core.ITopic;
import org.streamstore.core.AppendResult;
import org.streamstore.core.StoreNotifierFactory;

import static java.util.Objects.requireNonNull;

/**
 * Push notifier based on a Hazelcast topic. Each append publishes the new head checkpoint on the topic and every member that
 * listens to the topic signals its subscriptions. All stores that share a database should share the topic as well.
 *
 * <p>Global ordering is enabled for the topic so that all members observe the published heads in the same order.</p>
 *
 * @author Tommy Wassgren
 */
public class HazelcastStoreNotifier extends AbstractStoreNotifier {
    private final String listenerId;
    private final ITopic<Long> topic;

    public HazelcastStoreNotifier(final HazelcastInstance hz, final String topicName) {
        requireNonNull(hz, "Hazelcast instance must not be null");
        requireNonNull(topicName, "Topic must not be null");

        if (!hz.getConfig().getTopicConfigs().containsKey(topicName)) {
            hz.getConfig().addTopicConfig(topicConfig(topicName));
        }
        this.topic = hz.getTopic(topicName);
        this.listenerId = topic.addMessageListener(message -> {
            log.trace("Head published [topic={}, checkpoint={}]", topicName, message.getMessageObject());
            signalListeners();
        });
        log.info("Hazelcast notifier started [topic={}]", topicName);
    }

    /**
     * Creates a factory that uses a topic named after the log name of the store.
     */
    public static StoreNotifierFactory factory(final HazelcastInstance hz) {
        return store -> new HazelcastStoreNotifier(hz, topicName(store.logName()));
    }

    public static StoreNotifierFactory factory(final HazelcastInstance hz, final String topicName) {
        return store -> new HazelcastStoreNotifier(hz, topicName);
    }

    public static String topicName(final String logName) {
        return "streamstore." + logName;
    }

    @Override
    public void appended(final AppendResult result) {
        topic.publish(result.currentCheckpoint());
    }

    @Override
    public void close() {
        topic.removeMessageListener(listenerId);
        log.info("Hazelcast notifier stopped [topic={}]", topic.getName());
    }

    private static TopicConfig topicConfig(final String topicName) {
        final TopicConfig topicConfig = new TopicConfig();
        topicConfig.setGlobalOrderingEnabled(true);
        topicConfig.setName(topicName);
        return topicConfig;
    }
}
