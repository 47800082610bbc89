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

import org.streamstore.core.EventStore;
import org.streamstore.core.ReadStreamPage;
import org.streamstore.core.StoredEvent;
import org.streamstore.core.StreamSubscription;
import org.streamstore.core.StreamVersion;
import org.streamstore.core.SubscriptionDropped;

import java.util.function.Consumer;

/**
 * Delivers the events of one stream in version order. A stream that does not exist yet is treated as empty, the subscription
 * waits for its first events.
 *
 * @author Tommy Wassgren
 */
class StreamSubscriptionImpl extends AbstractSubscription implements StreamSubscription {
    private volatile Integer lastVersion;
    private int nextVersion;
    private final String streamId;

    StreamSubscriptionImpl(
            final String streamId,
            final String name,
            final Integer lastVersion,
            final EventStore store,
            final NotifierHandle notifierHandle,
            final int pageSize,
            final Consumer<StoredEvent> eventReceived,
            final SubscriptionDropped dropped,
            final Runnable caughtUp,
            final Consumer<AbstractSubscription> onStopped) {

        super(name, store, notifierHandle, pageSize, eventReceived, dropped, caughtUp, onStopped);
        this.streamId = streamId;
        this.lastVersion = lastVersion;
    }

    @Override
    public Integer lastVersion() {
        return lastVersion;
    }

    @Override
    public String streamId() {
        return streamId;
    }

    @Override
    protected void initialize() {
        if (lastVersion == null) {
            nextVersion = StreamVersion.START;
        } else if (lastVersion == StreamVersion.END) {
            final ReadStreamPage last = store.readStreamBackwards(streamId, StreamVersion.END, 1);
            if (last.status() == ReadStreamPage.Status.STREAM_NOT_FOUND) {
                lastVersion = null;
                nextVersion = StreamVersion.START;
            } else {
                lastVersion = last.lastStreamVersion();
                nextVersion = last.lastStreamVersion() + 1;
            }
        } else {
            nextVersion = lastVersion + 1;
        }
        log.debug("Subscription starting [name={}, streamId={}, fromVersion={}]", name(), streamId, nextVersion);
    }

    @Override
    protected boolean pullPage() {
        final ReadStreamPage page = store.readStreamForwards(streamId, nextVersion, pageSize);
        if (page.status() == ReadStreamPage.Status.STREAM_NOT_FOUND) {
            return true;
        }

        for (final StoredEvent event : page.events()) {
            if (!deliver(event)) {
                return true;
            }
            lastVersion = event.streamVersion();
        }
        nextVersion = page.nextVersion();
        return page.isEnd();
    }
}
