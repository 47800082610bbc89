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

import org.streamstore.core.AllStreamSubscription;
import org.streamstore.core.Checkpoint;
import org.streamstore.core.EventStore;
import org.streamstore.core.ReadAllPage;
import org.streamstore.core.StoredEvent;
import org.streamstore.core.SubscriptionDropped;

import java.util.function.Consumer;

/**
 * Delivers the events of all streams in checkpoint order.
 *
 * @author Tommy Wassgren
 */
class AllStreamSubscriptionImpl extends AbstractSubscription implements AllStreamSubscription {
    private volatile Long lastCheckpoint;
    private long nextCheckpoint;

    AllStreamSubscriptionImpl(
            final String name,
            final Long lastCheckpoint,
            final EventStore store,
            final NotifierHandle notifierHandle,
            final int pageSize,
            final Consumer<StoredEvent> eventReceived,
            final SubscriptionDropped dropped,
            final Runnable caughtUp,
            final Consumer<AbstractSubscription> onStopped) {

        super(name, store, notifierHandle, pageSize, eventReceived, dropped, caughtUp, onStopped);
        this.lastCheckpoint = lastCheckpoint;
    }

    @Override
    public Long lastCheckpoint() {
        return lastCheckpoint;
    }

    @Override
    protected void initialize() {
        if (lastCheckpoint == null) {
            nextCheckpoint = Checkpoint.START;
        } else if (lastCheckpoint == Checkpoint.END) {
            final long head = store.readHeadCheckpoint();
            lastCheckpoint = head == Checkpoint.NONE ? null : head;
            nextCheckpoint = head + 1;
        } else {
            nextCheckpoint = lastCheckpoint + 1;
        }
        log.debug("Subscription starting [name={}, fromCheckpoint={}]", name(), nextCheckpoint);
    }

    @Override
    protected boolean pullPage() {
        final ReadAllPage page = store.readAllForwards(nextCheckpoint, pageSize);
        for (final StoredEvent event : page.events()) {
            if (!deliver(event)) {
                return true;
            }
            lastCheckpoint = event.checkpoint();
        }
        nextCheckpoint = page.nextCheckpoint();
        return page.isEnd();
    }
}
