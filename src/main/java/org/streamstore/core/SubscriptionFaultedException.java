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

/**
 * Passed to {@link SubscriptionDropped} when a subscription stops because of a failure. The subscription does not restart, a
 * new one has to be created.
 *
 * @author Tommy Wassgren
 */
public class SubscriptionFaultedException extends EventStoreException {
    private static final long serialVersionUID = 1L;
    private final SubscriptionDroppedReason reason;

    public SubscriptionFaultedException(final String name, final SubscriptionDroppedReason reason, final Throwable cause) {
        super(String.format("Subscription faulted [name=%s, reason=%s]", name, reason), cause);
        this.reason = reason;
    }

    public SubscriptionDroppedReason reason() {
        return reason;
    }
}
