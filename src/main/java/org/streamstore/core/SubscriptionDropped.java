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
 * Invoked exactly once when a subscription stops delivering events.
 *
 * @author Tommy Wassgren
 */
@FunctionalInterface
public interface SubscriptionDropped {
    /**
     * @param subscription The subscription that stopped.
     * @param reason       Why it stopped.
     * @param exception    The failure, {@code null} when the subscription was disposed.
     */
    void onDropped(Subscription subscription, SubscriptionDroppedReason reason, Throwable exception);
}
