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
 * Subscription to the events of all streams in checkpoint order.
 *
 * @author Tommy Wassgren
 */
public interface AllStreamSubscription extends Subscription {
    /**
     * The checkpoint of the last delivered event, {@code null} if no event has been delivered yet and the subscription started
     * from the beginning of the store.
     */
    Long lastCheckpoint();
}
