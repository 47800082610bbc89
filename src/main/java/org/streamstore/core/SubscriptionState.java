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
 * Lifecycle of a subscription: {@code INITIALIZING -> CATCHING_UP -> LIVE -> (FAULTED | DISPOSED)}. Faulted and disposed are
 * terminal.
 *
 * @author Tommy Wassgren
 */
public enum SubscriptionState {
    INITIALIZING,
    CATCHING_UP,
    LIVE,
    FAULTED,
    DISPOSED;

    public boolean isTerminal() {
        return this == FAULTED || this == DISPOSED;
    }
}
