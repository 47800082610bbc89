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
 * An operation was invoked on a store that has been closed.
 *
 * @author Tommy Wassgren
 */
public class EventStoreDisposedException extends EventStoreException {
    private static final long serialVersionUID = 1L;

    public EventStoreDisposedException(final String logName) {
        super(String.format("The event store has been closed [store=%s]", logName));
    }
}
