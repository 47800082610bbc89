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
 * Special checkpoint values. Real checkpoints are non-negative and strictly increasing in commit order.
 *
 * @author Tommy Wassgren
 */
public final class Checkpoint {
    /**
     * The head checkpoint of a store without any events.
     */
    public static final long NONE = -1L;

    /**
     * The head of the store. Reading backwards from here starts with the newest event, subscribing from here skips all history.
     */
    public static final long END = Long.MAX_VALUE;

    public static final long START = 0L;

    private Checkpoint() {
        // Constants only
    }
}
