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
 * Special values for the expected version of an append. Any non-negative value means "the stream must currently be at exactly
 * this version".
 *
 * @author Tommy Wassgren
 */
public final class ExpectedVersion {
    /**
     * No concurrency check, the events are always appended (or treated as an idempotent replay).
     */
    public static final int ANY = -2;

    /**
     * The stream must not contain any events yet.
     */
    public static final int NO_STREAM = -1;

    private ExpectedVersion() {
        // Constants only
    }
}
