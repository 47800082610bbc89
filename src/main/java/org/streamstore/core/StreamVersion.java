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
 * Special stream versions used when reading and subscribing.
 *
 * @author Tommy Wassgren
 */
public final class StreamVersion {
    public static final int START = 0;

    /**
     * The last event of the stream. Reading backwards from here starts with the newest event, subscribing from here skips the
     * events already in the stream.
     */
    public static final int END = -1;

    private StreamVersion() {
        // Constants only
    }
}
