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
 * Thrown when the expected version of an append did not match the stream and the append was not an idempotent replay of an
 * already committed batch. The append is never retried by the store.
 *
 * @author Tommy Wassgren
 */
public class ConcurrencyConflictException extends EventStoreException {
    private static final long serialVersionUID = 1L;
    private final int actualVersion;
    private final int expectedVersion;
    private final String streamId;

    public ConcurrencyConflictException(final String streamId, final int expectedVersion, final int actualVersion) {
        this(streamId, expectedVersion, actualVersion, null);
    }

    public ConcurrencyConflictException(
            final String streamId, final int expectedVersion, final int actualVersion, final Throwable cause) {

        super(String.format("Append failed due to wrong expected version [streamId=%s, expectedVersion=%d, actualVersion=%d]",
                streamId, expectedVersion, actualVersion), cause);
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public int actualVersion() {
        return actualVersion;
    }

    public int expectedVersion() {
        return expectedVersion;
    }

    public String streamId() {
        return streamId;
    }
}
