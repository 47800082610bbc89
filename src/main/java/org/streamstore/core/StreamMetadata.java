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

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Per-stream policy deciding which events are current. {@code maxAge} is in seconds, events older than that are no longer
 * returned by reads. {@code maxCount} limits the number of events kept, the oldest are purged on append. Both are optional.
 *
 * @author Tommy Wassgren
 */
public final class StreamMetadata {
    private final Integer maxAge;
    private final Integer maxCount;
    private final int metadataVersion;
    private final String streamId;

    public StreamMetadata(final String streamId, final int metadataVersion, final Integer maxAge, final Integer maxCount) {
        this.streamId = requireNonNull(streamId, "Stream id must not be null");
        this.metadataVersion = metadataVersion;
        this.maxAge = maxAge;
        this.maxCount = maxCount;
    }

    /**
     * Metadata of a stream that never had any set.
     */
    public static StreamMetadata none(final String streamId) {
        return new StreamMetadata(streamId, StreamVersion.END, null, null);
    }

    @Override
    public boolean equals(final Object otherObject) {
        if (otherObject instanceof StreamMetadata) {
            final StreamMetadata other = (StreamMetadata) otherObject;
            return metadataVersion == other.metadataVersion
                    && Objects.equals(streamId, other.streamId)
                    && Objects.equals(maxAge, other.maxAge)
                    && Objects.equals(maxCount, other.maxCount);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamId, metadataVersion, maxAge, maxCount);
    }

    public Integer maxAge() {
        return maxAge;
    }

    public Integer maxCount() {
        return maxCount;
    }

    /**
     * Incremented each time the metadata is set, {@link StreamVersion#END} if it never was.
     */
    public int metadataVersion() {
        return metadataVersion;
    }

    public String streamId() {
        return streamId;
    }

    @Override
    public String toString() {
        return "StreamMetadata[streamId=" + streamId + ", metadataVersion=" + metadataVersion + ", maxAge=" + maxAge
                + ", maxCount=" + maxCount + "]";
    }
}
