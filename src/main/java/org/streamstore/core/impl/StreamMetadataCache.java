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

package org.streamstore.core.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.streamstore.core.StreamMetadata;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Cache-aside store for stream metadata. An entry is served until its max age has passed, after that the next lookup loads
 * it again. When more than max size streams are cached the entries that were loaded first are evicted first. The loader is
 * never invoked while holding the lock, so a slow backend does not block lookups of other streams.
 *
 * @author Tommy Wassgren
 */
public class StreamMetadataCache {
    private static final class Entry {
        private final Instant expires;
        private final StreamMetadata metadata;

        private Entry(final StreamMetadata metadata, final Instant expires) {
            this.metadata = metadata;
            this.expires = expires;
        }
    }

    private final Clock clock;
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Function<String, StreamMetadata> loader;
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final Duration maxAge;
    private final int maxSize;

    public StreamMetadataCache(
            final Duration maxAge, final int maxSize, final Clock clock, final Function<String, StreamMetadata> loader) {

        this.maxAge = requireNonNull(maxAge, "Max age must not be null");
        this.maxSize = maxSize;
        this.clock = requireNonNull(clock, "Clock must not be null");
        this.loader = requireNonNull(loader, "Loader must not be null");
    }

    /**
     * Finds the metadata of the stream, from the cache if it has not expired and from the loader otherwise.
     */
    public StreamMetadata get(final String streamId) {
        if (isDisabled()) {
            return loader.apply(streamId);
        }

        // Expiry is measured from before the load so that an entry is never older than max age
        final Instant now = clock.instant();
        synchronized (entries) {
            final Entry entry = entries.get(streamId);
            if (entry != null && now.isBefore(entry.expires)) {
                return entry.metadata;
            }
        }

        log.trace("Loading stream metadata [streamId={}]", streamId);
        final StreamMetadata metadata = loader.apply(streamId);
        put(streamId, new Entry(metadata, now.plus(maxAge)));
        return metadata;
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }

    public void invalidate(final String streamId) {
        synchronized (entries) {
            entries.remove(streamId);
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    private boolean isDisabled() {
        return maxSize == 0 || maxAge.isZero();
    }

    private void put(final String streamId, final Entry entry) {
        synchronized (entries) {
            // Re-insert so that the entry counts as the newest
            entries.remove(streamId);
            entries.put(streamId, entry);

            final Iterator<Map.Entry<String, Entry>> oldestFirst = entries.entrySet().iterator();
            while (entries.size() > maxSize && oldestFirst.hasNext()) {
                final Map.Entry<String, Entry> evicted = oldestFirst.next();
                oldestFirst.remove();
                log.trace("Evicted stream metadata [streamId={}]", evicted.getKey());
            }
        }
    }
}
