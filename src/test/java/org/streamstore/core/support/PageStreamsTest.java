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

package org.streamstore.core.support;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;

/**
 * @author Tommy Wassgren
 */
public class PageStreamsTest {
    @Test
    public void readsNextPageOnlyWhenNeeded() {
        // Given
        final AtomicInteger reads = new AtomicInteger();
        final List<List<Integer>> pages = Arrays.asList(Arrays.asList(1, 2), Arrays.asList(3, 4), Collections.singletonList(5));

        // When
        final List<Integer> firstThree = PageStreams.createStream(
                0,
                page -> {
                    reads.incrementAndGet();
                    return page + 1;
                },
                pages::get,
                page -> page == pages.size() - 1)
                .limit(3)
                .collect(Collectors.toList());

        // Then
        assertEquals(Arrays.asList(1, 2, 3), firstThree);
        assertEquals(1, reads.get());
    }

    @Test
    public void skipsEmptyPages() {
        // Given
        final List<List<Integer>> pages = Arrays.asList(
                Collections.emptyList(), Arrays.asList(1, 2), Collections.emptyList(), Collections.singletonList(3));

        // When
        final List<Integer> all = PageStreams.createStream(0, page -> page + 1, pages::get, page -> page == pages.size() - 1)
                .collect(Collectors.toList());

        // Then
        assertEquals(Arrays.asList(1, 2, 3), all);
    }
}
