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

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static java.util.Objects.requireNonNull;

/**
 * Turns paged reads into lazy streams. The next page is only read when the elements of the current page have been consumed.
 *
 * @author Tommy Wassgren
 */
public final class PageStreams {
    private PageStreams() {
        // Utility
    }

    /**
     * Creates a stream that reads pages until a page is the last one.
     *
     * @param first    The first page (read eagerly).
     * @param next     Reads the page following the given one.
     * @param elements The elements of a page.
     * @param isLast   Whether no pages follow the given one.
     */
    public static <P, T> Stream<T> createStream(
            final P first,
            final Function<P, P> next,
            final Function<P, List<T>> elements,
            final Predicate<P> isLast) {

        requireNonNull(first, "First page must not be null");
        return createStream(new Iterator<T>() {
            private Iterator<T> current = elements.apply(first).iterator();
            private P page = first;

            @Override
            public boolean hasNext() {
                while (!current.hasNext()) {
                    if (isLast.test(page)) {
                        current = Collections.emptyIterator();
                        return false;
                    }
                    page = next.apply(page);
                    current = elements.apply(page).iterator();
                }
                return true;
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return current.next();
            }
        });
    }

    public static <T> Stream<T> createStream(final Iterator<T> iterator) {
        requireNonNull(iterator, "Iterator must not be null");
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false);
    }
}
