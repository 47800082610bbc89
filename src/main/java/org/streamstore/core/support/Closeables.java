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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

import static java.util.Objects.requireNonNull;

/**
 * Closing of resources that may fail while closing.
 *
 * @author Tommy Wassgren
 */
public final class Closeables {
    private static final Logger logger = LoggerFactory.getLogger(Closeables.class);

    private Closeables() {
        // Utility
    }

    /**
     * Closes all the provided resources, failures are logged and do not prevent the remaining resources from being closed.
     */
    public static void closeSilently(final AutoCloseable... closeables) {
        requireNonNull(closeables, "Closeables must not be null");
        Arrays.stream(closeables).forEach(Closeables::closeSilentlyAndLog);
    }

    private static void closeSilentlyAndLog(final AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (final Exception e) {
            logger.error("Unable to close resource [resource={}]", closeable, e);
        }
    }
}
