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

/**
 * The outcome of a successful append: the version of the stream and the checkpoint of its last event after the append.
 *
 * @author Tommy Wassgren
 */
public final class AppendResult {
    private final long currentCheckpoint;
    private final int currentVersion;

    public AppendResult(final int currentVersion, final long currentCheckpoint) {
        this.currentVersion = currentVersion;
        this.currentCheckpoint = currentCheckpoint;
    }

    public long currentCheckpoint() {
        return currentCheckpoint;
    }

    public int currentVersion() {
        return currentVersion;
    }

    @Override
    public boolean equals(final Object otherObject) {
        if (otherObject instanceof AppendResult) {
            final AppendResult other = (AppendResult) otherObject;
            return currentVersion == other.currentVersion && currentCheckpoint == other.currentCheckpoint;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(currentVersion, currentCheckpoint);
    }

    @Override
    public String toString() {
        return "AppendResult[currentVersion=" + currentVersion + ", currentCheckpoint=" + currentCheckpoint + "]";
    }
}
