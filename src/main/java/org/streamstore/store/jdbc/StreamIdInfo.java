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

package org.streamstore.store.jdbc;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import static java.util.Objects.requireNonNull;

/**
 * A stream id as stored by the backend. Stream ids are opaque strings of any length, the backend indexes a fixed length
 * SHA-1 hash of them and keeps the original next to it.
 *
 * @author Tommy Wassgren
 */
final class StreamIdInfo {
    private static final char[] HEX = "0123456789abcdef".toCharArray();
    private final String hashed;
    private final String original;

    StreamIdInfo(final String original) {
        this.original = requireNonNull(original, "Stream id must not be null");
        this.hashed = sha1(original);
    }

    String hashed() {
        return hashed;
    }

    String original() {
        return original;
    }

    @Override
    public String toString() {
        return "StreamIdInfo[original=" + original + ", hashed=" + hashed + "]";
    }

    private static String sha1(final String value) {
        try {
            final byte[] digest = MessageDigest.getInstance("SHA-1").digest(value.getBytes(StandardCharsets.UTF_8));
            final char[] chars = new char[digest.length * 2];
            for (int i = 0; i < digest.length; i++) {
                chars[i * 2] = HEX[(digest[i] >> 4) & 0x0f];
                chars[i * 2 + 1] = HEX[digest[i] & 0x0f];
            }
            return new String(chars);
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 is not available", e);
        }
    }
}
