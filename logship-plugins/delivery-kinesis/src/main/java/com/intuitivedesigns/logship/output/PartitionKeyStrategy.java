/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.output;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Chooses the Kinesis partition key of a record.
 */
@FunctionalInterface
public interface PartitionKeyStrategy {

    /** Kinesis rejects longer keys. */
    int MAX_KEY_LENGTH = 256;

    int RANDOM_KEY_LENGTH = 8;

    /** Separates the levels of a nested field path, e.g. {@code kubernetes->pod_name}. */
    String PATH_SEPARATOR = "->";

    String partitionKey(Map<String, Object> record);

    // --- FACTORY METHODS ---

    /**
     * A fresh random alphanumeric key per record, spreading load evenly across shards.
     */
    static PartitionKeyStrategy random() {
        return record -> randomKey();
    }

    /**
     * The value found at {@code path} in the record, so related records share a shard.
     * Falls back to a random key when the field is absent or not a scalar.
     */
    static PartitionKeyStrategy fromField(String path) {
        Objects.requireNonNull(path, "path");
        final String[] levels = path.split(PATH_SEPARATOR, -1);
        return record -> {
            final String value = lookup(record, levels);
            if (value == null || value.isEmpty()) {
                return randomKey();
            }
            return value.length() > MAX_KEY_LENGTH ? value.substring(0, MAX_KEY_LENGTH) : value;
        };
    }

    private static String lookup(Map<String, Object> record, String[] levels) {
        Object current = record;
        for (String level : levels) {
            if (!(current instanceof Map<?, ?> m)) {
                return null;
            }
            current = m.get(level);
        }
        if (current instanceof String s) {
            return s;
        }
        if (current instanceof Number || current instanceof Boolean) {
            return current.toString();
        }
        if (current instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return null;
    }

    private static String randomKey() {
        final String alphabet = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
        final ThreadLocalRandom rnd = ThreadLocalRandom.current();
        final char[] key = new char[RANDOM_KEY_LENGTH];
        for (int i = 0; i < key.length; i++) {
            key[i] = alphabet.charAt(rnd.nextInt(alphabet.length()));
        }
        return new String(key);
    }
}
