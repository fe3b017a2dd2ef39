/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.logship.spi;

/**
 * Anything {@link ServicePluginRegistry} can look up by id.
 */
public interface ServicePlugin {

    /**
     * Lookup key, matched ignoring case and surrounding blanks (e.g. {@code KINESIS}, {@code LOG}).
     */
    String id();
}
