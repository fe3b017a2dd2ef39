/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

import com.intuitivedesigns.logship.config.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only table of output instances, indexed by identifier.
 *
 * <p>Invariant: an instance's identifier is its position, and positions never
 * change. Creation takes the write lock so it is serialized against itself and
 * against every lookup; lookups share the read lock.</p>
 */
public final class InstanceRegistry {

    private final List<OutputInstance> instances = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Builds an instance for a pre-assigned identifier.
     */
    @FunctionalInterface
    public interface InstanceFactory {
        OutputInstance create(int id) throws ConfigurationException;
    }

    /**
     * Assigns the next identifier, builds the instance and appends it.
     * If the factory fails nothing is appended and the identifier is reused by the next call.
     *
     * @return the new instance's identifier
     * @throws ConfigurationException if the factory rejects the configuration
     */
    public int create(InstanceFactory factory) throws ConfigurationException {
        Objects.requireNonNull(factory, "factory");
        lock.writeLock().lock();
        try {
            final int id = instances.size();
            final OutputInstance instance = factory.create(id);
            if (instance == null || instance.id() != id) {
                throw new IllegalStateException("factory must return an instance with id " + id);
            }
            instances.add(instance);
            return id;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @throws IndexOutOfBoundsException if {@code id} was never issued
     */
    public OutputInstance get(int id) {
        lock.readLock().lock();
        try {
            Objects.checkIndex(id, instances.size());
            return instances.get(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return instances.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<OutputInstance> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(instances);
        } finally {
            lock.readLock().unlock();
        }
    }
}
