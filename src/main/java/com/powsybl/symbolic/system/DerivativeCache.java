/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.system;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.WeakReference;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import static com.powsybl.symbolic.util.Markers.CACHE_MARKER;

/**
 * Write-once storage of derived artifacts, owned by the caller and keyed by system identity. A system
 * which is no more referenced elsewhere has its entry evicted.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class DerivativeCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(DerivativeCache.class);

    static final class Entry {

        private final WeakReference<OdeSystem> systemRef;

        private final ConcurrentMap<ArtifactType, Object> artifacts = new ConcurrentHashMap<>();

        private Entry(OdeSystem system) {
            this.systemRef = new WeakReference<>(system);
        }

        WeakReference<OdeSystem> getSystemRef() {
            return systemRef;
        }
    }

    private final List<Entry> entries = new ArrayList<>();

    private final Lock lock = new ReentrantLock();

    private void evictDeadEntries() {
        Iterator<Entry> it = entries.iterator();
        while (it.hasNext()) {
            Entry entry = it.next();
            if (entry.getSystemRef().get() == null) {
                it.remove();
                LOGGER.debug(CACHE_MARKER, "Dead system removed from cache ({} remains)", entries.size());
            }
        }
    }

    private Entry getEntry(OdeSystem system) {
        lock.lock();
        try {
            evictDeadEntries();
            for (Entry entry : entries) {
                if (entry.getSystemRef().get() == system) {
                    return entry;
                }
            }
            Entry entry = new Entry(system);
            entries.add(entry);
            LOGGER.debug(CACHE_MARKER, "Cache entry created for system '{}'", system.getName());
            return entry;
        } finally {
            lock.unlock();
        }
    }

    public int getEntryCount() {
        lock.lock();
        try {
            evictDeadEntries();
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> find(OdeSystem system, ArtifactType type) {
        Objects.requireNonNull(system);
        Objects.requireNonNull(type);
        lock.lock();
        try {
            for (Entry entry : entries) {
                if (entry.getSystemRef().get() == system) {
                    return Optional.ofNullable((T) entry.artifacts.get(type));
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Get an artifact of a system, computing it if absent. The artifact is published at most once: if two
     * threads compute it concurrently, both get the first published value. The supplier may itself
     * request other artifacts of the same system.
     */
    @SuppressWarnings("unchecked")
    public <T> T computeIfAbsent(OdeSystem system, ArtifactType type, Supplier<T> supplier) {
        Objects.requireNonNull(system);
        Objects.requireNonNull(type);
        Objects.requireNonNull(supplier);
        Entry entry = getEntry(system);
        Object artifact = entry.artifacts.get(type);
        if (artifact != null) {
            LOGGER.trace(CACHE_MARKER, "{} of system '{}' found in cache", type, system.getName());
            return (T) artifact;
        }
        LOGGER.debug(CACHE_MARKER, "{} of system '{}' not in cache, computing it", type, system.getName());
        T computed = Objects.requireNonNull(supplier.get());
        Object previous = entry.artifacts.putIfAbsent(type, computed);
        return previous != null ? (T) previous : computed;
    }
}
