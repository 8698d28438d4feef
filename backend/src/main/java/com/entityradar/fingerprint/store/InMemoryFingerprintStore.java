package com.entityradar.fingerprint.store;

import com.entityradar.common.ChainValues;
import com.entityradar.config.FingerprintProperties;
import com.entityradar.domain.StoredFingerprint;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Caffeine-backed store. Each address maps to an immutable newest-first list of sequenced slots. The global cap is
 * enforced in insertion order, oldest entry first, so it matches the Mongo backend; Caffeine carries no size bound.
 * Writes are serialized by one lock, reads go straight to the cache.
 */
@Slf4j
public class InMemoryFingerprintStore implements FingerprintStore {

    private final Cache<String, List<Slot>> entries;
    private final int maxEntriesPerAddress;
    private final long maxTotalEntries;
    private final ReentrantLock writeLock = new ReentrantLock();
    /** Insertion sequence to address, oldest first. Guarded by writeLock. */
    private final TreeMap<Long, String> insertionOrder = new TreeMap<>();
    private long nextSeq;

    public InMemoryFingerprintStore(FingerprintProperties properties) {
        properties.validate();
        this.maxEntriesPerAddress = properties.getMaxEntriesPerAddress();
        this.maxTotalEntries = properties.getMaxTotalEntries();
        this.entries = Caffeine.newBuilder().build();
    }

    @Override
    public void append(StoredFingerprint entry) {
        String key = ChainValues.normalizeAddress(entry.address());
        writeLock.lock();
        try {
            Slot slot = new Slot(nextSeq++, entry);
            List<Slot> existing = entries.getIfPresent(key);
            List<Slot> updated = new ArrayList<>(maxEntriesPerAddress);
            updated.add(slot);
            if (existing != null) {
                for (int i = 0; i < existing.size(); i++) {
                    if (updated.size() < maxEntriesPerAddress) {
                        updated.add(existing.get(i));
                    } else {
                        insertionOrder.remove(existing.get(i).seq());
                    }
                }
            }
            entries.put(key, List.copyOf(updated));
            insertionOrder.put(slot.seq(), key);
            trimGlobal();
        } finally {
            writeLock.unlock();
        }
        log.debug("Recorded fingerprint {} for {}", entry.entityType(), key);
    }

    private void trimGlobal() {
        int trimmed = 0;
        while (insertionOrder.size() > maxTotalEntries) {
            Map.Entry<Long, String> oldest = insertionOrder.pollFirstEntry();
            String address = oldest.getValue();
            List<Slot> list = entries.getIfPresent(address);
            if (list == null) {
                continue;
            }
            List<Slot> remaining = list.stream().filter(s -> s.seq() != oldest.getKey()).toList();
            if (remaining.isEmpty()) {
                entries.invalidate(address);
            } else {
                entries.put(address, remaining);
            }
            trimmed++;
        }
        if (trimmed > 0) {
            log.debug("Trimmed {} fingerprint entries over global cap {}", trimmed, maxTotalEntries);
        }
    }

    @Override
    public List<StoredFingerprint> findByAddress(String address) {
        List<Slot> list = entries.getIfPresent(ChainValues.normalizeAddress(address));
        return list == null ? List.of() : list.stream().map(Slot::fingerprint).toList();
    }

    @Override
    public long totalEntries() {
        writeLock.lock();
        try {
            return insertionOrder.size();
        } finally {
            writeLock.unlock();
        }
    }

    private record Slot(long seq, StoredFingerprint fingerprint) {
    }
}
