package com.entityradar.fingerprint.store;

import com.entityradar.common.ChainValues;
import com.entityradar.config.FingerprintProperties;
import com.entityradar.domain.StoredFingerprint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed store for entity_fingerprints. Writes for one address are serialized by a striped lock;
 * older entries beyond the per-address limit and the oldest entries beyond the global cap are deleted after
 * each append.
 */
@Slf4j
public class MongoFingerprintStore implements FingerprintStore {

    private static final int LOCK_STRIPES = 64;

    private final MongoTemplate mongoTemplate;
    private final int maxEntriesPerAddress;
    private final long maxTotalEntries;
    private final ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];
    private final ReentrantLock globalTrimLock = new ReentrantLock();

    public MongoFingerprintStore(MongoTemplate mongoTemplate, FingerprintProperties properties) {
        properties.validate();
        this.mongoTemplate = mongoTemplate;
        this.maxEntriesPerAddress = properties.getMaxEntriesPerAddress();
        this.maxTotalEntries = properties.getMaxTotalEntries();
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    @Override
    public void append(StoredFingerprint entry) {
        String address = ChainValues.normalizeAddress(entry.address());
        ReentrantLock lock = stripes[Math.floorMod(address.hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            mongoTemplate.insert(FingerprintDocument.from(address, entry));
            trimAddress(address);
        } finally {
            lock.unlock();
        }
        trimGlobal();
    }

    private void trimAddress(String address) {
        Query older = new Query(where("address").is(address))
                .with(Sort.by(Sort.Direction.DESC, "recordedAt", "_id"))
                .skip(maxEntriesPerAddress);
        older.fields().include("_id");
        List<FingerprintDocument> stale = mongoTemplate.find(older, FingerprintDocument.class);
        if (!stale.isEmpty()) {
            deleteByIds(stale);
        }
    }

    private void trimGlobal() {
        globalTrimLock.lock();
        try {
            long total = mongoTemplate.estimatedCount(FingerprintDocument.class);
            long excess = total - maxTotalEntries;
            if (excess <= 0) {
                return;
            }
            Query oldest = new Query()
                    .with(Sort.by(Sort.Direction.ASC, "recordedAt", "_id"))
                    .limit((int) Math.min(excess, Integer.MAX_VALUE));
            oldest.fields().include("_id");
            deleteByIds(mongoTemplate.find(oldest, FingerprintDocument.class));
            log.debug("Trimmed {} fingerprint entries over global cap {}", excess, maxTotalEntries);
        } finally {
            globalTrimLock.unlock();
        }
    }

    private void deleteByIds(List<FingerprintDocument> docs) {
        List<String> ids = docs.stream().map(FingerprintDocument::getId).toList();
        mongoTemplate.remove(new Query(where("_id").in(ids)), FingerprintDocument.class);
    }

    @Override
    public List<StoredFingerprint> findByAddress(String address) {
        Query query = new Query(where("address").is(ChainValues.normalizeAddress(address)))
                .with(Sort.by(Sort.Direction.DESC, "recordedAt", "_id"))
                .limit(maxEntriesPerAddress);
        return mongoTemplate.find(query, FingerprintDocument.class).stream()
                .map(FingerprintDocument::toStored)
                .toList();
    }

    @Override
    public long totalEntries() {
        return mongoTemplate.count(new Query(), FingerprintDocument.class);
    }
}
