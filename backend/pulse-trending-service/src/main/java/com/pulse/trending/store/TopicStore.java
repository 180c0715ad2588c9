package com.pulse.trending.store;

import com.pulse.trending.model.VelocitySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Keyword → {@link TopicRecord} store shared by analysis cycles.
 *
 * <p>Single writer: every mutation runs inside {@link #write(Supplier)}, which serialises
 * whole cycles so mention appends and score recomputation for a keyword never interleave.
 * Mutating methods fail fast when called without the lock. Each engine owns its own
 * store; there is no process-wide instance.
 */
public class TopicStore {

    private static final Logger log = LoggerFactory.getLogger(TopicStore.class);

    private final Map<String, TopicRecord> records = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public <T> T write(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public TopicRecord getOrCreate(String keyword) {
        requireLock();
        return records.computeIfAbsent(keyword, TopicRecord::new);
    }

    public Optional<TopicRecord> find(String keyword) {
        requireLock();
        return Optional.ofNullable(records.get(keyword));
    }

    /**
     * Drops every mention older than {@code cutoff} from every record.
     *
     * @return number of mentions dropped
     */
    public int evictExpired(Instant cutoff) {
        requireLock();
        int evicted = 0;
        for (TopicRecord record : records.values()) {
            evicted += record.evictBefore(cutoff);
        }
        return evicted;
    }

    /**
     * Removes records without a mention at or after {@code cutoff}.
     *
     * @return keywords removed
     */
    public List<String> purgeInactive(Instant cutoff) {
        requireLock();
        List<String> purged = new ArrayList<>();
        Iterator<Map.Entry<String, TopicRecord>> it = records.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, TopicRecord> entry = it.next();
            if (!entry.getValue().hasMentionSince(cutoff)) {
                purged.add(entry.getKey());
                it.remove();
            }
        }
        return purged;
    }

    /** Lock-free; may be read while a cycle is running. */
    public int size() {
        return records.size();
    }

    public List<VelocitySnapshot> history(String keyword) {
        return write(() -> {
            TopicRecord record = records.get(keyword);
            return record == null ? List.<VelocitySnapshot>of() : record.history();
        });
    }

    /** Clears all records and their history. Safe to call more than once. */
    public void cleanup() {
        write(() -> {
            int dropped = records.size();
            records.clear();
            if (dropped > 0) {
                log.info("[cleanup] Topic store cleared, dropped {} topics", dropped);
            }
            return null;
        });
    }

    private void requireLock() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("TopicStore mutation outside write()");
        }
    }
}
