package com.enterprise.jobscheduler.ledger;

import com.enterprise.jobscheduler.core.Invocation;
import com.enterprise.jobscheduler.core.InvocationStatus;
import com.enterprise.jobscheduler.exception.StoreException;
import com.enterprise.jobscheduler.store.MapDBFiles;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.mapdb.Atomic;
import org.mapdb.DB;
import org.mapdb.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * MapDB-based invocation ledger.
 * Invocations are stored as JSON keyed by ID, with a persistent sequence counter
 * that orders records sharing a start time.
 */
public class MapDBInvocationLedger implements InvocationLedger {

    private static final Logger logger = LoggerFactory.getLogger(MapDBInvocationLedger.class);

    private static final Comparator<Invocation> OLDEST_FIRST = Comparator
        .comparing(Invocation::getStartedAt)
        .thenComparingLong(Invocation::getSequence);

    private final DB db;
    private final Map<UUID, String> invocationStorage;
    private final Atomic.Long sequence;
    private final ObjectMapper objectMapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // Secondary index: jobId -> invocation IDs
    private final Map<UUID, Set<UUID>> jobIndex = new ConcurrentHashMap<>();

    public MapDBInvocationLedger(String dbPath, boolean mmapEnabled) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());

        this.db = MapDBFiles.open(dbPath, mmapEnabled);
        this.invocationStorage = db.hashMap("invocations", Serializer.UUID, Serializer.STRING).createOrOpen();
        this.sequence = db.atomicLong("invocationSequence").createOrOpen();

        rebuildJobIndex();

        logger.info("MapDBInvocationLedger initialized with database at: {} ({} invocations)",
                   dbPath, invocationStorage.size());
    }

    private void rebuildJobIndex() {
        lock.writeLock().lock();
        try {
            for (Map.Entry<UUID, String> entry : invocationStorage.entrySet()) {
                try {
                    Invocation invocation = objectMapper.readValue(entry.getValue(), Invocation.class);
                    indexOf(invocation.getJobId()).add(invocation.getId());
                } catch (JsonProcessingException e) {
                    logger.error("Skipping unreadable invocation {} while rebuilding index", entry.getKey(), e);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Invocation recordInvocation(Invocation invocation) {
        lock.writeLock().lock();
        try {
            if (invocationStorage.containsKey(invocation.getId())) {
                throw new IllegalStateException("Invocation " + invocation.getId() + " is already recorded");
            }
            Invocation stored = invocation.withSequence(sequence.incrementAndGet());
            invocationStorage.put(stored.getId(), objectMapper.writeValueAsString(stored));
            db.commit();
            indexOf(stored.getJobId()).add(stored.getId());

            logger.debug("Recorded invocation {} for job {} as {}", stored.getId(), stored.getJobId(), stored.getStatus());
            return stored;

        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            db.rollback();
            logger.error("Failed to record invocation {}", invocation.getId(), e);
            throw new StoreException("Failed to record invocation " + invocation.getId(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void updateInvocation(Invocation invocation) {
        lock.writeLock().lock();
        try {
            Invocation current = read(invocation.getId())
                .orElseThrow(() -> new IllegalStateException("Invocation " + invocation.getId() + " is not recorded"));
            if (current.isFinalized()) {
                throw new IllegalStateException("Invocation " + invocation.getId()
                    + " is already " + current.getStatus().value());
            }

            Invocation updated = invocation.withSequence(current.getSequence());
            try {
                invocationStorage.put(updated.getId(), objectMapper.writeValueAsString(updated));
                db.commit();
            } catch (Exception e) {
                db.rollback();
                logger.error("Failed to update invocation {}", invocation.getId(), e);
                throw new StoreException("Failed to update invocation " + invocation.getId(), e);
            }

            logger.debug("Invocation {} finalized as {} after {}ms",
                        updated.getId(), updated.getStatus(), updated.getDurationMs());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Invocation> getInvocation(UUID invocationId) {
        lock.readLock().lock();
        try {
            return read(invocationId);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Invocation> queryByJob(UUID jobId, InvocationStatus statusFilter, int limit, boolean newestFirst) {
        if (limit <= 0) {
            return List.of();
        }
        lock.readLock().lock();
        try {
            Set<UUID> ids = jobIndex.get(jobId);
            if (ids == null) {
                return List.of();
            }
            Comparator<Invocation> order = newestFirst ? OLDEST_FIRST.reversed() : OLDEST_FIRST;
            return new ArrayList<>(ids).stream()
                .map(this::read)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .filter(invocation -> statusFilter == null || invocation.getStatus() == statusFilter)
                .sorted(order)
                .limit(limit)
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return invocationStorage.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (!db.isClosed()) {
                db.close();
            }
            logger.info("MapDBInvocationLedger closed");
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Optional<Invocation> read(UUID invocationId) {
        String json = invocationStorage.get(invocationId);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Invocation.class));
        } catch (JsonProcessingException e) {
            logger.error("Failed to read invocation {}", invocationId, e);
            throw new StoreException("Failed to read invocation " + invocationId, e);
        }
    }

    private Set<UUID> indexOf(UUID jobId) {
        return jobIndex.computeIfAbsent(jobId, id -> ConcurrentHashMap.newKeySet());
    }
}
