package com.enterprise.jobscheduler.store;

import com.enterprise.jobscheduler.core.Job;
import com.enterprise.jobscheduler.core.JobFilter;
import com.enterprise.jobscheduler.core.JobStatus;
import com.enterprise.jobscheduler.core.JobStatusUpdate;
import com.enterprise.jobscheduler.core.JobType;
import com.enterprise.jobscheduler.exception.JobNotFoundException;
import com.enterprise.jobscheduler.exception.StoreException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.mapdb.DB;
import org.mapdb.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * MapDB-based job store.
 * Jobs are stored as JSON keyed by ID; type and status indexes are kept in memory
 * and rebuilt from storage on open.
 */
public class MapDBJobStore implements JobStore {

    private static final Logger logger = LoggerFactory.getLogger(MapDBJobStore.class);

    private static final Comparator<Job> NEWEST_FIRST = Comparator
        .comparing(Job::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
        .thenComparing(job -> job.getId().toString());

    private final DB db;
    private final ObjectMapper objectMapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    // MapDB collections
    private final Map<UUID, String> jobStorage;

    // In-memory indexes for filtered listing
    private final Map<JobStatus, Set<UUID>> statusIndex = new ConcurrentHashMap<>();
    private final Map<JobType, Set<UUID>> typeIndex = new ConcurrentHashMap<>();

    public MapDBJobStore(String dbPath, boolean mmapEnabled, Clock clock) {
        this.clock = clock;
        this.objectMapper = new ObjectMapper().findAndRegisterModules();

        this.db = MapDBFiles.open(dbPath, mmapEnabled);
        this.jobStorage = db.hashMap("jobs", Serializer.UUID, Serializer.STRING).createOrOpen();

        initializeIndexes();

        logger.info("MapDBJobStore initialized with database at: {} ({} jobs)", dbPath, jobStorage.size());
    }

    private void initializeIndexes() {
        lock.writeLock().lock();
        try {
            for (JobStatus status : JobStatus.values()) {
                statusIndex.put(status, ConcurrentHashMap.newKeySet());
            }
            for (JobType type : JobType.values()) {
                typeIndex.put(type, ConcurrentHashMap.newKeySet());
            }

            // Rebuild indexes from persistent storage
            for (UUID jobId : jobStorage.keySet()) {
                try {
                    read(jobId).ifPresent(this::index);
                } catch (StoreException e) {
                    logger.error("Skipping unreadable job {} while rebuilding indexes", jobId);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Job createJob(Job job) {
        lock.writeLock().lock();
        try {
            jobStorage.put(job.getId(), objectMapper.writeValueAsString(job));
            db.commit();
            index(job);

            logger.debug("Job {} stored with status {}", job.getId(), job.getStatus());
            return job;

        } catch (Exception e) {
            db.rollback();
            logger.error("Failed to store job {}", job.getId(), e);
            throw new StoreException("Failed to store job " + job.getId(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Job> getJob(UUID jobId) {
        lock.readLock().lock();
        try {
            return read(jobId);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Job> listJobs(JobFilter filter, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        lock.readLock().lock();
        try {
            return candidates(filter)
                .map(this::read)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .filter(filter::matches)
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    private Stream<UUID> candidates(JobFilter filter) {
        if (filter.getStatus() != null) {
            return new ArrayList<>(statusIndex.get(filter.getStatus())).stream();
        }
        if (filter.getType() != null) {
            return new ArrayList<>(typeIndex.get(filter.getType())).stream();
        }
        return new ArrayList<>(jobStorage.keySet()).stream();
    }

    @Override
    public Job updateJobStatus(UUID jobId, JobStatusUpdate update) throws JobNotFoundException {
        lock.writeLock().lock();
        try {
            Job current = read(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            Job updated = current.apply(update);
            write(updated);

            logger.debug("Job {} status updated from {} to {}, invocations {}",
                        jobId, current.getStatus(), updated.getStatus(), updated.getInvocationCount());
            return updated;

        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Job attachRule(UUID jobId, String ruleId) throws JobNotFoundException {
        lock.writeLock().lock();
        try {
            Job current = read(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            Job updated = current.withRuleId(ruleId, clock.instant());
            write(updated);

            logger.debug("Job {} attached to rule {}", jobId, ruleId);
            return updated;

        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void deleteJob(UUID jobId) throws JobNotFoundException {
        lock.writeLock().lock();
        try {
            Job existing = read(jobId).orElseThrow(() -> new JobNotFoundException(jobId));

            jobStorage.remove(jobId);
            db.commit();
            unindex(existing);

            logger.debug("Job {} removed from store", jobId);

        } catch (JobNotFoundException e) {
            throw e;
        } catch (Exception e) {
            db.rollback();
            logger.error("Failed to delete job {}", jobId, e);
            throw new StoreException("Failed to delete job " + jobId, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return jobStorage.size();
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
            logger.info("MapDBJobStore closed");
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Callers hold the write lock
    private void write(Job updated) {
        Optional<Job> previous = read(updated.getId());
        try {
            jobStorage.put(updated.getId(), objectMapper.writeValueAsString(updated));
            db.commit();
        } catch (Exception e) {
            db.rollback();
            logger.error("Failed to update job {}", updated.getId(), e);
            throw new StoreException("Failed to update job " + updated.getId(), e);
        }
        previous.ifPresent(this::unindex);
        index(updated);
    }

    private Optional<Job> read(UUID jobId) {
        String json = jobStorage.get(jobId);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Job.class));
        } catch (Exception e) {
            logger.error("Failed to read job {}", jobId, e);
            throw new StoreException("Failed to read job " + jobId, e);
        }
    }

    private void index(Job job) {
        statusIndex.get(job.getStatus()).add(job.getId());
        typeIndex.get(job.getType()).add(job.getId());
    }

    private void unindex(Job job) {
        statusIndex.get(job.getStatus()).remove(job.getId());
        typeIndex.get(job.getType()).remove(job.getId());
    }
}
