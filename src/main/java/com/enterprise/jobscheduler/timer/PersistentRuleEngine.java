package com.enterprise.jobscheduler.timer;

import com.enterprise.jobscheduler.exception.JobValidationException;
import com.enterprise.jobscheduler.exception.SchedulingException;
import com.enterprise.jobscheduler.exception.StoreException;
import com.enterprise.jobscheduler.store.MapDBFiles;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.mapdb.DB;
import org.mapdb.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * MapDB-backed rule engine. Rules survive restarts; the wake loop polls for due rules
 * at a fixed delay and hands their signals to the registered {@link FireListener}.
 *
 * <p>Consumption of a one-shot rule is committed before its signal is delivered, so a
 * single registration never fires twice from this engine. A crash between the commit
 * and the delivery loses that fire; a crash before the commit replays it on restart.
 */
public class PersistentRuleEngine implements RuleEngine {

    private static final Logger logger = LoggerFactory.getLogger(PersistentRuleEngine.class);

    private final DB db;
    private final Map<String, String> ruleStorage;
    private final ObjectMapper objectMapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private final Duration tickInterval;

    // In-memory view of the stored rules
    private final Map<String, Rule> rules = new ConcurrentHashMap<>();
    private final Map<String, ScheduleExpression> expressions = new ConcurrentHashMap<>();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile FireListener fireListener;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> wakeLoop;

    public PersistentRuleEngine(String dbPath, boolean mmapEnabled, Clock clock, Duration tickInterval) {
        this.clock = clock;
        this.tickInterval = tickInterval;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());

        this.db = MapDBFiles.open(dbPath, mmapEnabled);
        this.ruleStorage = db.hashMap("rules", Serializer.STRING, Serializer.STRING).createOrOpen();

        loadRules();

        logger.info("PersistentRuleEngine initialized with database at: {} ({} rules)", dbPath, rules.size());
    }

    private void loadRules() {
        lock.writeLock().lock();
        try {
            for (Map.Entry<String, String> entry : ruleStorage.entrySet()) {
                try {
                    Rule rule = objectMapper.readValue(entry.getValue(), Rule.class);
                    rules.put(rule.getId(), rule);
                } catch (Exception e) {
                    logger.error("Skipping unreadable rule {}", entry.getKey(), e);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String registerOneShot(UUID jobId, Instant at, Map<String, Object> input) throws SchedulingException {
        Instant now = clock.instant();
        if (at == null || !at.isAfter(now)) {
            throw new SchedulingException("One-shot rule for job " + jobId + " must fire in the future, got " + at);
        }

        Rule rule = Rule.oneShot(jobId, at, input, now);
        store(rule);
        logger.info("Registered one-shot rule {} for job {} at {}", rule.getId(), jobId, at);
        return rule.getId();
    }

    @Override
    public String registerRecurring(UUID jobId, String expression, Map<String, Object> input)
            throws JobValidationException, SchedulingException {
        ScheduleExpression schedule = ScheduleExpression.parse(expression);
        Instant now = clock.instant();
        Instant first = schedule.nextFireAfter(now, now);
        if (first == null) {
            throw new JobValidationException("scheduleExpression",
                "Schedule expression never fires: " + expression);
        }

        Rule rule = Rule.recurring(jobId, schedule.getExpression(), input, first, now);
        expressions.put(rule.getExpression(), schedule);
        store(rule);
        logger.info("Registered recurring rule {} for job {} with expression '{}', first fire at {}",
                   rule.getId(), jobId, expression, first);
        return rule.getId();
    }

    private void store(Rule rule) throws SchedulingException {
        lock.writeLock().lock();
        try {
            ruleStorage.put(rule.getId(), objectMapper.writeValueAsString(rule));
            db.commit();
            Rule previous = rules.put(rule.getId(), rule);
            if (previous != null) {
                logger.warn("Rule {} replaced an existing registration", rule.getId());
            }
        } catch (Exception e) {
            db.rollback();
            logger.error("Failed to store rule {}", rule.getId(), e);
            throw new SchedulingException("Failed to store rule " + rule.getId(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void unregister(String ruleId) throws SchedulingException {
        if (ruleId == null) {
            return;
        }
        lock.writeLock().lock();
        try {
            if (ruleStorage.remove(ruleId) == null) {
                logger.debug("Rule {} not found, nothing to unregister", ruleId);
                return;
            }
            db.commit();
            rules.remove(ruleId);
            logger.info("Unregistered rule {}", ruleId);
        } catch (Exception e) {
            db.rollback();
            logger.error("Failed to unregister rule {}", ruleId, e);
            throw new SchedulingException("Failed to unregister rule " + ruleId, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Rule> getRule(String ruleId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(rules.get(ruleId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Rule> listRules() {
        lock.readLock().lock();
        try {
            return rules.values().stream()
                .sorted(Comparator.comparing(Rule::getId))
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<FireSignal> fireDueRules() {
        List<FireSignal> signals = new ArrayList<>();
        Map<String, Rule> advanced = new java.util.HashMap<>();
        List<String> consumed = new ArrayList<>();

        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            List<Rule> due = rules.values().stream()
                .filter(rule -> rule.isDue(now))
                .sorted(Comparator.comparing(Rule::getNextFireAt))
                .collect(Collectors.toList());

            if (due.isEmpty()) {
                return signals;
            }

            for (Rule rule : due) {
                signals.add(FireSignal.of(rule, now));
                if (rule.getKind() == RuleKind.ONE_SHOT) {
                    ruleStorage.remove(rule.getId());
                    consumed.add(rule.getId());
                } else {
                    Instant next = expressionOf(rule).nextFireAfter(now, rule.getCreatedAt());
                    if (next == null) {
                        // A stored rule whose expression can never match again
                        logger.error("Rule {} can never fire again, removing it", rule.getId());
                        ruleStorage.remove(rule.getId());
                        consumed.add(rule.getId());
                        continue;
                    }
                    Rule updated = rule.withNextFireAt(next);
                    ruleStorage.put(rule.getId(), objectMapper.writeValueAsString(updated));
                    advanced.put(rule.getId(), updated);
                }
            }

            db.commit();
            consumed.forEach(rules::remove);
            rules.putAll(advanced);

        } catch (Exception e) {
            db.rollback();
            logger.error("Failed to advance due rules", e);
            throw new StoreException("Failed to advance due rules", e);
        } finally {
            lock.writeLock().unlock();
        }

        deliver(signals);
        return signals;
    }

    private void deliver(List<FireSignal> signals) {
        FireListener listener = fireListener;
        for (FireSignal signal : signals) {
            logger.debug("Rule {} fired for job {}", signal.getRuleId(), signal.getJobId());
            if (listener == null) {
                logger.warn("No fire listener registered, dropping fire of rule {}", signal.getRuleId());
                continue;
            }
            try {
                listener.onFire(signal);
            } catch (Exception e) {
                logger.error("Fire listener failed for rule {}", signal.getRuleId(), e);
            }
        }
    }

    private ScheduleExpression expressionOf(Rule rule) throws JobValidationException {
        ScheduleExpression cached = expressions.get(rule.getExpression());
        if (cached != null) {
            return cached;
        }
        ScheduleExpression parsed = ScheduleExpression.parse(rule.getExpression());
        expressions.put(rule.getExpression(), parsed);
        return parsed;
    }

    @Override
    public void setFireListener(FireListener listener) {
        this.fireListener = listener;
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "rule-engine-wake-loop");
                t.setDaemon(true);
                return t;
            });
            wakeLoop = scheduler.scheduleWithFixedDelay(
                this::tick, 0, tickInterval.toMillis(), TimeUnit.MILLISECONDS);
            logger.info("PersistentRuleEngine started, tick interval {}ms", tickInterval.toMillis());
        }
    }

    private void tick() {
        try {
            fireDueRules();
        } catch (Exception e) {
            logger.error("Error processing due rules", e);
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            if (wakeLoop != null) {
                wakeLoop.cancel(false);
            }
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            logger.info("PersistentRuleEngine stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        stop();
        lock.writeLock().lock();
        try {
            if (!db.isClosed()) {
                db.close();
            }
            logger.info("PersistentRuleEngine closed");
        } finally {
            lock.writeLock().unlock();
        }
    }
}
