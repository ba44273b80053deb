package com.shopadmin.backend.modules.audit.application;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * Buffers decision entries in a bounded in-memory queue drained by a single writer thread.
 * <p>
 * {@link #record} waits at most {@code offer-timeout} for space. An entry that does not fit is
 * rejected and counted in {@code authz.audit.rejected}; the check that produced it is not
 * affected. Once accepted, an entry is delivered at least once: while the sink runs, a failed
 * batch is retried with linear backoff capped at {@code max-backoff} until the store recovers.
 * A batch rejected by a constraint is split and written entry by entry so that one bad row only
 * costs itself. After {@link #stop()} the remaining entries get {@code max-attempts} tries each and
 * are then dropped with an alert.
 */
@Component
@ConditionalOnProperty(name = "app.authorization.audit.mode", havingValue = "async", matchIfMissing = true)
public class QueuedDecisionAuditSink implements DecisionAuditSink {

    private static final Logger log = LoggerFactory.getLogger(QueuedDecisionAuditSink.class);
    private static final long POLL_TIMEOUT_MILLIS = 100;

    private final DecisionAuditWriter writer;
    private final BlockingQueue<DecisionAuditEntry> queue;
    private final int batchSize;
    private final Duration offerTimeout;
    private final int maxAttempts;
    private final Duration retryBackoff;
    private final Duration maxBackoff;
    private final Duration shutdownTimeout;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final Counter rejected;
    private final Counter written;
    private final Counter writeFailures;
    private final Counter dropped;

    private Thread worker;

    public QueuedDecisionAuditSink(
            DecisionAuditWriter writer,
            MeterRegistry meterRegistry,
            @Value("${app.authorization.audit.queue-capacity:10000}") int capacity,
            @Value("${app.authorization.audit.batch-size:200}") int batchSize,
            @Value("${app.authorization.audit.offer-timeout:PT0.05S}") Duration offerTimeout,
            @Value("${app.authorization.audit.max-attempts:5}") int maxAttempts,
            @Value("${app.authorization.audit.retry-backoff:PT0.2S}") Duration retryBackoff,
            @Value("${app.authorization.audit.max-backoff:PT5S}") Duration maxBackoff,
            @Value("${app.authorization.audit.shutdown-timeout:PT10S}") Duration shutdownTimeout
    ) {
        if (capacity < 1 || batchSize < 1 || maxAttempts < 1) {
            throw new IllegalArgumentException("queue-capacity, batch-size and max-attempts must be positive");
        }
        this.writer = writer;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.batchSize = batchSize;
        this.offerTimeout = offerTimeout;
        this.maxAttempts = maxAttempts;
        this.retryBackoff = retryBackoff;
        this.maxBackoff = maxBackoff;
        this.shutdownTimeout = shutdownTimeout;

        Gauge.builder("authz.audit.queue.size", queue, BlockingQueue::size)
                .description("Decision audit entries waiting to be written")
                .register(meterRegistry);
        this.rejected = Counter.builder("authz.audit.rejected")
                .description("Decision audit entries rejected because the queue was full")
                .register(meterRegistry);
        this.written = Counter.builder("authz.audit.written")
                .description("Decision audit entries persisted")
                .register(meterRegistry);
        this.writeFailures = Counter.builder("authz.audit.write_failures")
                .description("Failed attempts to persist decision audit entries")
                .register(meterRegistry);
        this.dropped = Counter.builder("authz.audit.dropped")
                .description("Decision audit entries discarded after shutdown retries or a constraint violation")
                .register(meterRegistry);
    }

    @PostConstruct
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        worker = new Thread(this::drainLoop, "decision-audit-writer");
        worker.setDaemon(true);
        worker.start();
        log.info("Decision audit queue started capacity={} batchSize={}", queue.remainingCapacity(), batchSize);
    }

    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            flush();
            return;
        }
        Thread current = worker;
        if (current != null) {
            try {
                current.join(shutdownTimeout.toMillis());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for decision audit writer to stop");
            }
        }
        flush();
        log.info("Decision audit queue stopped");
    }

    @Override
    public void record(DecisionAuditEntry entry) {
        boolean accepted;
        try {
            accepted = queue.offer(entry, offerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            accepted = false;
        }
        if (!accepted) {
            rejected.increment();
            log.error("[ALERT][Audit] decision audit queue full, entry rejected actor={} capability={}.{} allowed={}",
                    entry.actorId(), entry.resourceType().code(), entry.actionType().code(), entry.allowed());
        }
    }

    /**
     * Writes everything currently queued on the calling thread.
     */
    public void flush() {
        List<DecisionAuditEntry> batch = new ArrayList<>(batchSize);
        while (queue.drainTo(batch, batchSize) > 0) {
            writeWithRetry(batch);
            batch.clear();
        }
    }

    public int size() {
        return queue.size();
    }

    private void drainLoop() {
        List<DecisionAuditEntry> batch = new ArrayList<>(batchSize);
        while (running.get()) {
            try {
                DecisionAuditEntry first = queue.poll(POLL_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, batchSize - 1);
                writeWithRetry(batch);
                batch.clear();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.info("Decision audit writer interrupted");
                break;
            }
        }
    }

    private void writeWithRetry(List<DecisionAuditEntry> batch) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                writer.write(batch);
                written.increment(batch.size());
                return;
            } catch (DataIntegrityViolationException ex) {
                writeFailures.increment();
                rejectedByConstraint(batch, ex);
                return;
            } catch (RuntimeException ex) {
                writeFailures.increment();
                log.warn("Decision audit batch write failed attempt={} size={}", attempt, batch.size(), ex);
                boolean keepRetrying = running.get() || attempt < maxAttempts;
                if (!keepRetrying || !sleepBeforeRetry(attempt)) {
                    break;
                }
            }
        }
        dropped.increment(batch.size());
        log.error("[ALERT][Audit] dropped {} decision audit entries after {} attempts", batch.size(), attempt);
    }

    private void rejectedByConstraint(List<DecisionAuditEntry> batch, DataIntegrityViolationException ex) {
        if (batch.size() > 1) {
            log.warn("Decision audit batch of {} violated a constraint, writing entries one by one", batch.size());
            for (DecisionAuditEntry entry : batch) {
                writeWithRetry(List.of(entry));
            }
            return;
        }
        DecisionAuditEntry entry = batch.get(0);
        dropped.increment();
        log.error("[ALERT][Audit] dropped decision audit entry rejected by a constraint actor={} capability={}.{}",
                entry.actorId(), entry.resourceType().code(), entry.actionType().code(), ex);
    }

    private boolean sleepBeforeRetry(int attempt) {
        long delay = Math.min(retryBackoff.toMillis() * attempt, maxBackoff.toMillis());
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
