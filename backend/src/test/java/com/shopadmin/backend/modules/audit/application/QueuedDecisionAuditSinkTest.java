package com.shopadmin.backend.modules.audit.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import com.shopadmin.backend.global.web.ClientRequestContext;
import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.PermissionDecision;
import com.shopadmin.backend.modules.permission.domain.ResourceType;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

class QueuedDecisionAuditSinkTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private QueuedDecisionAuditSink sink;

    @AfterEach
    void tearDown() {
        if (sink != null) {
            sink.stop();
        }
    }

    private QueuedDecisionAuditSink newSink(DecisionAuditWriter writer, int capacity, int maxAttempts) {
        return new QueuedDecisionAuditSink(writer, meterRegistry, capacity, 10, Duration.ZERO, maxAttempts,
                Duration.ZERO, Duration.ZERO, Duration.ofSeconds(1));
    }

    private static DecisionAuditEntry entry() {
        return entry(UUID.randomUUID());
    }

    private static DecisionAuditEntry entry(UUID actorId) {
        return DecisionAuditEntry.of(actorId, ResourceType.ORDER, ActionType.READ, null,
                PermissionDecision.noGrant(), ClientRequestContext.empty(), OffsetDateTime.now(ZoneOffset.UTC));
    }

    private void awaitWritten(double expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (count("authz.audit.written") < expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
    }

    private double count(String name) {
        return meterRegistry.get(name).counter().count();
    }

    @Test
    @DisplayName("queued entries are written in one batch on flush")
    void flushWritesQueuedEntries() {
        List<List<DecisionAuditEntry>> batches = new ArrayList<>();
        DecisionAuditWriter writer = mock(DecisionAuditWriter.class);
        doAnswer(inv -> {
            batches.add(List.copyOf(inv.getArgument(0)));
            return null;
        }).when(writer).write(anyList());
        sink = newSink(writer, 100, 3);

        sink.record(entry());
        sink.record(entry());
        sink.record(entry());
        assertThat(sink.size()).isEqualTo(3);

        sink.flush();

        assertThat(sink.size()).isZero();
        assertThat(batches).hasSize(1);
        assertThat(batches.get(0)).hasSize(3);
        assertThat(count("authz.audit.written")).isEqualTo(3.0);
        assertThat(meterRegistry.get("authz.audit.queue.size").gauge().value()).isZero();
    }

    @Test
    @DisplayName("a full queue rejects the entry and counts it instead of blocking")
    void fullQueueRejectsAndCounts() {
        DecisionAuditWriter writer = mock(DecisionAuditWriter.class);
        sink = newSink(writer, 2, 3);

        sink.record(entry());
        sink.record(entry());
        sink.record(entry());

        assertThat(sink.size()).isEqualTo(2);
        assertThat(count("authz.audit.rejected")).isEqualTo(1.0);
        verifyNoInteractions(writer);
    }

    @Test
    @DisplayName("a stopped sink retries max-attempts times and then drops the batch")
    void stoppedSinkDropsAfterLastAttempt() {
        DecisionAuditWriter writer = mock(DecisionAuditWriter.class);
        doThrow(new DataAccessResourceFailureException("audit store down")).when(writer).write(anyList());
        sink = newSink(writer, 10, 3);

        sink.record(entry());
        sink.record(entry());
        sink.flush();

        verify(writer, times(3)).write(anyList());
        assertThat(count("authz.audit.write_failures")).isEqualTo(3.0);
        assertThat(count("authz.audit.dropped")).isEqualTo(2.0);
        assertThat(count("authz.audit.written")).isZero();
    }

    @Test
    @DisplayName("a transient failure is absorbed by the retry")
    void transientFailureIsRetried() {
        DecisionAuditWriter writer = mock(DecisionAuditWriter.class);
        doThrow(new DataAccessResourceFailureException("blip"))
                .doNothing()
                .when(writer).write(anyList());
        sink = newSink(writer, 10, 3);

        sink.record(entry());
        sink.flush();

        verify(writer, times(2)).write(anyList());
        assertThat(count("authz.audit.written")).isEqualTo(1.0);
        assertThat(count("authz.audit.dropped")).isZero();
    }

    @Test
    @DisplayName("the background writer drains the queue once started")
    void backgroundWriterDrainsQueue() throws InterruptedException {
        DecisionAuditWriter writer = mock(DecisionAuditWriter.class);
        sink = newSink(writer, 100, 3);
        sink.start();

        sink.record(entry());
        sink.record(entry());

        awaitWritten(2.0);
        assertThat(count("authz.audit.written")).isEqualTo(2.0);
        assertThat(sink.size()).isZero();
    }

    @Test
    @DisplayName("entries still queued at shutdown are flushed")
    void stopFlushesRemainingEntries() {
        DecisionAuditWriter writer = mock(DecisionAuditWriter.class);
        sink = newSink(writer, 100, 3);

        sink.record(entry());
        sink.stop();

        verify(writer).write(anyList());
        assertThat(sink.size()).isZero();
    }

    @Test
    @DisplayName("a running sink keeps retrying past max-attempts until the store recovers")
    void runningSinkRetriesUntilStoreRecovers() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        DecisionAuditWriter writer = mock(DecisionAuditWriter.class);
        doAnswer(inv -> {
            if (calls.incrementAndGet() <= 6) {
                throw new DataAccessResourceFailureException("audit store down");
            }
            return null;
        }).when(writer).write(anyList());
        sink = newSink(writer, 10, 3);
        sink.start();

        sink.record(entry());
        awaitWritten(1.0);

        assertThat(count("authz.audit.written")).isEqualTo(1.0);
        assertThat(count("authz.audit.write_failures")).isEqualTo(6.0);
        assertThat(count("authz.audit.dropped")).isZero();
        assertThat(calls.get()).isEqualTo(7);
    }

    @Test
    @DisplayName("a constraint violation in a batch only drops the offending entry")
    void constraintViolationIsolatesOffendingEntry() {
        UUID offendingActor = UUID.randomUUID();
        List<DecisionAuditEntry> persisted = new ArrayList<>();
        DecisionAuditWriter writer = mock(DecisionAuditWriter.class);
        doAnswer(inv -> {
            List<DecisionAuditEntry> batch = inv.getArgument(0);
            if (batch.stream().anyMatch(e -> e.actorId().equals(offendingActor))) {
                throw new DataIntegrityViolationException("value too long for type character varying(64)");
            }
            persisted.addAll(batch);
            return null;
        }).when(writer).write(anyList());
        sink = newSink(writer, 100, 3);

        for (int i = 0; i < 9; i++) {
            sink.record(entry());
        }
        sink.record(entry(offendingActor));
        sink.flush();

        assertThat(persisted).hasSize(9).noneMatch(e -> e.actorId().equals(offendingActor));
        assertThat(count("authz.audit.written")).isEqualTo(9.0);
        assertThat(count("authz.audit.dropped")).isEqualTo(1.0);
    }
}
