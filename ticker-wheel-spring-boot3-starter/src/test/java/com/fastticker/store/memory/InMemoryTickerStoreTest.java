package com.fastticker.store.memory;

import com.fastticker.model.ExecutionRecord;
import com.fastticker.model.entity.BaseTickerEntity;
import com.fastticker.model.entity.CronTickerEntity;
import com.fastticker.model.entity.CronTickerOccurrenceEntity;
import com.fastticker.model.entity.TimeTickerEntity;
import com.fastticker.model.enums.RunCondition;
import com.fastticker.model.enums.TickerStatus;
import com.fastticker.model.enums.TickerType;
import com.fastticker.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class InMemoryTickerStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private MutableClock clock;
    private InMemoryTickerStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new InMemoryTickerStore(clock);
    }

    @Test
    @DisplayName("Should let exactly one of many concurrent claimers win")
    void testConcurrentClaim() throws Exception {
        // Given
        store.addTimeTickers(List.of(ticker("t-1", NOW)));
        int racers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(racers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        // When
        for (int i = 0; i < racers; i++) {
            String node = "node-" + i;
            results.add(pool.submit(() -> {
                start.await();
                return store.tryClaim(TickerType.TIME, "t-1", node, NOW);
            }));
        }
        start.countDown();
        int winners = 0;
        for (Future<Boolean> f : results) {
            if (f.get(5, TimeUnit.SECONDS)) {
                winners++;
            }
        }
        pool.shutdown();

        // Then
        assertThat(winners).isEqualTo(1);
        TimeTickerEntity row = store.getTimeTicker("t-1");
        assertThat(row.getStatus()).isEqualTo(TickerStatus.IN_PROGRESS);
        assertThat(row.getLockedBy()).startsWith("node-");
    }

    @Test
    @DisplayName("Should only return rows that are due and not waiting for a parent")
    void testFindDue() {
        TimeTickerEntity root = ticker("root", NOW);
        TimeTickerEntity future = ticker("future", NOW.plusSeconds(60));
        TimeTickerEntity child = ticker("child", NOW);
        child.setParentId("root");
        child.setRunCondition(RunCondition.ON_SUCCESS);
        store.addTimeTickers(List.of(root, future, child));

        List<BaseTickerEntity> due = store.findDue(TickerType.TIME, NOW, 10);

        assertThat(due).extracting(BaseTickerEntity::getId).containsExactly("root");
    }

    @Test
    @DisplayName("Should only let the owner release or finish a claimed row")
    void testOwnership() {
        store.addTimeTickers(List.of(ticker("t-1", NOW)));
        assertThat(store.tryClaim(TickerType.TIME, "t-1", "node-a", NOW)).isTrue();

        assertThat(store.release(TickerType.TIME, "t-1", "node-b")).isFalse();
        assertThat(store.setTerminal(TickerType.TIME, "t-1", "node-b", TickerStatus.DONE, ExecutionRecord.empty()))
                .isFalse();
        assertThat(store.setTerminal(TickerType.TIME, "t-1", "node-a", TickerStatus.DONE,
                ExecutionRecord.builder().executedAt(NOW).elapsedMillis(5L).build())).isTrue();

        TimeTickerEntity row = store.getTimeTicker("t-1");
        assertThat(row.getStatus()).isEqualTo(TickerStatus.DONE);
        assertThat(row.getLockedBy()).isNull();
        assertThat(row.getElapsedMillis()).isEqualTo(5L);
        // 终态不可再抢占
        assertThat(store.tryClaim(TickerType.TIME, "t-1", "node-a", NOW)).isFalse();
    }

    @Test
    @DisplayName("Should return rows held by a node to the queue")
    void testReleaseAllLockedBy() {
        store.addTimeTickers(List.of(ticker("a", NOW), ticker("b", NOW), ticker("c", NOW)));
        store.tryClaim(TickerType.TIME, "a", "dead", NOW);
        store.tryClaim(TickerType.TIME, "b", "dead", NOW);
        store.tryClaim(TickerType.TIME, "c", "alive", NOW);

        int released = store.releaseAllLockedBy("dead");

        assertThat(released).isEqualTo(2);
        assertThat(store.getTimeTicker("a").getStatus()).isEqualTo(TickerStatus.QUEUED);
        assertThat(store.getTimeTicker("a").getLockedBy()).isNull();
        assertThat(store.getTimeTicker("c").getLockedBy()).isEqualTo("alive");
    }

    @Test
    @DisplayName("Should materialize an occurrence once per boundary")
    void testIdempotentUpsert() {
        CronTickerEntity cron = cron("cron-1", NOW);
        store.addCronTickers(List.of(cron));

        CronTickerOccurrenceEntity first = store.upsertOccurrence(cron, NOW);
        CronTickerOccurrenceEntity second = store.upsertOccurrence(cron, NOW);

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(store.occurrencesOf("cron-1")).hasSize(1);
        assertThat(first.getStatus()).isEqualTo(TickerStatus.IDLE);
        assertThat(first.getFunction()).isEqualTo("report");
    }

    @Test
    @DisplayName("Should advance a cron ticker only from the expected boundary")
    void testAdvanceCas() {
        store.addCronTickers(List.of(cron("cron-1", NOW)));

        assertThat(store.advanceCronTicker("cron-1", NOW, NOW.plusSeconds(60))).isTrue();
        assertThat(store.advanceCronTicker("cron-1", NOW, NOW.plusSeconds(120))).isFalse();
        assertThat(store.getCronTicker("cron-1").getNextOccurrence()).isEqualTo(NOW.plusSeconds(60));
    }

    @Test
    @DisplayName("Should not update a row that is already claimed")
    void testUpdateClaimed() {
        store.addTimeTickers(List.of(ticker("t-1", NOW)));
        store.tryClaim(TickerType.TIME, "t-1", "node-a", NOW);

        TimeTickerEntity changed = ticker("t-1", NOW.plusSeconds(30));

        assertThat(store.updateTimeTickers(List.of(changed))).isZero();
        assertThat(store.getTimeTicker("t-1").getExecutionTime()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should keep in-progress occurrences when the cron ticker is deleted")
    void testDeleteCron() {
        CronTickerEntity cron = cron("cron-1", NOW);
        store.addCronTickers(List.of(cron));
        CronTickerOccurrenceEntity running = store.upsertOccurrence(cron, NOW);
        store.upsertOccurrence(cron, NOW.plusSeconds(10));
        store.tryClaim(TickerType.CRON_OCCURRENCE, running.getId(), "node-a", NOW);

        assertThat(store.deleteCronTickers(List.of("cron-1"))).isEqualTo(1);

        assertThat(store.getCronTicker("cron-1")).isNull();
        assertThat(store.occurrencesOf("cron-1")).extracting(BaseTickerEntity::getId)
                .containsExactly(running.getId());
    }

    private static TimeTickerEntity ticker(String id, Instant due) {
        TimeTickerEntity t = new TimeTickerEntity();
        t.setId(id);
        t.setFunction("report");
        t.setStatus(TickerStatus.IDLE);
        t.setRetries(0);
        t.setRetryCount(0);
        t.setExecutionTime(due);
        return t;
    }

    private static CronTickerEntity cron(String id, Instant next) {
        CronTickerEntity c = new CronTickerEntity();
        c.setId(id);
        c.setFunction("report");
        c.setExpression("*/10 * * * * *");
        c.setNextOccurrence(next);
        c.setRetries(0);
        return c;
    }
}
