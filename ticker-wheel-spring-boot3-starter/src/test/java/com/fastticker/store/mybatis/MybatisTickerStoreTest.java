package com.fastticker.store.mybatis;

import com.baomidou.mybatisplus.autoconfigure.MybatisPlusAutoConfiguration;
import com.fastticker.autoconfig.TickerTxAutoConfiguration;
import com.fastticker.autoconfig.TickerWheelMybatisAutoConfiguration;
import com.fastticker.core.spi.TickerStore;
import com.fastticker.mapper.CronTickerMapper;
import com.fastticker.mapper.CronTickerOccurrenceMapper;
import com.fastticker.mapper.TimeTickerMapper;
import com.fastticker.model.ExecutionRecord;
import com.fastticker.model.entity.BaseTickerEntity;
import com.fastticker.model.entity.CronTickerEntity;
import com.fastticker.model.entity.CronTickerOccurrenceEntity;
import com.fastticker.model.entity.TimeTickerEntity;
import com.fastticker.model.enums.TickerPriority;
import com.fastticker.model.enums.TickerStatus;
import com.fastticker.model.enums.TickerType;
import com.fastticker.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.autoconfigure.transaction.TransactionAutoConfiguration;
import org.springframework.boot.test.context.assertj.AssertableApplicationContext;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.*;

/**
 * H2 (MySQL 模式) 上跑真实的 schema 与 mapper SQL
 */
class MybatisTickerStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    DataSourceAutoConfiguration.class,
                    SqlInitializationAutoConfiguration.class,
                    DataSourceTransactionManagerAutoConfiguration.class,
                    TransactionAutoConfiguration.class,
                    MybatisPlusAutoConfiguration.class,
                    TickerTxAutoConfiguration.class,
                    TickerWheelMybatisAutoConfiguration.class));

    @Test
    @DisplayName("Should wire the MyBatis store when a data source is present")
    void testAutoConfigured() {
        withStore((ctx, store) -> {
            assertThat(ctx).hasNotFailed();
            assertThat(ctx.getBean(TickerStore.class)).isInstanceOf(MybatisTickerStore.class);
        });
    }

    @Test
    @DisplayName("Should let exactly one of many concurrent claimers win a row")
    void testSingleWinnerClaim() {
        withStore((ctx, store) -> {
            // Given
            store.addTimeTickers(List.of(ticker("t-1", T0)));
            int nodes = 8;
            ExecutorService pool = Executors.newFixedThreadPool(nodes);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<Boolean>> results = new ArrayList<>();
                for (int i = 0; i < nodes; i++) {
                    String nodeId = "node-" + i;
                    Callable<Boolean> claim = () -> {
                        start.await();
                        return store.tryClaim(TickerType.TIME, "t-1", nodeId, T0);
                    };
                    results.add(pool.submit(claim));
                }

                // When
                start.countDown();
                int winners = 0;
                for (Future<Boolean> f : results) {
                    if (f.get()) {
                        winners++;
                    }
                }

                // Then
                assertThat(winners).isEqualTo(1);
                TimeTickerEntity row = store.getTimeTicker("t-1");
                assertThat(row.getStatus()).isEqualTo(TickerStatus.IN_PROGRESS);
                assertThat(row.getLockedBy()).startsWith("node-");
            } finally {
                pool.shutdownNow();
            }
        });
    }

    @Test
    @DisplayName("Should create one occurrence per boundary however often it is materialized")
    void testUpsertOccurrenceIdempotent() {
        withStore((ctx, store) -> {
            // Given
            CronTickerEntity cron = cron("c-1");
            Instant boundary = T0.plusSeconds(60);

            // When
            CronTickerOccurrenceEntity first = store.upsertOccurrence(cron, boundary);
            CronTickerOccurrenceEntity second = store.upsertOccurrence(cron, boundary);
            store.upsertOccurrence(cron, boundary.plusSeconds(60));

            // Then
            assertThat(second.getId()).isEqualTo(first.getId());
            assertThat(second.getExecutionTime()).isEqualTo(boundary);
            assertThat(second.getStatus()).isEqualTo(TickerStatus.IDLE);
            assertThat(ctx.getBean(CronTickerOccurrenceMapper.class).selectCount(null)).isEqualTo(2L);
        });
    }

    @Test
    @DisplayName("Should return every row held by a node to the queue and leave other owners alone")
    void testReleaseAllLockedBy() {
        withStore((ctx, store) -> {
            // Given
            store.addTimeTickers(List.of(ticker("t-1", T0), ticker("t-2", T0)));
            CronTickerOccurrenceEntity occ = store.upsertOccurrence(cron("c-1"), T0);
            assertThat(store.tryClaim(TickerType.TIME, "t-1", "node-1", T0)).isTrue();
            assertThat(store.tryClaim(TickerType.CRON_OCCURRENCE, occ.getId(), "node-1", T0)).isTrue();
            assertThat(store.tryClaim(TickerType.TIME, "t-2", "node-2", T0)).isTrue();

            // When
            int released = store.releaseAllLockedBy("node-1");

            // Then
            assertThat(released).isEqualTo(2);
            assertThat(store.getTimeTicker("t-1").getStatus()).isEqualTo(TickerStatus.QUEUED);
            assertThat(store.getTimeTicker("t-1").getLockedBy()).isNull();
            BaseTickerEntity o = store.get(TickerType.CRON_OCCURRENCE, occ.getId());
            assertThat(o.getStatus()).isEqualTo(TickerStatus.QUEUED);
            assertThat(o.getLockedBy()).isNull();
            assertThat(store.getTimeTicker("t-2").getLockedBy()).isEqualTo("node-2");
            assertThat(store.releaseAllLockedBy("node-1")).isZero();
        });
    }

    @Test
    @DisplayName("Should accept write-backs only from the owning node")
    void testOwnerGuardedWrites() {
        withStore((ctx, store) -> {
            // Given
            store.addTimeTickers(List.of(ticker("t-1", T0)));
            store.tryClaim(TickerType.TIME, "t-1", "node-1", T0);
            ExecutionRecord record = ExecutionRecord.builder().executedAt(T0).elapsedMillis(5L).build();

            // When / Then
            assertThat(store.setTerminal(TickerType.TIME, "t-1", "node-2", TickerStatus.DONE, record)).isFalse();
            assertThat(store.reschedule(TickerType.TIME, "t-1", "node-2", T0.plusSeconds(60),
                    TickerStatus.QUEUED, 1, "boom")).isFalse();
            assertThat(store.release(TickerType.TIME, "t-1", "node-2")).isFalse();
            assertThat(store.getTimeTicker("t-1").getStatus()).isEqualTo(TickerStatus.IN_PROGRESS);

            assertThat(store.setTerminal(TickerType.TIME, "t-1", "node-1", TickerStatus.DONE, record)).isTrue();
            TimeTickerEntity row = store.getTimeTicker("t-1");
            assertThat(row.getStatus()).isEqualTo(TickerStatus.DONE);
            assertThat(row.getExecutedAt()).isEqualTo(T0);
            assertThat(row.getElapsedMillis()).isEqualTo(5L);
            assertThat(row.getLockedBy()).isNull();
            assertThat(store.setTerminal(TickerType.TIME, "t-1", "node-1", TickerStatus.FAILED, record)).isFalse();
        });
    }

    @Test
    @DisplayName("Should keep the scheduled time and make a retry due at its own instant")
    void testRescheduleKeepsExecutionTime() {
        withStore((ctx, store) -> {
            // Given
            store.addTimeTickers(List.of(ticker("t-1", T0), ticker("t-2", T0.plusSeconds(30))));
            store.tryClaim(TickerType.TIME, "t-1", "node-1", T0);

            // When
            boolean ok = store.reschedule(TickerType.TIME, "t-1", "node-1", T0.plusSeconds(60),
                    TickerStatus.QUEUED, 1, "boom");

            // Then
            assertThat(ok).isTrue();
            TimeTickerEntity row = store.getTimeTicker("t-1");
            assertThat(row.getExecutionTime()).isEqualTo(T0);
            assertThat(row.getNextDueAt()).isEqualTo(T0.plusSeconds(60));
            assertThat(row.getRetryCount()).isEqualTo(1);
            assertThat(row.getExceptionMessage()).isEqualTo("boom");

            assertThat(ids(store.findDue(TickerType.TIME, T0.plusSeconds(30), 10))).containsExactly("t-2");
            assertThat(ids(store.findDue(TickerType.TIME, T0.plusSeconds(60), 10))).containsExactly("t-2", "t-1");
        });
    }

    @Test
    @DisplayName("Should find due occurrences by retry time once one is rescheduled")
    void testOccurrenceRetryDue() {
        withStore((ctx, store) -> {
            // Given
            CronTickerOccurrenceEntity occ = store.upsertOccurrence(cron("c-1"), T0);
            store.tryClaim(TickerType.CRON_OCCURRENCE, occ.getId(), "node-1", T0);

            // When
            store.reschedule(TickerType.CRON_OCCURRENCE, occ.getId(), "node-1", T0.plusSeconds(5),
                    TickerStatus.QUEUED, 1, "boom");

            // Then
            assertThat(store.findDue(TickerType.CRON_OCCURRENCE, T0.plusSeconds(4), 10)).isEmpty();
            List<BaseTickerEntity> due = store.findDue(TickerType.CRON_OCCURRENCE, T0.plusSeconds(5), 10);
            assertThat(ids(due)).containsExactly(occ.getId());
            assertThat(due.get(0).getExecutionTime()).isEqualTo(T0);
        });
    }

    @Test
    @DisplayName("Should advance a cron ticker only from the expected next occurrence")
    void testAdvanceCronTicker() {
        withStore((ctx, store) -> {
            CronTickerEntity cron = cron("c-1");
            cron.setNextOccurrence(T0);
            store.addCronTickers(List.of(cron));

            assertThat(store.advanceCronTicker("c-1", T0, T0.plusSeconds(60))).isTrue();
            assertThat(store.advanceCronTicker("c-1", T0, T0.plusSeconds(120))).isFalse();
            assertThat(store.getCronTicker("c-1").getNextOccurrence()).isEqualTo(T0.plusSeconds(60));
        });
    }

    // ----------------- 工具 -----------------

    private interface StoreCase {
        void run(AssertableApplicationContext ctx, MybatisTickerStore store) throws Exception;
    }

    private void withStore(StoreCase body) {
        String url = "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1";
        Consumer<AssertableApplicationContext> check = ctx -> {
            MutableClock clock = new MutableClock(T0);
            MybatisTickerStore store = new MybatisTickerStore(ctx.getBean(TimeTickerMapper.class),
                    ctx.getBean(CronTickerOccurrenceMapper.class), ctx.getBean(CronTickerMapper.class),
                    ctx.getBean(TransactionTemplate.class), clock);
            try {
                body.run(ctx, store);
            } catch (Exception e) {
                throw new AssertionError(e);
            }
        };
        runner.withPropertyValues(
                        "spring.datasource.url=" + url,
                        "spring.sql.init.mode=always",
                        "spring.sql.init.schema-locations=classpath:ticker-wheel-schema.sql")
                .run(check::accept);
    }

    private static List<String> ids(List<? extends BaseTickerEntity> rows) {
        return rows.stream().map(BaseTickerEntity::getId).toList();
    }

    private static TimeTickerEntity ticker(String id, Instant at) {
        TimeTickerEntity t = new TimeTickerEntity();
        t.setId(id);
        t.setFunction("report");
        t.setStatus(TickerStatus.IDLE);
        t.setPriority(TickerPriority.NORMAL);
        t.setRetries(3);
        t.setRetryCount(0);
        t.setRetryIntervals(List.of(60));
        t.setExecutionTime(at);
        return t;
    }

    private static CronTickerEntity cron(String id) {
        CronTickerEntity c = new CronTickerEntity();
        c.setId(id);
        c.setFunction("report");
        c.setExpression("0 * * * * *");
        c.setPriority(TickerPriority.NORMAL);
        c.setRetries(1);
        c.setRetryIntervals(List.of(5));
        c.setSeeded(false);
        c.setNextOccurrence(T0.plus(Duration.ofMinutes(1)));
        return c;
    }
}
