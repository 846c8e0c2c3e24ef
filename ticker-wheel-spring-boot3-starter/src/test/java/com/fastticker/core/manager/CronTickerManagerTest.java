package com.fastticker.core.manager;

import com.fastticker.exception.InvalidCronExpressionException;
import com.fastticker.exception.TickerValidationException;
import com.fastticker.model.CronTickerRequest;
import com.fastticker.model.TickerResult;
import com.fastticker.model.entity.CronTickerEntity;
import com.fastticker.model.enums.TickerType;
import com.fastticker.store.memory.InMemoryClusterStore;
import com.fastticker.store.memory.InMemoryTickerStore;
import com.fastticker.support.MutableClock;
import com.fastticker.support.RecordingFunction;
import com.fastticker.support.TickerHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CronTickerManagerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:05Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final List<TickerHarness> harnesses = new ArrayList<>();
    private TickerHarness h;

    @BeforeEach
    void setUp() {
        h = track(TickerHarness.single(clock, TickerHarness.defaultProps(),
                RecordingFunction.named("report"),
                RecordingFunction.named("cleanup").cron("0 0 3 * * *")));
    }

    @AfterEach
    void tearDown() {
        harnesses.forEach(TickerHarness::shutdown);
    }

    @Test
    @DisplayName("Should compute the next boundary when a cron ticker is added")
    void testAdd() {
        TickerResult<CronTickerEntity> r = h.cronTickers.add(CronTickerRequest.builder()
                .function("report").expression(" 0 */15 * * * * ").retries(1).build());

        assertThat(r.isSucceeded()).isTrue();
        CronTickerEntity stored = h.store.getCronTicker(r.getResult().getId());
        assertThat(stored.getExpression()).isEqualTo("0 */15 * * * *");
        assertThat(stored.getNextOccurrence()).isEqualTo(Instant.parse("2024-03-01T10:15:00Z"));
        assertThat(stored.getSeeded()).isFalse();
    }

    @Test
    @DisplayName("Should reject an invalid cron expression")
    void testInvalidExpression() {
        TickerResult<CronTickerEntity> r = h.cronTickers.add(CronTickerRequest.builder()
                .function("report").expression("*/5 * * * *").build());

        assertThat(r.isSucceeded()).isFalse();
        assertThat(r.getException()).isInstanceOf(InvalidCronExpressionException.class);
    }

    @Test
    @DisplayName("Should return a failure when the cron ticker id already exists")
    void testAddExistingId() {
        h.cronTickers.add(CronTickerRequest.builder().id("c-1").function("report").expression("0 * * * * *").build());

        TickerResult<CronTickerEntity> r = h.cronTickers.add(CronTickerRequest.builder()
                .id("c-1").function("report").expression("0 0 * * * *").build());

        assertThat(r.isSucceeded()).isFalse();
        assertThat(r.getException()).isInstanceOf(TickerValidationException.class)
                .hasMessageContaining("c-1");
        assertThat(h.store.getCronTicker("c-1").getExpression()).isEqualTo("0 * * * * *");
    }

    @Test
    @DisplayName("Should recompute the next boundary only when the expression changes")
    void testUpdate() {
        String id = h.cronTickers.add(CronTickerRequest.builder()
                .id("c-1").function("report").expression("0 */15 * * * *").build()).getResult().getId();

        h.cronTickers.update(CronTickerRequest.builder()
                .id(id).function("report").expression("0 */15 * * * *").description("same").build());
        assertThat(h.store.getCronTicker(id).getNextOccurrence()).isEqualTo(Instant.parse("2024-03-01T10:15:00Z"));
        assertThat(h.store.getCronTicker(id).getDescription()).isEqualTo("same");

        h.cronTickers.update(CronTickerRequest.builder()
                .id(id).function("report").expression("0 0 * * * *").build());
        assertThat(h.store.getCronTicker(id).getNextOccurrence()).isEqualTo(Instant.parse("2024-03-01T11:00:00Z"));

        assertThat(h.cronTickers.update(CronTickerRequest.builder()
                .id("ghost").function("report").expression("0 0 * * * *").build()).isSucceeded()).isFalse();
    }

    @Test
    @DisplayName("Should seed function-declared cron tickers once")
    void testSeedIdempotent() {
        assertThat(h.cronTickers.seedDeclared()).isEqualTo(1);
        assertThat(h.cronTickers.seedDeclared()).isZero();

        CronTickerEntity seeded = h.store.findSeededCronTicker("cleanup");
        assertThat(seeded).isNotNull();
        assertThat(seeded.getExpression()).isEqualTo("0 0 3 * * *");
        assertThat(seeded.getNextOccurrence()).isEqualTo(Instant.parse("2024-03-02T03:00:00Z"));
    }

    @Test
    @DisplayName("Should follow a changed declaration on the next start")
    void testSeedUpdatesExpression() {
        h.cronTickers.seedDeclared();
        InMemoryTickerStore store = h.store;

        TickerHarness restarted = track(new TickerHarness("node-2", store, new InMemoryClusterStore(), clock,
                TickerHarness.defaultProps(), RecordingFunction.named("cleanup").cron("0 30 4 * * *")));

        assertThat(restarted.cronTickers.seedDeclared()).isZero();
        CronTickerEntity seeded = store.findSeededCronTicker("cleanup");
        assertThat(seeded.getExpression()).isEqualTo("0 30 4 * * *");
        assertThat(seeded.getNextOccurrence()).isEqualTo(Instant.parse("2024-03-02T04:30:00Z"));
    }

    @Test
    @DisplayName("Should remove pending occurrences when a cron ticker is deleted")
    void testDelete() {
        CronTickerEntity cron = h.cronTickers.add(CronTickerRequest.builder()
                .function("report").expression("*/10 * * * * *").build()).getResult();
        h.store.upsertOccurrence(cron, Instant.parse("2024-03-01T10:00:10Z"));

        TickerResult<CronTickerEntity> r = h.cronTickers.delete(cron.getId());

        assertThat(r.getAffectedRows()).isEqualTo(1);
        assertThat(h.store.occurrencesOf(cron.getId())).isEmpty();
        assertThat(h.store.findDue(TickerType.CRON_OCCURRENCE, Instant.parse("2024-03-02T00:00:00Z"), 10)).isEmpty();
        assertThat(h.cronTickers.get(cron.getId()).isSucceeded()).isFalse();
    }

    private TickerHarness track(TickerHarness harness) {
        harnesses.add(harness);
        return harness;
    }
}
