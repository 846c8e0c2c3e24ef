package com.fastticker.core.chain;

import com.fastticker.exception.TickerValidationException;
import com.fastticker.model.entity.TimeTickerEntity;
import com.fastticker.model.enums.RunCondition;
import com.fastticker.model.enums.TickerStatus;
import com.fastticker.store.memory.InMemoryTickerStore;
import com.fastticker.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ChainEngineTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private InMemoryTickerStore store;
    private ChainEngine chain;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        store = new InMemoryTickerStore(clock);
        chain = new ChainEngine(store, clock, 3);
    }

    @Test
    @DisplayName("Should queue only the children whose run condition matches the terminal status")
    void testTerminalRelease() {
        TimeTickerEntity parent = ticker("p", null, null);
        store.addTimeTickers(List.of(parent,
                ticker("on-success", "p", RunCondition.ON_SUCCESS),
                ticker("on-failure", "p", RunCondition.ON_FAILURE),
                ticker("on-any", "p", RunCondition.ON_ANY_COMPLETED_STATUS)));

        int queued = chain.onTerminal(parent, TickerStatus.DUE_DONE);

        assertThat(queued).isEqualTo(2);
        assertThat(store.getTimeTicker("on-success").getStatus()).isEqualTo(TickerStatus.QUEUED);
        assertThat(store.getTimeTicker("on-any").getStatus()).isEqualTo(TickerStatus.QUEUED);
        assertThat(store.getTimeTicker("on-failure").getStatus()).isEqualTo(TickerStatus.IDLE);
        // 未指定执行时间的子任务放行后立即到期
        assertThat(store.getTimeTicker("on-success").getExecutionTime()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should release failure and cancellation children on the matching outcome")
    void testFailureConditions() {
        TimeTickerEntity parent = ticker("p", null, null);
        store.addTimeTickers(List.of(parent,
                ticker("on-cancelled", "p", RunCondition.ON_CANCELLED),
                ticker("on-fail-or-cancel", "p", RunCondition.ON_FAILURE_OR_CANCELLED),
                ticker("on-success", "p", RunCondition.ON_SUCCESS)));

        chain.onTerminal(parent, TickerStatus.CANCELLED);

        assertThat(store.getTimeTicker("on-cancelled").getStatus()).isEqualTo(TickerStatus.QUEUED);
        assertThat(store.getTimeTicker("on-fail-or-cancel").getStatus()).isEqualTo(TickerStatus.QUEUED);
        assertThat(store.getTimeTicker("on-success").getStatus()).isEqualTo(TickerStatus.IDLE);
    }

    @Test
    @DisplayName("Should release IN_PROGRESS children as soon as the parent starts")
    void testInProgressRelease() {
        TimeTickerEntity parent = ticker("p", null, null);
        store.addTimeTickers(List.of(parent,
                ticker("sidecar", "p", RunCondition.IN_PROGRESS),
                ticker("after", "p", RunCondition.ON_SUCCESS)));

        assertThat(chain.onInProgress(parent)).isEqualTo(1);
        assertThat(store.getTimeTicker("sidecar").getStatus()).isEqualTo(TickerStatus.QUEUED);
        // 终态阶段不会重复放行
        assertThat(chain.onTerminal(parent, TickerStatus.DONE)).isEqualTo(1);
        assertThat(store.getTimeTicker("after").getStatus()).isEqualTo(TickerStatus.QUEUED);
    }

    @Test
    @DisplayName("Should reject a ticker becoming its own parent")
    void testSelfParent() {
        store.addTimeTickers(List.of(ticker("a", null, null)));

        assertThatThrownBy(() -> chain.validateAncestry("a", "a", 1))
                .isInstanceOf(TickerValidationException.class)
                .hasMessageContaining("own parent");
    }

    @Test
    @DisplayName("Should reject a parent change that closes a cycle")
    void testCycle() {
        store.addTimeTickers(List.of(
                ticker("a", null, null),
                ticker("b", "a", RunCondition.ON_SUCCESS),
                ticker("c", "b", RunCondition.ON_SUCCESS)));

        assertThatThrownBy(() -> chain.validateAncestry("a", "c", 3))
                .isInstanceOf(TickerValidationException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    @DisplayName("Should reject chains deeper than the configured maximum")
    void testDepth() {
        store.addTimeTickers(List.of(
                ticker("a", null, null),
                ticker("b", "a", RunCondition.ON_SUCCESS),
                ticker("c", "b", RunCondition.ON_SUCCESS)));

        assertThatCode(() -> chain.validateAncestry(null, "b", 1)).doesNotThrowAnyException();
        assertThatThrownBy(() -> chain.validateAncestry(null, "c", 1))
                .isInstanceOf(TickerValidationException.class)
                .hasMessageContaining("max depth");
        assertThatThrownBy(() -> chain.validateAncestry(null, null, 4))
                .isInstanceOf(TickerValidationException.class);
    }

    @Test
    @DisplayName("Should reject a parent that does not exist")
    void testMissingParent() {
        assertThatThrownBy(() -> chain.validateAncestry(null, "ghost", 1))
                .isInstanceOf(TickerValidationException.class)
                .hasMessageContaining("not found");
    }

    private static TimeTickerEntity ticker(String id, String parentId, RunCondition condition) {
        TimeTickerEntity t = new TimeTickerEntity();
        t.setId(id);
        t.setFunction("report");
        t.setStatus(TickerStatus.IDLE);
        t.setRetries(0);
        t.setRetryCount(0);
        t.setParentId(parentId);
        t.setRunCondition(condition);
        t.setExecutionTime(parentId == null ? NOW : null);
        return t;
    }
}
