package com.fastticker.core.manager;

import com.fastticker.config.TickerWheelProperties;
import com.fastticker.core.cron.CronEngine;
import com.fastticker.core.function.TickerFunctionRegistry;
import com.fastticker.core.spi.PayloadSerializer;
import com.fastticker.core.spi.TickerFunctionHandler;
import com.fastticker.core.spi.TickerStore;
import com.fastticker.exception.TickerValidationException;
import com.fastticker.model.CronTickerRequest;
import com.fastticker.model.TickerResult;
import com.fastticker.model.entity.CronTickerEntity;
import com.fastticker.model.enums.TickerPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * cron 任务管理
 * 表达式在创建/更新时校验, 不会在触发时才发现非法
 */
public class CronTickerManager {

    private static final Logger log = LoggerFactory.getLogger(CronTickerManager.class);

    private final TickerStore store;

    private final TickerFunctionRegistry functions;

    private final CronEngine cronEngine;

    private final PayloadSerializer serializer;

    private final TickerWheelProperties props;

    private final Clock clock;

    public CronTickerManager(TickerStore store, TickerFunctionRegistry functions, CronEngine cronEngine,
                             PayloadSerializer serializer, TickerWheelProperties props, Clock clock) {
        this.store = store;
        this.functions = functions;
        this.cronEngine = cronEngine;
        this.serializer = serializer;
        this.props = props;
        this.clock = clock;
    }

    public TickerResult<CronTickerEntity> add(CronTickerRequest request) {
        TickerResult<CronTickerEntity> r = addBatch(List.of(request));
        return r.isSucceeded() ? TickerResult.ok(r.getResults().get(0)) : r;
    }

    public TickerResult<CronTickerEntity> addBatch(List<CronTickerRequest> requests) {
        List<CronTickerEntity> rows = new ArrayList<>();
        try {
            Instant now = clock.instant();
            Set<String> ids = new HashSet<>();
            for (CronTickerRequest req : requests) {
                CronTickerEntity e = build(req, now);
                if (!ids.add(e.getId())) {
                    throw new TickerValidationException("duplicate cron ticker id " + e.getId() + " in request");
                }
                if (req.getId() != null && store.getCronTicker(e.getId()) != null) {
                    throw new TickerValidationException("cron ticker " + e.getId() + " already exists");
                }
                rows.add(e);
            }
        } catch (TickerValidationException e) {
            log.debug("[CronTicker] add rejected: {}", e.getMessage());
            return TickerResult.failure(e);
        }
        int n = store.addCronTickers(rows);
        return TickerResult.ok(rows, n);
    }

    public TickerResult<CronTickerEntity> update(CronTickerRequest request) {
        TickerResult<CronTickerEntity> r = updateBatch(List.of(request));
        return r.isSucceeded() ? TickerResult.ok(r.getResults().get(0)) : r;
    }

    /**
     * 表达式变化时从当前时间重新计算下一个边界, 已物化的 occurrence 不受影响
     */
    public TickerResult<CronTickerEntity> updateBatch(List<CronTickerRequest> requests) {
        List<CronTickerEntity> rows = new ArrayList<>();
        try {
            Instant now = clock.instant();
            for (CronTickerRequest req : requests) {
                String id = TickerValidations.requireId(req.getId());
                CronTickerEntity existing = store.getCronTicker(id);
                if (existing == null) {
                    throw new TickerValidationException("cron ticker " + id + " not found");
                }
                CronTickerEntity e = build(req, now);
                e.setSeeded(existing.getSeeded());
                e.setCreatedAt(existing.getCreatedAt());
                if (Objects.equals(existing.getExpression(), e.getExpression())) {
                    e.setNextOccurrence(existing.getNextOccurrence());
                }
                rows.add(e);
            }
        } catch (TickerValidationException e) {
            log.debug("[CronTicker] update rejected: {}", e.getMessage());
            return TickerResult.failure(e);
        }
        int n = store.updateCronTickers(rows);
        return TickerResult.ok(rows, n);
    }

    public TickerResult<CronTickerEntity> delete(String id) {
        if (store.getCronTicker(id) == null) {
            return TickerResult.failure(new TickerValidationException("cron ticker " + id + " not found"));
        }
        return deleteBatch(List.of(id));
    }

    public TickerResult<CronTickerEntity> deleteBatch(Collection<String> ids) {
        int n = store.deleteCronTickers(ids);
        log.info("[CronTicker] deleted {} cron ticker(s) for ids={}", n, ids);
        return TickerResult.affected(n);
    }

    public TickerResult<CronTickerEntity> get(String id) {
        CronTickerEntity c = store.getCronTicker(id);
        if (c == null) {
            return TickerResult.failure(new TickerValidationException("cron ticker " + id + " not found"));
        }
        return TickerResult.ok(c);
    }

    /**
     * 为声明了 cron 的 function 创建 cron 任务, 按 function 名幂等
     *
     * @return 新建的数量
     */
    public int seedDeclared() {
        int created = 0;
        Instant now = clock.instant();
        for (TickerFunctionHandler<?> h : functions.all()) {
            String expression = h.cronExpression();
            if (expression == null || expression.isBlank()) {
                continue;
            }
            CronTickerEntity existing = store.findSeededCronTicker(h.name());
            if (existing != null) {
                if (!expression.equals(existing.getExpression())) {
                    // 声明变化时以代码为准
                    existing.setExpression(expression);
                    existing.setNextOccurrence(cronEngine.nextOccurrence(expression, now));
                    store.updateCronTickers(List.of(existing));
                    log.info("[CronTicker] seeded cron of function={} changed to '{}'", h.name(), expression);
                }
                continue;
            }
            CronTickerEntity e = build(CronTickerRequest.builder()
                    .function(h.name())
                    .expression(expression)
                    .description("declared by function " + h.name())
                    .build(), now);
            e.setSeeded(true);
            store.addCronTickers(List.of(e));
            created++;
            log.info("[CronTicker] seeded function={} expression='{}' next={}", h.name(), expression, e.getNextOccurrence());
        }
        return created;
    }

    private CronTickerEntity build(CronTickerRequest req, Instant now) {
        TickerValidations.requireFunction(functions, req.getFunction());
        if (req.getExpression() == null || req.getExpression().isBlank()) {
            throw new TickerValidationException("cron expression is required");
        }
        String expression = req.getExpression().trim();
        cronEngine.validate(expression);

        CronTickerEntity e = new CronTickerEntity();
        e.setId(req.getId() == null || req.getId().isBlank() ? UUID.randomUUID().toString() : req.getId());
        e.setFunction(req.getFunction());
        e.setExpression(expression);
        e.setDescription(req.getDescription());
        e.setPriority(req.getPriority() != null ? req.getPriority()
                : functions.find(req.getFunction()).map(TickerFunctionHandler::priority).orElse(TickerPriority.NORMAL));
        e.setRetries(TickerValidations.retries(req.getRetries(), props.getRetry().getDefaultRetries()));
        e.setRetryIntervals(TickerValidations.intervals(req.getRetryIntervals()));
        e.setRequestPayload(serializer.serialize(req.getRequest()));
        e.setNextOccurrence(cronEngine.nextOccurrence(expression, now));
        e.setSeeded(false);
        return e;
    }
}
