package com.fastticker.core.manager;

import com.fastticker.config.TickerWheelProperties;
import com.fastticker.core.chain.ChainEngine;
import com.fastticker.core.function.TickerFunctionRegistry;
import com.fastticker.core.metric.TickerMetrics;
import com.fastticker.core.spi.PayloadSerializer;
import com.fastticker.core.spi.TickerFunctionHandler;
import com.fastticker.core.spi.TickerStore;
import com.fastticker.exception.TickerValidationException;
import com.fastticker.model.TickerResult;
import com.fastticker.model.TimeTickerRequest;
import com.fastticker.model.entity.TimeTickerEntity;
import com.fastticker.model.enums.RunCondition;
import com.fastticker.model.enums.TickerPriority;
import com.fastticker.model.enums.TickerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * 一次性任务管理
 * 校验失败与找不到通过 {@link TickerResult} 返回, 存储异常照常抛出
 */
public class TimeTickerManager {

    private static final Logger log = LoggerFactory.getLogger(TimeTickerManager.class);

    private final TickerStore store;

    private final TickerFunctionRegistry functions;

    private final ChainEngine chain;

    private final PayloadSerializer serializer;

    private final TickerMetrics metrics;

    private final TickerWheelProperties props;

    private final Clock clock;

    public TimeTickerManager(TickerStore store, TickerFunctionRegistry functions, ChainEngine chain,
                             PayloadSerializer serializer, TickerMetrics metrics,
                             TickerWheelProperties props, Clock clock) {
        this.store = store;
        this.functions = functions;
        this.chain = chain;
        this.serializer = serializer;
        this.metrics = metrics;
        this.props = props;
        this.clock = clock;
    }

    public TickerResult<TimeTickerEntity> add(TimeTickerRequest request) {
        TickerResult<TimeTickerEntity> r = addBatch(List.of(request));
        if (!r.isSucceeded()) {
            return r;
        }
        // 首个为根任务, 其余为子任务
        return TickerResult.ok(r.getResults().get(0));
    }

    /**
     * 批量新建, 全部校验通过才落库; 请求中的子任务一并落库
     */
    public TickerResult<TimeTickerEntity> addBatch(List<TimeTickerRequest> requests) {
        List<TimeTickerEntity> rows = new ArrayList<>();
        try {
            Instant now = clock.instant();
            Set<String> ids = new HashSet<>();
            for (TimeTickerRequest req : requests) {
                if (req.getParentId() != null) {
                    chain.validateAncestry(null, req.getParentId(), height(req, 1));
                } else {
                    chain.validateAncestry(null, null, height(req, 1));
                }
                flatten(req, req.getParentId(), now, rows, ids);
            }
        } catch (TickerValidationException e) {
            log.debug("[TimeTicker] add rejected: {}", e.getMessage());
            return TickerResult.failure(e);
        }
        int n = store.addTimeTickers(rows);
        metrics.incEnqueued(n);
        return TickerResult.ok(rows, n);
    }

    public TickerResult<TimeTickerEntity> update(TimeTickerRequest request) {
        TickerResult<TimeTickerEntity> r = updateBatch(List.of(request));
        if (!r.isSucceeded()) {
            return r;
        }
        if (r.getAffectedRows() == 0) {
            return TickerResult.failure(new TickerValidationException(
                    "time ticker " + request.getId() + " was claimed before it could be updated"));
        }
        return TickerResult.ok(r.getResults().get(0));
    }

    /**
     * 批量更新, 只允许修改未被抢占的 IDLE/QUEUED 行; 子任务只能在创建时挂载
     */
    public TickerResult<TimeTickerEntity> updateBatch(List<TimeTickerRequest> requests) {
        List<TimeTickerEntity> rows = new ArrayList<>();
        try {
            for (TimeTickerRequest req : requests) {
                String id = TickerValidations.requireId(req.getId());
                TimeTickerEntity existing = store.getTimeTicker(id);
                if (existing == null) {
                    throw new TickerValidationException("time ticker " + id + " not found");
                }
                if (!existing.getStatus().isClaimable()) {
                    throw new TickerValidationException("time ticker " + id + " is " + existing.getStatus()
                            + " and can no longer be updated");
                }
                if (req.getChildren() != null && !req.getChildren().isEmpty()) {
                    throw new TickerValidationException("children can only be attached when the ticker is created");
                }
                if (!Objects.equals(existing.getParentId(), req.getParentId())) {
                    chain.validateAncestry(id, req.getParentId(), subtreeHeight(id));
                }
                rows.add(merge(existing, req));
            }
        } catch (TickerValidationException e) {
            log.debug("[TimeTicker] update rejected: {}", e.getMessage());
            return TickerResult.failure(e);
        }
        int n = store.updateTimeTickers(rows);
        return TickerResult.ok(rows, n);
    }

    /**
     * 删除任务及其全部后代
     */
    public TickerResult<TimeTickerEntity> delete(String id) {
        if (store.getTimeTicker(id) == null) {
            return TickerResult.failure(new TickerValidationException("time ticker " + id + " not found"));
        }
        return deleteBatch(List.of(id));
    }

    public TickerResult<TimeTickerEntity> deleteBatch(Collection<String> ids) {
        Set<String> all = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>(ids);
        while (!pending.isEmpty()) {
            String id = pending.poll();
            if (all.add(id)) {
                store.findChildren(id).forEach(c -> pending.add(c.getId()));
            }
        }
        int n = store.deleteTimeTickers(all);
        log.info("[TimeTicker] deleted {} ticker(s) for ids={}", n, ids);
        return TickerResult.affected(n);
    }

    public TickerResult<TimeTickerEntity> get(String id) {
        TimeTickerEntity t = store.getTimeTicker(id);
        if (t == null) {
            return TickerResult.failure(new TickerValidationException("time ticker " + id + " not found"));
        }
        return TickerResult.ok(t);
    }

    // ----------------- 内部 -----------------

    private void flatten(TimeTickerRequest req, String parentId, Instant now,
                         List<TimeTickerEntity> out, Set<String> ids) {
        TimeTickerEntity e = build(req, parentId, now);
        if (!ids.add(e.getId())) {
            throw new TickerValidationException("duplicate ticker id " + e.getId() + " in request");
        }
        if (req.getId() != null && store.getTimeTicker(e.getId()) != null) {
            throw new TickerValidationException("time ticker " + e.getId() + " already exists");
        }
        out.add(e);
        if (req.getChildren() != null) {
            for (TimeTickerRequest child : req.getChildren()) {
                if (child.getParentId() != null && !child.getParentId().equals(e.getId())) {
                    throw new TickerValidationException("nested child must not reference another parent");
                }
                flatten(child, e.getId(), now, out, ids);
            }
        }
    }

    private TimeTickerEntity build(TimeTickerRequest req, String parentId, Instant now) {
        TickerValidations.requireFunction(functions, req.getFunction());
        TimeTickerEntity e = new TimeTickerEntity();
        e.setId(req.getId() == null || req.getId().isBlank() ? UUID.randomUUID().toString() : req.getId());
        e.setFunction(req.getFunction());
        e.setDescription(req.getDescription());
        e.setStatus(TickerStatus.IDLE);
        e.setPriority(priorityOf(req.getPriority(), req.getFunction()));
        e.setRetries(TickerValidations.retries(req.getRetries(), props.getRetry().getDefaultRetries()));
        e.setRetryCount(0);
        e.setRetryIntervals(TickerValidations.intervals(req.getRetryIntervals()));
        e.setRequestPayload(serializer.serialize(req.getRequest()));
        e.setBatchParent(req.getBatchParent());
        if (parentId == null) {
            // 根任务没有到期时间时立即到期
            e.setExecutionTime(req.getExecutionTime() == null ? now : req.getExecutionTime());
            if (req.getRunCondition() != null) {
                throw new TickerValidationException("run condition is only meaningful on a child ticker");
            }
        } else {
            e.setParentId(parentId);
            e.setExecutionTime(req.getExecutionTime());
            e.setRunCondition(req.getRunCondition() == null ? RunCondition.ON_SUCCESS : req.getRunCondition());
        }
        return e;
    }

    private TimeTickerEntity merge(TimeTickerEntity existing, TimeTickerRequest req) {
        TickerValidations.requireFunction(functions, req.getFunction());
        TimeTickerEntity e = new TimeTickerEntity();
        e.setId(existing.getId());
        e.setStatus(existing.getStatus());
        e.setRetryCount(existing.getRetryCount());
        e.setCreatedAt(existing.getCreatedAt());
        e.setFunction(req.getFunction());
        e.setDescription(req.getDescription());
        e.setPriority(priorityOf(req.getPriority(), req.getFunction()));
        e.setRetries(TickerValidations.retries(req.getRetries(), props.getRetry().getDefaultRetries()));
        e.setRetryIntervals(TickerValidations.intervals(req.getRetryIntervals()));
        e.setRequestPayload(serializer.serialize(req.getRequest()));
        e.setBatchParent(req.getBatchParent());
        e.setParentId(req.getParentId());
        if (req.getParentId() == null) {
            e.setExecutionTime(req.getExecutionTime() == null ? existing.getExecutionTime() : req.getExecutionTime());
            // 未改计划时间时保留待执行的重试
            if (req.getExecutionTime() == null) {
                e.setNextDueAt(existing.getNextDueAt());
            }
            if (e.getExecutionTime() == null) {
                e.setExecutionTime(clock.instant());
            }
            // 脱离父任务后按根任务调度
            if (existing.getParentId() != null && e.getStatus() == TickerStatus.IDLE) {
                e.setStatus(TickerStatus.QUEUED);
            }
        } else {
            e.setExecutionTime(req.getExecutionTime());
            e.setRunCondition(req.getRunCondition() == null ? RunCondition.ON_SUCCESS : req.getRunCondition());
            // 挂到父任务下后等待放行
            if (existing.getParentId() == null) {
                e.setStatus(TickerStatus.IDLE);
            }
        }
        return e;
    }

    private TickerPriority priorityOf(TickerPriority requested, String function) {
        if (requested != null) {
            return requested;
        }
        return functions.find(function).map(TickerFunctionHandler::priority).orElse(TickerPriority.NORMAL);
    }

    /** 请求自身及嵌套子任务的层数 */
    private static int height(TimeTickerRequest req, int level) {
        int max = level;
        if (req.getChildren() != null) {
            for (TimeTickerRequest c : req.getChildren()) {
                max = Math.max(max, height(c, level + 1));
            }
        }
        return max;
    }

    /** 已存在任务自身及后代的层数 */
    private int subtreeHeight(String id) {
        int height = 0;
        Set<String> seen = new HashSet<>();
        List<String> level = List.of(id);
        while (!level.isEmpty()) {
            height++;
            List<String> next = new ArrayList<>();
            for (String p : level) {
                if (seen.add(p)) {
                    store.findChildren(p).forEach(c -> next.add(c.getId()));
                }
            }
            level = next;
        }
        return height;
    }
}
