package com.fastticker.store.mybatis;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.toolkit.Wrappers;
import com.fastticker.core.spi.TickerStore;
import com.fastticker.exception.TickerStoreException;
import com.fastticker.mapper.CronTickerMapper;
import com.fastticker.mapper.CronTickerOccurrenceMapper;
import com.fastticker.mapper.TimeTickerMapper;
import com.fastticker.model.ExecutionRecord;
import com.fastticker.model.entity.BaseTickerEntity;
import com.fastticker.model.entity.CronTickerEntity;
import com.fastticker.model.entity.CronTickerOccurrenceEntity;
import com.fastticker.model.entity.TimeTickerEntity;
import com.fastticker.model.enums.TickerStatus;
import com.fastticker.model.enums.TickerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 基于 MyBatis-Plus 的存储
 * 状态迁移全部是带条件的单行 UPDATE, 影响行数即 CAS 结果
 */
public class MybatisTickerStore implements TickerStore {

    private static final Logger log = LoggerFactory.getLogger(MybatisTickerStore.class);

    /** 待重试的行按 next_due_at 到期, 其余按计划时间 */
    private static final String DUE_AT = "COALESCE(next_due_at, execution_time)";

    private final TimeTickerMapper timeMapper;

    private final CronTickerOccurrenceMapper occurrenceMapper;

    private final CronTickerMapper cronMapper;

    private final TransactionTemplate tx;

    private final Clock clock;

    public MybatisTickerStore(TimeTickerMapper timeMapper, CronTickerOccurrenceMapper occurrenceMapper,
                              CronTickerMapper cronMapper, TransactionTemplate tx, Clock clock) {
        this.timeMapper = timeMapper;
        this.occurrenceMapper = occurrenceMapper;
        this.cronMapper = cronMapper;
        this.tx = tx;
        this.clock = clock;
    }

    // ----------------- 调度 -----------------

    @Override
    public List<BaseTickerEntity> findDue(TickerType type, Instant now, int limit) {
        return guard("findDue", () -> {
            if (type == TickerType.TIME) {
                LambdaQueryWrapper<TimeTickerEntity> q = Wrappers.<TimeTickerEntity>lambdaQuery()
                        .apply(DUE_AT + " <= {0}", now)
                        .isNull(TimeTickerEntity::getLockedBy)
                        .and(w -> w.eq(TimeTickerEntity::getStatus, TickerStatus.QUEUED.getCode())
                                .or(i -> i.eq(TimeTickerEntity::getStatus, TickerStatus.IDLE.getCode())
                                        .isNull(TimeTickerEntity::getParentId)))
                        .last("ORDER BY " + DUE_AT + " LIMIT " + limit);
                return new ArrayList<BaseTickerEntity>(timeMapper.selectList(q));
            }
            LambdaQueryWrapper<CronTickerOccurrenceEntity> q = Wrappers.<CronTickerOccurrenceEntity>lambdaQuery()
                    .apply(DUE_AT + " <= {0}", now)
                    .isNull(CronTickerOccurrenceEntity::getLockedBy)
                    .in(CronTickerOccurrenceEntity::getStatus, TickerStatus.IDLE.getCode(), TickerStatus.QUEUED.getCode())
                    .last("ORDER BY " + DUE_AT + " LIMIT " + limit);
            return new ArrayList<BaseTickerEntity>(occurrenceMapper.selectList(q));
        });
    }

    @Override
    public List<CronTickerEntity> findDueCronTickers(Instant now, int limit) {
        return guard("findDueCronTickers", () -> cronMapper.selectList(Wrappers.<CronTickerEntity>lambdaQuery()
                .le(CronTickerEntity::getNextOccurrence, now)
                .orderByAsc(CronTickerEntity::getNextOccurrence)
                .last("LIMIT " + limit)));
    }

    @Override
    public boolean tryClaim(TickerType type, String id, String nodeId, Instant now) {
        return guard("tryClaim", () -> type == TickerType.TIME
                ? timeMapper.tryClaim(id, nodeId, now) == 1
                : occurrenceMapper.tryClaim(id, nodeId, now) == 1);
    }

    @Override
    public boolean release(TickerType type, String id, String nodeId) {
        Instant now = clock.instant();
        return guard("release", () -> type == TickerType.TIME
                ? timeMapper.release(id, nodeId, now) == 1
                : occurrenceMapper.release(id, nodeId, now) == 1);
    }

    @Override
    public boolean reschedule(TickerType type, String id, String nodeId, Instant nextDue,
                              TickerStatus newStatus, int retryCount, String lastError) {
        Instant now = clock.instant();
        return guard("reschedule", () -> type == TickerType.TIME
                ? timeMapper.reschedule(id, nodeId, newStatus.getCode(), nextDue, retryCount, lastError, now) == 1
                : occurrenceMapper.reschedule(id, nodeId, newStatus.getCode(), nextDue, retryCount, lastError, now) == 1);
    }

    @Override
    public boolean setTerminal(TickerType type, String id, String nodeId, TickerStatus status, ExecutionRecord r) {
        Instant now = clock.instant();
        return guard("setTerminal", () -> type == TickerType.TIME
                ? timeMapper.setTerminal(id, nodeId, status.getCode(), r.getExecutedAt(), r.getElapsedMillis(),
                        r.getExceptionMessage(), r.getSkippedReason(), now) == 1
                : occurrenceMapper.setTerminal(id, nodeId, status.getCode(), r.getExecutedAt(), r.getElapsedMillis(),
                        r.getExceptionMessage(), r.getSkippedReason(), now) == 1);
    }

    @Override
    public int releaseAllLockedBy(String nodeId) {
        Instant now = clock.instant();
        return guard("releaseAllLockedBy", () -> tx.execute(s ->
                timeMapper.releaseAllLockedBy(nodeId, now) + occurrenceMapper.releaseAllLockedBy(nodeId, now)));
    }

    // ----------------- cron -----------------

    @Override
    public CronTickerOccurrenceEntity upsertOccurrence(CronTickerEntity cron, Instant boundary) {
        return guard("upsertOccurrence", () -> {
            CronTickerOccurrenceEntity existing = findOccurrence(cron.getId(), boundary);
            if (existing != null) {
                return existing;
            }
            CronTickerOccurrenceEntity o = newOccurrence(cron, boundary, clock.instant());
            try {
                occurrenceMapper.insert(o);
                return o;
            } catch (DuplicateKeyException dup) {
                // 唯一键 (cron_ticker_id, execution_time) 冲突: 其他节点已创建
                log.debug("[Store] occurrence of cron={} at {} created concurrently", cron.getId(), boundary);
                return findOccurrence(cron.getId(), boundary);
            }
        });
    }

    @Override
    public boolean advanceCronTicker(String cronTickerId, Instant expectedNext, Instant newNext) {
        return guard("advanceCronTicker",
                () -> cronMapper.advance(cronTickerId, expectedNext, newNext, clock.instant()) == 1);
    }

    @Override
    public boolean existsNewerDueOccurrence(String cronTickerId, Instant boundary, Instant now) {
        return guard("existsNewerDueOccurrence", () -> occurrenceMapper.exists(
                Wrappers.<CronTickerOccurrenceEntity>lambdaQuery()
                        .eq(CronTickerOccurrenceEntity::getCronTickerId, cronTickerId)
                        .gt(CronTickerOccurrenceEntity::getExecutionTime, boundary)
                        .le(CronTickerOccurrenceEntity::getExecutionTime, now)
                        .in(CronTickerOccurrenceEntity::getStatus, TickerStatus.IDLE.getCode(),
                                TickerStatus.QUEUED.getCode(), TickerStatus.IN_PROGRESS.getCode())));
    }

    @Override
    public boolean existsRunningOccurrenceBefore(String cronTickerId, Instant boundary) {
        return guard("existsRunningOccurrenceBefore", () -> occurrenceMapper.exists(
                Wrappers.<CronTickerOccurrenceEntity>lambdaQuery()
                        .eq(CronTickerOccurrenceEntity::getCronTickerId, cronTickerId)
                        .lt(CronTickerOccurrenceEntity::getExecutionTime, boundary)
                        .eq(CronTickerOccurrenceEntity::getStatus, TickerStatus.IN_PROGRESS.getCode())));
    }

    // ----------------- 父子链 -----------------

    @Override
    public List<TimeTickerEntity> findChildren(String parentId) {
        return guard("findChildren", () -> timeMapper.selectList(Wrappers.<TimeTickerEntity>lambdaQuery()
                .eq(TimeTickerEntity::getParentId, parentId)));
    }

    @Override
    public boolean queueChild(String childId, Instant dueAt) {
        return guard("queueChild", () -> timeMapper.queueChild(childId, dueAt) == 1);
    }

    @Override
    public boolean expedite(String timeTickerId, Instant now) {
        return guard("expedite", () -> timeMapper.expedite(timeTickerId, now) == 1);
    }

    // ----------------- 管理 -----------------

    @Override
    public BaseTickerEntity get(TickerType type, String id) {
        return guard("get", () -> type == TickerType.TIME ? timeMapper.selectById(id) : occurrenceMapper.selectById(id));
    }

    @Override
    public TimeTickerEntity getTimeTicker(String id) {
        return guard("getTimeTicker", () -> timeMapper.selectById(id));
    }

    @Override
    public CronTickerEntity getCronTicker(String id) {
        return guard("getCronTicker", () -> cronMapper.selectById(id));
    }

    @Override
    public CronTickerEntity findSeededCronTicker(String function) {
        return guard("findSeededCronTicker", () -> cronMapper.selectList(Wrappers.<CronTickerEntity>lambdaQuery()
                        .eq(CronTickerEntity::getFunction, function)
                        .eq(CronTickerEntity::getSeeded, true))
                .stream().findFirst().orElse(null));
    }

    @Override
    public int addTimeTickers(List<TimeTickerEntity> tickers) {
        Instant now = clock.instant();
        return guard("addTimeTickers", () -> tx.execute(s -> {
            int n = 0;
            for (TimeTickerEntity t : tickers) {
                t.setCreatedAt(now);
                t.setUpdatedAt(now);
                n += timeMapper.insert(t);
            }
            return n;
        }));
    }

    @Override
    public int updateTimeTickers(List<TimeTickerEntity> tickers) {
        Instant now = clock.instant();
        return guard("updateTimeTickers", () -> tx.execute(s -> {
            int n = 0;
            for (TimeTickerEntity t : tickers) {
                t.setUpdatedAt(now);
                // 已被抢占的行不允许修改
                n += timeMapper.update(t, Wrappers.<TimeTickerEntity>lambdaUpdate()
                        .eq(TimeTickerEntity::getId, t.getId())
                        .in(TimeTickerEntity::getStatus, TickerStatus.IDLE.getCode(), TickerStatus.QUEUED.getCode())
                        .isNull(TimeTickerEntity::getLockedBy));
            }
            return n;
        }));
    }

    @Override
    public int deleteTimeTickers(Collection<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return guard("deleteTimeTickers", () -> timeMapper.deleteBatchIds(ids));
    }

    @Override
    public int addCronTickers(List<CronTickerEntity> tickers) {
        Instant now = clock.instant();
        return guard("addCronTickers", () -> tx.execute(s -> {
            int n = 0;
            for (CronTickerEntity c : tickers) {
                c.setCreatedAt(now);
                c.setUpdatedAt(now);
                n += cronMapper.insert(c);
            }
            return n;
        }));
    }

    @Override
    public int updateCronTickers(List<CronTickerEntity> tickers) {
        Instant now = clock.instant();
        return guard("updateCronTickers", () -> tx.execute(s -> {
            int n = 0;
            for (CronTickerEntity c : tickers) {
                c.setUpdatedAt(now);
                n += cronMapper.updateById(c);
            }
            return n;
        }));
    }

    @Override
    public int deleteCronTickers(Collection<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return guard("deleteCronTickers", () -> tx.execute(s -> {
            occurrenceMapper.delete(Wrappers.<CronTickerOccurrenceEntity>lambdaQuery()
                    .in(CronTickerOccurrenceEntity::getCronTickerId, ids)
                    .ne(CronTickerOccurrenceEntity::getStatus, TickerStatus.IN_PROGRESS.getCode()));
            return cronMapper.deleteBatchIds(ids);
        }));
    }

    // ----------------- 内部 -----------------

    private CronTickerOccurrenceEntity findOccurrence(String cronTickerId, Instant boundary) {
        return occurrenceMapper.selectOne(Wrappers.<CronTickerOccurrenceEntity>lambdaQuery()
                .eq(CronTickerOccurrenceEntity::getCronTickerId, cronTickerId)
                .eq(CronTickerOccurrenceEntity::getExecutionTime, boundary));
    }

    private static CronTickerOccurrenceEntity newOccurrence(CronTickerEntity cron, Instant boundary, Instant now) {
        CronTickerOccurrenceEntity o = new CronTickerOccurrenceEntity();
        o.setId(UUID.randomUUID().toString());
        o.setCronTickerId(cron.getId());
        o.setFunction(cron.getFunction());
        o.setStatus(TickerStatus.IDLE);
        o.setPriority(cron.getPriority());
        o.setRetries(cron.getRetries());
        o.setRetryCount(0);
        o.setRetryIntervals(cron.getRetryIntervals());
        o.setRequestPayload(cron.getRequestPayload());
        o.setExecutionTime(boundary);
        o.setCreatedAt(now);
        o.setUpdatedAt(now);
        return o;
    }

    /**
     * 数据访问异常统一转为 TickerStoreException
     */
    private static <T> T guard(String op, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new TickerStoreException("store operation '" + op + "' failed", e);
        }
    }
}
