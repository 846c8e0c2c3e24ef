package com.fastticker.core.spi;

import com.fastticker.model.ExecutionRecord;
import com.fastticker.model.entity.BaseTickerEntity;
import com.fastticker.model.entity.CronTickerEntity;
import com.fastticker.model.entity.CronTickerOccurrenceEntity;
import com.fastticker.model.entity.TimeTickerEntity;
import com.fastticker.model.enums.TickerStatus;
import com.fastticker.model.enums.TickerType;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * 任务存储
 * 多节点正确性完全依赖 {@link #tryClaim} 在存储层是真正的 compare-and-swap
 *
 * 实现方在不可达时抛 {@link com.fastticker.exception.TickerStoreException}
 */
public interface TickerStore {

    // ----------------- 调度 -----------------

    /**
     * 到期且可执行的行: executionTime <= now, 状态 QUEUED 或（没有父任务的）IDLE
     * 等待父任务放行的子任务不会返回
     */
    List<BaseTickerEntity> findDue(TickerType type, Instant now, int limit);

    /** nextOccurrence <= now 的 cron 定义 */
    List<CronTickerEntity> findDueCronTickers(Instant now, int limit);

    /**
     * 原子抢占: IDLE/QUEUED → IN_PROGRESS 并写入 lockedBy/lockedAt
     * @return true=本次调用完成了状态迁移
     */
    boolean tryClaim(TickerType type, String id, String nodeId, Instant now);

    /** 释放抢占: IN_PROGRESS → QUEUED, 清空锁, 仅持有者可释放 */
    boolean release(TickerType type, String id, String nodeId);

    /** 失败待重试: IN_PROGRESS → newStatus, 写入下次到期时间与重试次数, 清空锁 */
    boolean reschedule(TickerType type, String id, String nodeId, Instant nextDue,
                       TickerStatus newStatus, int retryCount, String lastError);

    /** 终态写回, 仅持有者可写, 清空锁 */
    boolean setTerminal(TickerType type, String id, String nodeId, TickerStatus status, ExecutionRecord record);

    /** 宕机回收: lockedBy = nodeId 且 IN_PROGRESS 的行全部回到 QUEUED */
    int releaseAllLockedBy(String nodeId);

    // ----------------- cron -----------------

    /** 以 (cronTickerId, boundary) 幂等创建 occurrence, 已存在时返回已有行 */
    CronTickerOccurrenceEntity upsertOccurrence(CronTickerEntity cron, Instant boundary);

    /** nextOccurrence 比较并替换 */
    boolean advanceCronTicker(String cronTickerId, Instant expectedNext, Instant newNext);

    /** 是否存在同一 cron 更晚且已到期、尚未终结的 occurrence */
    boolean existsNewerDueOccurrence(String cronTickerId, Instant boundary, Instant now);

    /** 是否有同一 cron 更早边界的 occurrence 正在执行 */
    boolean existsRunningOccurrenceBefore(String cronTickerId, Instant boundary);

    // ----------------- 父子链 -----------------

    List<TimeTickerEntity> findChildren(String parentId);

    /** 子任务 IDLE → QUEUED, executionTime 为空时补为 dueAt */
    boolean queueChild(String childId, Instant dueAt);

    /** 立即执行: 未被抢占的 TimeTicker 到期时间提前到 now */
    boolean expedite(String timeTickerId, Instant now);

    // ----------------- 管理 -----------------

    BaseTickerEntity get(TickerType type, String id);

    TimeTickerEntity getTimeTicker(String id);

    CronTickerEntity getCronTicker(String id);

    /** 由 function 声明自动创建的 cron 定义 */
    CronTickerEntity findSeededCronTicker(String function);

    int addTimeTickers(List<TimeTickerEntity> tickers);

    /** 只更新未被抢占（IDLE/QUEUED 且无锁）的行 */
    int updateTimeTickers(List<TimeTickerEntity> tickers);

    int deleteTimeTickers(Collection<String> ids);

    int addCronTickers(List<CronTickerEntity> tickers);

    int updateCronTickers(List<CronTickerEntity> tickers);

    /** 同时删除未在执行的 occurrence */
    int deleteCronTickers(Collection<String> ids);
}
