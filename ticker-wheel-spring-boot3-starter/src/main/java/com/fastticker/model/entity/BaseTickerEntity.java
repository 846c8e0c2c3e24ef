package com.fastticker.model.entity;

import com.baomidou.mybatisplus.annotation.FieldStrategy;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import com.fastticker.model.enums.TickerPriority;
import com.fastticker.model.enums.TickerStatus;
import com.fastticker.model.enums.TickerType;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * 可执行行的公共部分: TimeTicker 与 CronTickerOccurrence 共用
 */
@Data
public abstract class BaseTickerEntity {

    @TableId(type = IdType.INPUT)
    private String id;

    /** 执行时按名称解析的 function */
    @TableField("function_name")
    private String function;

    private TickerStatus status;

    private TickerPriority priority;

    /** 最大重试次数 */
    private Integer retries;

    /** 已重试次数 */
    private Integer retryCount;

    /** 退避间隔（秒）, 下标 = 第几次重试 */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private List<Integer> retryIntervals;

    /** 任务载荷, 对引擎不透明 */
    private byte[] requestPayload;

    /** 计划时间点; occurrence 上即 cron 边界, 创建后不变 */
    private Instant executionTime;

    /** 重试到期时间, 为空时按 executionTime 到期 */
    @TableField(updateStrategy = FieldStrategy.IGNORED)
    private Instant nextDueAt;

    /** 当前持有者节点 */
    private String lockedBy;

    private Instant lockedAt;

    /** 最近一次开始执行的时间 */
    private Instant executedAt;

    private Long elapsedMillis;

    /** 最后一次错误信息（截断） */
    private String exceptionMessage;

    private String skippedReason;

    private Instant createdAt;

    private Instant updatedAt;

    public abstract TickerType type();

    /** 实际到期时间 */
    public Instant dueAt() {
        return nextDueAt != null ? nextDueAt : executionTime;
    }

    public int retryCountOrZero() {
        return retryCount == null ? 0 : retryCount;
    }

    public int retriesOrZero() {
        return retries == null ? 0 : retries;
    }

    public TickerPriority priorityOrDefault() {
        return priority == null ? TickerPriority.NORMAL : priority;
    }
}
