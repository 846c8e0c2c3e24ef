package com.fastticker.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import com.fastticker.model.enums.TickerPriority;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * cron 任务定义, 每个边界时间点物化为一条 occurrence
 */
@TableName(value = "cron_ticker", autoResultMap = true)
@Data
public class CronTickerEntity {

    @TableId(type = IdType.INPUT)
    private String id;

    @TableField("function_name")
    private String function;

    /** 六段 cron: 秒 分 时 日 月 周 */
    private String expression;

    private String description;

    private TickerPriority priority;

    private Integer retries;

    @TableField(typeHandler = JacksonTypeHandler.class)
    private List<Integer> retryIntervals;

    private byte[] requestPayload;

    /** 下一个尚未物化的边界 */
    private Instant nextOccurrence;

    /** 是否由 function 声明的 cron 自动创建 */
    private Boolean seeded;

    private Instant createdAt;

    private Instant updatedAt;
}
