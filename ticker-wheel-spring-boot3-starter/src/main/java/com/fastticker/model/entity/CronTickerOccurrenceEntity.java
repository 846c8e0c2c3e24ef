package com.fastticker.model.entity;

import com.baomidou.mybatisplus.annotation.TableName;
import com.fastticker.model.enums.TickerType;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * cron 任务在一个边界时间点上的实例
 * (cronTickerId, executionTime) 唯一
 */
@TableName(value = "cron_ticker_occurrence", autoResultMap = true)
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class CronTickerOccurrenceEntity extends BaseTickerEntity {

    private String cronTickerId;

    @Override
    public TickerType type() {
        return TickerType.CRON_OCCURRENCE;
    }
}
