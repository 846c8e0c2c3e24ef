package com.fastticker.model;

import com.fastticker.model.enums.TickerPriority;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class CronTickerRequest {

    /** 新建时可为空（自动生成）, 更新时必填 */
    private String id;
    private String function;
    /** 六段 cron: 秒 分 时 日 月 周 */
    private String expression;
    private String description;
    private Object request;
    private Integer retries;
    private List<Integer> retryIntervals;
    private TickerPriority priority;
}
