package com.fastticker.model;

import com.fastticker.model.enums.RunCondition;
import com.fastticker.model.enums.TickerPriority;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class TimeTickerRequest {

    /** 新建时可为空（自动生成）, 更新时必填 */
    private String id;
    private String function;
    private String description;
    /** 到期时间, 子任务可为空（被父任务放行时立即到期） */
    private Instant executionTime;
    /** 任务载荷, 由 PayloadSerializer 序列化 */
    private Object request;
    private Integer retries;
    /** 退避间隔（秒） */
    private List<Integer> retryIntervals;
    /** 为空时取 function 声明的优先级 */
    private TickerPriority priority;
    /** 挂到已存在的父任务下 */
    private String parentId;
    private RunCondition runCondition;
    private String batchParent;
    /** 创建时一并落库的子任务 */
    @Singular
    private List<TimeTickerRequest> children;
}
