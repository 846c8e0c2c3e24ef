package com.fastticker.core.spi.notify;

import com.fastticker.model.ctx.NotifyContext;
import com.fastticker.model.enums.Severity;

/**
 * 事件通知器（失败、回收、引擎异常等）
 */
public interface Notifier {

    /**
     * 返回此Notifier支持的渠道/名称, 用于路由日志与指标纬度
     */
    String name();

    /**
     * 能否处理此事件, 粗粒度过滤
     */
    default boolean supports(NotifyContext ctx) {
        return true;
    }

    /**
     * 派发通知, 同步方法 框架层负责异步调用
     */
    void notify(NotifyContext ctx, Severity severity);

}
