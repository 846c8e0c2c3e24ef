package com.fastticker.core.spi;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fastticker.model.ctx.TickerFunctionContext;
import com.fastticker.model.enums.TickerPriority;

/**
 * 任务函数
 */
public interface TickerFunctionHandler<T> {

    /** 注册名, 任务通过它解析到函数 */
    String name();

    /** 正常返回=成功；抛异常=失败（进入重试/失败策略）*/
    void execute(TickerFunctionContext ctx, T payload) throws Exception;

    /** 负载类型 */
    TypeReference<T> payloadType();

    /** 声明的 cron, 非空时启动时自动创建 cron 任务 */
    default String cronExpression() {
        return null;
    }

    /** 请求未指定优先级时使用 */
    default TickerPriority priority() {
        return TickerPriority.NORMAL;
    }
}
