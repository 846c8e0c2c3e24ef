package com.fastticker.model.enums;

/**
 * 通知事件
 */
public enum NotifyEventType {
    /** 不可重试的失败 */
    FAILED,

    /** 达到最大重试 */
    MAX_RETRY_REACHED,

    /** 执行时找不到 function */
    FUNCTION_NOT_FOUND,

    /** 协作式取消 */
    CANCELLED,

    /** 宕机节点持有的任务被回收 */
    RECLAIMED,

    /** 持久化失败（Store/DB） */
    PERSIST_FAILED,

    /** 引擎级异常（扫描周期中断、心跳失败等） */
    ENGINE_ERROR
}
