package com.fastticker.model.enums;

/**
 * 可执行行的种类
 */
public enum TickerType {
    /** 一次性任务 */
    TIME,

    /** cron 任务在某个边界时间点的实例 */
    CRON_OCCURRENCE
}
