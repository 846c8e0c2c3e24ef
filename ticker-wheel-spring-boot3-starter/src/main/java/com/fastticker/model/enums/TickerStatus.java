package com.fastticker.model.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.EnumSet;
import java.util.Set;

/**
 * Ticker状态
 */
@AllArgsConstructor
@Getter
public enum TickerStatus {
    IDLE(0, "已创建, 等待到期或等待父任务"),
    QUEUED(1, "已入队, 到期即可被抢占"),
    IN_PROGRESS(2, "执行中（被某节点独占）"),
    DONE(3, "晚于计划时间开始执行并成功，终态"),
    DUE_DONE(4, "在计划时间点或之前开始执行并成功，终态"),
    FAILED(5, "重试耗尽或不可重试，终态"),
    CANCELLED(6, "协作式取消，终态"),
    SKIPPED(7, "被更新的执行实例取代，终态")
    ;

    private static final Set<TickerStatus> TERMINALS = EnumSet.of(DONE, DUE_DONE, FAILED, CANCELLED, SKIPPED);

    @EnumValue
    public final int code;
    public final String desc;

    public boolean isTerminal() {
        return TERMINALS.contains(this);
    }

    /** 可被抢占的状态 */
    public boolean isClaimable() {
        return this == IDLE || this == QUEUED;
    }

    public boolean isSuccess() {
        return this == DONE || this == DUE_DONE;
    }

    public static TickerStatus of(int code) {
        for (TickerStatus s : values()) {
            if (s.code == code) {
                return s;
            }
        }
        throw new IllegalArgumentException("unknown ticker status code: " + code);
    }
}
