package com.fastticker.model.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 子任务运行条件, 只对带 parentId 的 TimeTicker 有意义
 */
@AllArgsConstructor
@Getter
public enum RunCondition {
    ON_SUCCESS(0),
    ON_FAILURE(1),
    ON_CANCELLED(2),
    ON_FAILURE_OR_CANCELLED(3),
    ON_ANY_COMPLETED_STATUS(4),
    /** 父任务进入 IN_PROGRESS 即触发, 与父任务终态无关 */
    IN_PROGRESS(5)
    ;

    @EnumValue
    public final int code;

    /**
     * 父任务终态是否满足条件
     */
    public boolean matches(TickerStatus parentTerminal) {
        return switch (this) {
            case ON_SUCCESS -> parentTerminal.isSuccess();
            case ON_FAILURE -> parentTerminal == TickerStatus.FAILED;
            case ON_CANCELLED -> parentTerminal == TickerStatus.CANCELLED;
            case ON_FAILURE_OR_CANCELLED -> parentTerminal == TickerStatus.FAILED
                    || parentTerminal == TickerStatus.CANCELLED;
            case ON_ANY_COMPLETED_STATUS -> parentTerminal.isTerminal();
            case IN_PROGRESS -> false;
        };
    }
}
