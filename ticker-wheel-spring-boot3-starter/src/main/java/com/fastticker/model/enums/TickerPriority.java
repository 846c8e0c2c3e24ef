package com.fastticker.model.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 执行优先级
 * LONG_RUNNING 不参与排序, 走独立的无上限线程池
 */
@AllArgsConstructor
@Getter
public enum TickerPriority {
    HIGH(0),
    NORMAL(1),
    LOW(2),
    LONG_RUNNING(3)
    ;

    /** 越小越优先 */
    @EnumValue
    public final int rank;
}
