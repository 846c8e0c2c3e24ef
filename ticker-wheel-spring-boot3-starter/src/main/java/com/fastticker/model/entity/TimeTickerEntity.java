package com.fastticker.model.entity;

import com.baomidou.mybatisplus.annotation.TableName;
import com.fastticker.model.enums.RunCondition;
import com.fastticker.model.enums.TickerType;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@TableName(value = "time_ticker", autoResultMap = true)
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TimeTickerEntity extends BaseTickerEntity {

    private String description;

    /** 父任务id, 弱引用 */
    private String parentId;

    /** 仅对子任务有意义 */
    private RunCondition runCondition;

    /** 分组引用, 与 parentId 无关 */
    private String batchParent;

    @Override
    public TickerType type() {
        return TickerType.TIME;
    }
}
