package com.fastticker.core.execution;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 协作式取消信号
 * 引擎不会强行终止 handler, 只在 handler 观察到信号并返回后标记 CANCELLED
 */
public class CancellationToken {

    private final AtomicBoolean requested = new AtomicBoolean(false);

    private volatile boolean observed;

    /**
     * @return true=本次调用发出了取消请求
     */
    public boolean request() {
        return requested.compareAndSet(false, true);
    }

    public boolean isRequested() {
        return requested.get();
    }

    /** handler 是否读到过取消信号 */
    public boolean isObserved() {
        return observed;
    }

    void markObserved() {
        observed = true;
    }

    /** 读取并记录观察 */
    public boolean poll() {
        boolean r = requested.get();
        if (r) {
            markObserved();
        }
        return r;
    }
}
