package com.fastticker.model;

import io.netty.util.Timeout;
import io.netty.util.TimerTask;

/**
 * 时间轮上的引擎周期任务
 * 让时间轮返回的 Timeout 能识别任务种类
 */
public class WheelTask implements TimerTask {

    public enum Kind { SCAN, HEARTBEAT }

    private final Kind kind;

    /** 真正要执行的逻辑 */
    private final Runnable actual;

    public WheelTask(Kind kind, Runnable actual) {
        this.kind = kind;
        this.actual = actual;
    }

    @Override
    public void run(Timeout timeout) throws Exception {
        if (timeout.isCancelled()) {
            return;
        }
        actual.run();
    }

    public Kind getKind() {
        return kind;
    }
}
