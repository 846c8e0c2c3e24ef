package com.fastticker.core.notify;

import com.fastticker.model.ctx.NotifyContext;
import com.fastticker.model.enums.Severity;
import org.springframework.beans.factory.ObjectProvider;

import java.util.function.Supplier;

public class NotifyingFacade {

    private final Supplier<AsyncNotifyingService> delegate;

    public NotifyingFacade(ObjectProvider<AsyncNotifyingService> p) {
        // 未启用notify则为 null
        this.delegate = p::getIfAvailable;
    }

    public NotifyingFacade(AsyncNotifyingService service) {
        this.delegate = () -> service;
    }

    /** 不派发任何通知 */
    public static NotifyingFacade noop() {
        return new NotifyingFacade((AsyncNotifyingService) null);
    }

    public void fire(NotifyContext ctx, Severity sev) {
        AsyncNotifyingService s = delegate.get();
        if (s != null) s.fire(ctx, sev);
    }
}
