package com.fastticker.core.notify.route;

import com.fastticker.core.spi.notify.Notifier;
import com.fastticker.core.spi.notify.NotifierRouter;
import com.fastticker.model.ctx.NotifyContext;
import com.fastticker.model.enums.Severity;

import java.util.List;

/**
 * 简单路由
 * 所有事件广播给全部已注册的 Notifier
 */
public class SimpleRouter implements NotifierRouter {

    private final List<Notifier> notifiers;

    public SimpleRouter(List<Notifier> notifiers) {
        this.notifiers = List.copyOf(notifiers);
    }

    @Override
    public List<Notifier> route(NotifyContext ctx, Severity severity) {
        return notifiers;
    }
}
