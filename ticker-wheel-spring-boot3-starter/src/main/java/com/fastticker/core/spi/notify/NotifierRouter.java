package com.fastticker.core.spi.notify;

import com.fastticker.model.ctx.NotifyContext;
import com.fastticker.model.enums.Severity;

import java.util.List;

/**
 * 路由：根据事件 → 选择若干 Notifier
 */
public interface NotifierRouter {

    List<Notifier> route(NotifyContext ctx, Severity severity);
}
