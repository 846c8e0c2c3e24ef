package com.fastticker.core.notify.notifier;

import com.fastticker.core.spi.notify.Notifier;
import com.fastticker.model.ctx.NotifyContext;
import com.fastticker.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志通知, 默认启用
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void notify(NotifyContext ctx, Severity severity) {
        switch (severity) {
            case CRITICAL, ERROR -> log.error("[Notify-{}] function={}, ticker={}, reason={}, err={}, attrs={}",
                    ctx.getType(), ctx.getFunction(), ctx.getTickerId(), ctx.getReasonCode(),
                    truncate(ctx.getLastError()), ctx.getAttributes());
            case WARNING -> log.warn("[Notify-{}] function={}, ticker={}, reason={}, attrs={}",
                    ctx.getType(), ctx.getFunction(), ctx.getTickerId(), ctx.getReasonCode(), ctx.getAttributes());
            default -> log.info("[Notify-{}] function={}, ticker={}, attrs={}",
                    ctx.getType(), ctx.getFunction(), ctx.getTickerId(), ctx.getAttributes());
        }
    }

    private String truncate(String s) {
        return s == null ? null : (s.length() > 2000 ? s.substring(0, 2000) : s);
    }
}
