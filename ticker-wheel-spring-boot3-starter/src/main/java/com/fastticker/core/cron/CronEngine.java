package com.fastticker.core.cron;

import com.fastticker.exception.InvalidCronExpressionException;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 六段 cron 计算: 秒 分 时 日 月 周
 * 边界按配置时区解释, 对外统一使用 Instant
 */
public class CronEngine {

    private static final int FIELDS = 6;

    private final ZoneId zone;

    private final Map<String, CronExpression> cache = new ConcurrentHashMap<>();

    public CronEngine(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    /**
     * 校验表达式, 不合法时抛 {@link InvalidCronExpressionException}
     */
    public void validate(String expression) {
        CronExpression cron = parse(expression);
        // 语法合法但永远不会触发（如 2月30日）同样视为非法
        if (cron.next(ZonedDateTime.now(zone)) == null) {
            throw new InvalidCronExpressionException(expression, "expression never fires");
        }
    }

    /**
     * 严格晚于 after 的第一个边界
     */
    public Instant nextOccurrence(String expression, Instant after) {
        ZonedDateTime next = parse(expression).next(after.atZone(zone));
        if (next == null) {
            throw new InvalidCronExpressionException(expression, "no occurrence after " + after);
        }
        return next.toInstant();
    }

    /**
     * (afterExclusive, untilInclusive] 内的边界, 升序
     * 超过 limit 时只保留最近的 limit 个
     */
    public List<Instant> boundaries(String expression, Instant afterExclusive, Instant untilInclusive, int limit) {
        if (limit <= 0 || !untilInclusive.isAfter(afterExclusive)) {
            return List.of();
        }
        CronExpression cron = parse(expression);
        Deque<Instant> window = new ArrayDeque<>(Math.min(limit, 64));
        ZonedDateTime cursor = afterExclusive.atZone(zone);
        while (true) {
            cursor = cron.next(cursor);
            if (cursor == null || cursor.toInstant().isAfter(untilInclusive)) {
                break;
            }
            if (window.size() == limit) {
                window.pollFirst();
            }
            window.addLast(cursor.toInstant());
        }
        return new ArrayList<>(window);
    }

    public ZoneId getZone() {
        return zone;
    }

    private CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException(String.valueOf(expression), "expression is empty");
        }
        String normalized = expression.trim();
        return cache.computeIfAbsent(normalized, e -> {
            int fields = e.split("\\s+").length;
            if (fields != FIELDS) {
                throw new InvalidCronExpressionException(e, "expected " + FIELDS + " fields but got " + fields);
            }
            try {
                return CronExpression.parse(e);
            } catch (IllegalArgumentException ex) {
                throw new InvalidCronExpressionException(e, ex);
            }
        });
    }
}
