package com.fastticker.core.function;

import com.fastticker.core.spi.TickerFunctionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * function 注册表, 启动时构建, 之后只读
 */
public class TickerFunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(TickerFunctionRegistry.class);

    private final Map<String, TickerFunctionHandler<?>> handlers;

    public TickerFunctionRegistry(List<? extends TickerFunctionHandler<?>> discovered) {
        Map<String, TickerFunctionHandler<?>> m = new LinkedHashMap<>();
        if (discovered != null) {
            for (TickerFunctionHandler<?> h : discovered) {
                String name = h.name();
                if (name == null || name.isBlank()) {
                    throw new IllegalStateException("ticker function " + h.getClass().getName() + " has no name");
                }
                TickerFunctionHandler<?> prev = m.putIfAbsent(name, h);
                if (prev != null) {
                    throw new IllegalStateException("duplicate ticker function name '" + name + "': "
                            + prev.getClass().getName() + " and " + h.getClass().getName());
                }
            }
        }
        this.handlers = Collections.unmodifiableMap(m);
        log.info("[Functions] registered {}", handlers.keySet());
    }

    public static TickerFunctionRegistry of(TickerFunctionHandler<?>... handlers) {
        return new TickerFunctionRegistry(List.of(handlers));
    }

    public Optional<TickerFunctionHandler<?>> find(String name) {
        return Optional.ofNullable(name == null ? null : handlers.get(name));
    }

    public boolean contains(String name) {
        return name != null && handlers.containsKey(name);
    }

    public Collection<TickerFunctionHandler<?>> all() {
        return handlers.values();
    }
}
