package com.fastticker.annotation;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EnableTickerWheel {

    /**
     * 是否启动调度扫描
     */
    boolean value() default true;
}
