package com.evidex.core.service;

import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a prerequisite service. The annotated service refuses to start while
 * the prerequisite is not RUNNING and is failed when the prerequisite fails.
 */
@Target(TYPE)
@Retention(RUNTIME)
@Repeatable(DependsOn.List.class)
public @interface DependsOn {

    Class<? extends ManagedService> value();

    @Target(TYPE)
    @Retention(RUNTIME)
    @interface List {
        DependsOn[] value();
    }
}
