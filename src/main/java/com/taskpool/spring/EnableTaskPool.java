package com.taskpool.spring;

import com.taskpool.adapter.spring.PoolAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the worker pool in a Spring application that does not rely on auto-configuration.
 *
 * Usage:
 * <pre>
 * &#64;Configuration
 * &#64;EnableTaskPool
 * public class AlignmentConfiguration {
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(PoolAutoConfiguration.class)
public @interface EnableTaskPool {
}
