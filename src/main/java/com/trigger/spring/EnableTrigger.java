package com.trigger.spring;

import com.trigger.adapter.spring.TriggerAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the trigger engine in a Spring Boot application.
 *
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableTrigger
 * public class MyApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(MyApplication.class, args);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(TriggerAutoConfiguration.class)
public @interface EnableTrigger {
}
