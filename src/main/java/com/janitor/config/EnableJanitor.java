package com.janitor.config;

import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the janitor in a Spring Boot application.
 *
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableJanitor
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
@Import(JanitorAutoConfiguration.class)
public @interface EnableJanitor {
}
