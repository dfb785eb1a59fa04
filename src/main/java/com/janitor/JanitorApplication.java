package com.janitor;

import com.janitor.config.EnableJanitor;
import com.janitor.config.JanitorConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point of the janitor.
 */
@SpringBootApplication
@EnableJanitor
public class JanitorApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(JanitorApplication.class, args);
        JanitorConfig config = context.getBeanProvider(JanitorConfig.class).getIfAvailable();
        if (config != null && config.once() && context.isActive()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
