package com.trigger;

import com.trigger.rule.RuleManager;
import com.trigger.spring.EnableTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.CountDownLatch;

/**
 * Spring Boot entry point. Runs the rule engine until the process is stopped.
 */
@SpringBootApplication
@EnableTrigger
public class TriggerApplication {

    private static final Logger log = LoggerFactory.getLogger(TriggerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TriggerApplication.class, args);
    }

    @Bean
    public CommandLineRunner engine(RuleManager ruleManager) {
        return args -> {
            log.info("Trigger engine running with {} rules", ruleManager.getRules().size());

            // Engine threads are daemons; keep the JVM alive until shutdown
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(stopped::countDown, "trigger-shutdown"));
            stopped.await();
        };
    }
}
