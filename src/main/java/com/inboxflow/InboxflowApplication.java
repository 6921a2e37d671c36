package com.inboxflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Process entry point. Starts the webhook gate, the Kafka workers (event processing,
 * message dispatch, retries) and the flow execution poller inside one Spring context,
 * so everything shuts down with the context.
 */
@SpringBootApplication
@EnableScheduling
public class InboxflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(InboxflowApplication.class, args);
    }
}
