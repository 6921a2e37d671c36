package com.inboxflow.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * RestTemplate used for provider send calls. Timeouts are bounded so a slow
 * provider cannot pin a dispatch worker indefinitely.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, InboxflowProperties properties) {
        InboxflowProperties.Dispatch dispatch = properties.getDispatch();
        return builder
                .setConnectTimeout(Duration.ofMillis(dispatch.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(dispatch.getReadTimeoutMs()))
                .build();
    }
}
