package com.relevx.push;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PushConfig {

    @Bean
    public SubscriptionRegistry subscriptionRegistry() {
        return new SubscriptionRegistry();
    }

    @Bean
    public ProjectListPublisher projectListPublisher(SubscriptionRegistry registry) {
        return new SinkProjectListPublisher(registry);
    }
}
