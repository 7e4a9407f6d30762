package io.github.drompincen.mockjira.gateway.config;

import io.github.drompincen.mockjira.runtime.auth.RateLimitSettings;
import io.github.drompincen.mockjira.runtime.seed.SeedGenerator;
import io.github.drompincen.mockjira.runtime.webhook.WebhookSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;

/**
 * Binds the {@code mockjira.*} properties to the settings records of the runtime components.
 */
@Configuration
public class MockJiraConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    RateLimitSettings rateLimitSettings(
            @Value("${mockjira.rate-limit.limit:100}") int limit,
            @Value("${mockjira.rate-limit.window-seconds:60}") long windowSeconds,
            @Value("${mockjira.rate-limit.read-cost:1}") int readCost,
            @Value("${mockjira.rate-limit.write-cost:2}") int writeCost,
            @Value("${mockjira.rate-limit.search-cost:5}") int searchCost,
            @Value("${mockjira.rate-limit.forced-retry-after-seconds:5}") long forcedRetryAfter) {
        return new RateLimitSettings(limit, Duration.ofSeconds(windowSeconds), readCost, writeCost, searchCost,
                forcedRetryAfter);
    }

    @Bean
    WebhookSettings webhookSettings(
            @Value("${mockjira.webhooks.secret:mock-webhook-secret}") String secret,
            @Value("${mockjira.webhooks.signature-version:2}") String signatureVersion,
            @Value("${mockjira.webhooks.legacy-signature:true}") boolean legacySignature,
            @Value("${mockjira.webhooks.jitter-min-ms:50}") long jitterMinMs,
            @Value("${mockjira.webhooks.jitter-max-ms:250}") long jitterMaxMs,
            @Value("${mockjira.webhooks.poison-rate:0.0}") double poisonRate,
            @Value("${mockjira.webhooks.send-timeout-ms:500}") long sendTimeoutMs,
            @Value("${mockjira.webhooks.queue-capacity:1000}") int queueCapacity,
            @Value("${mockjira.webhooks.log-capacity:5000}") int logCapacity,
            @Value("${mockjira.webhooks.random-seed:0}") long randomSeed) {
        return new WebhookSettings(secret, signatureVersion, legacySignature, Duration.ofMillis(jitterMinMs),
                Duration.ofMillis(Math.max(jitterMinMs, jitterMaxMs)), poisonRate, Duration.ofMillis(sendTimeoutMs),
                queueCapacity, logCapacity, randomSeed);
    }

    @Bean
    ThreadPoolTaskExecutor webhookExecutor(@Value("${mockjira.webhooks.workers:4}") int workers) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setThreadNamePrefix("webhook-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    SeedGenerator seedGenerator(Clock clock) {
        return new SeedGenerator(clock);
    }
}
