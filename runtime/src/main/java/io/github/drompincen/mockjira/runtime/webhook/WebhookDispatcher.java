package io.github.drompincen.mockjira.runtime.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.mockjira.runtime.model.WebhookRegistration;
import io.github.drompincen.mockjira.runtime.query.QueryEvaluator;
import io.github.drompincen.mockjira.runtime.query.QueryParser;
import io.github.drompincen.mockjira.runtime.query.QueryPlan;
import io.github.drompincen.mockjira.runtime.query.QuerySyntaxException;
import io.github.drompincen.mockjira.runtime.store.InMemoryStore;
import io.github.drompincen.mockjira.runtime.store.StoreEvent;
import io.github.drompincen.mockjira.runtime.store.StoreEventListener;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Executor;

/**
 * Fans store events out to matching webhook registrations. Each registration has its own serial
 * lane so deliveries to one target keep event order; failures are recorded, never raised.
 */
@Service
public class WebhookDispatcher implements StoreEventListener {

    private static final Logger log = LoggerFactory.getLogger(WebhookDispatcher.class);

    public static final String EVENT_ID_HEADER = "X-MockJira-Event-Id";
    public static final String WEBHOOK_ID_HEADER = "X-MockJira-Webhook-Id";
    public static final String SIGNATURE_HEADER = "X-MockJira-Signature";
    public static final String SIGNATURE_VERSION_HEADER = "X-MockJira-Signature-Version";
    public static final String LEGACY_SIGNATURE_HEADER = "X-MockJira-Legacy-Signature";

    static final String POISON_DROP = "drop";
    static final String POISON_CORRUPT = "corrupt";
    private static final String BOGUS_SIGNATURE = WebhookSigner.PREFIX + "0".repeat(64);

    private final InMemoryStore store;
    private final WebhookTransport transport;
    private final WebhookSettings settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Sleeper sleeper;
    private final QueryEvaluator evaluator;
    private final DeliveryLanes lanes;
    private final Random random;
    private final int logCapacity;
    private final Deque<DeliveryRecord> deliveries = new ArrayDeque<>();
    private final Deque<DeliveryAttempt> attempts = new ArrayDeque<>();

    @Autowired
    public WebhookDispatcher(InMemoryStore store, WebhookTransport transport, WebhookSettings settings,
                             ObjectMapper objectMapper, Clock clock,
                             @Qualifier("webhookExecutor") Executor executor) {
        this(store, transport, settings, objectMapper, clock, executor, Sleeper.THREAD);
    }

    public WebhookDispatcher(InMemoryStore store, WebhookTransport transport, WebhookSettings settings,
                             ObjectMapper objectMapper, Clock clock, Executor executor, Sleeper sleeper) {
        this.store = store;
        this.transport = transport;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.sleeper = sleeper;
        this.evaluator = new QueryEvaluator(clock);
        this.lanes = new DeliveryLanes(executor, settings.queueCapacity());
        this.logCapacity = Math.max(1, settings.logCapacity());
        this.random = settings.randomSeed() != 0 ? new Random(settings.randomSeed()) : new Random();
    }

    @PostConstruct
    public void attach() {
        store.addListener(this);
        log.info("Webhook dispatcher attached (signature v{}, legacy={}, poisonRate={})",
                settings.signatureVersion(), settings.legacySignature(), settings.poisonRate());
    }

    @PreDestroy
    public void shutdown() {
        int dropped = lanes.close();
        if (dropped > 0) {
            log.info("Abandoned {} pending webhook deliveries on shutdown", dropped);
        }
    }

    @Override
    public void onEvent(StoreEvent event) {
        for (WebhookRegistration registration : store.listWebhooks()) {
            if (!registration.events().contains(event.type().wireName()) || !filterMatches(registration, event)) {
                continue;
            }
            boolean accepted = lanes.submit(registration.id(), () -> deliver(registration, event));
            if (!accepted) {
                log.warn("Webhook {} queue full, dropping event {}", registration.id(), event.eventId());
                Instant now = clock.instant();
                recordAttempt(new DeliveryAttempt(event.eventId(), registration.id(), registration.url(), null,
                        "delivery queue full", 0, 0, false, now));
                recordDelivery(registration, event, DeliveryOutcome.FAILED, null, now);
            }
        }
    }

    public List<DeliveryRecord> deliveries() {
        synchronized (deliveries) {
            return List.copyOf(deliveries);
        }
    }

    public List<DeliveryAttempt> attempts() {
        synchronized (attempts) {
            return List.copyOf(attempts);
        }
    }

    public int pending() {
        return lanes.pending();
    }

    public void clearLogs() {
        synchronized (deliveries) {
            deliveries.clear();
        }
        synchronized (attempts) {
            attempts.clear();
        }
    }

    public WebhookSettings settings() {
        return settings;
    }

    private boolean filterMatches(WebhookRegistration registration, StoreEvent event) {
        if (registration.jqlFilter() == null || registration.jqlFilter().isBlank()) {
            return true;
        }
        try {
            QueryPlan plan = QueryParser.parse(registration.jqlFilter());
            return evaluator.matches(plan, event.attributes(), registration.createdBy());
        } catch (QuerySyntaxException e) {
            log.warn("Webhook {} has an unparseable filter '{}'", registration.id(), registration.jqlFilter(), e);
            return false;
        }
    }

    void deliver(WebhookRegistration registration, StoreEvent event) {
        long jitterMs = nextJitterMillis();
        try {
            sleeper.sleep(Duration.ofMillis(jitterMs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(registration, event, null, "interrupted", 0, jitterMs, null);
            return;
        }

        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(event.payload());
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise event {} for webhook {}", event.eventId(), registration.id(), e);
            fail(registration, event, null, "serialisation failed: " + e.getOriginalMessage(), 0, jitterMs, null);
            return;
        }

        String poisonMode = rollPoison();
        if (POISON_DROP.equals(poisonMode)) {
            log.debug("Poisoned delivery of {} to webhook {} dropped", event.eventId(), registration.id());
            fail(registration, event, null, "poisoned: dropped", 0, jitterMs, poisonMode);
            return;
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(EVENT_ID_HEADER, event.eventId());
        headers.put(WEBHOOK_ID_HEADER, registration.id());
        headers.put(SIGNATURE_VERSION_HEADER, settings.signatureVersion());
        if (POISON_CORRUPT.equals(poisonMode)) {
            body = Arrays.copyOf(body, body.length / 2);
            headers.put(SIGNATURE_HEADER, BOGUS_SIGNATURE);
        } else {
            headers.put(SIGNATURE_HEADER, WebhookSigner.sign(settings.secret(), body));
            if (settings.legacySignature()) {
                headers.put(LEGACY_SIGNATURE_HEADER, WebhookSigner.signLegacy(settings.secret(), body));
            }
        }

        long started = System.nanoTime();
        Integer status = null;
        String error = null;
        try {
            status = transport.send(registration.url(), headers, body, settings.sendTimeout());
            if (status < 200 || status >= 300) {
                error = "HTTP " + status;
            }
        } catch (HttpTimeoutException e) {
            error = "timeout after " + settings.sendTimeout().toMillis() + "ms";
        } catch (IOException | RuntimeException e) {
            error = e.getClass().getSimpleName() + ": " + e.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error = "interrupted";
        }
        long latencyMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

        if (poisonMode != null) {
            fail(registration, event, status, "poisoned: corrupted payload", latencyMs, jitterMs, poisonMode);
        } else if (error != null) {
            log.warn("Delivery of {} to webhook {} ({}) failed: {}", event.eventId(), registration.id(),
                    registration.url(), error);
            fail(registration, event, status, error, latencyMs, jitterMs, null);
        } else {
            log.debug("Delivered {} to webhook {} in {}ms", event.eventId(), registration.id(), latencyMs);
            Instant now = clock.instant();
            recordAttempt(new DeliveryAttempt(event.eventId(), registration.id(), registration.url(), status,
                    null, latencyMs, jitterMs, false, now));
            recordDelivery(registration, event, DeliveryOutcome.DELIVERED, null, now);
        }
    }

    private void fail(WebhookRegistration registration, StoreEvent event, Integer status, String error,
                      long latencyMs, long jitterMs, String poisonMode) {
        Instant now = clock.instant();
        recordAttempt(new DeliveryAttempt(event.eventId(), registration.id(), registration.url(), status, error,
                latencyMs, jitterMs, poisonMode != null, now));
        recordDelivery(registration, event, DeliveryOutcome.FAILED, poisonMode, now);
    }

    private void recordDelivery(WebhookRegistration registration, StoreEvent event, DeliveryOutcome outcome,
                                String poisonMode, Instant completedAt) {
        DeliveryRecord record = new DeliveryRecord(event.eventId(), registration.id(), registration.url(),
                event.type().wireName(), outcome, poisonMode != null, poisonMode, event.timestamp(), completedAt,
                event.payload().deepCopy());
        synchronized (deliveries) {
            append(deliveries, record);
        }
    }

    private void recordAttempt(DeliveryAttempt attempt) {
        synchronized (attempts) {
            append(attempts, attempt);
        }
    }

    private <T> void append(Deque<T> log, T entry) {
        if (log.size() == logCapacity) {
            log.removeFirst();
        }
        log.addLast(entry);
    }

    private long nextJitterMillis() {
        long min = Math.max(0, settings.jitterMin().toMillis());
        long max = Math.max(min, settings.jitterMax().toMillis());
        if (max == min) {
            return min;
        }
        synchronized (random) {
            return min + (long) (random.nextDouble() * (max - min + 1));
        }
    }

    private String rollPoison() {
        if (settings.poisonRate() <= 0) {
            return null;
        }
        synchronized (random) {
            if (random.nextDouble() >= settings.poisonRate()) {
                return null;
            }
            return random.nextBoolean() ? POISON_DROP : POISON_CORRUPT;
        }
    }
}
