package io.github.drompincen.mockjira.gateway.controller;

import io.github.drompincen.mockjira.gateway.web.RequestTraceLog;
import io.github.drompincen.mockjira.protocol.api.ImportResult;
import io.github.drompincen.mockjira.protocol.api.TraceEntry;
import io.github.drompincen.mockjira.runtime.auth.CostWindowRateLimiter;
import io.github.drompincen.mockjira.runtime.seed.DefaultSeed;
import io.github.drompincen.mockjira.runtime.seed.GeneratorConfig;
import io.github.drompincen.mockjira.runtime.seed.SeedGenerator;
import io.github.drompincen.mockjira.runtime.store.InMemoryStore;
import io.github.drompincen.mockjira.runtime.store.StoreSnapshot;
import io.github.drompincen.mockjira.runtime.webhook.WebhookDispatcher;
import io.github.drompincen.mockjira.runtime.webhook.WebhookSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator endpoints. Not gated: they are meant for test harnesses driving the mock.
 */
@RestController
@RequestMapping("/_mock")
public class MockAdminController {

    private static final Logger log = LoggerFactory.getLogger(MockAdminController.class);

    private final InMemoryStore store;
    private final CostWindowRateLimiter rateLimiter;
    private final WebhookDispatcher dispatcher;
    private final SeedGenerator seedGenerator;
    private final RequestTraceLog traceLog;
    private final Clock clock;
    private final String version;

    public MockAdminController(InMemoryStore store, CostWindowRateLimiter rateLimiter, WebhookDispatcher dispatcher,
                               SeedGenerator seedGenerator, RequestTraceLog traceLog, Clock clock,
                               @Value("${mockjira.version:1.0.0-SNAPSHOT}") String version) {
        this.store = store;
        this.rateLimiter = rateLimiter;
        this.dispatcher = dispatcher;
        this.seedGenerator = seedGenerator;
        this.traceLog = traceLog;
        this.clock = clock;
        this.version = version;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info() {
        Map<String, Integer> counts = store.counts();
        Map<String, Integer> seed = new LinkedHashMap<>();
        seed.put("projects", counts.get("projects"));
        seed.put("users", counts.get("users"));
        seed.put("issues", counts.get("issues"));
        seed.put("webhooks", counts.get("webhooks"));
        WebhookSettings settings = dispatcher.settings();
        Map<String, Object> signature = new LinkedHashMap<>();
        signature.put("version", settings.signatureVersion());
        signature.put("legacyCompat", settings.legacySignature());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("version", version);
        body.put("seed", seed);
        body.put("webhookSignature", signature);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/seed/export")
    public ResponseEntity<StoreSnapshot> export() {
        return ResponseEntity.ok(store.exportState());
    }

    @PostMapping("/seed/import")
    public ResponseEntity<ImportResult> importSnapshot(@RequestBody StoreSnapshot snapshot) {
        store.importState(snapshot);
        return ResponseEntity.ok(new ImportResult("imported", store.counts()));
    }

    /**
     * Same as import; without a body the built-in sample data is loaded.
     */
    @PostMapping("/seed/load")
    public ResponseEntity<ImportResult> load(@RequestBody(required = false) StoreSnapshot snapshot) {
        store.importState(snapshot != null ? snapshot : DefaultSeed.snapshot(clock));
        return ResponseEntity.ok(new ImportResult("loaded", store.counts()));
    }

    @PostMapping("/seed/generate")
    public ResponseEntity<ImportResult> generate(@RequestBody(required = false) GeneratorConfig config) {
        StoreSnapshot snapshot = seedGenerator.generate(config != null ? config : GeneratorConfig.defaults());
        store.importState(snapshot);
        return ResponseEntity.ok(new ImportResult("ok", store.counts()));
    }

    /**
     * Empties the store, rate windows, delivery logs and request trace; {@code seed=true} swaps the sample
     * data in instead of an empty store.
     */
    @PostMapping("/reset")
    public ResponseEntity<ImportResult> reset(@RequestParam(defaultValue = "false") boolean seed) {
        store.resetTo(seed ? DefaultSeed.snapshot(clock) : null);
        rateLimiter.resetWindows();
        dispatcher.clearLogs();
        traceLog.clear();
        log.info("Mock reset (seed={})", seed);
        return ResponseEntity.ok(new ImportResult("reset", store.counts()));
    }

    @GetMapping("/trace/{requestId}")
    public ResponseEntity<Map<String, List<TraceEntry>>> trace(@PathVariable String requestId) {
        return ResponseEntity.ok(Map.of("entries", traceLog.find(requestId)));
    }
}
