package io.github.drompincen.mockjira.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.mockjira.runtime.seed.DefaultSeed;
import io.github.drompincen.mockjira.runtime.store.InMemoryStore;
import io.github.drompincen.mockjira.runtime.store.StoreSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Populates the store once the context is up: a snapshot file when one is configured, otherwise the
 * sample data unless seeding is disabled.
 */
@Component
public class SeedInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SeedInitializer.class);

    private final InMemoryStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean seedEnabled;
    private final String seedFile;

    public SeedInitializer(InMemoryStore store, ObjectMapper objectMapper, Clock clock,
                           @Value("${mockjira.seed.enabled:true}") boolean seedEnabled,
                           @Value("${mockjira.seed.file:}") String seedFile) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.seedEnabled = seedEnabled;
        this.seedFile = seedFile;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (seedFile != null && !seedFile.isBlank()) {
            Path path = Path.of(seedFile);
            try {
                store.importState(objectMapper.readValue(Files.readAllBytes(path), StoreSnapshot.class));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read seed file " + path, e);
            }
            log.info("Loaded seed file {}", path);
        } else if (seedEnabled) {
            store.importState(DefaultSeed.snapshot(clock));
            log.info("Loaded default sample data");
        } else {
            log.info("Seeding disabled, starting with an empty store");
        }
    }
}
