package io.github.drompincen.mockjira.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.mockjira")
public class MockJiraApplication {

    private static final Logger log = LoggerFactory.getLogger(MockJiraApplication.class);

    public static void main(String... args) {
        ServerOptions options;
        try {
            options = ServerOptions.parse(args, System.getenv());
        } catch (IllegalArgumentException e) {
            System.err.println("mockjira: " + e.getMessage());
            System.err.println(ServerOptions.usage());
            System.exit(2);
            return;
        }
        if (options.help()) {
            System.out.println(ServerOptions.usage());
            return;
        }

        options.toProperties().forEach(System::setProperty);
        try {
            SpringApplication.run(MockJiraApplication.class);
        } catch (RuntimeException e) {
            log.error("Mock server failed to start", e);
            System.exit(1);
        }
    }
}
