package io.github.drompincen.mockjira.gateway;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command line of the mock server. Resolution order for the port: {@code --port}, then
 * {@code MOCKJIRA_PORT}, then 8000.
 */
public record ServerOptions(String host, int port, String logLevel, boolean seed, String seedFile, boolean help) {

    public static final int DEFAULT_PORT = 8000;
    private static final Set<String> LOG_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    /**
     * @throws IllegalArgumentException on unknown flags, missing values or malformed numbers
     */
    public static ServerOptions parse(String[] args, Map<String, String> env) {
        String host = "0.0.0.0";
        int port = env.containsKey("MOCKJIRA_PORT") ? port(env.get("MOCKJIRA_PORT")) : DEFAULT_PORT;
        String logLevel = null;
        boolean seed = true;
        String seedFile = null;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--host" -> host = value(args, ++i, "--host");
                case "--port" -> port = port(value(args, ++i, "--port"));
                case "--log-level" -> {
                    logLevel = value(args, ++i, "--log-level").toUpperCase(Locale.ROOT);
                    if (!LOG_LEVELS.contains(logLevel)) {
                        throw new IllegalArgumentException("unknown log level '" + args[i] + "'");
                    }
                }
                case "--no-seed" -> seed = false;
                case "--seed-file" -> seedFile = value(args, ++i, "--seed-file");
                case "-h", "--help" -> help = true;
                default -> throw new IllegalArgumentException("unknown option '" + args[i] + "'");
            }
        }
        return new ServerOptions(host, port, logLevel, seed, seedFile, help);
    }

    /**
     * Spring properties that carry these options into the application context.
     */
    public Map<String, String> toProperties() {
        Map<String, String> props = new LinkedHashMap<>();
        props.put("server.address", host);
        props.put("server.port", Integer.toString(port));
        props.put("mockjira.seed.enabled", Boolean.toString(seed));
        if (seedFile != null) {
            props.put("mockjira.seed.file", seedFile);
        }
        if (logLevel != null) {
            props.put("logging.level.root", logLevel);
            props.put("logging.level.io.github.drompincen.mockjira", logLevel);
        }
        return props;
    }

    public static String usage() {
        return String.join(System.lineSeparator(),
                "Usage: mockjira [options]",
                "  --host <address>      bind address (default 0.0.0.0)",
                "  --port <port>         HTTP port (default " + DEFAULT_PORT + ", env MOCKJIRA_PORT)",
                "  --log-level <level>   TRACE, DEBUG, INFO, WARN, ERROR or OFF",
                "  --no-seed             start with an empty store",
                "  --seed-file <path>    load a JSON snapshot instead of the sample data",
                "  --help                print this help");
    }

    private static String value(String[] args, int index, String flag) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return args[index];
    }

    private static int port(String raw) {
        try {
            int port = Integer.parseInt(raw.trim());
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port out of range: " + raw);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port '" + raw + "'", e);
        }
    }
}
