package com.projectdesk;

import com.projectdesk.providers.GenerationEndpoint;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Application configuration: command-line arguments with environment fallbacks.
 */
public class AppConfig {

    private static final String APP_NAME = "Project-Desk";
    public static final long DEFAULT_GENERATION_TIMEOUT_MS = 300_000L;

    private final Path projectsPath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;
    private final GenerationEndpoint endpoint;
    private final String apiKey;
    private final long generationTimeoutMs;
    private final boolean shellEnabled;
    private final List<String> corsOrigins;

    private AppConfig(Builder b, Path projectsPath, Path logPath, int port) {
        this.projectsPath = projectsPath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = b.devMode;
        this.endpoint = new GenerationEndpoint(b.provider, b.model, b.baseUrl, b.maxOutputTokens, b.maxRetries);
        this.apiKey = b.apiKey;
        this.generationTimeoutMs = b.generationTimeoutMs;
        this.shellEnabled = b.shellEnabled;
        this.corsOrigins = List.copyOf(b.corsOrigins.isEmpty()
            ? List.of("http://localhost:5173", "http://127.0.0.1:5173")
            : b.corsOrigins);
    }

    public Path getProjectsPath() {
        return projectsPath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    public GenerationEndpoint getEndpoint() {
        return endpoint;
    }

    public String getApiKey() {
        return apiKey;
    }

    public long getGenerationTimeoutMs() {
        return generationTimeoutMs;
    }

    public boolean isShellEnabled() {
        return shellEnabled;
    }

    public List<String> getCorsOrigins() {
        return corsOrigins;
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\Project-Desk\logs
     * macOS: ~/Library/Logs/Project-Desk
     * Linux: ~/.local/share/Project-Desk/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    public static Path getLogFilePath() {
        return getLogDirectory().resolve("project-desk.log");
    }

    /**
     * Find an available port, starting with the preferred port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
                if (isPortAvailable(port)) {
                    return port;
                }
            }
        }
        // let the server fail later with a clear bind error
        return preferredPort;
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static Path ensureLogDirectory() throws IOException {
        Path logDir = getLogDirectory();
        Files.createDirectories(logDir);
        return getLogFilePath();
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Path projectsPath = null;
        private int preferredPort = 8000;
        private boolean devMode = false;
        private String provider;
        private String model;
        private String baseUrl;
        private int maxOutputTokens = GenerationEndpoint.DEFAULT_MAX_OUTPUT_TOKENS;
        private int maxRetries = GenerationEndpoint.DEFAULT_MAX_RETRIES;
        private String apiKey;
        private long generationTimeoutMs = DEFAULT_GENERATION_TIMEOUT_MS;
        private boolean shellEnabled = true;
        private final List<String> corsOrigins = new ArrayList<>();

        public Builder() {
            this(System::getenv);
        }

        public Builder(Function<String, String> env) {
            projectsPath(env.apply("DESK_PROJECTS_DIR"));
            this.provider = firstNonBlank(env.apply("DESK_PROVIDER"), "anthropic");
            this.model = firstNonBlank(env.apply("DESK_MODEL"), "claude-sonnet-4-20250514");
            this.baseUrl = env.apply("DESK_BASE_URL");
            this.maxOutputTokens = parseInt(env.apply("DESK_MAX_OUTPUT_TOKENS"), maxOutputTokens);
            this.maxRetries = parseInt(env.apply("DESK_MAX_RETRIES"), maxRetries);
            this.apiKey = firstNonBlank(env.apply("DESK_API_KEY"), env.apply("ANTHROPIC_API_KEY"));
        }

        public Builder projectsPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.projectsPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                String value = null;
                String name = arg;
                int eq = arg.indexOf('=');
                if (arg.startsWith("--") && eq > 0) {
                    name = arg.substring(0, eq);
                    value = arg.substring(eq + 1);
                } else if (i + 1 < args.length && takesValue(arg)) {
                    value = args[++i];
                }

                switch (name) {
                    case "--projects":
                        projectsPath(value);
                        break;
                    case "--port":
                        try {
                            this.preferredPort = Integer.parseInt(value);
                        } catch (NumberFormatException ignored) {
                            // keep default port
                        }
                        break;
                    case "--dev":
                        this.devMode = true;
                        break;
                    case "--provider":
                        this.provider = value;
                        break;
                    case "--model":
                        this.model = value;
                        break;
                    case "--base-url":
                        this.baseUrl = value;
                        break;
                    case "--max-output-tokens":
                        this.maxOutputTokens = parseInt(value, maxOutputTokens);
                        break;
                    case "--max-retries":
                        this.maxRetries = parseInt(value, maxRetries);
                        break;
                    case "--generation-timeout-ms":
                        try {
                            this.generationTimeoutMs = Long.parseLong(value);
                        } catch (NumberFormatException ignored) {
                            // keep default timeout
                        }
                        break;
                    case "--no-shell":
                        this.shellEnabled = false;
                        break;
                    case "--cors-origin":
                        if (value != null && !value.isBlank()) {
                            corsOrigins.add(value.trim());
                        }
                        break;
                    default:
                        break;
                }
            }
            return this;
        }

        private static boolean takesValue(String arg) {
            switch (arg) {
                case "--projects":
                case "--port":
                case "--provider":
                case "--model":
                case "--base-url":
                case "--generation-timeout-ms":
                case "--max-output-tokens":
                case "--max-retries":
                case "--cors-origin":
                    return true;
                default:
                    return false;
            }
        }

        private static int parseInt(String value, int fallback) {
            if (value == null || value.isBlank()) {
                return fallback;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }

        private static String firstNonBlank(String a, String b) {
            if (a != null && !a.isBlank()) {
                return a.trim();
            }
            return b;
        }

        public AppConfig build() throws IOException {
            Path projects = projectsPath != null
                ? projectsPath
                : Paths.get("projects").toAbsolutePath().normalize();
            int port = findAvailablePort(preferredPort);
            Path logPath = ensureLogDirectory();
            return new AppConfig(this, projects, logPath, port);
        }
    }
}
