package com.gamemaster;

import com.gamemaster.models.ResolverEndpointConfig;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration: listening port, world file, log location and the
 * semantic resolver endpoint.
 */
public class AppConfig {

    private static final String APP_NAME = "Brinmere-GM";
    public static final String API_KEY_ENV = "GAME_MASTER_RESOLVER_API_KEY";
    public static final String PROVIDER_NONE = "none";

    private final Path worldPath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;
    private final ResolverEndpointConfig resolver;
    private final String resolverApiKey;

    private AppConfig(Path worldPath, Path logPath, int port, boolean devMode,
                      ResolverEndpointConfig resolver, String resolverApiKey) {
        this.worldPath = worldPath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
        this.resolver = resolver;
        this.resolverApiKey = resolverApiKey;
    }

    /**
     * World file given on the command line, or null to use the bundled world.
     */
    public Path getWorldPath() {
        return worldPath;
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

    public ResolverEndpointConfig getResolver() {
        return resolver;
    }

    public String getResolverApiKey() {
        return resolverApiKey;
    }

    public boolean isResolverEnabled() {
        return resolver != null && !PROVIDER_NONE.equalsIgnoreCase(resolver.getProvider());
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\Brinmere-GM\logs
     * macOS: ~/Library/Logs/Brinmere-GM
     * Linux: ~/.local/share/Brinmere-GM/logs
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
        return getLogDirectory().resolve("game-master.log");
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

        // Let the server fail later with a clear bind error
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
        Files.createDirectories(getLogDirectory());
        return getLogFilePath();
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Path worldPath = null;
        private int preferredPort = 8080;
        private boolean devMode = false;
        private String resolverProvider = "gemini";
        private String resolverModel = "gemini-2.5-flash";
        private String resolverBaseUrl = null;
        private int resolverTimeoutMs = ResolverEndpointConfig.DEFAULT_TIMEOUT_MS;
        private String resolverApiKey = null;

        public Builder worldPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.worldPath = Paths.get(path).toAbsolutePath().normalize();
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

        public Builder resolverApiKey(String apiKey) {
            this.resolverApiKey = apiKey;
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                String name = arg;
                String value = null;
                int eq = arg.indexOf('=');
                if (arg.startsWith("--") && eq > 0) {
                    name = arg.substring(0, eq);
                    value = arg.substring(eq + 1);
                }

                if ("--dev".equals(name)) {
                    this.devMode = true;
                    continue;
                }
                if (value == null && takesValue(name) && i + 1 < args.length) {
                    value = args[++i];
                }
                if (value == null) {
                    continue;
                }

                switch (name) {
                    case "--world":
                        worldPath(value);
                        break;
                    case "--port":
                        this.preferredPort = parseInt(value, preferredPort);
                        break;
                    case "--resolver-provider":
                        this.resolverProvider = value.trim().toLowerCase();
                        break;
                    case "--resolver-model":
                        this.resolverModel = value.trim();
                        break;
                    case "--resolver-base-url":
                        this.resolverBaseUrl = value.trim();
                        break;
                    case "--resolver-timeout-ms":
                        this.resolverTimeoutMs = parseInt(value, resolverTimeoutMs);
                        break;
                    default:
                        break;
                }
            }
            return this;
        }

        private boolean takesValue(String name) {
            switch (name) {
                case "--world":
                case "--port":
                case "--resolver-provider":
                case "--resolver-model":
                case "--resolver-base-url":
                case "--resolver-timeout-ms":
                    return true;
                default:
                    return false;
            }
        }

        private int parseInt(String value, int fallback) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }

        public ResolverEndpointConfig buildResolverEndpoint() {
            return new ResolverEndpointConfig(resolverProvider, resolverModel, resolverBaseUrl,
                resolverTimeoutMs > 0 ? resolverTimeoutMs : ResolverEndpointConfig.DEFAULT_TIMEOUT_MS);
        }

        public Path getWorldPath() {
            return worldPath;
        }

        public boolean isDevMode() {
            return devMode;
        }

        public AppConfig build() throws IOException {
            int port = findAvailablePort(preferredPort);
            Path logPath = ensureLogDirectory();
            String apiKey = resolverApiKey != null ? resolverApiKey : System.getenv(API_KEY_ENV);
            return new AppConfig(worldPath, logPath, port, devMode, buildResolverEndpoint(), apiKey);
        }
    }
}
