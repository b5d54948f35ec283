package com.contextgraph;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Server configuration handling platform-specific paths and settings.
 */
public class AppConfig {

    private static final String APP_NAME = "ContextGraph";
    public static final String ENV_DATA_DIR = "CONTEXTGRAPH_DATA_DIR";
    public static final String ENV_PORT = "CONTEXTGRAPH_PORT";

    private final Path dataPath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;

    private AppConfig(Path dataPath, Path logPath, int port, boolean devMode) {
        this.dataPath = dataPath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
    }

    public Path getDataPath() {
        return dataPath;
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

    /**
     * Get the default data path based on the operating system.
     * Windows: %APPDATA%\ContextGraph\data
     * macOS: ~/Library/Application Support/ContextGraph/data
     * Linux: ~/.local/share/ContextGraph/data
     */
    public static Path getDefaultDataPath() {
        return getAppDirectory().resolve("data");
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\ContextGraph\logs
     * macOS: ~/Library/Logs/ContextGraph
     * Linux: ~/.local/share/ContextGraph/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        if (os.contains("mac")) {
            return Paths.get(System.getProperty("user.home"), "Library", "Logs", APP_NAME);
        }
        return getAppDirectory().resolve("logs");
    }

    private static Path getAppDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME);
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Application Support", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME);
        }
    }

    /**
     * Get the log file path.
     */
    public static Path getLogFilePath() {
        return getLogDirectory().resolve("contextgraph.log");
    }

    /**
     * Find an available port, starting with the preferred port.
     * If the preferred port is in use, finds the next available port.
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

        // Last resort: return the preferred port and let it fail later with a clear error
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

    /**
     * Ensure the log directory exists and return the log file path.
     */
    public static Path ensureLogDirectory() throws IOException {
        Path logDir = getLogDirectory();
        Files.createDirectories(logDir);
        return getLogFilePath();
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Path dataPath = null;
        private int preferredPort = 8080;
        private boolean devMode = false;

        public Builder dataPath(String path) {
            if (path != null && !path.isBlank()) {
                this.dataPath = Paths.get(path).toAbsolutePath().normalize();
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

        /**
         * Apply environment fallbacks. Command-line arguments parsed afterwards win.
         */
        public Builder fromEnvironment(Map<String, String> env) {
            if (env == null) {
                return this;
            }
            dataPath(env.get(ENV_DATA_DIR));
            String port = env.get(ENV_PORT);
            if (port != null && !port.isBlank()) {
                portValue(port, ENV_PORT);
            }
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                // Handle --data-dir=value or --data-dir value
                if (arg.startsWith("--data-dir=")) {
                    dataPath(arg.substring("--data-dir=".length()));
                } else if ("--data-dir".equals(arg) && i + 1 < args.length) {
                    dataPath(args[++i]);
                }

                // Handle --port=value or --port value
                else if (arg.startsWith("--port=")) {
                    portValue(arg.substring("--port=".length()), "--port");
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    portValue(args[++i], "--port");
                }

                else if ("--dev".equals(arg)) {
                    this.devMode = true;
                }
            }
            return this;
        }

        private void portValue(String raw, String source) {
            try {
                this.preferredPort = Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                AppLogger.get().warn("Ignoring invalid port from " + source + ": " + raw);
            }
        }

        Path resolvedDataPath() {
            return dataPath != null ? dataPath : getDefaultDataPath();
        }

        int preferredPort() {
            return preferredPort;
        }

        public AppConfig build() throws IOException {
            Path data = resolvedDataPath();
            Files.createDirectories(data);

            int port = findAvailablePort(preferredPort);

            Path logPath = ensureLogDirectory();

            return new AppConfig(data, logPath, port, devMode);
        }
    }
}
