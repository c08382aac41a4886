package com.chatgateway;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Process-level settings: where data and logs live, which port to bind, which gateway
 * configuration file to overlay on the bundled defaults.
 */
public class AppConfig {

    private static final String APP_NAME = "ChatGateway";

    private final Path dataPath;
    private final Path logPath;
    private final Path configFile;
    private final int port;
    private final boolean devMode;

    private AppConfig(Path dataPath, Path logPath, Path configFile, int port, boolean devMode) {
        this.dataPath = dataPath;
        this.logPath = logPath;
        this.configFile = configFile;
        this.port = port;
        this.devMode = devMode;
    }

    public Path getDataPath() {
        return dataPath;
    }

    public Path getLogPath() {
        return logPath;
    }

    /**
     * Optional override file; null means bundled defaults only.
     */
    public Path getConfigFile() {
        return configFile;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /**
     * Default data directory.
     * Windows: %APPDATA%\ChatGateway\data
     * macOS: ~/Library/Application Support/ChatGateway/data
     * Linux: ~/.local/share/ChatGateway/data
     */
    public static Path getDefaultDataPath() {
        return getAppDirectory().resolve("data");
    }

    public static Path getLogDirectory() {
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

    public static Path getLogFilePath() {
        return getLogDirectory().resolve("chat-gateway.log");
    }

    /**
     * Find an available port, starting with the preferred port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }
        for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
            if (isPortAvailable(port)) {
                return port;
            }
        }
        // Let the bind fail later with a clear error.
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

    public static class Builder {
        private Path dataPath = null;
        private Path configFile = null;
        private int preferredPort = 8080;
        private boolean devMode = false;

        public Builder dataPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.dataPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder configFile(String path) {
            if (path != null && !path.isEmpty()) {
                this.configFile = Paths.get(path).toAbsolutePath().normalize();
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
         * Accepts {@code --data-dir}, {@code --config}, {@code --port} (as {@code --flag value} or
         * {@code --flag=value}) and {@code --dev}.
         */
        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.startsWith("--data-dir=")) {
                    dataPath(arg.substring("--data-dir=".length()));
                } else if ("--data-dir".equals(arg) && i + 1 < args.length) {
                    dataPath(args[++i]);
                } else if (arg.startsWith("--config=")) {
                    configFile(arg.substring("--config=".length()));
                } else if ("--config".equals(arg) && i + 1 < args.length) {
                    configFile(args[++i]);
                } else if (arg.startsWith("--port=")) {
                    this.preferredPort = parsePort(arg.substring("--port=".length()));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    this.preferredPort = parsePort(args[++i]);
                } else if ("--dev".equals(arg)) {
                    this.devMode = true;
                }
            }
            return this;
        }

        private int parsePort(String value) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid --port value: " + value, e);
            }
        }

        public AppConfig build() throws IOException {
            Path data = dataPath != null ? dataPath : getDefaultDataPath();
            Files.createDirectories(data);
            int port = findAvailablePort(preferredPort);
            Path logPath = ensureLogDirectory();
            return new AppConfig(data, logPath, configFile, port, devMode);
        }
    }
}
