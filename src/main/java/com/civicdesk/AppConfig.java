package com.civicdesk;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Application configuration handling platform-specific paths and settings.
 */
public class AppConfig {

    private static final String APP_NAME = "Civic-Desk";
    private static final String LOG_FILE_NAME = "civic-desk.log";
    static final String PORT_ENV = "CIVICDESK_PORT";

    private final Path logPath;
    private final int port;
    private final boolean devMode;

    private AppConfig(Path logPath, int port, boolean devMode) {
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
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
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\Civic-Desk\logs
     * macOS: ~/Library/Logs/Civic-Desk
     * Linux: ~/.local/share/Civic-Desk/logs
     */
    public static Path getDefaultLogDirectory() {
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

        // Let the server fail to bind with a clear error.
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
     * Builder for AppConfig.
     */
    public static class Builder {
        private Integer preferredPort = null;
        private boolean devMode = false;
        private Path logDirectory = null;
        private Map<String, String> environment = System.getenv();

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder logDirectory(String path) {
            if (path != null && !path.isBlank()) {
                this.logDirectory = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment = environment != null ? environment : Map.of();
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.startsWith("--port=")) {
                    parsePort(arg.substring("--port=".length()));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    parsePort(args[++i]);
                } else if (arg.startsWith("--log-dir=")) {
                    logDirectory(arg.substring("--log-dir=".length()));
                } else if ("--log-dir".equals(arg) && i + 1 < args.length) {
                    logDirectory(args[++i]);
                } else if ("--dev".equals(arg)) {
                    this.devMode = true;
                }
            }
            return this;
        }

        /**
         * Port requested by arguments, then by the CIVICDESK_PORT variable, defaulting to 8080.
         */
        public int preferredPort() {
            if (preferredPort != null) {
                return preferredPort;
            }
            String fromEnv = environment.get(PORT_ENV);
            if (fromEnv != null && !fromEnv.isBlank()) {
                try {
                    return Integer.parseInt(fromEnv.trim());
                } catch (NumberFormatException e) {
                    System.err.println("Ignoring invalid " + PORT_ENV + " value: " + fromEnv);
                }
            }
            return 8080;
        }

        public AppConfig build() throws IOException {
            int port = findAvailablePort(preferredPort());

            Path logDir = logDirectory != null ? logDirectory : getDefaultLogDirectory();
            Files.createDirectories(logDir);

            return new AppConfig(logDir.resolve(LOG_FILE_NAME), port, devMode);
        }

        private void parsePort(String value) {
            try {
                this.preferredPort = Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                System.err.println("Ignoring invalid --port value: " + value);
            }
        }
    }
}
