package com.storyroom;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Runtime configuration: where stories and logs live, and which port to serve on.
 */
public class AppConfig {

    private static final String APP_NAME = "Story-Room";
    private static final int DEFAULT_PORT = 7070;

    private final Path storiesPath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;

    private AppConfig(Path storiesPath, Path logPath, int port, boolean devMode) {
        this.storiesPath = storiesPath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
    }

    public Path getStoriesPath() {
        return storiesPath;
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
     * Default story folder.
     * Windows/macOS: ~/Documents/Story-Room/stories
     * Linux: ~/Story-Room/stories
     */
    public static Path getDefaultStoriesPath() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");
        if (os.contains("win") || os.contains("mac")) {
            return Paths.get(userHome, "Documents", APP_NAME, "stories");
        }
        return Paths.get(userHome, APP_NAME, "stories");
    }

    /**
     * Windows: %APPDATA%\Story-Room\logs
     * macOS: ~/Library/Logs/Story-Room
     * Linux: ~/.local/share/Story-Room/logs
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

    public static Path ensureLogFile() throws IOException {
        Path logDir = getLogDirectory();
        Files.createDirectories(logDir);
        return logDir.resolve("story-room.log");
    }

    /**
     * The preferred port when free, otherwise any free port the OS hands out.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            // let the server fail on bind with a clear error
            return preferredPort;
        }
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static class Builder {
        private Path storiesPath = null;
        private int preferredPort = DEFAULT_PORT;
        private boolean devMode = false;

        public Builder storiesPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.storiesPath = Paths.get(path).toAbsolutePath().normalize();
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
         * Accepts --stories=DIR / --stories DIR, --port=N / --port N and --dev.
         */
        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg.startsWith("--stories=")) {
                    storiesPath(arg.substring("--stories=".length()));
                } else if ("--stories".equals(arg) && i + 1 < args.length) {
                    storiesPath(args[++i]);
                } else if (arg.startsWith("--port=")) {
                    preferredPort = parsePort(arg.substring("--port=".length()));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    preferredPort = parsePort(args[++i]);
                } else if ("--dev".equals(arg)) {
                    devMode = true;
                }
            }
            return this;
        }

        private int parsePort(String value) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return preferredPort;
            }
        }

        public Path getStoriesPath() {
            return storiesPath != null ? storiesPath : getDefaultStoriesPath();
        }

        public int getPreferredPort() {
            return preferredPort;
        }

        public boolean isDevMode() {
            return devMode;
        }

        public AppConfig build() throws IOException {
            Path stories = getStoriesPath();
            Files.createDirectories(stories);
            return new AppConfig(stories, ensureLogFile(), findAvailablePort(preferredPort), devMode);
        }
    }
}
