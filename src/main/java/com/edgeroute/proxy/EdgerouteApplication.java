package com.edgeroute.proxy;

import com.edgeroute.proxy.config.EdgerouteProperties;
import com.edgeroute.proxy.core.engine.EdgeRuntime;
import com.edgeroute.proxy.core.exceptions.ConfigException;
import com.edgeroute.proxy.core.exceptions.ProxyException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Scanner;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for Edgeroute.
 * Handles command-line arguments, configuration loading, and the runtime
 * lifecycle.
 */
@Command(name = "edgeroute", mixinStandardHelpOptions = true, version = "1.0.0", description = "Store-driven routing, load balancing and certificate selection for a reverse proxy.")
public class EdgerouteApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(EdgerouteApplication.class);

    /**
     * Path to the YAML configuration file.
     */
    @Option(names = { "-c", "--config" }, description = "Path to config file (YAML)", defaultValue = "application.yml")
    private String configPath;

    private volatile EdgeRuntime runtime;

    /** Latch to block the main thread until shutdown is triggered. */
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    /** Flag to signal background threads to stop. */
    private final AtomicBoolean running = new AtomicBoolean(true);

    /** Only assigned once by the watcher thread. */
    private volatile WatchService watchService;

    /** Reference to the registered shutdown hook for cleanup. */
    private Thread shutdownHook;

    /**
     * Main method to launch the application.
     * 
     * @param args Command-line arguments.
     */
    public static void main(String[] args) {
        System.exit(new CommandLine(new EdgerouteApplication()).execute(args));
    }

    /**
     * Bootstraps the runtime and sets up configuration watching.
     * 
     * @return Exit code (0 for success, 1 for failure).
     */
    @Override
    public Integer call() {
        try {
            log.info("Starting Edgeroute...");

            EdgerouteProperties props = loadConfig(configPath);
            this.runtime = new EdgeRuntime(props);
            runtime.start();

            startFileWatcher();
            if (System.getProperty("edgeroute.no-command-listener") == null) {
                startCommandListener();
            }

            if (System.getProperty("edgeroute.no-shutdown-hook") == null) {
                this.shutdownHook = new Thread(this::stop, "ShutdownHook");
                Runtime.getRuntime().addShutdownHook(shutdownHook);
            }

            shutdownLatch.await();
            return 0;
        } catch (ConfigException e) {
            log.error("Configuration Error: {}", e.getMessage());
            return 1;
        } catch (ProxyException e) {
            log.error("Fatal error: {}", e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            log.warn("Application interrupted");
            Thread.currentThread().interrupt();
            return 0;
        } catch (Exception e) {
            log.error("Unexpected fatal error", e);
            return 1;
        } finally {
            stop();
        }
    }

    /**
     * Starts an interactive command listener on System.in.
     */
    private void startCommandListener() {
        Thread listener = new Thread(() -> {
            try (Scanner scanner = new Scanner(System.in, StandardCharsets.UTF_8)) {
                log.info("Interactive console ready. Type 'reload' to refresh config or 'stop' to exit.");
                while (running.get() && readAndProcessCommand(scanner)) {
                    // Loop continues as long as input is available and stop hasn't been signaled
                }
            } catch (Exception e) {
                if (running.get()) {
                    log.warn("Command listener fatal error: {}", e.getMessage(), e);
                }
            }
        }, "CommandListener");
        listener.setDaemon(true);
        listener.start();
    }

    private boolean readAndProcessCommand(Scanner scanner) {
        try {
            if (scanner.hasNextLine()) {
                processCommand(scanner.nextLine().trim().toLowerCase(Locale.ROOT));
                return true;
            }
        } catch (NoSuchElementException e) {
            log.debug("Console input closed");
        }
        return false;
    }

    private void processCommand(String command) {
        if (command.isEmpty()) {
            return;
        }

        switch (command) {
            case "reload" -> reloadConfiguration();
            case "stop", "exit", "quit" -> stop();
            case "help" -> log.info("Available commands: reload, stop, exit, quit, help");
            default -> log.warn("Unknown command: {}. Type 'help' for available commands.", command);
        }
    }

    /**
     * Stops the runtime, the configuration watcher and background listeners.
     * Also unregisters the shutdown hook so repeated runs in one JVM do not
     * accumulate hooks.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down Edgeroute...");

            unregisterShutdownHook();

            if (runtime != null) {
                runtime.stop();
            }
            closeWatchService();
            shutdownLatch.countDown();
        }
    }

    /**
     * Returns the running runtime.
     *
     * @return The runtime, or null before startup.
     */
    public EdgeRuntime getRuntime() {
        return runtime;
    }

    private void unregisterShutdownHook() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                // JVM is already shutting down; stop() was called from the hook
                log.debug("Shutdown in progress, hook not removed");
            }
        }
    }

    private void closeWatchService() {
        WatchService service = watchService;
        if (service != null) {
            try {
                service.close();
            } catch (IOException e) {
                log.debug("Failed to close config watcher: {}", e.getMessage());
            }
        }
    }

    /**
     * Reloads the configuration from disk and applies it to the runtime.
     */
    private void reloadConfiguration() {
        try {
            log.info("Reloading configuration from {}...", configPath);
            EdgerouteProperties newProps = loadConfig(configPath);
            runtime.reload(newProps);
            log.info("Configuration reloaded successfully.");
        } catch (ProxyException e) {
            log.error("Failed to reload configuration: {}", e.getMessage());
        }
    }

    /**
     * Starts a background thread to watch for changes in the configuration file.
     * Uses a debounce mechanism to avoid multiple reloads for a single logical
     * change.
     */
    private void startFileWatcher() {
        Thread watcherThread = new Thread(() -> {
            try {
                Path path = Paths.get(configPath).toAbsolutePath();
                Path parent = path.getParent();
                if (parent == null || !path.toFile().exists()) {
                    return;
                }

                this.watchService = FileSystems.getDefault().newWatchService();
                parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY,
                        StandardWatchEventKinds.ENTRY_CREATE);

                log.info("Watching configuration file for changes: {}", path);
                runWatcherLoop(path.getFileName().toString());
            } catch (ClosedWatchServiceException e) {
                log.debug("Watch service closed");
            } catch (InterruptedException e) {
                log.debug("File watcher interrupted");
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                if (running.get()) {
                    log.warn("File watcher error: {}", e.getMessage(), e);
                }
            }
        }, "ConfigWatcher");
        watcherThread.setDaemon(true);
        watcherThread.start();
    }

    /**
     * Executes the main loop for the configuration file watcher.
     * 
     * @param fileName The name of the file to watch.
     * @throws InterruptedException If the thread is interrupted.
     */
    private void runWatcherLoop(String fileName) throws InterruptedException {
        // Debounce: reload only after 1s without further events.
        final long debounceNanos = 1_000_000_000L;
        long lastEventNano = 0;

        while (running.get()) {
            WatchKey key = watchService.poll(500, TimeUnit.MILLISECONDS);
            if (key != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.context().toString().equals(fileName)) {
                        lastEventNano = System.nanoTime();
                    }
                }
                if (!key.reset()) {
                    break;
                }
            }

            if (lastEventNano > 0 && System.nanoTime() - lastEventNano >= debounceNanos) {
                lastEventNano = 0;
                reloadConfiguration();
            }
        }
    }

    /**
     * Loads the configuration from the specified path or classpath.
     * 
     * @param path Path to the configuration file.
     * @return Loaded properties.
     * @throws ConfigException if configuration cannot be loaded.
     */
    static EdgerouteProperties loadConfig(String path) {
        Yaml yaml = new Yaml(new Constructor(EdgerouteProperties.class, new LoaderOptions()));

        EdgerouteProperties fromFile = tryLoadFromFile(yaml, path);
        if (fromFile != null) {
            return fromFile;
        }

        EdgerouteProperties fromClasspath = tryLoadFromClasspath(yaml, path);
        if (fromClasspath != null) {
            return fromClasspath;
        }

        throw new ConfigException("Configuration file not found: " + path);
    }

    private static EdgerouteProperties tryLoadFromFile(Yaml yaml, String path) {
        File file = new File(path);
        if (file.exists()) {
            try (InputStream is = new FileInputStream(file)) {
                return orDefaults(yaml.load(is));
            } catch (YAMLException | ClassCastException e) {
                throw new ConfigException("Invalid YAML in " + path + ": " + e.getMessage());
            } catch (IOException e) {
                throw new ConfigException("Error reading config file: " + path, e);
            }
        }
        return null;
    }

    private static EdgerouteProperties tryLoadFromClasspath(Yaml yaml, String path) {
        try (InputStream is = EdgerouteApplication.class.getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                return orDefaults(yaml.load(is));
            }
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigException("Invalid YAML in classpath resource " + path + ": " + e.getMessage());
        } catch (IOException e) {
            log.debug("Classpath resource lookup failed for {}", path);
        }
        return null;
    }

    /** An empty document loads as null. */
    private static EdgerouteProperties orDefaults(EdgerouteProperties loaded) {
        return loaded == null ? new EdgerouteProperties() : loaded;
    }
}
