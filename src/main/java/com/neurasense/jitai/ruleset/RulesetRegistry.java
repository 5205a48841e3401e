package com.neurasense.jitai.ruleset;

import com.neurasense.jitai.domain.Ruleset;
import com.neurasense.jitai.util.AlertLogger;
import com.neurasense.jitai.util.EngineMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active rule snapshot and keeps it in step with the rule document.
 * <p>
 * Every {@link #current()} call compares the document's modification time with the one that
 * was last loaded and reloads when it changed. Reloads parse into a new snapshot and publish
 * it with a single reference swap; a failed reload keeps serving the previous snapshot.
 * Readers racing a reload see either the old or the new snapshot, never a partial one.
 * <p>
 * When no document path is configured, or the file does not exist at startup, the bundled
 * classpath document is used and never reloaded.
 */
@ApplicationScoped
public class RulesetRegistry {

    private static final Logger LOG = Logger.getLogger(RulesetRegistry.class);

    private final AtomicReference<Ruleset> current = new AtomicReference<>(Ruleset.empty());

    // Modification time of the last load attempt, successful or not, so a broken file is not
    // re-parsed on every request.
    private volatile FileTime attemptedMtime;

    @Inject
    RulesetLoader loader;

    @Inject
    EngineMetrics engineMetrics;

    @ConfigProperty(name = "app.rules.path")
    Optional<String> rulesPath;

    @ConfigProperty(name = "app.rules.auto-reload.enabled", defaultValue = "false")
    boolean autoReloadEnabled;

    @ConfigProperty(name = "app.rules.auto-reload.interval-seconds", defaultValue = "30")
    int autoReloadIntervalSeconds;

    private ScheduledExecutorService reloadScheduler;

    @PostConstruct
    void init() {
        LOG.info("Initializing RulesetRegistry");
        refresh();

        if (autoReloadEnabled && documentPath().isPresent()) {
            startReloadScheduler();
            LOG.infof("Auto-reload enabled: checking every %d seconds", autoReloadIntervalSeconds);
        } else {
            LOG.info("Auto-reload disabled (modification check on access only)");
        }
    }

    @PreDestroy
    void destroy() {
        if (reloadScheduler != null) {
            reloadScheduler.shutdown();
            try {
                if (!reloadScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    reloadScheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                reloadScheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        LOG.info("RulesetRegistry destroyed");
    }

    // ========== Lookup ==========

    /**
     * Returns the active snapshot, reloading first if the document changed on disk.
     */
    public Ruleset current() {
        Optional<Path> path = documentPath();
        if (path.isPresent() && isStale(path.get())) {
            reloadIfStale(path.get());
        }
        return current.get();
    }

    /**
     * Returns the active snapshot without touching the filesystem.
     */
    public Ruleset peek() {
        return current.get();
    }

    // ========== Refresh ==========

    /**
     * Reloads the rule document unconditionally.
     *
     * @return what happened; on failure the previous snapshot stays active
     */
    public synchronized ReloadResult refresh() {
        Ruleset previous = current.get();
        Optional<Path> path = documentPath();
        try {
            Ruleset next;
            if (path.isPresent() && Files.isRegularFile(path.get())) {
                attemptedMtime = modifiedTime(path.get());
                next = loader.loadFromFile(path.get());
            } else if (path.isPresent() && previous.getLastModified() != null) {
                throw new RulesetLoadException("Rule document " + path.get() + " no longer exists");
            } else {
                if (path.isPresent()) {
                    LOG.warnf("Rule document %s not found, using builtin rules", path.get());
                }
                next = loader.loadBuiltin();
            }
            current.set(next);
            engineMetrics.incrementRuleReloadSuccess();
            LOG.infof("Rules active: source=%s, version=%d (previous v%d), rules=%d",
                    next.getSource(), next.getVersion(), previous.getVersion(), next.size());
            return new ReloadResult(true, "SUCCESS", "Rules reloaded", previous.getVersion(), next.getVersion());
        } catch (RuntimeException e) {
            engineMetrics.incrementRuleReloadFailure();
            AlertLogger.ruleReloadFailed(path.map(Path::toString).orElse("builtin"), previous.getVersion(), e.getMessage());
            return new ReloadResult(false, "LOAD_FAILED", e.getMessage(), previous.getVersion(), previous.getVersion());
        }
    }

    private synchronized void reloadIfStale(Path path) {
        // another caller may have reloaded while we waited for the lock
        if (isStale(path)) {
            LOG.infof("Rule document %s changed on disk, reloading", path);
            refresh();
        }
    }

    private boolean isStale(Path path) {
        FileTime mtime = modifiedTime(path);
        return mtime != null && !Objects.equals(mtime, attemptedMtime);
    }

    private static FileTime modifiedTime(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            return null;
        }
    }

    private Optional<Path> documentPath() {
        return rulesPath.filter(p -> !p.isBlank()).map(Path::of);
    }

    // ========== Background Reload ==========

    private void startReloadScheduler() {
        reloadScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "rules-reload-scheduler");
            thread.setDaemon(true);
            return thread;
        });

        reloadScheduler.scheduleAtFixedRate(
                this::checkForUpdates,
                autoReloadIntervalSeconds,
                autoReloadIntervalSeconds,
                TimeUnit.SECONDS
        );
    }

    private void checkForUpdates() {
        try {
            LOG.debug("Checking rule document for updates...");
            current();
        } catch (Exception e) {
            LOG.errorf(e, "Error during auto-reload check");
        }
    }

    // ========== Inner Classes ==========

    /**
     * Result of a reload.
     */
    public static class ReloadResult {
        private final boolean success;
        private final String status;
        private final String message;
        private final int oldVersion;
        private final int newVersion;

        public ReloadResult(boolean success, String status, String message, int oldVersion, int newVersion) {
            this.success = success;
            this.status = status;
            this.message = message;
            this.oldVersion = oldVersion;
            this.newVersion = newVersion;
        }

        public boolean success() {
            return success;
        }

        public String status() {
            return status;
        }

        public String message() {
            return message;
        }

        public int oldVersion() {
            return oldVersion;
        }

        public int newVersion() {
            return newVersion;
        }

        @Override
        public String toString() {
            return "ReloadResult{" +
                    "success=" + success +
                    ", status='" + status + '\'' +
                    ", oldVersion=" + oldVersion +
                    ", newVersion=" + newVersion +
                    '}';
        }
    }
}
