package com.neurasense.jitai;

import com.neurasense.jitai.catalog.CatalogService;
import com.neurasense.jitai.ruleset.RulesetRegistry;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main application class for the JITAI decision engine.
 */
@QuarkusMain
public class JitaiEngineApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(JitaiEngineApplication.class);

    public static void main(String[] args) {
        Quarkus.run(JitaiEngineApplication.class, args);
    }

    @Override
    public int run(String... args) throws Exception {
        LOG.info("JITAI Decision Engine starting...");
        Quarkus.waitForExit();
        return 0;
    }

    /**
     * Checks if the application is shutting down.
     *
     * @return true once the shutdown signal was received
     */
    public static boolean isShuttingDown() {
        return ApplicationLifecycleObserver.SHUTTING_DOWN.get();
    }
}

/**
 * Lifecycle observer for application startup and shutdown events.
 */
@ApplicationScoped
class ApplicationLifecycleObserver {

    private static final Logger LOG = Logger.getLogger(ApplicationLifecycleObserver.class);

    /**
     * Set once the shutdown signal has been received. Read by the readiness check.
     */
    static final AtomicBoolean SHUTTING_DOWN = new AtomicBoolean(false);

    @Inject
    RulesetRegistry rulesetRegistry;

    @Inject
    CatalogService catalogService;

    /**
     * Forces the rule and catalog beans to load at startup instead of on the first request.
     */
    void onStart(@Observes StartupEvent event) {
        LOG.infof("JITAI Decision Engine started: rules=%d (v%d, %s), catalog=%d",
                rulesetRegistry.peek().size(),
                rulesetRegistry.peek().getVersion(),
                rulesetRegistry.peek().getSource(),
                catalogService.size());
    }

    void onShutdown(@Observes ShutdownEvent event) {
        SHUTTING_DOWN.set(true);
        LOG.info("Shutdown signal received, JITAI Decision Engine stopping");
    }
}
