package com.neurasense.jitai.health;

import com.neurasense.jitai.JitaiEngineApplication;
import com.neurasense.jitai.domain.Ruleset;
import com.neurasense.jitai.ruleset.RulesetRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Ready once a rule snapshot with rules or default actions is active, and not after the
 * shutdown signal.
 */
@Readiness
@ApplicationScoped
public class RulesetHealthCheck implements HealthCheck {

    @Inject
    RulesetRegistry rulesetRegistry;

    @Override
    public HealthCheckResponse call() {
        if (JitaiEngineApplication.isShuttingDown()) {
            return HealthCheckResponse.builder()
                    .name("ruleset")
                    .down()
                    .withData("reason", "Shutting down")
                    .build();
        }

        Ruleset ruleset = rulesetRegistry.peek();

        if (ruleset.size() > 0 || !ruleset.getDefaultActions().isEmpty()) {
            return HealthCheckResponse.builder()
                    .name("ruleset")
                    .up()
                    .withData("rules", (long) ruleset.size())
                    .withData("version", (long) ruleset.getVersion())
                    .withData("source", ruleset.getSource())
                    .build();
        }
        return HealthCheckResponse.builder()
                .name("ruleset")
                .down()
                .withData("reason", "No rules loaded")
                .withData("source", ruleset.getSource())
                .build();
    }
}
