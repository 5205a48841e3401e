package com.neurasense.jitai.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Supplies the wall clock used for time variables, so tests can substitute a fixed one.
 */
@ApplicationScoped
public class ClockProducer {

    private static final Logger LOG = Logger.getLogger(ClockProducer.class);

    @Inject
    DecisionConfig config;

    @Produces
    @Singleton
    Clock clock() {
        ZoneId zone = ZoneId.of(config.timeZone);
        LOG.infof("Decision clock zone: %s", zone);
        return Clock.system(zone);
    }
}
