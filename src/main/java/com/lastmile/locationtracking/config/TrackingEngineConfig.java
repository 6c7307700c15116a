package com.lastmile.locationtracking.config;

import com.lastmile.locationtracking.service.privacy.CoordinateGeneralizer;
import com.lastmile.locationtracking.service.privacy.GridSnapGeneralizer;
import com.lastmile.locationtracking.service.privacy.RandomOffsetGeneralizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;

/**
 * Engine-wide collaborators: the time source and the coordinate
 * generalization strategy used by the privacy filter.
 *
 *   tracking.privacy.strategy = random (default) | grid
 *   tracking.privacy.seed     = optional seed for reproducible random offsets
 */
@Configuration
@Slf4j
public class TrackingEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CoordinateGeneralizer coordinateGeneralizer(
            @Value("${tracking.privacy.strategy:random}") String strategy,
            @Value("${tracking.privacy.seed:#{null}}") Long seed) {
        if ("grid".equalsIgnoreCase(strategy)) {
            log.info("Privacy generalization: grid snapping");
            return new GridSnapGeneralizer();
        }
        if (!"random".equalsIgnoreCase(strategy)) {
            throw new IllegalStateException("Unknown tracking.privacy.strategy: " + strategy);
        }
        log.info("Privacy generalization: random offset{}", seed != null ? " (seeded)" : "");
        return new RandomOffsetGeneralizer(seed != null ? new Random(seed) : new Random());
    }
}
