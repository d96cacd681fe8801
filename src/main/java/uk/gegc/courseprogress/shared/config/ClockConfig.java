package uk.gegc.courseprogress.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import uk.gegc.courseprogress.features.gamification.application.GamificationProperties;

import java.time.Clock;

/**
 * Single source of time for the engine.
 * <p>
 * Every component that stamps {@code completed_at}, {@code grace_period_used_at} or derives a
 * calendar activity date takes this {@link Clock} by injection, so tests can pin it with
 * {@link Clock#fixed}. The clock runs in the streak reference zone.
 */
@Configuration
public class ClockConfig {

    @Bean
    @Primary
    public Clock clock(GamificationProperties properties) {
        return Clock.system(properties.getReferenceZone());
    }
}
