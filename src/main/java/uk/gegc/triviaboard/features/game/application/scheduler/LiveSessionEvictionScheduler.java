package uk.gegc.triviaboard.features.game.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.triviaboard.features.game.application.LiveSessionRegistry;
import uk.gegc.triviaboard.features.game.config.GameProperties;

import java.time.Clock;
import java.time.Instant;

/**
 * Drops in-memory state of sessions nobody has acted on for a while. Sessions still in progress are
 * rebuilt from the store on their next action.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LiveSessionEvictionScheduler {

    private final LiveSessionRegistry liveSessions;
    private final GameProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${triviaboard.game.eviction-fixed-delay-seconds:300}000")
    public void evictIdleSessions() {
        try {
            Instant cutoff = clock.instant().minus(properties.getIdleEviction());
            int evicted = liveSessions.evictIdle(cutoff);
            if (evicted > 0) {
                log.info("Evicted {} idle live sessions, {} remain", evicted, liveSessions.size());
            }
        } catch (Exception e) {
            log.error("Error during idle live session eviction", e);
        }
    }
}
