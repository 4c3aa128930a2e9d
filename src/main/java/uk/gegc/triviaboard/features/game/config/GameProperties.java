package uk.gegc.triviaboard.features.game.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tuning for live game sessions and event fanout.
 */
@Data
@Component
@ConfigurationProperties(prefix = "triviaboard.game")
public class GameProperties {

    /**
     * Grace interval between a dice roll and the question reveal, long enough for clients to animate the dice.
     */
    private Duration revealDelay = Duration.ofSeconds(3);

    /**
     * Live state untouched for this long is dropped from memory and rebuilt on the next action.
     */
    private Duration idleEviction = Duration.ofHours(6);

    /**
     * Fixed delay between idle eviction sweeps (in seconds).
     */
    private int evictionFixedDelaySeconds = 300;

    private int roomCodeLength = 6;

    private int roomCodeMaxAttempts = 20;

    private Fanout fanout = new Fanout();

    private WebSocket websocket = new WebSocket();

    @Data
    public static class Fanout {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 1000;
        private int schedulerPoolSize = 2;
    }

    @Data
    public static class WebSocket {
        /**
         * Time allowed for a single send before the connection is considered stuck.
         */
        private int sendTimeLimitMillis = 10_000;
        private int bufferSizeLimitBytes = 512 * 1024;
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
