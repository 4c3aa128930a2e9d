package uk.gegc.triviaboard.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import uk.gegc.triviaboard.features.game.config.GameProperties;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools behind live games: the fanout executor that carries outbound WebSocket lanes
 * and the scheduler that fires delayed question reveals.
 */
@Configuration
@EnableScheduling
@Slf4j
public class GameAsyncConfig {

    @Bean(name = "gameEventExecutor")
    public ThreadPoolTaskExecutor gameEventExecutor(GameProperties properties) {
        GameProperties.Fanout fanout = properties.getFanout();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(fanout.getCorePoolSize());
        executor.setMaxPoolSize(fanout.getMaxPoolSize());
        executor.setQueueCapacity(fanout.getQueueCapacity());
        executor.setThreadNamePrefix("game-fanout-");

        // Never run a send on the calling thread; a rejected send is counted as a failed delivery
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();

        log.info("Game event executor configured - Core: {}, Max: {}, Queue: {}",
                fanout.getCorePoolSize(), fanout.getMaxPoolSize(), fanout.getQueueCapacity());
        return executor;
    }

    @Bean(name = "gameTaskScheduler")
    public ThreadPoolTaskScheduler gameTaskScheduler(GameProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getFanout().getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("game-reveal-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();

        log.info("Game task scheduler configured - Pool: {}", properties.getFanout().getSchedulerPoolSize());
        return scheduler;
    }
}
