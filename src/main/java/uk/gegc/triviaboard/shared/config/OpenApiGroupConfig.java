package uk.gegc.triviaboard.shared.config;

import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups. Facilitator endpoints use HTTP Basic.
 */
@Configuration
@SecurityScheme(name = "basicAuth", type = SecuritySchemeType.HTTP, scheme = "basic")
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi gamesGroup() {
        return GroupedOpenApi.builder()
                .group("games")
                .displayName("Live Games")
                .pathsToMatch("/api/v1/games/**")
                .build();
    }

    @Bean
    public GroupedOpenApi launchGroup() {
        return GroupedOpenApi.builder()
                .group("launch")
                .displayName("Quiz Validation & Launch")
                .pathsToMatch("/api/v1/quizzes/**")
                .build();
    }
}
