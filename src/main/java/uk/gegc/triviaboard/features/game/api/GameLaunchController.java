package uk.gegc.triviaboard.features.game.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.triviaboard.features.game.api.dto.GameSessionDto;
import uk.gegc.triviaboard.features.game.api.dto.QuizReadinessDto;
import uk.gegc.triviaboard.features.game.application.GameLaunchService;
import uk.gegc.triviaboard.features.game.domain.model.GameSession;
import uk.gegc.triviaboard.features.game.infra.mapping.GameMapper;

import java.util.List;

@Tag(name = "Game Launch", description = "Validate quizzes and launch game sessions")
@SecurityRequirement(name = "basicAuth")
@RestController
@RequestMapping("/api/v1/quizzes/{quizId}")
@RequiredArgsConstructor
public class GameLaunchController {

    private final GameLaunchService launchService;
    private final GameMapper gameMapper;

    @Operation(
            summary = "Validate a quiz for launch",
            description = "Checks that the quiz has one question per team per round and the configured minimum of every difficulty."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Quiz is ready",
                    content = @Content(schema = @Schema(implementation = QuizReadinessDto.class))),
            @ApiResponse(responseCode = "400", description = "Not enough questions",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Caller does not own the quiz",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Quiz not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/validate")
    public ResponseEntity<QuizReadinessDto> validateQuiz(
            @Parameter(description = "Quiz identifier", required = true) @PathVariable Long quizId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(gameMapper.toDto(launchService.validateQuiz(quizId, authentication.getName())));
    }

    @Operation(summary = "Launch a game session", description = "Creates a waiting session with a unique room code.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Session created",
                    content = @Content(schema = @Schema(implementation = GameSessionDto.class))),
            @ApiResponse(responseCode = "400", description = "Quiz is not ready",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Caller does not own the quiz",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/sessions")
    public ResponseEntity<GameSessionDto> launchSession(
            @Parameter(description = "Quiz identifier", required = true) @PathVariable Long quizId,
            Authentication authentication
    ) {
        GameSession session = launchService.launchSession(quizId, authentication.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(gameMapper.toDto(session, List.of()));
    }
}
