package uk.gegc.triviaboard.features.game.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.triviaboard.features.game.api.dto.AnswerSubmittedResponse;
import uk.gegc.triviaboard.features.game.api.dto.GameEndedResponse;
import uk.gegc.triviaboard.features.game.api.dto.GameSessionDto;
import uk.gegc.triviaboard.features.game.api.dto.GradeAnswerRequest;
import uk.gegc.triviaboard.features.game.api.dto.GradeAnswerResponse;
import uk.gegc.triviaboard.features.game.api.dto.JoinGameRequest;
import uk.gegc.triviaboard.features.game.api.dto.ServeQuestionResponse;
import uk.gegc.triviaboard.features.game.api.dto.SubmitAnswerRequest;
import uk.gegc.triviaboard.features.game.api.dto.TeamDto;
import uk.gegc.triviaboard.features.game.application.GameQueryService;
import uk.gegc.triviaboard.features.game.application.GameSessionCoordinator;
import uk.gegc.triviaboard.features.game.domain.model.GameSession;
import uk.gegc.triviaboard.features.game.domain.model.GameStateSnapshot;
import uk.gegc.triviaboard.features.game.domain.model.LeaderboardEntry;
import uk.gegc.triviaboard.features.game.domain.model.Team;
import uk.gegc.triviaboard.features.game.infra.mapping.GameMapper;

import java.util.List;

@Tag(name = "Games", description = "Join, run and follow live game sessions")
@RestController
@RequestMapping("/api/v1/games")
@RequiredArgsConstructor
public class GameController {

    private final GameSessionCoordinator coordinator;
    private final GameQueryService queryService;
    private final GameMapper gameMapper;

    @Operation(summary = "Join a game", description = "Registers a team in a waiting game identified by its room code.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Team joined",
                    content = @Content(schema = @Schema(implementation = TeamDto.class))),
            @ApiResponse(responseCode = "400", description = "Game started, full, or team name taken",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Unknown room code",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/join")
    public ResponseEntity<TeamDto> joinGame(@RequestBody @Valid JoinGameRequest request) {
        Team team = coordinator.joinTeam(request.roomCode(), request.teamName());
        return ResponseEntity.ok(gameMapper.toDto(team, team.getGameSession().getId()));
    }

    @Operation(summary = "Get a game session")
    @GetMapping("/{sessionId}")
    public ResponseEntity<GameSessionDto> getSession(
            @Parameter(description = "Session identifier", required = true) @PathVariable Long sessionId) {
        return ResponseEntity.ok(queryService.getSession(sessionId));
    }

    @Operation(summary = "Find a game session by room code")
    @GetMapping("/room/{roomCode}")
    public ResponseEntity<GameSessionDto> getSessionByRoomCode(
            @Parameter(description = "Room code", required = true, example = "K7Q2ZD") @PathVariable String roomCode) {
        return ResponseEntity.ok(queryService.getSessionByRoomCode(roomCode));
    }

    @Operation(summary = "List the teams of a game in join order")
    @ApiResponse(responseCode = "200", description = "Teams returned",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = TeamDto.class))))
    @GetMapping("/{sessionId}/teams")
    public ResponseEntity<List<TeamDto>> getTeams(@PathVariable Long sessionId) {
        return ResponseEntity.ok(queryService.getTeams(sessionId));
    }

    @Operation(summary = "Start a game", description = "Requires exactly the configured number of teams.")
    @SecurityRequirement(name = "basicAuth")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Game started",
                    content = @Content(schema = @Schema(implementation = GameSessionDto.class))),
            @ApiResponse(responseCode = "400", description = "Already started or wrong number of teams",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Caller does not own the quiz",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{sessionId}/start")
    public ResponseEntity<GameSessionDto> startGame(@PathVariable Long sessionId, Authentication authentication) {
        GameSession started = coordinator.startGame(sessionId, authentication.getName());
        return ResponseEntity.ok(queryService.getSession(started.getId()));
    }

    @Operation(
            summary = "Serve the next question",
            description = "Hands the next allocated question to the team on turn, which must roll the dice before it is revealed."
    )
    @SecurityRequirement(name = "basicAuth")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Question served",
                    content = @Content(schema = @Schema(implementation = ServeQuestionResponse.class))),
            @ApiResponse(responseCode = "400", description = "Game not in progress",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "All allocated questions have been served",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{sessionId}/questions/serve")
    public ResponseEntity<ServeQuestionResponse> serveQuestion(@PathVariable Long sessionId,
                                                               Authentication authentication) {
        return ResponseEntity.ok(gameMapper.toResponse(
                coordinator.serveNextQuestion(sessionId, authentication.getName())));
    }

    @Operation(summary = "Submit an answer", description = "Players submit anonymously; the facilitator grades later.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Answer stored",
                    content = @Content(schema = @Schema(implementation = AnswerSubmittedResponse.class))),
            @ApiResponse(responseCode = "400", description = "Game not in progress or team not in game",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Session or question not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{sessionId}/answers")
    public ResponseEntity<AnswerSubmittedResponse> submitAnswer(@PathVariable Long sessionId,
                                                                @RequestBody @Valid SubmitAnswerRequest request) {
        AnswerSubmittedResponse response = gameMapper.toResponse(coordinator.submitAnswer(
                sessionId, request.teamId(), request.questionId(), request.submittedAnswer()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Grade an answer", description = "Correct answers move the team forward by the awarded points.")
    @SecurityRequirement(name = "basicAuth")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Answer graded",
                    content = @Content(schema = @Schema(implementation = GradeAnswerResponse.class))),
            @ApiResponse(responseCode = "400", description = "Already graded or invalid points",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Answer not found in this session",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{sessionId}/grade")
    public ResponseEntity<GradeAnswerResponse> gradeAnswer(@PathVariable Long sessionId,
                                                           @RequestBody @Valid GradeAnswerRequest request,
                                                           Authentication authentication) {
        return ResponseEntity.ok(gameMapper.toResponse(coordinator.gradeAnswer(sessionId, request.answerId(),
                request.isCorrect(), request.pointsAwarded(), authentication.getName())));
    }

    @Operation(summary = "End a game", description = "Completes the game and announces the winner.")
    @SecurityRequirement(name = "basicAuth")
    @PostMapping("/{sessionId}/end")
    public ResponseEntity<GameEndedResponse> endGame(@PathVariable Long sessionId, Authentication authentication) {
        return ResponseEntity.ok(gameMapper.toResponse(coordinator.endGame(sessionId, authentication.getName())));
    }

    @Operation(
            summary = "Get the full game state",
            description = "Everything a reconnecting client needs: teams, leaderboard, question in flight and pending answers. "
                    + "The answer key of pending answers is only included for the quiz owner."
    )
    @GetMapping("/{sessionId}/state")
    public ResponseEntity<GameStateSnapshot> getState(@PathVariable Long sessionId, Authentication authentication) {
        String viewer = authentication != null ? authentication.getName() : null;
        return ResponseEntity.ok(coordinator.getState(sessionId, viewer));
    }

    @Operation(summary = "Get the leaderboard")
    @ApiResponse(responseCode = "200", description = "Teams ranked by position, score, then join order",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = LeaderboardEntry.class))))
    @GetMapping("/{sessionId}/leaderboard")
    public ResponseEntity<List<LeaderboardEntry>> getLeaderboard(@PathVariable Long sessionId) {
        return ResponseEntity.ok(coordinator.leaderboard(sessionId));
    }
}
