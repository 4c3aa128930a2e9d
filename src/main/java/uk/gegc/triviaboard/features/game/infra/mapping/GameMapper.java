package uk.gegc.triviaboard.features.game.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.triviaboard.features.game.api.dto.AnswerSubmittedResponse;
import uk.gegc.triviaboard.features.game.api.dto.GameEndedResponse;
import uk.gegc.triviaboard.features.game.api.dto.GameSessionDto;
import uk.gegc.triviaboard.features.game.api.dto.GradeAnswerResponse;
import uk.gegc.triviaboard.features.game.api.dto.QuizReadinessDto;
import uk.gegc.triviaboard.features.game.api.dto.ServeQuestionResponse;
import uk.gegc.triviaboard.features.game.api.dto.TeamDto;
import uk.gegc.triviaboard.features.game.domain.model.GameResult;
import uk.gegc.triviaboard.features.game.domain.model.GameSession;
import uk.gegc.triviaboard.features.game.domain.model.GradedAnswer;
import uk.gegc.triviaboard.features.game.domain.model.PendingAnswer;
import uk.gegc.triviaboard.features.game.domain.model.ServedQuestion;
import uk.gegc.triviaboard.features.game.domain.model.Team;
import uk.gegc.triviaboard.features.quiz.application.QuizReadiness;
import uk.gegc.triviaboard.features.quiz.domain.model.Quiz;

import java.util.List;

@Component
public class GameMapper {

    public TeamDto toDto(Team team, Long sessionId) {
        return new TeamDto(
                team.getId(),
                sessionId,
                team.getName(),
                team.getPosition(),
                team.getScore(),
                team.getJoinOrder(),
                team.getCreatedAt()
        );
    }

    public List<TeamDto> toDtos(List<Team> teams, Long sessionId) {
        return teams.stream().map(team -> toDto(team, sessionId)).toList();
    }

    public GameSessionDto toDto(GameSession session, List<Team> teams) {
        Quiz quiz = session.getQuiz();
        return new GameSessionDto(
                session.getId(),
                quiz.getId(),
                quiz.getName(),
                session.getRoomCode(),
                session.getStatus(),
                quiz.getNumTeams(),
                quiz.getNumRounds(),
                session.getQuestionsServed(),
                session.getCreatedAt(),
                session.getStartedAt(),
                session.getCompletedAt(),
                toDtos(teams, session.getId())
        );
    }

    public ServeQuestionResponse toResponse(ServedQuestion served) {
        return new ServeQuestionResponse(
                served.question(),
                served.team(),
                served.roundNumber(),
                served.modelAnswer(),
                served.correctAnswer()
        );
    }

    public AnswerSubmittedResponse toResponse(PendingAnswer pending) {
        return new AnswerSubmittedResponse(
                pending.answerId(),
                pending.teamId(),
                pending.questionId(),
                "Answer submitted successfully"
        );
    }

    public GradeAnswerResponse toResponse(GradedAnswer graded) {
        return new GradeAnswerResponse(
                graded.answerId(),
                graded.teamId(),
                graded.teamName(),
                graded.isCorrect(),
                graded.pointsAwarded(),
                graded.leaderboard()
        );
    }

    public GameEndedResponse toResponse(GameResult result) {
        GameSession session = result.session();
        return new GameEndedResponse(
                session.getId(),
                session.getStatus(),
                session.getCompletedAt(),
                result.winner(),
                result.leaderboard()
        );
    }

    public QuizReadinessDto toDto(QuizReadiness readiness) {
        return new QuizReadinessDto(readiness.valid(), readiness.message());
    }
}
