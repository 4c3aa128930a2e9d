package uk.gegc.triviaboard.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when a question is requested but every allocated question has already been served.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class QuestionsExhaustedException extends RuntimeException {

    private final Long sessionId;

    public QuestionsExhaustedException(Long sessionId) {
        super("No more questions available for game session " + sessionId);
        this.sessionId = sessionId;
    }

    public Long getSessionId() {
        return sessionId;
    }
}
