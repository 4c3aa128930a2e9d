package uk.gegc.triviaboard.features.game.domain.model;

import uk.gegc.triviaboard.shared.exception.QuestionsExhaustedException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * Authoritative in-memory state of one running session: the allocation and its cursor, the
 * in-flight question slot and the answers waiting to be graded.
 *
 * <p>Not thread-safe. Every access happens while the owning session lock from
 * {@code LiveSessionRegistry} is held.</p>
 */
public class LiveGameSession {

    private final Long sessionId;
    private final Long quizId;
    private final int teamCount;
    private final List<AllocationEntry> allocation;
    private final Map<Long, PendingAnswer> pendingAnswers = new LinkedHashMap<>();

    private int cursor;
    private long generation;
    private QuestionSlot slot = QuestionSlot.idle();
    private ScheduledFuture<?> pendingReveal;
    private Instant lastActivity;

    public LiveGameSession(Long sessionId, Long quizId, int teamCount, List<AllocationEntry> allocation,
                           int startCursor, Instant now) {
        if (teamCount <= 0) {
            throw new IllegalArgumentException("teamCount must be positive");
        }
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.quizId = quizId;
        this.teamCount = teamCount;
        this.allocation = List.copyOf(allocation);
        this.cursor = Math.max(0, Math.min(startCursor, this.allocation.size()));
        this.lastActivity = now;
    }

    public Long getSessionId() {
        return sessionId;
    }

    public Long getQuizId() {
        return quizId;
    }

    public int getTeamCount() {
        return teamCount;
    }

    public int getCursor() {
        return cursor;
    }

    public int getAllocationSize() {
        return allocation.size();
    }

    public boolean hasNextQuestion() {
        return cursor < allocation.size();
    }

    /**
     * Round of the allocation entry at the given cursor position: one full pass over all teams is a round.
     */
    public int roundAt(int position) {
        return position / teamCount + 1;
    }

    /**
     * Consumes the next allocation entry. The cursor only ever moves forward.
     *
     * @throws QuestionsExhaustedException when every entry has been served
     */
    public AllocationEntry advance() {
        if (!hasNextQuestion()) {
            throw new QuestionsExhaustedException(sessionId);
        }
        return allocation.get(cursor++);
    }

    public QuestionSlot getSlot() {
        return slot;
    }

    /**
     * Puts a freshly served question into the slot, superseding whatever was there.
     * Any reveal scheduled for the previous slot is cancelled.
     */
    public QuestionSlot awaitDice(ServedQuestion served) {
        cancelPendingReveal();
        slot = QuestionSlot.awaitingDice(served, ++generation);
        return slot;
    }

    /**
     * Promotes the slot to {@code ACTIVE} if it is still awaiting the dice under the given generation.
     *
     * @return {@code true} when the slot was promoted, {@code false} for a stale or unexpected call
     */
    public boolean activate(long expectedGeneration) {
        if (!slot.isAwaitingDice() || slot.generation() != expectedGeneration) {
            return false;
        }
        slot = slot.activate();
        pendingReveal = null;
        return true;
    }

    public boolean hasPendingReveal() {
        return pendingReveal != null && !pendingReveal.isDone();
    }

    public void setPendingReveal(ScheduledFuture<?> pendingReveal) {
        this.pendingReveal = pendingReveal;
    }

    public void cancelPendingReveal() {
        if (pendingReveal != null) {
            pendingReveal.cancel(false);
            pendingReveal = null;
        }
    }

    public void addPendingAnswer(PendingAnswer answer) {
        pendingAnswers.putIfAbsent(answer.answerId(), answer);
    }

    /**
     * Removes a graded answer. When it was the last outstanding one an active slot returns to idle.
     *
     * @return {@code true} if the answer was pending
     */
    public boolean resolvePendingAnswer(Long answerId) {
        boolean removed = pendingAnswers.remove(answerId) != null;
        if (pendingAnswers.isEmpty() && slot.isActive()) {
            slot = QuestionSlot.idle();
        }
        return removed;
    }

    public List<PendingAnswer> getPendingAnswers() {
        return List.copyOf(new ArrayList<>(pendingAnswers.values()));
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public void touch(Instant now) {
        this.lastActivity = now;
    }

    /**
     * Releases scheduled work. Called when the session is torn down or evicted.
     */
    public void close() {
        cancelPendingReveal();
    }
}
