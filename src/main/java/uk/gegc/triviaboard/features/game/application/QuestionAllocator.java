package uk.gegc.triviaboard.features.game.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import uk.gegc.triviaboard.features.game.domain.model.AllocationEntry;
import uk.gegc.triviaboard.features.quiz.domain.model.Difficulty;
import uk.gegc.triviaboard.features.quiz.domain.model.Question;

import java.security.SecureRandom;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Pre-assigns questions to teams before the first question is served.
 *
 * <p>Each difficulty pool is shuffled independently. Turns are generated round by round in join order;
 * for every turn the team receives a question from the difficulty it has been given least so far among
 * the pools that still have questions, ties broken in {@link Difficulty} declaration order. When all pools
 * run dry the allocation simply ends early.</p>
 */
@Slf4j
@Component
public class QuestionAllocator {

    private final Random random;

    @Autowired
    public QuestionAllocator() {
        this(new SecureRandom());
    }

    public QuestionAllocator(Random random) {
        this.random = random;
    }

    /**
     * @param teamCount  number of teams, in join order
     * @param roundCount number of rounds
     * @param questions  the quiz's questions; never modified
     * @return at most {@code teamCount * roundCount} entries, round-major
     */
    public List<AllocationEntry> allocate(int teamCount, int roundCount, List<Question> questions) {
        Map<Difficulty, Deque<Question>> pools = shuffledPools(questions);

        List<Map<Difficulty, Integer>> received = new ArrayList<>(teamCount);
        for (int i = 0; i < teamCount; i++) {
            received.add(new EnumMap<>(Difficulty.class));
        }

        List<AllocationEntry> allocation = new ArrayList<>(Math.max(0, teamCount * roundCount));
        for (int round = 0; round < roundCount; round++) {
            for (int team = 0; team < teamCount; team++) {
                Difficulty difficulty = leastReceived(received.get(team), pools);
                if (difficulty == null) {
                    log.warn("Question pools exhausted after {} of {} allocations",
                            allocation.size(), teamCount * roundCount);
                    return allocation;
                }
                allocation.add(new AllocationEntry(team, pools.get(difficulty).pollFirst()));
                received.get(team).merge(difficulty, 1, Integer::sum);
            }
        }
        return allocation;
    }

    private Map<Difficulty, Deque<Question>> shuffledPools(List<Question> questions) {
        Map<Difficulty, List<Question>> partitioned = new EnumMap<>(Difficulty.class);
        for (Difficulty difficulty : Difficulty.values()) {
            partitioned.put(difficulty, new ArrayList<>());
        }
        for (Question question : questions) {
            partitioned.get(question.getDifficulty()).add(question);
        }

        Map<Difficulty, Deque<Question>> pools = new EnumMap<>(Difficulty.class);
        partitioned.forEach((difficulty, bucket) -> {
            Collections.shuffle(bucket, random);
            pools.put(difficulty, new ArrayDeque<>(bucket));
        });
        return pools;
    }

    private Difficulty leastReceived(Map<Difficulty, Integer> received, Map<Difficulty, Deque<Question>> pools) {
        Difficulty best = null;
        int bestCount = Integer.MAX_VALUE;
        for (Difficulty difficulty : Difficulty.values()) {
            if (pools.get(difficulty).isEmpty()) {
                continue;
            }
            int count = received.getOrDefault(difficulty, 0);
            // strict comparison keeps the earlier difficulty on ties
            if (count < bestCount) {
                best = difficulty;
                bestCount = count;
            }
        }
        return best;
    }
}
