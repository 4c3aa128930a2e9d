package uk.gegc.triviaboard.shared.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.triviaboard.features.quiz.domain.model.Difficulty;
import uk.gegc.triviaboard.features.quiz.domain.model.Question;
import uk.gegc.triviaboard.features.quiz.domain.model.QuestionType;
import uk.gegc.triviaboard.features.quiz.domain.model.Quiz;
import uk.gegc.triviaboard.features.quiz.domain.repository.QuestionRepository;
import uk.gegc.triviaboard.features.quiz.domain.repository.QuizRepository;

import java.util.List;

/**
 * Seeds a playable demo quiz on an empty database. Quiz authoring lives outside this service,
 * so local runs would otherwise have nothing to launch.
 */
@Component
@ConditionalOnProperty(prefix = "triviaboard.demo", name = "seed", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DataInitializer implements CommandLineRunner {

    private static final String DEMO_QUIZ_NAME = "Demo Trivia Night";

    private final QuizRepository quizRepository;
    private final QuestionRepository questionRepository;

    @Value("${triviaboard.demo.owner:facilitator}")
    private String demoOwner;

    @Override
    @Transactional
    public void run(String... args) {
        if (quizRepository.count() > 0) {
            log.debug("Quizzes already present, skipping demo data");
            return;
        }
        Quiz quiz = new Quiz();
        quiz.setName(DEMO_QUIZ_NAME);
        quiz.setOwnerUsername(demoOwner);
        quiz.setNumTeams(3);
        quiz.setNumRounds(4);
        quiz.setEasyQuestionsCount(3);
        quiz.setMediumQuestionsCount(3);
        quiz.setHardQuestionsCount(3);
        quiz.setInsaneQuestionsCount(3);
        Quiz saved = quizRepository.save(quiz);

        List<Question> questions = List.of(
                mcq(saved, Difficulty.EASY, "What is the capital of France?", "Berlin", "Paris", "Rome", "Madrid", "B"),
                mcq(saved, Difficulty.EASY, "How many legs does a spider have?", "6", "8", "10", "12", "B"),
                open(saved, Difficulty.EASY, QuestionType.FILL_IN_THE_BLANKS, "The largest ocean is the ____ Ocean.", "Pacific"),
                mcq(saved, Difficulty.MEDIUM, "Which planet has the most moons?", "Earth", "Mars", "Saturn", "Venus", "C"),
                mcq(saved, Difficulty.MEDIUM, "Who painted the Mona Lisa?", "Da Vinci", "Picasso", "Monet", "Dali", "A"),
                open(saved, Difficulty.MEDIUM, QuestionType.FILL_IN_THE_BLANKS, "Water boils at ____ degrees Celsius at sea level.", "100"),
                mcq(saved, Difficulty.HARD, "In which year did the Berlin Wall fall?", "1987", "1988", "1989", "1991", "C"),
                open(saved, Difficulty.HARD, QuestionType.WHAT_WOULD_YOU_DO, "Your team finds a lost wallet. What would you do?", "Return it to its owner or hand it to the authorities."),
                mcq(saved, Difficulty.HARD, "What is the chemical symbol for tungsten?", "Tu", "W", "Tg", "Wo", "B"),
                mcq(saved, Difficulty.INSANE, "What is the smallest prime number greater than 100?", "101", "103", "107", "109", "A"),
                open(saved, Difficulty.INSANE, QuestionType.FILL_IN_THE_BLANKS, "The speed of light is roughly ____ km/s.", "300000"),
                open(saved, Difficulty.INSANE, QuestionType.WHAT_WOULD_YOU_DO, "The power fails mid-quiz. What would you do?", "Keep scores on paper and continue by voice.")
        );
        questionRepository.saveAll(questions);
        log.info("Seeded demo quiz {} with {} questions for '{}'", saved.getId(), questions.size(), demoOwner);
    }

    private static Question mcq(Quiz quiz, Difficulty difficulty, String text, String a, String b, String c, String d,
                                String correct) {
        Question question = base(quiz, difficulty, QuestionType.MCQ, text);
        question.setOptionA(a);
        question.setOptionB(b);
        question.setOptionC(c);
        question.setOptionD(d);
        question.setCorrectAnswer(correct);
        return question;
    }

    private static Question open(Quiz quiz, Difficulty difficulty, QuestionType type, String text, String modelAnswer) {
        Question question = base(quiz, difficulty, type, text);
        question.setModelAnswer(modelAnswer);
        return question;
    }

    private static Question base(Quiz quiz, Difficulty difficulty, QuestionType type, String text) {
        Question question = new Question();
        question.setQuiz(quiz);
        question.setDifficulty(difficulty);
        question.setType(type);
        question.setQuestionText(text);
        question.setTimeLimit(60);
        return question;
    }
}
