package ru.tigran.stylistengine.quiz;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.stylistengine.exception.ErrorCode;
import ru.tigran.stylistengine.exception.IncompleteQuizException;
import ru.tigran.stylistengine.exception.UnknownCategoryException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StyleProfileBuilder unit тесты")
class StyleProfileBuilderTest {

    private QuizProperties properties;
    private StyleProfileBuilder builder;

    @BeforeEach
    void setUp() {
        properties = new QuizProperties();
        builder = new StyleProfileBuilder(properties);
    }

    private static List<QuizSelection> answers(String... categories) {
        List<QuizSelection> selections = new ArrayList<>();
        for (int i = 0; i < categories.length; i++) {
            selections.add(new QuizSelection("q" + (i + 1), "item-" + (i + 1), categories[i]));
        }
        return selections;
    }

    @Test
    @DisplayName("build - явный лидер: 3 Classic, 2 Edgy")
    void clearPrimaryWithSecondary() {
        StyleProfile profile = builder.build(answers("Classic", "Classic", "Classic", "Edgy", "Edgy"));

        assertEquals("Classic", profile.primaryStyle());
        assertEquals("Edgy", profile.secondaryStyle());
        assertEquals(0.6, profile.confidence(), 1e-9);
        assertFalse(profile.hybrid());
        assertEquals("Classic with a hint of Edgy", profile.styleMessage());
    }

    @Test
    @DisplayName("build - ничья 2/2/1 дает hybrid, порядок по конфигурации")
    void tieProducesHybrid() {
        StyleProfile profile = builder.build(answers("Edgy", "Edgy", "Classic", "Classic", "Vintage"));

        // Classic стоит раньше Edgy в списке категорий
        assertEquals("Classic", profile.primaryStyle());
        assertEquals("Edgy", profile.secondaryStyle());
        assertTrue(profile.hybrid());
        assertEquals(0.4, profile.confidence(), 1e-9);
    }

    @Test
    @DisplayName("build - все ответы одной категории: без secondary, confidence 1")
    void pureStyle() {
        StyleProfile profile = builder.build(answers("Minimalist", "Minimalist", "Minimalist", "Minimalist", "Minimalist"));

        assertEquals("Minimalist", profile.primaryStyle());
        assertNull(profile.secondaryStyle());
        assertFalse(profile.hybrid());
        assertEquals(1.0, profile.confidence(), 1e-9);
        assertEquals("Pure Minimalist", profile.styleMessage());
    }

    @Test
    @DisplayName("build - в scores есть все категории, включая нулевые, в порядке конфигурации")
    void scoresAreZeroFilled() {
        StyleProfile profile = builder.build(answers("Classic", "Classic", "Classic", "Edgy", "Edgy"));

        assertEquals(QuizProperties.DEFAULT_CATEGORIES, List.copyOf(profile.scores().keySet()));
        assertEquals(0.0, profile.scoreOf("Bohemian"), 1e-9);
        assertEquals(3.0, profile.scoreOf("Classic"), 1e-9);
    }

    @Test
    @DisplayName("build - категории сравниваются без учета регистра")
    void caseInsensitiveCategories() {
        StyleProfile profile = builder.build(answers("classic", "CLASSIC", " Classic ", "edgy", "Edgy"));

        assertEquals("Classic", profile.primaryStyle());
        assertEquals(3.0, profile.scoreOf("Classic"), 1e-9);
    }

    @Test
    @DisplayName("build - неполный квиз")
    void incompleteQuiz() {
        IncompleteQuizException exception = assertThrows(IncompleteQuizException.class,
                () -> builder.build(answers("Classic", "Edgy", "Vintage")));

        assertEquals(ErrorCode.INCOMPLETE_QUIZ.getCode(), exception.getErrorCode());
        assertEquals(5, exception.getExpected());
        assertEquals(3, exception.getActual());
        assertThrows(IncompleteQuizException.class, () -> builder.build(null));
    }

    @Test
    @DisplayName("build - неизвестная категория")
    void unknownCategory() {
        UnknownCategoryException exception = assertThrows(UnknownCategoryException.class,
                () -> builder.build(answers("Classic", "Classic", "Preppy", "Edgy", "Edgy")));

        assertEquals(ErrorCode.UNKNOWN_STYLE_CATEGORY.getCode(), exception.getErrorCode());
        assertEquals("Preppy", exception.getCategory());
    }

    @Test
    @DisplayName("build - вес вопроса меняет расклад")
    void questionWeights() {
        properties.setQuestionWeights(Map.of("q5", 3.0));
        builder = new StyleProfileBuilder(properties);

        StyleProfile profile = builder.build(answers("Classic", "Classic", "Edgy", "Edgy", "Vintage"));

        assertEquals("Vintage", profile.primaryStyle());
        assertEquals(3.0 / 7.0, profile.confidence(), 1e-9);
        assertFalse(profile.hybrid());
    }

    @Test
    @DisplayName("build - порог hybrid допускает разрыв в один голос")
    void hybridThreshold() {
        properties.setHybridTieThreshold(1.0);
        builder = new StyleProfileBuilder(properties);

        StyleProfile profile = builder.build(answers("Classic", "Classic", "Classic", "Edgy", "Edgy"));

        assertTrue(profile.hybrid());
    }

    @Test
    @DisplayName("build - одинаковый вход дает одинаковый профиль")
    void deterministic() {
        List<QuizSelection> selections = answers("Bohemian", "Edgy", "Classic", "Vintage", "Glamorous");

        assertEquals(builder.build(selections), builder.build(selections));
        assertEquals("Bohemian", builder.build(selections).primaryStyle());
    }

    @Test
    @DisplayName("constructor - пустой список категорий отклоняется при старте")
    void emptyCategoriesRejected() {
        properties.setCategories(new ArrayList<>());

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new StyleProfileBuilder(properties));
        assertTrue(ex.getMessage().contains("app.quiz.categories"));
    }
}
