package ru.tigran.stylistengine.quiz;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds app.quiz.* from application.yml.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.quiz")
public class QuizProperties {

    public static final List<String> DEFAULT_CATEGORIES = List.of(
            "Bohemian", "Streetwear", "Classic", "Feminine", "Edgy",
            "Athleisure", "Vintage", "Glamorous", "Eclectic", "Minimalist"
    );

    private int questionCount = 5;

    /** Known style categories. The list order is the tie-break order. */
    private List<String> categories = new ArrayList<>(DEFAULT_CATEGORIES);

    /** questionId -> multiplier. Questions not listed weigh 1.0. */
    private Map<String, Double> questionWeights = new HashMap<>();

    /** Maximum primary-secondary gap that still counts as hybrid. 0 means exact tie only. */
    private double hybridTieThreshold = 0.0;

    public double weightFor(String questionId) {
        Double weight = questionWeights.get(questionId);
        return weight == null ? 1.0 : weight;
    }
}
