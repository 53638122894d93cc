package ru.tigran.stylistengine.quiz;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.tigran.stylistengine.exception.IncompleteQuizException;
import ru.tigran.stylistengine.exception.UnknownCategoryException;
import ru.tigran.stylistengine.scoring.ScoringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a complete quiz submission into a {@link StyleProfile}. Pure function of the
 * selections and the quiz configuration: identical input always gives identical output.
 */
@Slf4j
@Component
public class StyleProfileBuilder {

    private final QuizProperties properties;
    // lower-case name -> canonical spelling
    private final Map<String, String> canonicalNames = new HashMap<>();
    // canonical name -> position in configuration, used as tie-break key
    private final Map<String, Integer> categoryOrder = new HashMap<>();

    public StyleProfileBuilder(QuizProperties properties) {
        this.properties = properties;
        List<String> categories = properties.getCategories();
        if (categories == null || categories.isEmpty()) {
            throw new IllegalStateException("app.quiz.categories must contain at least one style category");
        }
        for (int i = 0; i < categories.size(); i++) {
            String category = categories.get(i).trim();
            canonicalNames.putIfAbsent(category.toLowerCase(Locale.ROOT), category);
            categoryOrder.putIfAbsent(category, i);
        }
    }

    public StyleProfile build(List<QuizSelection> selections) {
        int expected = properties.getQuestionCount();
        int actual = selections == null ? 0 : selections.size();
        if (actual != expected) {
            throw new IncompleteQuizException(expected, actual);
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        for (String category : categoryOrder.keySet().stream()
                .sorted(Comparator.comparing(categoryOrder::get)).toList()) {
            scores.put(category, 0.0);
        }

        for (QuizSelection selection : selections) {
            String category = resolve(selection);
            scores.merge(category, properties.weightFor(selection.questionId()), Double::sum);
        }

        List<String> ranked = new ArrayList<>(scores.keySet());
        ranked.sort(Comparator.<String>comparingDouble(scores::get).reversed()
                .thenComparing(categoryOrder::get));

        String primary = ranked.get(0);
        double primaryTally = scores.get(primary);
        String secondary = null;
        if (ranked.size() > 1 && scores.get(ranked.get(1)) > 0) {
            secondary = ranked.get(1);
        }

        boolean hybrid = secondary != null
                && primaryTally - scores.get(secondary) <= properties.getHybridTieThreshold();

        double total = scores.values().stream().mapToDouble(Double::doubleValue).sum();
        double confidence = total > 0 ? ScoringUtils.clamp01(primaryTally / total) : 0.0;

        StyleProfile profile = new StyleProfile(scores, primary, secondary, confidence, hybrid,
                styleMessage(primary, secondary));
        log.debug("Built style profile: primary={}, secondary={}, confidence={}, hybrid={}",
                primary, secondary, confidence, hybrid);
        return profile;
    }

    private String resolve(QuizSelection selection) {
        String raw = selection.styleCategory();
        String canonical = raw == null ? null : canonicalNames.get(raw.trim().toLowerCase(Locale.ROOT));
        if (canonical == null) {
            throw new UnknownCategoryException(selection.questionId(), raw);
        }
        return canonical;
    }

    static String styleMessage(String primary, String secondary) {
        if (secondary == null) {
            return "Pure " + primary;
        }
        return primary + " with a hint of " + secondary;
    }
}
