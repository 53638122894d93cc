package ru.tigran.stylistengine.matching;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds app.matching.* from application.yml.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.matching")
public class MatchingProperties {

    private Weights weights = new Weights();

    /**
     * Best candidates scoring below this value are reported as missing. 0 keeps every match.
     */
    private double minOverall = 0.0;

    @Getter
    @Setter
    public static class Weights {
        private double semantic = 0.35;
        private double style = 0.25;
        private double category = 0.20;
        private double color = 0.20;
    }
}
