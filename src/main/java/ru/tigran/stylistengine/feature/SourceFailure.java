package ru.tigran.stylistengine.feature;

/**
 * Why one feature source did not produce a bag for an image.
 */
public record SourceFailure(FeatureSource source, String reason) {
    @Override
    public String toString() {
        return source.getValue() + ": " + reason;
    }
}
