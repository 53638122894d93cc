package ru.tigran.stylistengine.matching;

import java.util.ArrayList;
import java.util.List;

/**
 * Colors already committed by earlier roles in one match pass. Immutable:
 * {@link #with(String)} returns a new palette.
 */
public final class ColorPalette {

    private static final ColorPalette EMPTY = new ColorPalette(List.of());

    private final List<String> colors;

    private ColorPalette(List<String> colors) {
        this.colors = colors;
    }

    public static ColorPalette empty() {
        return EMPTY;
    }

    public ColorPalette with(String color) {
        if (color == null || color.isBlank()) {
            return this;
        }
        List<String> next = new ArrayList<>(colors);
        next.add(color);
        return new ColorPalette(List.copyOf(next));
    }

    public List<String> colors() {
        return colors;
    }

    public boolean isEmpty() {
        return colors.isEmpty();
    }

    @Override
    public String toString() {
        return "ColorPalette" + colors;
    }
}
