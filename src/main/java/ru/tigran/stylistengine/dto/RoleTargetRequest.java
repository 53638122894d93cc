package ru.tigran.stylistengine.dto;

import jakarta.validation.constraints.Size;
import ru.tigran.stylistengine.matching.RoleTarget;

import java.util.List;
import java.util.Map;

/**
 * Описание одной вещи в запросе на подбор.
 */
public record RoleTargetRequest(
        @Size(max = 50, message = "Тип вещи не должен превышать 50 символов")
        String type,

        Map<String, Double> features,

        @Size(max = 50, message = "Цвет не должен превышать 50 символов")
        String color,

        List<Float> embedding
) {
    public RoleTarget toTarget() {
        float[] vector = null;
        if (embedding != null && !embedding.isEmpty()) {
            vector = new float[embedding.size()];
            for (int i = 0; i < embedding.size(); i++) {
                Float value = embedding.get(i);
                vector[i] = value == null ? 0f : value;
            }
        }
        return new RoleTarget(type, features, color, vector);
    }
}
