package ru.tigran.stylistengine.model;

import jakarta.persistence.*;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import ru.tigran.stylistengine.feature.FeatureSource;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Вещь из гардероба пользователя вместе с результатом анализа изображения.
 * Порядок вещей (по id) задает порядок инвентаря при подборе образа.
 */
@Entity
@Table(name = "clothing_items", indexes = {
    @Index(name = "idx_clothing_item_user", columnList = "user_id"),
    @Index(name = "idx_clothing_item_image_hash", columnList = "image_hash")
})
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
@ToString(exclude = {"features", "provenance", "embedding"})
public class ClothingItem extends AuditableEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false, length = 150)
    private String name;

    // Категория, заданная пользователем или выведенная из category:* признака
    @Column(length = 50)
    private String category;

    @Column(length = 50)
    private String color;

    @Column(length = 100)
    private String brand;

    @Column(name = "image_hash", length = 64)
    private String imageHash;

    @Column(columnDefinition = "JSONB")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Double> features;

    @Column(columnDefinition = "JSONB")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Set<FeatureSource>> provenance;

    @Column(columnDefinition = "JSONB")
    @JdbcTypeCode(SqlTypes.JSON)
    private List<Float> embedding;

    // Поля (category/color/brand), значения которых пришли из анализа, а не от пользователя
    @Column(name = "derived_attributes", columnDefinition = "JSONB")
    @JdbcTypeCode(SqlTypes.JSON)
    private Set<String> derivedAttributes = new HashSet<>();

    private LocalDateTime analyzedAt;
}
