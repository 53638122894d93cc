package ru.tigran.stylistengine.model;

import jakarta.persistence.*;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import ru.tigran.stylistengine.dto.RoleMatchResponse;
import ru.tigran.stylistengine.matching.OutfitRole;

import java.util.List;

/**
 * Сохраненный результат подбора образа вместе с оценкой пользователя.
 * prompt и aiResponse заполнены только для образов, сгенерированных моделью.
 */
@Entity
@Table(name = "outfit_recommendations", indexes = {
    @Index(name = "idx_outfit_recommendation_user", columnList = "user_id")
})
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
@ToString(exclude = {"matches", "aiResponse"})
public class OutfitRecommendation extends AuditableEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(columnDefinition = "TEXT")
    private String prompt;

    @Column(columnDefinition = "TEXT")
    private String aiResponse;

    @Column(length = 100)
    private String aiModel;

    @Column(length = 100)
    private String occasion;

    @Column(length = 100)
    private String weather;

    @Column(length = 50)
    private String primaryStyle;

    @Column(columnDefinition = "JSONB", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private List<RoleMatchResponse> matches;

    @Column(columnDefinition = "JSONB", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private List<OutfitRole> missingRoles;

    @Column(nullable = false)
    private Double overallQuality;

    @Column(nullable = false)
    private Boolean complete;

    // 1..5, null пока пользователь не оценил
    private Integer feedbackScore;

    @Column(columnDefinition = "TEXT")
    private String feedbackComments;

    @Column(nullable = false)
    private Boolean favorite = false;
}
