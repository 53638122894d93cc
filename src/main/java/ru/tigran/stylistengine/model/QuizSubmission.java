package ru.tigran.stylistengine.model;

import jakarta.persistence.*;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import ru.tigran.stylistengine.quiz.QuizSelection;

import java.util.List;
import java.util.Map;

/**
 * Одно прохождение стилевого квиза. История сохраняется, актуальным считается последнее.
 */
@Entity
@Table(name = "quiz_submissions", indexes = {
    @Index(name = "idx_quiz_submission_user", columnList = "user_id")
})
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
@ToString(exclude = {"selections", "scores"})
public class QuizSubmission extends AuditableEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(columnDefinition = "JSONB", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private List<QuizSelection> selections;

    // Все настроенные категории, включая нулевые
    @Column(columnDefinition = "JSONB", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Double> scores;

    @Column(nullable = false, length = 50)
    private String primaryStyle;

    @Column(length = 50)
    private String secondaryStyle;

    @Column(nullable = false)
    private Double confidence;

    @Column(nullable = false)
    private Boolean hybrid;

    @Column(length = 150)
    private String styleMessage;
}
