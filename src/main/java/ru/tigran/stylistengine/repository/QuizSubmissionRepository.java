package ru.tigran.stylistengine.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.tigran.stylistengine.model.QuizSubmission;

import java.util.List;
import java.util.Optional;

@Repository
public interface QuizSubmissionRepository extends JpaRepository<QuizSubmission, Long> {
    Optional<QuizSubmission> findFirstByUserIdOrderByIdDesc(Long userId);

    List<QuizSubmission> findByUserIdOrderByIdDesc(Long userId);
}
