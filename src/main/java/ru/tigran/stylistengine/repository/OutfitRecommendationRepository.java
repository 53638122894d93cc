package ru.tigran.stylistengine.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.tigran.stylistengine.model.OutfitRecommendation;

import java.util.Optional;

@Repository
public interface OutfitRecommendationRepository extends JpaRepository<OutfitRecommendation, Long> {
    Optional<OutfitRecommendation> findByUserIdAndId(Long userId, Long id);

    /**
     * История подборов пользователя, новые первыми. null-фильтр не применяется.
     */
    @Query("""
        SELECT r FROM OutfitRecommendation r
        WHERE r.userId = :userId
          AND (:occasion IS NULL OR r.occasion = :occasion)
          AND (:weather IS NULL OR r.weather = :weather)
          AND (:favorite IS NULL OR r.favorite = :favorite)
        ORDER BY r.id DESC
        """)
    Page<OutfitRecommendation> findHistory(
            @Param("userId") Long userId,
            @Param("occasion") String occasion,
            @Param("weather") String weather,
            @Param("favorite") Boolean favorite,
            Pageable pageable
    );
}
