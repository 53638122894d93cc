package ru.tigran.stylistengine.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.tigran.stylistengine.model.ClothingItem;

import java.util.List;
import java.util.Optional;

@Repository
public interface ClothingItemRepository extends JpaRepository<ClothingItem, Long> {
    Optional<ClothingItem> findByUserIdAndId(Long userId, Long id);

    /**
     * Весь гардероб пользователя в порядке добавления.
     * Этот порядок используется как последний tie-break при подборе образа.
     */
    List<ClothingItem> findByUserIdOrderByIdAsc(Long userId);
}
