package uk.gegc.courseprogress.features.achievement.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.courseprogress.features.achievement.domain.model.Achievement;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AchievementRepository extends JpaRepository<Achievement, UUID> {

    List<Achievement> findByActiveTrueOrderBySortOrderAscCodeAsc();

    Optional<Achievement> findByCode(String code);

    long countByActiveTrue();
}
