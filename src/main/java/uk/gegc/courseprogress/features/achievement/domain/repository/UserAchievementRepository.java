package uk.gegc.courseprogress.features.achievement.domain.repository;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.courseprogress.features.achievement.domain.model.UserAchievement;

import java.util.List;
import java.util.Set;
import java.util.UUID;

public interface UserAchievementRepository extends JpaRepository<UserAchievement, UUID> {

    @Query("select ua.achievement.id from UserAchievement ua where ua.userId = :userId")
    Set<UUID> findAchievementIdsByUserId(@Param("userId") UUID userId);

    @EntityGraph(attributePaths = "achievement")
    List<UserAchievement> findByUserIdOrderByEarnedAtDesc(UUID userId);

    long countByUserId(UUID userId);
}
