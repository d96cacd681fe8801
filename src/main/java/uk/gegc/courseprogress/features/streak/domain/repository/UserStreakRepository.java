package uk.gegc.courseprogress.features.streak.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.courseprogress.features.streak.domain.model.UserStreak;

import java.util.UUID;

public interface UserStreakRepository extends JpaRepository<UserStreak, UUID> {
}
