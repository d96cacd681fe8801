package uk.gegc.courseprogress.features.points.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import uk.gegc.courseprogress.features.points.domain.model.UserPoints;

import java.util.List;
import java.util.UUID;

public interface UserPointsRepository extends JpaRepository<UserPoints, UUID> {

    @Query("select p from UserPoints p order by p.totalPoints desc, p.userId asc")
    List<UserPoints> findTopByTotalPoints(Pageable pageable);
}
