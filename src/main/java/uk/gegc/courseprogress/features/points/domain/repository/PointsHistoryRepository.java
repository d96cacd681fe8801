package uk.gegc.courseprogress.features.points.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.courseprogress.features.points.domain.model.PointsHistory;
import uk.gegc.courseprogress.features.points.domain.model.PointsReason;
import uk.gegc.courseprogress.features.points.domain.model.PointsReferenceType;

import java.util.Optional;
import java.util.UUID;

public interface PointsHistoryRepository extends JpaRepository<PointsHistory, UUID> {

    Optional<PointsHistory> findByUserIdAndReferenceTypeAndReferenceId(UUID userId,
                                                                      PointsReferenceType referenceType,
                                                                      UUID referenceId);

    @Query(value = """
        select h from PointsHistory h
        where h.userId = :userId
        order by h.createdAt desc, h.id desc
    """, countQuery = "select count(h) from PointsHistory h where h.userId = :userId")
    Page<PointsHistory> findHistory(@Param("userId") UUID userId, Pageable pageable);

    long countByUserIdAndReason(UUID userId, PointsReason reason);

    @Query("select coalesce(sum(h.points), 0) from PointsHistory h where h.userId = :userId")
    long sumPointsByUserId(@Param("userId") UUID userId);
}
