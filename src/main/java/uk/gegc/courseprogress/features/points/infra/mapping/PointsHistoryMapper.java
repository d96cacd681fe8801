package uk.gegc.courseprogress.features.points.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.courseprogress.features.points.application.dto.PointsHistoryDto;
import uk.gegc.courseprogress.features.points.domain.model.PointsHistory;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface PointsHistoryMapper {
    PointsHistoryDto toDto(PointsHistory entity);
    List<PointsHistoryDto> toDtos(List<PointsHistory> entities);
}
