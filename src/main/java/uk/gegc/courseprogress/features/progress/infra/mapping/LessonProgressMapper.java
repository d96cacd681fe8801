package uk.gegc.courseprogress.features.progress.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.courseprogress.features.progress.application.dto.LessonProgressDto;
import uk.gegc.courseprogress.features.progress.domain.model.LessonProgress;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface LessonProgressMapper {
    LessonProgressDto toDto(LessonProgress entity);
}
