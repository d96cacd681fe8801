package uk.gegc.courseprogress.features.achievement.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.courseprogress.features.achievement.application.dto.AchievementDto;
import uk.gegc.courseprogress.features.achievement.application.dto.UserAchievementDto;
import uk.gegc.courseprogress.features.achievement.domain.model.Achievement;
import uk.gegc.courseprogress.features.achievement.domain.model.UserAchievement;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface AchievementMapper {
    AchievementDto toDto(Achievement entity);
    List<AchievementDto> toDtos(List<Achievement> entities);
    UserAchievementDto toDto(UserAchievement entity);
    List<UserAchievementDto> toUserDtos(List<UserAchievement> entities);
}
