package uk.gegc.courseprogress.features.achievement.infra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import uk.gegc.courseprogress.BaseUnitTest;
import uk.gegc.courseprogress.features.achievement.domain.model.Achievement;
import uk.gegc.courseprogress.features.achievement.domain.repository.AchievementRepository;
import uk.gegc.courseprogress.features.gamification.application.GamificationProperties;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("AchievementCatalogInitializer Tests")
class AchievementCatalogInitializerTest extends BaseUnitTest {

    @Mock
    private AchievementRepository achievementRepository;

    @Test
    @DisplayName("Seeds missing codes in order and keeps existing ones")
    void seedsMissingCodes() {
        when(achievementRepository.findByCode(anyString())).thenReturn(Optional.empty());
        when(achievementRepository.findByCode("streak_7_days")).thenReturn(Optional.of(new Achievement()));

        new AchievementCatalogInitializer(achievementRepository, new GamificationProperties()).run();

        ArgumentCaptor<Achievement> captor = ArgumentCaptor.forClass(Achievement.class);
        verify(achievementRepository, times(AchievementCatalogInitializer.DEFAULTS.size() - 1)).save(captor.capture());
        assertThat(captor.getAllValues()).extracting(Achievement::getCode)
                .doesNotContain("streak_7_days")
                .startsWith("first_lesson_completed", "streak_3_days", "streak_14_days");
        assertThat(captor.getAllValues().get(0).getSortOrder()).isEqualTo(10);
        assertThat(captor.getAllValues()).allMatch(Achievement::isActive);
    }

    @Test
    @DisplayName("Does nothing when seeding is disabled")
    void seedingDisabled() {
        GamificationProperties properties = new GamificationProperties();
        properties.setSeedAchievements(false);

        new AchievementCatalogInitializer(achievementRepository, properties).run();

        verify(achievementRepository, never()).save(any());
    }
}
