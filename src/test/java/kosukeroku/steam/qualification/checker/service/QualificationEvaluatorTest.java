package kosukeroku.steam.qualification.checker.service;

import kosukeroku.steam.qualification.checker.modelDTO.AchievementCount;
import kosukeroku.steam.qualification.checker.modelDTO.GamingDataset;
import kosukeroku.steam.qualification.checker.modelDTO.OwnedGame;
import kosukeroku.steam.qualification.checker.modelDTO.QualificationVerdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("QualificationEvaluator")
class QualificationEvaluatorTest {

    private static final String STEAM_ID = "76561197960287930";

    private QualificationEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new QualificationEvaluator();
    }

    private static GamingDataset dataset(List<OwnedGame> games, AchievementCount... counts) {
        Map<Long, AchievementCount> byApp = new HashMap<>();
        Arrays.stream(counts).forEach(count -> byApp.put(count.appId(), count));
        return new GamingDataset(STEAM_ID, games, byApp);
    }

    private static OwnedGame game(long appId, int minutes) {
        return new OwnedGame(appId, "Game " + appId, minutes);
    }

    @Nested
    @DisplayName("scenarios")
    class Scenarios {

        @Test
        @DisplayName("one dominant game fails concentration")
        void dominantGameFailsConcentration() {
            GamingDataset data = dataset(
                    List.of(game(1, 6000), game(2, 120), game(3, 90)),
                    new AchievementCount(1, 5), new AchievementCount(2, 4), new AchievementCount(3, 3));

            QualificationVerdict verdict = evaluator.evaluate(data);

            assertThat(verdict.totalMinutes()).isEqualTo(6210);
            assertThat(verdict.totalHours()).isEqualTo(103.5);
            assertThat(verdict.totalAchievements()).isEqualTo(12);
            assertThat(verdict.gamesOver1Hr()).isEqualTo(3);
            assertThat(verdict.mostPlayedPercentage()).isCloseTo(96.618, within(0.001));
            assertThat(verdict.mostPlayedGame()).isEqualTo("Game 1");
            assertThat(verdict.concentrationOk()).isFalse();
            assertThat(verdict.valid()).isFalse();
            assertThat(verdict.criteriaMet()).isEqualTo(3);
        }

        @Test
        @DisplayName("balanced library passes all four criteria")
        void balancedLibraryQualifies() {
            GamingDataset data = dataset(
                    List.of(game(1, 3000), game(2, 2000), game(3, 1100), game(4, 50)),
                    new AchievementCount(1, 10), new AchievementCount(2, 5));

            QualificationVerdict verdict = evaluator.evaluate(data);

            assertThat(verdict.totalHours()).isEqualTo(102.5);
            assertThat(verdict.gamesOver1Hr()).isEqualTo(3);
            assertThat(verdict.totalAchievements()).isEqualTo(15);
            assertThat(verdict.mostPlayedPercentage()).isCloseTo(48.78, within(0.01));
            assertThat(verdict.hoursOk()).isTrue();
            assertThat(verdict.achievementsOk()).isTrue();
            assertThat(verdict.diversityOk()).isTrue();
            assertThat(verdict.concentrationOk()).isTrue();
            assertThat(verdict.valid()).isTrue();
            assertThat(verdict.criteriaMet()).isEqualTo(4);
        }

        @Test
        @DisplayName("games without achievement data still count towards playtime")
        void missingAchievementDataOnlyAffectsAchievements() {
            // game 3 has no entry: its lookup failed
            GamingDataset data = dataset(
                    List.of(game(1, 3000), game(2, 2500), game(3, 900)),
                    new AchievementCount(1, 4), new AchievementCount(2, 3));

            QualificationVerdict verdict = evaluator.evaluate(data);

            assertThat(data.achievementCountFor(3)).isEmpty();
            assertThat(verdict.totalAchievements()).isEqualTo(7);
            assertThat(verdict.totalMinutes()).isEqualTo(6400);
            assertThat(verdict.gamesOver1Hr()).isEqualTo(3);
            assertThat(verdict.achievementsOk()).isFalse();
            assertThat(verdict.valid()).isFalse();
        }

        @Test
        @DisplayName("zero achievements and missing achievements add up the same")
        void zeroCountIsKeptApartFromMissingCount() {
            GamingDataset data = dataset(List.of(game(1, 100), game(2, 100)), new AchievementCount(1, 0));

            assertThat(data.achievementCountFor(1)).contains(new AchievementCount(1, 0));
            assertThat(data.achievementCountFor(2)).isEmpty();
            assertThat(data.gamesWithoutAchievementData()).isEqualTo(1);
            assertThat(evaluator.evaluate(data).totalAchievements()).isZero();
        }
    }

    @Nested
    @DisplayName("boundaries")
    class Boundaries {

        @Test
        @DisplayName("exactly 60 minutes is not over one hour, 61 is")
        void oneHourIsStrict() {
            QualificationVerdict verdict = evaluator.evaluate(dataset(
                    List.of(game(1, 60), game(2, 61), game(3, 59))));

            assertThat(verdict.gamesOver1Hr()).isEqualTo(1);
        }

        @Test
        @DisplayName("exactly 50 percent in one game is allowed")
        void fiftyPercentIsInclusive() {
            QualificationVerdict verdict = evaluator.evaluate(dataset(
                    List.of(game(1, 3000), game(2, 3000))));

            assertThat(verdict.mostPlayedPercentage()).isEqualTo(50.0);
            assertThat(verdict.concentrationOk()).isTrue();
        }

        @Test
        @DisplayName("just over 50 percent in one game fails")
        void justOverFiftyPercentFails() {
            QualificationVerdict verdict = evaluator.evaluate(dataset(
                    List.of(game(1, 500_001), game(2, 499_999))));

            assertThat(verdict.mostPlayedPercentage()).isGreaterThan(50.0);
            assertThat(verdict.concentrationOk()).isFalse();
        }

        @Test
        @DisplayName("exactly 100 hours and 10 achievements pass")
        void inclusiveLowerThresholds() {
            QualificationVerdict verdict = evaluator.evaluate(dataset(
                    List.of(game(1, 2000), game(2, 2000), game(3, 2000)),
                    new AchievementCount(1, 10)));

            assertThat(verdict.totalHours()).isEqualTo(100.0);
            assertThat(verdict.hoursOk()).isTrue();
            assertThat(verdict.achievementsOk()).isTrue();
            assertThat(verdict.valid()).isTrue();
        }

        @Test
        @DisplayName("account without any playtime gets 0 percent and no division error")
        void zeroUsageAccount() {
            QualificationVerdict verdict = evaluator.evaluate(dataset(
                    List.of(game(1, 0), game(2, 0))));

            assertThat(verdict.totalHours()).isZero();
            assertThat(verdict.mostPlayedPercentage()).isZero();
            assertThat(verdict.concentrationOk()).isTrue();
            assertThat(verdict.valid()).isFalse();
        }

        @Test
        @DisplayName("empty dataset yields a verdict with an unknown most played game")
        void emptyDataset() {
            QualificationVerdict verdict = evaluator.evaluate(dataset(List.of()));

            assertThat(verdict.mostPlayedGame()).isEqualTo("Unknown");
            assertThat(verdict.mostPlayedPercentage()).isZero();
            assertThat(verdict.valid()).isFalse();
        }

        @Test
        @DisplayName("most played game without a name is reported as unknown")
        void namelessMostPlayedGame() {
            QualificationVerdict verdict = evaluator.evaluate(dataset(
                    List.of(new OwnedGame(1, null, 500), game(2, 100))));

            assertThat(verdict.mostPlayedGame()).isEqualTo("Unknown");
        }
    }

    @Nested
    @DisplayName("invariants")
    class Invariants {

        @Test
        @DisplayName("total hours is the exact minute sum divided by 60")
        void totalHoursIsUnroundedMinuteSum() {
            QualificationVerdict verdict = evaluator.evaluate(dataset(
                    List.of(game(1, 7), game(2, 13), game(3, 1))));

            assertThat(verdict.totalHours()).isEqualTo(21 / 60.0);
        }

        @Test
        @DisplayName("valid is the conjunction of the four criteria")
        void validIsConjunction() {
            List<GamingDataset> datasets = List.of(
                    dataset(List.of(game(1, 6000), game(2, 120), game(3, 90)), new AchievementCount(1, 12)),
                    dataset(List.of(game(1, 3000), game(2, 2000), game(3, 1100)), new AchievementCount(1, 15)),
                    dataset(List.of(game(1, 30))),
                    dataset(List.of(game(1, 3000), game(2, 3000), game(3, 3000)), new AchievementCount(2, 9)));

            for (GamingDataset data : datasets) {
                QualificationVerdict verdict = evaluator.evaluate(data);
                assertThat(verdict.valid()).isEqualTo(verdict.hoursOk() && verdict.achievementsOk()
                        && verdict.diversityOk() && verdict.concentrationOk());
            }
        }

        @Test
        @DisplayName("evaluating the same dataset twice gives equal verdicts")
        void idempotent() {
            GamingDataset data = dataset(
                    List.of(game(1, 3000), game(2, 2000), game(3, 1100), game(4, 50)),
                    new AchievementCount(1, 15));

            assertThat(evaluator.evaluate(data)).isEqualTo(evaluator.evaluate(data));
        }
    }
}
