package kosukeroku.steam.qualification.checker.service;

import kosukeroku.steam.qualification.checker.modelDTO.AchievementCount;
import kosukeroku.steam.qualification.checker.modelDTO.GamingDataset;
import kosukeroku.steam.qualification.checker.modelDTO.OwnedGame;
import kosukeroku.steam.qualification.checker.modelDTO.QualificationVerdict;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Optional;

import static kosukeroku.steam.qualification.checker.modelDTO.QualificationCriterion.*;

/**
 * Turns a collected dataset into a verdict. Stateless and free of I/O, so the same
 * dataset always produces the same verdict.
 */
@Component
public class QualificationEvaluator {

    private static final int ONE_HOUR_MINUTES = 60;
    private static final String UNKNOWN_GAME = "Unknown";

    public QualificationVerdict evaluate(GamingDataset dataset) {
        long totalMinutes = dataset.games().stream()
                .mapToLong(OwnedGame::playtimeMinutes)
                .sum();
        double totalHours = totalMinutes / 60.0;

        // exactly one hour does not count
        int gamesOver1Hr = (int) dataset.games().stream()
                .filter(game -> game.playtimeMinutes() > ONE_HOUR_MINUTES)
                .count();

        Optional<OwnedGame> mostPlayed = dataset.games().stream()
                .max(Comparator.comparingInt(OwnedGame::playtimeMinutes));
        int mostPlayedMinutes = mostPlayed.map(OwnedGame::playtimeMinutes).orElse(0);
        double mostPlayedPercentage = totalMinutes > 0
                ? (double) mostPlayedMinutes / totalMinutes * 100
                : 0.0;
        String mostPlayedGame = mostPlayed
                .map(OwnedGame::name)
                .orElse(UNKNOWN_GAME);

        // games without achievement data add nothing here
        int totalAchievements = dataset.achievementCounts().values().stream()
                .mapToInt(AchievementCount::completedCount)
                .sum();

        boolean hoursOk = TOTAL_HOURS.isMetBy(totalHours);
        boolean achievementsOk = TOTAL_ACHIEVEMENTS.isMetBy(totalAchievements);
        boolean diversityOk = GAMES_OVER_ONE_HOUR.isMetBy(gamesOver1Hr);
        boolean concentrationOk = MOST_PLAYED_PERCENTAGE.isMetBy(mostPlayedPercentage);

        return new QualificationVerdict(
                totalMinutes,
                totalHours,
                totalAchievements,
                gamesOver1Hr,
                mostPlayedPercentage,
                mostPlayedGame,
                hoursOk,
                achievementsOk,
                diversityOk,
                concentrationOk,
                hoursOk && achievementsOk && diversityOk && concentrationOk
        );
    }
}
