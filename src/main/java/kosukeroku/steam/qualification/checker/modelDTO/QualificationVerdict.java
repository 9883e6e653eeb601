package kosukeroku.steam.qualification.checker.modelDTO;

import java.util.EnumMap;
import java.util.Map;

public record QualificationVerdict(
        long totalMinutes,
        double totalHours,
        int totalAchievements,
        int gamesOver1Hr,
        double mostPlayedPercentage,
        String mostPlayedGame,
        boolean hoursOk,
        boolean achievementsOk,
        boolean diversityOk,
        boolean concentrationOk,
        boolean valid
) {

    public int criteriaMet() {
        int met = 0;
        for (boolean ok : new boolean[]{hoursOk, achievementsOk, diversityOk, concentrationOk}) {
            if (ok) {
                met++;
            }
        }
        return met;
    }

    public int criteriaTotal() {
        return QualificationCriterion.values().length;
    }

    // raw value per criterion, in the order the criteria are declared
    public Map<QualificationCriterion, Double> metricValues() {
        Map<QualificationCriterion, Double> values = new EnumMap<>(QualificationCriterion.class);
        values.put(QualificationCriterion.TOTAL_HOURS, totalHours);
        values.put(QualificationCriterion.TOTAL_ACHIEVEMENTS, (double) totalAchievements);
        values.put(QualificationCriterion.GAMES_OVER_ONE_HOUR, (double) gamesOver1Hr);
        values.put(QualificationCriterion.MOST_PLAYED_PERCENTAGE, mostPlayedPercentage);
        return values;
    }

    public boolean isMet(QualificationCriterion criterion) {
        return switch (criterion) {
            case TOTAL_HOURS -> hoursOk;
            case TOTAL_ACHIEVEMENTS -> achievementsOk;
            case GAMES_OVER_ONE_HOUR -> diversityOk;
            case MOST_PLAYED_PERCENTAGE -> concentrationOk;
        };
    }
}
