package kosukeroku.steam.qualification.checker.modelDTO;

public enum QualificationCriterion {

    TOTAL_HOURS("Total playtime", 100, true),
    TOTAL_ACHIEVEMENTS("Achievements earned", 10, true),
    GAMES_OVER_ONE_HOUR("Games with >1 hour", 3, true),
    MOST_PLAYED_PERCENTAGE("Playtime in most played game", 50, false);

    private final String label;
    private final double threshold;
    private final boolean atLeast; // false means the value must stay at or below the threshold

    QualificationCriterion(String label, double threshold, boolean atLeast) {
        this.label = label;
        this.threshold = threshold;
        this.atLeast = atLeast;
    }

    public String label() {
        return label;
    }

    public double threshold() {
        return threshold;
    }

    public boolean isMetBy(double value) {
        return atLeast ? value >= threshold : value <= threshold;
    }

    // how far the value is from passing, 0 when it already passes
    public double shortfall(double value) {
        if (isMetBy(value)) {
            return 0;
        }
        return atLeast ? threshold - value : value - threshold;
    }
}
