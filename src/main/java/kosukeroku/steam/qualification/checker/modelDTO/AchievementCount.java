package kosukeroku.steam.qualification.checker.modelDTO;

public record AchievementCount(
        long appId,
        int completedCount
) {
    public AchievementCount {
        if (completedCount < 0) {
            throw new IllegalArgumentException("Completed count can't be negative: " + completedCount);
        }
    }
}
