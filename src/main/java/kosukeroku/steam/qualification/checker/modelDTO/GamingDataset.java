package kosukeroku.steam.qualification.checker.modelDTO;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything collected for one account in one run. A game missing from
 * {@code achievementCounts} had no achievement data available, which is not the
 * same as a game with zero unlocked achievements.
 */
public record GamingDataset(
        String steamId,
        List<OwnedGame> games,
        Map<Long, AchievementCount> achievementCounts
) {
    public GamingDataset {
        games = List.copyOf(games);
        achievementCounts = Map.copyOf(achievementCounts);
    }

    public Optional<AchievementCount> achievementCountFor(long appId) {
        return Optional.ofNullable(achievementCounts.get(appId));
    }

    public int gamesWithoutAchievementData() {
        return (int) games.stream()
                .filter(OwnedGame::isPlayed)
                .filter(game -> !achievementCounts.containsKey(game.appId()))
                .count();
    }
}
