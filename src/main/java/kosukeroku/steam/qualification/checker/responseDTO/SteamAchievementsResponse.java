package kosukeroku.steam.qualification.checker.responseDTO;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SteamAchievementsResponse(
        @JsonProperty("playerstats") PlayerStats playerstats
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PlayerStats(
            @JsonProperty("steamID") String steamId,
            @JsonProperty("gameName") String gameName,
            @JsonProperty("achievements") List<GameAchievement> achievements,
            @JsonProperty("success") Boolean success,
            @JsonProperty("error") String error // e.g. "Requested app has no stats"
    ) {
        public boolean hasAchievements() {
            return Boolean.TRUE.equals(success) && achievements != null;
        }

        public int completedCount() {
            return (int) achievements.stream()
                    .filter(GameAchievement::isAchieved)
                    .count();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GameAchievement(
            @JsonProperty("apiname") String apiName,
            @JsonProperty("achieved") Integer achieved,
            @JsonProperty("unlocktime") Long unlockTime
    ) {
        public boolean isAchieved() {
            return achieved != null && achieved == 1;
        }
    }
}
