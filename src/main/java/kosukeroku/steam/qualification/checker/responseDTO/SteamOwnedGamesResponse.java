package kosukeroku.steam.qualification.checker.responseDTO;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

// a private profile comes back as {"response": {}} with no games list at all
@JsonIgnoreProperties(ignoreUnknown = true)
public record SteamOwnedGamesResponse(
        @JsonProperty("response") Response response
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Response(
            @JsonProperty("game_count") Integer gameCount,
            @JsonProperty("games") List<Game> games
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Game(
            @JsonProperty("appid") Long appId,
            @JsonProperty("name") String name,
            @JsonProperty("playtime_forever") Integer playtimeForever
    ) {}
}
