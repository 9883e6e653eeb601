package kosukeroku.steam.qualification.checker.responseDTO;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SteamPlayerSummariesResponse(
        @JsonProperty("response") Response response
) {

    // steam always returns an array, even when a single player is requested
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Response(
            @JsonProperty("players") List<Player> players
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Player(
            @JsonProperty("steamid") String steamId,
            @JsonProperty("personaname") String personaName,
            @JsonProperty("communityvisibilitystate") Integer visibilityState
    ) {}
}
