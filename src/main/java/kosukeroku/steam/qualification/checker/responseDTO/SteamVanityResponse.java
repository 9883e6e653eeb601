package kosukeroku.steam.qualification.checker.responseDTO;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SteamVanityResponse(
        @JsonProperty("response") Response response
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Response(
            @JsonProperty("steamid") String steamId,
            @JsonProperty("success") Integer success, // 1 for success, 42 for no match
            @JsonProperty("message") String message
    ) {}
}
