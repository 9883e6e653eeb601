package kosukeroku.steam.qualification.checker.client;

import kosukeroku.steam.qualification.checker.exception.AchievementsUnavailableException;
import kosukeroku.steam.qualification.checker.exception.SteamApiException;
import kosukeroku.steam.qualification.checker.exception.SteamPrivateProfileException;
import kosukeroku.steam.qualification.checker.exception.SteamUserNotFoundException;
import kosukeroku.steam.qualification.checker.modelDTO.OwnedGame;
import kosukeroku.steam.qualification.checker.responseDTO.SteamAchievementsResponse;
import kosukeroku.steam.qualification.checker.responseDTO.SteamOwnedGamesResponse;
import kosukeroku.steam.qualification.checker.responseDTO.SteamPlayerSummariesResponse;
import kosukeroku.steam.qualification.checker.responseDTO.SteamVanityResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

@Slf4j
@Component
public class SteamApiClient {

    public static final String STEAM_API_BASE_URL = "https://api.steampowered.com";

    private static final int VANITY_SUCCESS = 1; // returned code if vanity url was successfully found
    private static final String UNKNOWN_USER = "Unknown user";

    private final WebClient webClient;
    private final String steamApiKey;
    private final Duration requestTimeout;

    public SteamApiClient(
            WebClient.Builder webClientBuilder,
            @Value("${steam.api.key:}") String steamApiKey,
            @Value("${steam.api.request-timeout-seconds:10}") long requestTimeoutSeconds) {
        this.webClient = webClientBuilder.baseUrl(STEAM_API_BASE_URL).build();
        this.steamApiKey = steamApiKey;
        this.requestTimeout = Duration.ofSeconds(requestTimeoutSeconds);
    }

    // converts vanityURL name to steamID
    public String resolveSteamId(String input) {
        log.info("Resolving SteamID for: {}", input);

        // if input is 17 digits, it is steamID
        if (input.matches("^\\d{17}$")) {
            log.info("Input is already SteamID64: {}", input);
            return input;
        }

        // otherwise we consider it a vanity url
        log.info("Treating input as vanity URL: {}", input);

        SteamVanityResponse response;
        try {
            response = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/ISteamUser/ResolveVanityURL/v0001/")
                            .queryParam("key", steamApiKey)
                            .queryParam("vanityurl", input)
                            .build())
                    .retrieve()
                    .bodyToMono(SteamVanityResponse.class)
                    .timeout(requestTimeout)
                    .block();
        } catch (Exception e) {
            log.error("Error resolving vanity URL: {}", input, e);
            throw new SteamApiException("Error processing profile name.", e);
        }

        if (response != null && response.response() != null
                && Objects.equals(response.response().success(), VANITY_SUCCESS)) {
            String steamId = response.response().steamId();
            log.info("Successfully resolved '{}' to SteamID: {}", input, steamId);
            return steamId;
        }

        log.warn("Vanity URL not found: {}", input);
        throw new SteamUserNotFoundException(input);
    }

    public String getPlayerName(String steamId) {
        try {
            SteamPlayerSummariesResponse response = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/ISteamUser/GetPlayerSummaries/v2/")
                            .queryParam("key", steamApiKey)
                            .queryParam("steamids", steamId)
                            .build())
                    .retrieve()
                    .bodyToMono(SteamPlayerSummariesResponse.class)
                    .timeout(requestTimeout)
                    .block();

            if (response != null &&
                    response.response() != null &&
                    response.response().players() != null &&
                    !response.response().players().isEmpty()) {

                return response.response().players().get(0).personaName();
            }
        } catch (Exception e) {
            log.debug("Could not fetch name for user {}: {}", steamId, e.getMessage());
        }
        return UNKNOWN_USER;
    }

    /**
     * Fetches the full games library with lifetime playtime.
     * Errors with {@link SteamPrivateProfileException} when the library is hidden or
     * access is refused, and with {@link SteamApiException} for anything else.
     */
    public Mono<List<OwnedGame>> fetchOwnedGames(String steamId) {
        log.info("Fetching games library for SteamID: {}", steamId);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/IPlayerService/GetOwnedGames/v0001/")
                        .queryParam("key", steamApiKey)
                        .queryParam("steamid", steamId)
                        .queryParam("include_appinfo", 1)
                        .queryParam("include_played_free_games", 1)
                        .queryParam("format", "json")
                        .build())
                .retrieve()
                .onStatus(SteamApiClient::isAccessDenied,
                        response -> Mono.error(new SteamPrivateProfileException(steamId)))
                .bodyToMono(SteamOwnedGamesResponse.class)
                .timeout(requestTimeout)
                .switchIfEmpty(Mono.error(new SteamApiException("Empty response from Steam API")))
                .map(response -> toOwnedGames(response, steamId))
                .onErrorMap(e -> !(e instanceof SteamPrivateProfileException) && !(e instanceof SteamApiException),
                        e -> new SteamApiException("Could not fetch games for " + steamId, e));
    }

    /**
     * Counts unlocked achievements of one game. Errors with
     * {@link AchievementsUnavailableException} when Steam has no data for the game and
     * with {@link SteamApiException} on network trouble.
     */
    public Mono<Integer> fetchCompletedAchievements(String steamId, long appId) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/ISteamUserStats/GetPlayerAchievements/v1/")
                        .queryParam("key", steamApiKey)
                        .queryParam("steamid", steamId)
                        .queryParam("appid", appId)
                        .build())
                .retrieve()
                // steam answers 400 for apps without stats and 403 when game details are hidden
                .onStatus(HttpStatusCode::is4xxClientError,
                        response -> Mono.error(new AchievementsUnavailableException(appId,
                                "HTTP " + response.statusCode().value())))
                .bodyToMono(SteamAchievementsResponse.class)
                .timeout(requestTimeout)
                .switchIfEmpty(Mono.error(new AchievementsUnavailableException(appId, "empty response")))
                .map(response -> toCompletedCount(response, appId))
                .onErrorMap(e -> !(e instanceof AchievementsUnavailableException),
                        e -> new SteamApiException("Could not fetch achievements for appId " + appId, e));
    }

    private static boolean isAccessDenied(HttpStatusCode status) {
        return status.value() == HttpStatus.UNAUTHORIZED.value()
                || status.value() == HttpStatus.FORBIDDEN.value();
    }

    private static List<OwnedGame> toOwnedGames(SteamOwnedGamesResponse response, String steamId) {
        // both an absent response object and an absent games list mean steam hides the library
        if (response.response() == null || response.response().games() == null) {
            throw new SteamPrivateProfileException(steamId);
        }

        return response.response().games().stream()
                .filter(game -> game.appId() != null)
                .map(game -> new OwnedGame(
                        game.appId(),
                        game.name(),
                        game.playtimeForever() == null ? 0 : Math.max(0, game.playtimeForever())))
                .toList();
    }

    private static int toCompletedCount(SteamAchievementsResponse response, long appId) {
        SteamAchievementsResponse.PlayerStats stats = response.playerstats();
        if (stats == null || !stats.hasAchievements()) {
            String reason = stats != null && stats.error() != null ? stats.error() : "no achievements";
            throw new AchievementsUnavailableException(appId, reason);
        }
        return stats.completedCount();
    }
}
