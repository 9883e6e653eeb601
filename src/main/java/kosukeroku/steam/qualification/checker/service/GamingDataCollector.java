package kosukeroku.steam.qualification.checker.service;

import kosukeroku.steam.qualification.checker.client.SteamApiClient;
import kosukeroku.steam.qualification.checker.exception.AchievementsUnavailableException;
import kosukeroku.steam.qualification.checker.exception.CollectionErrorKind;
import kosukeroku.steam.qualification.checker.exception.CollectionException;
import kosukeroku.steam.qualification.checker.exception.SteamPrivateProfileException;
import kosukeroku.steam.qualification.checker.modelDTO.AchievementCount;
import kosukeroku.steam.qualification.checker.modelDTO.GamingDataset;
import kosukeroku.steam.qualification.checker.modelDTO.OwnedGame;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects the games library of an account together with the unlocked achievement
 * count of every played game.
 *
 * <p>Only a missing or unreadable games library fails the collection. Achievement
 * lookups run in parallel (at most {@code maxConcurrency} at a time) and each of them
 * may fail or run past the overall deadline on its own; such games simply end up
 * without an {@link AchievementCount} in the dataset.
 */
@Slf4j
@Service
public class GamingDataCollector {

    private final SteamApiClient steamApiClient;
    private final int maxConcurrency;
    private final Duration achievementsTimeout;

    @Autowired
    public GamingDataCollector(
            SteamApiClient steamApiClient,
            @Value("${qualification.collector.max-concurrency:8}") int maxConcurrency,
            @Value("${qualification.collector.achievements-timeout-seconds:30}") long achievementsTimeoutSeconds) {
        this(steamApiClient, maxConcurrency, Duration.ofSeconds(achievementsTimeoutSeconds));
    }

    GamingDataCollector(SteamApiClient steamApiClient, int maxConcurrency, Duration achievementsTimeout) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("Max concurrency must be positive: " + maxConcurrency);
        }
        this.steamApiClient = steamApiClient;
        this.maxConcurrency = maxConcurrency;
        this.achievementsTimeout = achievementsTimeout;
    }

    public Mono<GamingDataset> collect(String steamId) {
        return steamApiClient.fetchOwnedGames(steamId)
                .onErrorMap(e -> !(e instanceof CollectionException), e -> toCollectionException(steamId, e))
                .flatMap(games -> {
                    if (games.isEmpty()) {
                        log.warn("No games returned for SteamID {}", steamId);
                        return Mono.<GamingDataset>error(CollectionException.privateOrEmpty(steamId));
                    }

                    List<OwnedGame> playedGames = games.stream()
                            .filter(OwnedGame::isPlayed)
                            .toList();

                    log.info("Processing {} played games out of {} for achievements", playedGames.size(), games.size());

                    return collectAchievementCounts(steamId, playedGames)
                            .map(counts -> new GamingDataset(steamId, games, counts));
                })
                .doOnNext(dataset -> log.info("Collected {} games for SteamID {}, achievement data missing for {}",
                        dataset.games().size(), steamId, dataset.gamesWithoutAchievementData()));
    }

    private Mono<Map<Long, AchievementCount>> collectAchievementCounts(String steamId, List<OwnedGame> playedGames) {
        return Flux.fromIterable(playedGames)
                .flatMap(game -> fetchAchievementCount(steamId, game), maxConcurrency)
                .filter(Optional::isPresent)
                .map(Optional::get)
                // games still in flight at the deadline are cancelled and count as unavailable
                .take(achievementsTimeout)
                .collectMap(AchievementCount::appId);
    }

    private Mono<Optional<AchievementCount>> fetchAchievementCount(String steamId, OwnedGame game) {
        return steamApiClient.fetchCompletedAchievements(steamId, game.appId())
                .map(count -> Optional.of(new AchievementCount(game.appId(), count)))
                .defaultIfEmpty(Optional.empty())
                .onErrorResume(e -> {
                    if (e instanceof AchievementsUnavailableException) {
                        log.debug("{}", e.getMessage());
                    } else {
                        log.debug("Achievement lookup failed for appId {} ({}): {}", game.appId(), game.name(), e.getMessage());
                    }
                    return Mono.just(Optional.empty());
                });
    }

    private CollectionException toCollectionException(String steamId, Throwable e) {
        if (e instanceof SteamPrivateProfileException) {
            log.warn("Games library is not accessible for SteamID {}", steamId);
            return new CollectionException(CollectionErrorKind.PRIVATE_OR_EMPTY_PROFILE, steamId, e);
        }
        log.error("Error fetching games for SteamID {}: {}", steamId, e.getMessage());
        return new CollectionException(CollectionErrorKind.UPSTREAM, steamId, e);
    }
}
