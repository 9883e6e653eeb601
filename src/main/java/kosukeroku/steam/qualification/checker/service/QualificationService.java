package kosukeroku.steam.qualification.checker.service;

import kosukeroku.steam.qualification.checker.modelDTO.QualificationVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Slf4j
@Service
@RequiredArgsConstructor
public class QualificationService {

    private final GamingDataCollector dataCollector;
    private final QualificationEvaluator evaluator;

    // blocks the calling thread, fails with CollectionException
    public QualificationVerdict checkQualification(String steamId) {
        return checkQualificationAsync(steamId).block();
    }

    public Mono<QualificationVerdict> checkQualificationAsync(String steamId) {
        log.info("Checking qualification for SteamID: {}", steamId);

        return dataCollector.collect(steamId)
                .map(evaluator::evaluate)
                .doOnNext(verdict -> log.info("SteamID {} met {}/{} criteria, qualified: {}",
                        steamId, verdict.criteriaMet(), verdict.criteriaTotal(), verdict.valid()));
    }
}
