package kosukeroku.steam.qualification.checker.web;

import kosukeroku.steam.qualification.checker.client.SteamApiClient;
import kosukeroku.steam.qualification.checker.modelDTO.QualificationVerdict;
import kosukeroku.steam.qualification.checker.service.QualificationService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/qualification")
@RequiredArgsConstructor
public class QualificationController {

    private final SteamApiClient steamApiClient;
    private final QualificationService qualificationService;

    // accepts a SteamID64 or a custom profile name
    @GetMapping("/{profile}")
    public Mono<QualificationVerdict> checkQualification(@PathVariable String profile) {
        // resolving blocks, so it must stay off the event loop
        return Mono.fromCallable(() -> steamApiClient.resolveSteamId(profile.trim()))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(qualificationService::checkQualificationAsync);
    }
}
