package kosukeroku.steam.qualification.checker.service;

import kosukeroku.steam.qualification.checker.entity.UserSession;
import kosukeroku.steam.qualification.checker.repository.UserSessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
public class SessionService {

    private final UserSessionRepository sessionRepository;
    private final Long sessionTtlHours;

    public SessionService(
            UserSessionRepository sessionRepository,
            @Value("${app.session.ttl-hours:24}") Long sessionTtlHours) {
        this.sessionRepository = sessionRepository;
        this.sessionTtlHours = sessionTtlHours;
    }

    public void createSession(Long chatId, String steamId, String nickname) {
        UserSession session = new UserSession(chatId, steamId, nickname, sessionTtlHours);
        sessionRepository.save(session);
        log.info("Created session for chat {} with SteamID {}", chatId, steamId);
    }

    public Optional<UserSession> getSession(Long chatId) {
        return sessionRepository.findById(chatId);
    }
}
