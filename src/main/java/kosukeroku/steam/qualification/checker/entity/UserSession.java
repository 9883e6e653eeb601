package kosukeroku.steam.qualification.checker.entity;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.redis.core.RedisHash;
import org.springframework.data.redis.core.TimeToLive;

import java.io.Serializable;
import java.util.concurrent.TimeUnit;

// remembers which account a chat is checking, verdicts are never stored
@RedisHash("qualification_sessions")
@NoArgsConstructor
@Data
public class UserSession implements Serializable {

    @Id
    private Long chatId;
    private String steamId; // in resolved state
    private String nickname;
    private Long createdAt;

    @TimeToLive(unit = TimeUnit.HOURS)
    private Long ttl;

    public UserSession(Long chatId, String steamId, String nickname, Long ttl) {
        this.chatId = chatId;
        this.steamId = steamId;
        this.nickname = nickname;
        this.createdAt = System.currentTimeMillis();
        this.ttl = ttl;
    }
}
