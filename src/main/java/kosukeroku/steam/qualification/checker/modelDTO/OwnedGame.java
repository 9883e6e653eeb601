package kosukeroku.steam.qualification.checker.modelDTO;

public record OwnedGame(
        long appId,
        String name, // may be null, steam omits it for some delisted apps
        int playtimeMinutes // lifetime playtime ('playtime_forever' in steamAPI)
) {
    public OwnedGame {
        if (playtimeMinutes < 0) {
            throw new IllegalArgumentException("Playtime can't be negative: " + playtimeMinutes);
        }
    }

    public boolean isPlayed() {
        return playtimeMinutes > 0;
    }
}
