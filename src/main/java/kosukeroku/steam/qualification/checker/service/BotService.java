package kosukeroku.steam.qualification.checker.service;

import kosukeroku.steam.qualification.checker.client.SteamApiClient;
import kosukeroku.steam.qualification.checker.entity.UserSession;
import kosukeroku.steam.qualification.checker.exception.CollectionErrorKind;
import kosukeroku.steam.qualification.checker.exception.CollectionException;
import kosukeroku.steam.qualification.checker.exception.SteamApiException;
import kosukeroku.steam.qualification.checker.exception.SteamUserNotFoundException;
import kosukeroku.steam.qualification.checker.modelDTO.QualificationVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class BotService {

    public static final String RECHECK_BUTTON = "recheck";
    public static final String CRITERIA_BUTTON = "criteria";
    public static final String NEXT_ACTION_MESSAGE = "What would you like to do next?";

    private final SteamApiClient steamApiClient;
    private final QualificationService qualificationService;
    private final SessionService sessionService;
    private final VerdictMessageFormatter verdictMessageFormatter;

    private static final String NEW_PROFILE_HINT = "🔄 _To check a different profile, simply send another SteamID or custom URL_";
    private static final String WELCOME_MESSAGE = """
👋 *Hi! I am Steam Qualification Checker Bot!*

Send me your:
• 🔢 SteamID (17 digits)
• 🔗 Or custom profile name

I'll check whether your account has:
📊 100+ hours of total playtime
🏆 10+ achievements earned
🎮 3+ games played for more than an hour
⭐ No more than 50% of playtime in a single game

*Examples:*
`76561197960287930`
`gabelogannewell`

💡 _Your Game Details must be Public: Steam → Settings → Privacy → Game Details_
""";
    private static final String CRITERIA_MESSAGE = """
📋 *Qualification Criteria:*

• 📊 Total playtime of at least *100 hours*
• 🏆 At least *10 achievements* unlocked across all games
• 🎮 At least *3 games* with more than *1 hour* each
• ⭐ The most played game takes *50% or less* of total playtime

_Games without achievement data still count towards playtime._
""";

    // shows the welcome message for the '/start' command and runs the check in other cases
    public String handleInitialMessage(String message, Long chatId) {
        if (message.equals("/start")) {
            return WELCOME_MESSAGE;
        }

        if (message.trim().isEmpty()) {
            return "❌ Please send me your SteamID or custom URL name.";
        }

        return processInitialSteamInput(message.trim(), chatId);
    }

    // processes an input that expects steamID (which is any text input besides '/start' at this moment)
    private String processInitialSteamInput(String input, Long chatId) {
        try {
            String resolvedSteamId = steamApiClient.resolveSteamId(input);
            String nickname = steamApiClient.getPlayerName(resolvedSteamId);

            // creating a redis session so the check can be repeated with a button
            sessionService.createSession(chatId, resolvedSteamId, nickname);

            return runCheck(resolvedSteamId, nickname);

        } catch (SteamUserNotFoundException e) {
            return "❌ " + e.getMessage();
        } catch (SteamApiException e) {
            log.warn("Steam API failure for chat {}: {}", chatId, e.getMessage());
            return "⏳ Steam is not responding right now. Please try again later.";
        } catch (Exception e) {
            log.error("Error processing Steam input for chat {}: {}", chatId, e.getMessage(), e);
            return "❌ Server internal error. Please try again later.";
        }
    }

    // processes button responses (re-running the check, showing the criteria)
    public String handleButtonResponse(String buttonData, Long chatId) {

        if (CRITERIA_BUTTON.equals(buttonData)) {
            return CRITERIA_MESSAGE + "\n" + NEXT_ACTION_MESSAGE;
        }
        if (!RECHECK_BUTTON.equals(buttonData)) {
            return "❌ Unknown command.";
        }

        // getting steamID from a redis session
        Optional<UserSession> session = sessionService.getSession(chatId);

        if (session.isEmpty()) {
            return "❌ Session expired or not found. Please send your SteamID again.";
        }

        try {
            return runCheck(session.get().getSteamId(), session.get().getNickname());
        } catch (Exception e) {
            log.error("Error processing button {} for chat {}: {}", buttonData, chatId, e.getMessage(), e);
            return "❌ Error processing request. Please try again.";
        }
    }

    private String runCheck(String steamId, String nickname) {
        try {
            QualificationVerdict verdict = qualificationService.checkQualification(steamId);
            String report = verdictMessageFormatter.formatVerdictMessage(verdict, nickname, steamId);
            return report + "\n\n" + NEXT_ACTION_MESSAGE + "\n\n" + NEW_PROFILE_HINT;

        } catch (CollectionException e) {
            if (e.getKind() == CollectionErrorKind.PRIVATE_OR_EMPTY_PROFILE) {
                return "🔒 " + e.getMessage() + "\n\n" + NEXT_ACTION_MESSAGE;
            }
            return "⏳ " + e.getMessage() + "\n\n" + NEXT_ACTION_MESSAGE;
        }
    }
}
