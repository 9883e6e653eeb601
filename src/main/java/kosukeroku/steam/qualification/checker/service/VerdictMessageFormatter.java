package kosukeroku.steam.qualification.checker.service;

import kosukeroku.steam.qualification.checker.modelDTO.QualificationVerdict;
import org.springframework.stereotype.Component;

import java.util.Locale;

import static kosukeroku.steam.qualification.checker.modelDTO.QualificationCriterion.*;

// renders a verdict as a Markdown report for the chat
@Component
public class VerdictMessageFormatter {

    private static final String MET = "✅";
    private static final String NOT_MET = "❌";

    public String formatVerdictMessage(QualificationVerdict verdict, String nickname, String steamId) {
        StringBuilder message = new StringBuilder();

        message.append("👤 *User:* ").append(nickname).append(" (SteamID: ").append(steamId).append(")\n\n");
        message.append("📋 *Qualification Check:*\n\n");

        message.append(format("📊 *Total playtime:* %.2f hours\n", verdict.totalHours()));
        message.append(requirementLine(verdict.hoursOk(), "100+ hours",
                format("Need %.2f more", TOTAL_HOURS.shortfall(verdict.totalHours()))));

        message.append(format("🏆 *Achievements earned:* %d\n", verdict.totalAchievements()));
        message.append(requirementLine(verdict.achievementsOk(), "10+ achievements",
                format("Need %.0f more", TOTAL_ACHIEVEMENTS.shortfall(verdict.totalAchievements()))));

        message.append(format("🎮 *Games with >1 hour:* %d\n", verdict.gamesOver1Hr()));
        message.append(requirementLine(verdict.diversityOk(), "3+ games",
                format("Need %.0f more", GAMES_OVER_ONE_HOUR.shortfall(verdict.gamesOver1Hr()))));

        message.append(format("⭐ *Most played game:* %s (%.2f%% of total)\n",
                verdict.mostPlayedGame(), verdict.mostPlayedPercentage()));
        message.append(requirementLine(verdict.concentrationOk(), "≤50% in a single game",
                format("Over by %.2f%%", MOST_PLAYED_PERCENTAGE.shortfall(verdict.mostPlayedPercentage()))));

        message.append(format("Criteria met: *%d/%d*\n\n", verdict.criteriaMet(), verdict.criteriaTotal()));

        if (verdict.valid()) {
            message.append("✅ *QUALIFIED:* Account meets all criteria!");
        } else {
            message.append("❌ *NOT QUALIFIED:* Account does not meet all criteria");
        }

        return message.toString();
    }

    private String requirementLine(boolean met, String requirement, String shortfall) {
        if (met) {
            return "    " + MET + " Requirement: " + requirement + "\n\n";
        }
        return "    " + NOT_MET + " Requirement: " + requirement + " _(" + shortfall + ")_\n\n";
    }

    // fixed locale so decimals always use a dot
    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
