package kosukeroku.steam.qualification.checker.telegram;

import kosukeroku.steam.qualification.checker.service.BotService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.List;

@Component
@Slf4j
@ConditionalOnProperty(prefix = "telegram.bot", name = "enabled", havingValue = "true")
public class QualificationCheckerBot extends TelegramLongPollingBot {

    private final String botUsername;
    private final BotService botService;

    public QualificationCheckerBot(
            @Value("${telegram.bot.token}") String botToken,
            @Value("${telegram.bot.username}") String botUsername,
            BotService botService) {
        super(botToken);
        this.botUsername = botUsername;
        this.botService = botService;
    }

    @Override
    public String getBotUsername() {
        return botUsername;
    }

    @Override
    public void onUpdateReceived(Update update) {
        try {
            if (update.hasMessage() && update.getMessage().hasText()) {
                handleTextMessage(update);
            } else if (update.hasCallbackQuery()) {
                handleButtonClick(update);
            }
        } catch (Exception e) {
            log.error("Error processing update: {}", e.getMessage(), e);
        }
    }

    private void handleTextMessage(Update update) throws TelegramApiException {
        String messageText = update.getMessage().getText();
        long chatId = update.getMessage().getChatId();

        // collecting achievements of a large library takes a while
        if (!messageText.equals("/start")) {
            sendWaitMessage(chatId);
        }

        String response = botService.handleInitialMessage(messageText, chatId);
        sendResponse(chatId, response);
    }

    private void handleButtonClick(Update update) throws TelegramApiException {
        String callbackData = update.getCallbackQuery().getData();
        long chatId = update.getCallbackQuery().getMessage().getChatId();

        if (BotService.RECHECK_BUTTON.equals(callbackData)) {
            sendWaitMessage(chatId);
        }

        String response = botService.handleButtonResponse(callbackData, chatId);
        sendResponse(chatId, response);
    }

    private void sendWaitMessage(long chatId) throws TelegramApiException {
        SendMessage waitMessage = new SendMessage();
        waitMessage.setChatId(String.valueOf(chatId));
        waitMessage.setText("⏳ *Checking your library, please wait...*");
        waitMessage.setParseMode("Markdown");
        execute(waitMessage);
    }

    private void sendResponse(long chatId, String response) throws TelegramApiException {
        SendMessage message = new SendMessage();
        message.setChatId(String.valueOf(chatId));
        message.setText(response);
        message.setParseMode("Markdown");

        // showing buttons after a reply which asks for a next action
        if (response.contains(BotService.NEXT_ACTION_MESSAGE)) {
            message.setReplyMarkup(createMainMenuKeyboard());
        }

        execute(message);
    }

    private InlineKeyboardMarkup createMainMenuKeyboard() {
        List<InlineKeyboardButton> row = List.of(
                InlineKeyboardButton.builder()
                        .text("🔄 Check again")
                        .callbackData(BotService.RECHECK_BUTTON)
                        .build(),
                InlineKeyboardButton.builder()
                        .text("📋 Criteria")
                        .callbackData(BotService.CRITERIA_BUTTON)
                        .build());

        InlineKeyboardMarkup markup = new InlineKeyboardMarkup();
        markup.setKeyboard(List.of(row));
        return markup;
    }
}
