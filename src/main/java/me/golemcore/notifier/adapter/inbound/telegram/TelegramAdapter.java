package me.golemcore.notifier.adapter.inbound.telegram;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.notifier.domain.exception.DispatchException;
import me.golemcore.notifier.domain.exception.PermanentDispatchException;
import me.golemcore.notifier.domain.exception.TransientDispatchException;
import me.golemcore.notifier.infrastructure.config.NotifierProperties;
import me.golemcore.notifier.infrastructure.i18n.MessageService;
import me.golemcore.notifier.port.inbound.ChannelPort;
import me.golemcore.notifier.port.inbound.CommandPort;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.send.SendDocument;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Telegram channel adapter using long polling.
 *
 * <p>
 * Outbound, it posts notifications and command replies as plain text, split
 * at line boundaries below Telegram's message limit. Send failures are
 * classified for the scheduler:
 * <ul>
 * <li>400 and 403 (bad chat, bot removed or blocked) - permanent</li>
 * <li>429, 5xx and network errors - transient</li>
 * </ul>
 * A message longer than one chunk is sent chunk by chunk. If a later chunk
 * fails, the whole message is retried on the next tick, so the chunks already
 * delivered are posted again.
 *
 * <p>
 * Inbound, slash commands are routed to {@link CommandPort} together with the
 * sender's Telegram username and id. Other messages are ignored.
 *
 * <p>
 * Enabled via {@code notifier.telegram.enabled=true} and a configured token.
 *
 * @see me.golemcore.notifier.port.inbound.ChannelPort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramAdapter implements ChannelPort, LongPollingSingleThreadUpdateConsumer {

    private static final String CHANNEL_TYPE = "telegram";
    private static final int TELEGRAM_MAX_MESSAGE_LENGTH = 4096;
    private static final int TELEGRAM_MAX_CAPTION_LENGTH = 1024;
    private static final int CHUNK_LENGTH = 3800;
    private static final int HTTP_BAD_REQUEST = 400;
    private static final int HTTP_FORBIDDEN = 403;

    private final NotifierProperties properties;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final MessageService messageService;
    private final ObjectProvider<CommandPort> commandRouter;

    private TelegramClient telegramClient;
    private volatile boolean running = false;
    private volatile boolean initialized = false;
    private final Object lifecycleLock = new Object();

    /**
     * Package-private setter for testing, allows injecting a mock TelegramClient.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
        this.initialized = true;
    }

    private boolean isEnabled() {
        return properties.getTelegram().isEnabled();
    }

    private synchronized TelegramClient ensureInitialized() {
        if (initialized || !isEnabled()) {
            return telegramClient;
        }

        String token = properties.getTelegram().getToken();
        if (token == null || token.isBlank()) {
            log.warn("[Telegram] Token not configured, adapter will not start");
            return null;
        }
        this.telegramClient = new OkHttpTelegramClient(token);
        initialized = true;
        return telegramClient;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("[Telegram] Adapter already running");
                return;
            }
            if (!isEnabled()) {
                log.info("[Telegram] Channel disabled");
                return;
            }
            if (ensureInitialized() == null) {
                log.warn("[Telegram] Client not initialized, cannot start");
                return;
            }

            try {
                botsApplication.registerBot(properties.getTelegram().getToken(), this);
                running = true;
                log.info("[Telegram] Adapter started");
            } catch (TelegramApiException e) {
                if (e.getMessage() != null && e.getMessage().contains("already registered")) {
                    running = true;
                    log.warn("[Telegram] Bot already registered; keeping existing polling session active");
                    return;
                }
                log.error("[Telegram] Failed to start adapter", e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            try {
                botsApplication.close();
                log.info("[Telegram] Adapter stopped");
            } catch (Exception e) {
                log.error("[Telegram] Error stopping adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void consume(Update update) {
        if (!update.hasMessage()) {
            return;
        }
        Message telegramMessage = update.getMessage();
        if (!telegramMessage.hasText() || !telegramMessage.getText().startsWith("/")) {
            return;
        }
        handleCommand(telegramMessage);
    }

    private void handleCommand(Message telegramMessage) {
        String chatId = telegramMessage.getChatId().toString();
        String text = telegramMessage.getText().trim();
        String[] parts = text.split("\\s+", 2);
        String cmd = parts[0].substring(1).split("@")[0];

        CommandPort router = commandRouter.getIfAvailable();
        if (router == null || !router.hasCommand(cmd)) {
            log.debug("[Telegram] Ignoring unknown command /{} in chat {}", cmd, chatId);
            return;
        }

        List<String> args = parts.length > 1
                ? Arrays.asList(parts[1].trim().split("\\s+"))
                : List.of();

        Map<String, Object> ctx = new HashMap<>();
        ctx.put(CommandPort.CTX_CHAT_ID, chatId);
        User from = telegramMessage.getFrom();
        if (from != null) {
            if (from.getUserName() != null) {
                ctx.put(CommandPort.CTX_CALLER_USERNAME, from.getUserName());
            }
            ctx.put(CommandPort.CTX_CALLER_ID, String.valueOf(from.getId()));
        }

        try {
            CommandPort.CommandResult result = router.execute(cmd, args, ctx).join();
            if (result.data() instanceof CommandPort.Attachment attachment) {
                sendDocument(chatId, attachment.content(), attachment.filename(), result.output()).join();
            } else {
                sendMessage(chatId, result.output()).join();
            }
        } catch (RuntimeException e) {
            log.error("[Telegram] Command execution failed: /{}", cmd, e);
            sendMessage(chatId, messageService.getMessage("command.failed", e.getMessage()))
                    .exceptionally(sendError -> {
                        log.warn("[Telegram] Could not report failure to chat {}", chatId);
                        return null;
                    });
        }
    }

    @Override
    public CompletableFuture<Void> sendMessage(String chatId, String content) {
        return CompletableFuture.runAsync(() -> {
            TelegramClient client = ensureInitialized();
            if (client == null) {
                throw new TransientDispatchException("Telegram client not initialized", null);
            }
            for (String chunk : splitAtNewlines(content, CHUNK_LENGTH)) {
                String safeChunk = chunk.length() > TELEGRAM_MAX_MESSAGE_LENGTH
                        ? chunk.substring(0, TELEGRAM_MAX_MESSAGE_LENGTH - 3) + "..."
                        : chunk;
                SendMessage sendMessage = SendMessage.builder()
                        .chatId(chatId)
                        .text(safeChunk)
                        .build();
                try {
                    client.execute(sendMessage);
                } catch (TelegramApiException e) {
                    throw classify(chatId, e);
                }
            }
        });
    }

    @Override
    public CompletableFuture<Void> sendDocument(String chatId, byte[] fileData,
            String filename, String caption) {
        return CompletableFuture.runAsync(() -> {
            TelegramClient client = ensureInitialized();
            if (client == null) {
                throw new TransientDispatchException("Telegram client not initialized", null);
            }
            SendDocument.SendDocumentBuilder<?, ?> builder = SendDocument.builder()
                    .chatId(chatId)
                    .document(new InputFile(new ByteArrayInputStream(fileData), filename));

            if (caption != null && !caption.isBlank()) {
                builder.caption(truncateCaption(caption));
            }

            try {
                client.execute(builder.build());
                log.debug("[Telegram] Sent document '{}' ({} bytes) to chat: {}", filename, fileData.length, chatId);
            } catch (TelegramApiException e) {
                throw classify(chatId, e);
            }
        });
    }

    static DispatchException classify(String chatId, TelegramApiException e) {
        if (e instanceof TelegramApiRequestException requestException) {
            Integer code = requestException.getErrorCode();
            if (code != null && (code == HTTP_BAD_REQUEST || code == HTTP_FORBIDDEN)) {
                log.error("[Telegram] Chat {} rejected the message ({}): {}", chatId, code,
                        requestException.getApiResponse());
                return new PermanentDispatchException(
                        "Telegram rejected message to " + chatId + " (" + code + "): "
                                + requestException.getApiResponse(),
                        e);
            }
        }
        log.warn("[Telegram] Failed to send to chat {}: {}", chatId, e.getMessage());
        return new TransientDispatchException("Telegram send failed: " + e.getMessage(), e);
    }

    /**
     * Split text at paragraph (\n\n) or line (\n) boundaries to keep chunks under
     * maxLength.
     */
    static List<String> splitAtNewlines(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        int start = 0;

        while (start < text.length()) {
            if (start + maxLength >= text.length()) {
                chunks.add(text.substring(start));
                break;
            }

            String segment = text.substring(start, start + maxLength);

            int splitAt = segment.lastIndexOf("\n\n");
            if (splitAt > maxLength / 4) {
                chunks.add(text.substring(start, start + splitAt));
                start += splitAt + 2;
                continue;
            }

            splitAt = segment.lastIndexOf('\n');
            if (splitAt > maxLength / 4) {
                chunks.add(text.substring(start, start + splitAt));
                start += splitAt + 1;
                continue;
            }

            // hard split
            chunks.add(text.substring(start, start + maxLength));
            start += maxLength;
        }

        return chunks;
    }

    private String truncateCaption(String caption) {
        if (caption.length() <= TELEGRAM_MAX_CAPTION_LENGTH) {
            return caption;
        }
        return caption.substring(0, TELEGRAM_MAX_CAPTION_LENGTH - 3) + "...";
    }
}
