package me.golemcore.notifier.port.inbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Bidirectional port for communication channels (Telegram). Receives commands
 * from users and delivers notifications.
 */
public interface ChannelPort {

    /**
     * Returns the channel type identifier (e.g., "telegram").
     */
    String getChannelType();

    /**
     * Starts listening for incoming messages from the channel.
     */
    void start();

    /**
     * Stops listening for messages and disconnects from the channel.
     */
    void stop();

    /**
     * Checks if the channel is currently active and listening.
     */
    boolean isRunning();

    /**
     * Sends a text message to the specified chat. The future fails with a
     * {@link me.golemcore.notifier.domain.exception.TransientDispatchException}
     * or a
     * {@link me.golemcore.notifier.domain.exception.PermanentDispatchException}.
     */
    CompletableFuture<Void> sendMessage(String chatId, String content);

    /**
     * Sends a document to the chat with an optional caption. Fails the same way
     * as {@link #sendMessage(String, String)}.
     */
    CompletableFuture<Void> sendDocument(String chatId, byte[] fileData, String filename, String caption);
}
