package me.golemcore.notifier.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code notifier.*} prefix:
 * <ul>
 * <li>{@link TelegramProperties} - bot credential and target chats</li>
 * <li>{@link StorageProperties} - document store location</li>
 * <li>{@link SchedulerProperties} - tick loop, timezone and dispatch limits</li>
 * <li>{@link GovernanceProperties} - initial roster</li>
 * </ul>
 *
 * <p>
 * Values are read once at startup and not changed afterwards.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "notifier")
@Data
public class NotifierProperties {

    private TelegramProperties telegram = new TelegramProperties();
    private StorageProperties storage = new StorageProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private GovernanceProperties governance = new GovernanceProperties();

    @Data
    public static class TelegramProperties {
        private boolean enabled = false;
        private String token;
        private String groupChatId;
        private String adminChatId;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/notifier";
    }

    @Data
    public static class SchedulerProperties {
        private boolean enabled = true;
        private String zoneId = "Asia/Kolkata";
        private int tickIntervalSeconds = 60;
        private int dispatchTimeoutSeconds = 15;
        private int commitAttempts = 3;
        private int catchUpGraceSeconds = 300;

        public ZoneId getZone() {
            return ZoneId.of(zoneId);
        }

        /**
         * How long a passed occurrence stays due. Never shorter than one tick
         * plus one dispatch timeout, so a retried occurrence is not lost.
         */
        public Duration getCatchUpGrace() {
            long floor = (long) Math.max(1, tickIntervalSeconds) + Math.max(0, dispatchTimeoutSeconds);
            return Duration.ofSeconds(Math.max(catchUpGraceSeconds, floor));
        }
    }

    @Data
    public static class GovernanceProperties {
        private List<String> owners = new ArrayList<>();
        private List<String> admins = new ArrayList<>();
    }
}
