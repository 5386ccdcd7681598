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

import me.golemcore.notifier.domain.exception.StoreUnavailableException;
import me.golemcore.notifier.domain.service.GovernanceService;
import me.golemcore.notifier.domain.service.ScheduleCalculator;
import me.golemcore.notifier.port.inbound.ChannelPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.List;

/**
 * Shared beans plus startup: seeds the admin roster and starts enabled
 * channels.
 *
 * <p>
 * The roster is seeded from {@code notifier.governance.*} only when the store
 * holds none yet; afterwards the stored roster is the only source of truth.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final NotifierProperties properties;
    private final List<ChannelPort> channelPorts;
    private final GovernanceService governanceService;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public static ScheduleCalculator scheduleCalculator(NotifierProperties properties) {
        NotifierProperties.SchedulerProperties scheduler = properties.getScheduler();
        return new ScheduleCalculator(scheduler.getZone(), scheduler.getCatchUpGrace());
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Notifier v{} starting...", version);
        log.info("Group timezone: {}", properties.getScheduler().getZoneId());
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());

        try {
            governanceService.bootstrapRoster();
        } catch (StoreUnavailableException e) {
            log.error("[Governance] Could not seed roster, store unavailable: {}", e.getMessage());
        }

        for (ChannelPort channel : channelPorts) {
            log.info("Starting channel: {}", channel.getChannelType());
            channel.start();
        }

        log.info("GolemCore Notifier started successfully");
    }
}
