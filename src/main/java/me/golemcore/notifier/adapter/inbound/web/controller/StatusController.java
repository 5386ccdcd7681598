package me.golemcore.notifier.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.notifier.adapter.inbound.web.dto.StatusResponse;
import me.golemcore.notifier.auto.NotificationScheduler;
import me.golemcore.notifier.domain.exception.StoreUnavailableException;
import me.golemcore.notifier.domain.model.TickReport;
import me.golemcore.notifier.domain.service.ScheduleCalculator;
import me.golemcore.notifier.domain.service.ScheduleService;
import me.golemcore.notifier.port.inbound.ChannelPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.ZonedDateTime;

/**
 * Keep-alive and status endpoints.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class StatusController {

    private final ScheduleService scheduleService;
    private final ScheduleCalculator calculator;
    private final NotificationScheduler notificationScheduler;
    private final ChannelPort channelPort;
    private final Clock clock;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<ResponseEntity<String>> keepAlive() {
        return Mono.just(ResponseEntity.ok("Notifier is running"));
    }

    @GetMapping("/api/status")
    public Mono<ResponseEntity<StatusResponse>> status() {
        return Mono.fromCallable(this::buildStatus)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    private StatusResponse buildStatus() {
        Integer activeEntries = null;
        boolean storeReachable = true;
        try {
            activeEntries = scheduleService.listActiveEntries().size();
        } catch (StoreUnavailableException e) {
            log.warn("[Status] Store unavailable: {}", e.getMessage());
            storeReachable = false;
        }

        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        return StatusResponse.builder()
                .status(storeReachable ? "UP" : "DEGRADED")
                .version(buildProps != null ? buildProps.getVersion() : "dev")
                .serverTime(ZonedDateTime.now(clock.withZone(calculator.getZone())).toOffsetDateTime().toString())
                .zoneId(calculator.getZone().getId())
                .storeReachable(storeReachable)
                .activeEntries(activeEntries)
                .telegramRunning(channelPort.isRunning())
                .uptimeMs(ManagementFactory.getRuntimeMXBean().getUptime())
                .lastTick(toLastTick(notificationScheduler.getLastTickReport()))
                .build();
    }

    private static StatusResponse.LastTick toLastTick(TickReport report) {
        if (report == null) {
            return null;
        }
        return StatusResponse.LastTick.builder()
                .startedAt(report.startedAt().toString())
                .skipped(report.skipped())
                .evaluated(report.evaluated())
                .dispatched(report.dispatched())
                .committed(report.committed())
                .transientFailures(report.transientFailures())
                .permanentFailures(report.permanentFailures())
                .conflicts(report.conflicts())
                .errors(report.errors())
                .build();
    }
}
