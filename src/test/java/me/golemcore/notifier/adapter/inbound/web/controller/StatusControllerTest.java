package me.golemcore.notifier.adapter.inbound.web.controller;

import me.golemcore.notifier.adapter.inbound.web.dto.StatusResponse;
import me.golemcore.notifier.auto.NotificationScheduler;
import me.golemcore.notifier.domain.exception.StoreUnavailableException;
import me.golemcore.notifier.domain.model.ScheduleEntry;
import me.golemcore.notifier.domain.model.TickReport;
import me.golemcore.notifier.domain.service.ScheduleCalculator;
import me.golemcore.notifier.domain.service.ScheduleService;
import me.golemcore.notifier.port.inbound.ChannelPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StatusControllerTest {

    private static final Instant NOW = Instant.parse("2026-10-19T06:30:00Z");

    private ScheduleService scheduleService;
    private NotificationScheduler notificationScheduler;
    private ChannelPort channelPort;
    private ObjectProvider<BuildProperties> buildPropertiesProvider;
    private StatusController controller;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        scheduleService = mock(ScheduleService.class);
        notificationScheduler = mock(NotificationScheduler.class);
        channelPort = mock(ChannelPort.class);
        buildPropertiesProvider = mock(ObjectProvider.class);
        when(channelPort.isRunning()).thenReturn(true);

        controller = new StatusController(scheduleService, new ScheduleCalculator(ZoneId.of("Asia/Kolkata")),
                notificationScheduler, channelPort, Clock.fixed(NOW, ZoneOffset.UTC), buildPropertiesProvider);
    }

    @Test
    void keepAliveShouldAnswerPlainText() {
        StepVerifier.create(controller.keepAlive())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("Notifier is running", response.getBody());
                })
                .verifyComplete();
    }

    @Test
    void statusShouldReportSchedulerState() {
        Properties props = new Properties();
        props.setProperty("version", "1.2.0");
        when(buildPropertiesProvider.getIfAvailable()).thenReturn(new BuildProperties(props));
        when(scheduleService.listActiveEntries()).thenReturn(List.of(new ScheduleEntry(), new ScheduleEntry()));
        when(notificationScheduler.getLastTickReport())
                .thenReturn(new TickReport(NOW, false, 2, 1, 1, 0, 0, 0, 1));

        StepVerifier.create(controller.status())
                .assertNext(response -> {
                    StatusResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("UP", body.getStatus());
                    assertEquals("1.2.0", body.getVersion());
                    assertEquals("Asia/Kolkata", body.getZoneId());
                    assertEquals("2026-10-19T12:00+05:30", body.getServerTime());
                    assertEquals(2, body.getActiveEntries());
                    assertTrue(body.isTelegramRunning());
                    assertEquals(1, body.getLastTick().getDispatched());
                    assertEquals(1, body.getLastTick().getErrors());
                    assertEquals(NOW.toString(), body.getLastTick().getStartedAt());
                })
                .verifyComplete();
    }

    @Test
    void statusShouldDegradeWhenStoreIsDown() {
        when(scheduleService.listActiveEntries()).thenThrow(new StoreUnavailableException("offline", null));

        StepVerifier.create(controller.status())
                .assertNext(response -> {
                    StatusResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("DEGRADED", body.getStatus());
                    assertFalse(body.isStoreReachable());
                    assertNull(body.getActiveEntries());
                    assertEquals("dev", body.getVersion());
                    assertNull(body.getLastTick());
                })
                .verifyComplete();
    }
}
