package me.golemcore.notifier.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusResponse {
    private String status;
    private String version;
    private String serverTime;
    private String zoneId;
    private boolean storeReachable;
    private Integer activeEntries;
    private boolean telegramRunning;
    private long uptimeMs;
    private LastTick lastTick;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LastTick {
        private String startedAt;
        private boolean skipped;
        private int evaluated;
        private int dispatched;
        private int committed;
        private int transientFailures;
        private int permanentFailures;
        private int conflicts;
        private int errors;
    }
}
