package sp.sistemaspalacios.api_attendance.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_attendance.service.attendance.StaleBreakSweepService;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "attendance.anomaly", name = "scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class StaleBreakSweepScheduler {

    private final StaleBreakSweepService sweepService;

    @Scheduled(cron = "${attendance.sweep.stale-break-cron:0 0 * * * *}", zone = "${attendance.zone:}")
    public void closeStaleBreaks() {
        try {
            sweepService.closeStaleBreaks();
        } catch (RuntimeException e) {
            log.error("❌ El cierre de descansos olvidados falló", e);
        }
    }
}
