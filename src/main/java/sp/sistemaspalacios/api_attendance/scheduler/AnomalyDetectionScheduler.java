package sp.sistemaspalacios.api_attendance.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_attendance.dto.anomaly.DetectionRunSummary;
import sp.sistemaspalacios.api_attendance.service.anomaly.AnomalyDetectionService;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "attendance.anomaly", name = "scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class AnomalyDetectionScheduler {

    private final AnomalyDetectionService detectionService;

    @Scheduled(cron = "${attendance.anomaly.daily-cron:0 30 23 * * *}", zone = "${attendance.zone:}")
    public void runDailyDetection() {
        try {
            DetectionRunSummary summary = detectionService.runDailyDetection();
            if (summary.failures() > 0) {
                log.warn("⚠️ Detección diaria con {} fallos", summary.failures());
            }
        } catch (RuntimeException e) {
            log.error("❌ La detección diaria de anomalías falló", e);
        }
    }
}
