package sp.sistemaspalacios.api_attendance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Propiedades {@code attendance.*} de application.yml.
 */
@Data
@ConfigurationProperties(prefix = "attendance")
public class AttendanceProperties {

    /** Zona horaria usada para determinar el día calendario. Vacío = zona del sistema. */
    private String zone;

    private Anomaly anomaly = new Anomaly();
    private Sweep sweep = new Sweep();
    private Defaults defaults = new Defaults();
    private Timesheet timesheet = new Timesheet();
    private Cors cors = new Cors();

    public ZoneId zoneId() {
        return (zone == null || zone.isBlank()) ? ZoneId.systemDefault() : ZoneId.of(zone);
    }

    @Data
    public static class Anomaly {
        private boolean schedulerEnabled = true;
        private String dailyCron = "0 30 23 * * *";
    }

    @Data
    public static class Sweep {
        private String staleBreakCron = "0 0 * * * *";
    }

    /**
     * Política laboral usada cuando la empresa no tiene una registrada.
     */
    @Data
    public static class Defaults {
        private int breakDurationMinutes = 15;
        private int lunchDurationMinutes = 60;
        private int overtimeThresholdMinutes = 480;
        private int maxOvertimeMinutes = 240;
        private int standardWorkHours = 8;
        private int graceMinutesLate = 15;
        private LocalTime workStartTime = LocalTime.of(9, 0);
    }

    @Data
    public static class Timesheet {
        private String baseUrl = "http://localhost:3010";
        private String endpoint = "/api/timesheets/minutes";
        private int connectTimeoutMs = 2000;
        private int readTimeoutMs = 5000;
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:4200"));
    }
}
