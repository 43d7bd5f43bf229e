package sp.sistemaspalacios.api_attendance.entity.anomaly;

public enum AnomalySeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
