package sp.sistemaspalacios.api_attendance.entity.anomaly;

public enum AnomalyStatus {
    OPEN,          // Pendiente de revisión
    ACKNOWLEDGED,  // Vista por GH
    RESOLVED,
    DISMISSED
}
