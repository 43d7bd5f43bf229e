package sp.sistemaspalacios.api_attendance.entity.attendance;

public enum VerificationStatus {
    NONE,
    GEOFENCE_PASSED,
    GEOFENCE_FAILED
}
