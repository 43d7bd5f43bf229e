package sp.sistemaspalacios.api_attendance.entity.attendance;

public enum AttendanceEventType {
    CHECK_IN,  // Entrada
    CHECK_OUT  // Salida
}
