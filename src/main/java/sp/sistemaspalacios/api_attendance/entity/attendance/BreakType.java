package sp.sistemaspalacios.api_attendance.entity.attendance;

public enum BreakType {
    BREAK, // Pausa corta
    LUNCH  // Almuerzo
}
