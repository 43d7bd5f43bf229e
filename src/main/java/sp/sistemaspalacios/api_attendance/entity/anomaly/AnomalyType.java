package sp.sistemaspalacios.api_attendance.entity.anomaly;

public enum AnomalyType {
    REPEATED_LATE_CHECK_IN(false), // Tardanzas repetidas en la ventana de la regla
    MISSING_CHECK_OUT(true),       // Jornada sin salida al cierre del día
    EXCESSIVE_BREAK(true),         // Descansos por encima de lo permitido
    TIMESHEET_MISMATCH(false),     // Asistencia vs. horas reportadas
    GEOFENCE_FAILURE(false);       // Entrada en oficina fuera de la geocerca

    private final boolean dayScoped;

    AnomalyType(boolean dayScoped) {
        this.dayScoped = dayScoped;
    }

    /** Si la deduplicación se limita además al día calendario. */
    public boolean isDayScoped() {
        return dayScoped;
    }
}
