package sp.sistemaspalacios.api_attendance.entity.attendance;

public enum WorkMode {
    OFFICE,        // Única modalidad que exige geocerca
    REMOTE,
    CUSTOMER_SITE,
    FIELD_VISIT,
    TRAVEL
}
