package sp.sistemaspalacios.api_attendance.entity.attendance;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Estado derivado de la jornada. No se persiste.
 */
public enum AttendanceStatus {
    NOT_CHECKED_IN("not_checked_in"),
    WORKING("working"),
    ON_BREAK("on_break"),
    CHECKED_OUT("checked_out");

    private final String value;

    AttendanceStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
