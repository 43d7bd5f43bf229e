package sp.sistemaspalacios.api_attendance.entity.anomaly.data;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;

/**
 * Detalle estructurado de una anomalía. Hay una subclase por {@link AnomalyType};
 * se guarda como JSON en una sola columna con el tipo como discriminador.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LateCheckInData.class, name = "REPEATED_LATE_CHECK_IN"),
        @JsonSubTypes.Type(value = MissingCheckOutData.class, name = "MISSING_CHECK_OUT"),
        @JsonSubTypes.Type(value = ExcessiveBreakData.class, name = "EXCESSIVE_BREAK"),
        @JsonSubTypes.Type(value = TimesheetMismatchData.class, name = "TIMESHEET_MISMATCH"),
        @JsonSubTypes.Type(value = GeofenceFailureData.class, name = "GEOFENCE_FAILURE")
})
public abstract class AnomalyData {

    @JsonIgnore
    public abstract AnomalyType getAnomalyType();
}
