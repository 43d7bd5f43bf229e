package sp.sistemaspalacios.api_attendance.entity.anomaly.data;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;
import sp.sistemaspalacios.api_attendance.entity.attendance.VerificationStatus;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class GeofenceFailureData extends AnomalyData {

    private Double latitude;
    private Double longitude;
    private LocalDateTime timestamp;
    private VerificationStatus verificationStatus;

    @Override
    public AnomalyType getAnomalyType() {
        return AnomalyType.GEOFENCE_FAILURE;
    }
}
