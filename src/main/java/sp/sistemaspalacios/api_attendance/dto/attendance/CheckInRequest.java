package sp.sistemaspalacios.api_attendance.dto.attendance;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_attendance.entity.attendance.WorkMode;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CheckInRequest {
    @NotNull(message = "workMode es requerido")
    private WorkMode workMode;
    private Double latitude;
    private Double longitude;
    private String deviceFingerprint;
    private String notes;

    public static CheckInRequest of(WorkMode workMode) {
        return new CheckInRequest(workMode, null, null, null, null);
    }

    public static CheckInRequest at(WorkMode workMode, double latitude, double longitude) {
        return new CheckInRequest(workMode, latitude, longitude, null, null);
    }
}
