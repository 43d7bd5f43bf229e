package sp.sistemaspalacios.api_attendance.dto.boundaries;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GeofencePolicyDTO {
    private Boolean isEnabled;
    private Boolean requireGeofenceForOffice;
}
