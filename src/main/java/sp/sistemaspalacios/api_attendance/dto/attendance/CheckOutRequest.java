package sp.sistemaspalacios.api_attendance.dto.attendance;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CheckOutRequest {
    private Double latitude;
    private Double longitude;
    private String notes;
}
