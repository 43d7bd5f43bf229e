package sp.sistemaspalacios.api_attendance.dto.attendance;

import lombok.Builder;
import lombok.Data;
import sp.sistemaspalacios.api_attendance.entity.attendance.VerificationStatus;
import sp.sistemaspalacios.api_attendance.entity.attendance.WorkMode;

import java.time.LocalDateTime;

@Data
@Builder
public class CheckInLocationDTO {
    private Long id;
    private Long userId;
    private Double latitude;
    private Double longitude;
    private LocalDateTime timestamp;
    private WorkMode workMode;
    private VerificationStatus verificationStatus;
}
