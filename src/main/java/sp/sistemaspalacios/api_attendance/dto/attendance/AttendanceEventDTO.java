package sp.sistemaspalacios.api_attendance.dto.attendance;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceEvent;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceEventType;
import sp.sistemaspalacios.api_attendance.entity.attendance.VerificationStatus;
import sp.sistemaspalacios.api_attendance.entity.attendance.WorkMode;

import java.time.LocalDateTime;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AttendanceEventDTO {
    private Long id;
    private AttendanceEventType type;
    private LocalDateTime timestamp;
    private WorkMode workMode;
    private Double latitude;
    private Double longitude;
    private VerificationStatus verificationStatus;
    private String notes;
    @JsonProperty("isOverride")
    private boolean isOverride;

    public static AttendanceEventDTO from(AttendanceEvent event) {
        return AttendanceEventDTO.builder()
                .id(event.getId())
                .type(event.getType())
                .timestamp(event.getTimestamp())
                .workMode(event.getWorkMode())
                .latitude(event.getLatitude())
                .longitude(event.getLongitude())
                .verificationStatus(event.getVerificationStatus())
                .notes(event.getNotes())
                .isOverride(Boolean.TRUE.equals(event.getIsOverride()))
                .build();
    }
}
