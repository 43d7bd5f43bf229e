package sp.sistemaspalacios.api_attendance.dto.anomaly;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyEvent;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalySeverity;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyStatus;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;
import sp.sistemaspalacios.api_attendance.entity.anomaly.data.AnomalyData;

import java.time.LocalDateTime;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnomalyEventDTO {
    private Long id;
    private Long userId;
    private Long companyId;
    private Long ruleId;
    private AnomalyType type;
    private AnomalySeverity severity;
    private AnomalyStatus status;
    private String title;
    private String description;
    private AnomalyData data;
    private LocalDateTime detectedAt;
    private String acknowledgedBy;
    private LocalDateTime acknowledgedAt;
    private String resolvedBy;
    private LocalDateTime resolvedAt;
    private String resolutionNotes;

    public static AnomalyEventDTO from(AnomalyEvent event) {
        return AnomalyEventDTO.builder()
                .id(event.getId())
                .userId(event.getUserId())
                .companyId(event.getCompanyId())
                .ruleId(event.getRule().getId())
                .type(event.getType())
                .severity(event.getSeverity())
                .status(event.getStatus())
                .title(event.getTitle())
                .description(event.getDescription())
                .data(event.getData())
                .detectedAt(event.getDetectedAt())
                .acknowledgedBy(event.getAcknowledgedBy())
                .acknowledgedAt(event.getAcknowledgedAt())
                .resolvedBy(event.getResolvedBy())
                .resolvedAt(event.getResolvedAt())
                .resolutionNotes(event.getResolutionNotes())
                .build();
    }
}
