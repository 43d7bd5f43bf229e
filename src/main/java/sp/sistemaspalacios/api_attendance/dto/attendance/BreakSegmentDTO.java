package sp.sistemaspalacios.api_attendance.dto.attendance;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;
import sp.sistemaspalacios.api_attendance.entity.attendance.BreakSegment;
import sp.sistemaspalacios.api_attendance.entity.attendance.BreakType;

import java.time.LocalDateTime;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BreakSegmentDTO {
    private Long id;
    private BreakType type;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private Integer durationMinutes;
    private boolean autoClosed;

    public static BreakSegmentDTO from(BreakSegment segment) {
        return BreakSegmentDTO.builder()
                .id(segment.getId())
                .type(segment.getType())
                .startTime(segment.getStartTime())
                .endTime(segment.getEndTime())
                .durationMinutes(segment.getDurationMinutes())
                .autoClosed(Boolean.TRUE.equals(segment.getAutoClosed()))
                .build();
    }
}
