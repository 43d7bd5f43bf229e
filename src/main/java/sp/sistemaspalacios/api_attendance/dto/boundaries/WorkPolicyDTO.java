package sp.sistemaspalacios.api_attendance.dto.boundaries;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_attendance.entity.boundaries.workPolicy.WorkPolicy;

import java.time.LocalTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkPolicyDTO {
    private Integer breakDurationMinutes;
    private Integer lunchDurationMinutes;
    private Integer overtimeThresholdMinutes;
    private Integer maxOvertimeMinutes;
    private Integer standardWorkHours;
    private Integer graceMinutesLate;

    @JsonFormat(pattern = "HH:mm")
    private LocalTime workStartTime;

    public static WorkPolicyDTO from(WorkPolicy policy) {
        return WorkPolicyDTO.builder()
                .breakDurationMinutes(policy.getBreakDurationMinutes())
                .lunchDurationMinutes(policy.getLunchDurationMinutes())
                .overtimeThresholdMinutes(policy.getOvertimeThresholdMinutes())
                .maxOvertimeMinutes(policy.getMaxOvertimeMinutes())
                .standardWorkHours(policy.getStandardWorkHours())
                .graceMinutesLate(policy.getGraceMinutesLate())
                .workStartTime(policy.getWorkStartTime())
                .build();
    }
}
