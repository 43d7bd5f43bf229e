package sp.sistemaspalacios.api_attendance.dto.attendance;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AttendanceSummaryResponse {
    private long totalDays;
    private long presentDays;
    private long absentDays;
    private double totalWorkHours;
    private double totalOvertimeHours;
    private String averageCheckInTime;
    private String averageCheckOutTime;
}
