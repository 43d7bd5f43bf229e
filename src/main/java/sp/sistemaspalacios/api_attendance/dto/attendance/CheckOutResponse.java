package sp.sistemaspalacios.api_attendance.dto.attendance;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CheckOutResponse {
    private AttendanceEventDTO event;
    private AttendanceDayResponse attendanceDay;
    private CheckOutSummaryDTO summary;
}
