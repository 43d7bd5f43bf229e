package sp.sistemaspalacios.api_attendance.dto.attendance;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CheckInResponse {
    private AttendanceEventDTO event;
    private AttendanceDayResponse attendanceDay;
}
