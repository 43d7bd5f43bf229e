package sp.sistemaspalacios.api_attendance.dto.attendance;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;
import sp.sistemaspalacios.api_attendance.dto.boundaries.WorkPolicyDTO;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceStatus;
import sp.sistemaspalacios.api_attendance.entity.attendance.WorkMode;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Vista completa de la jornada: estado, totales (en vivo si la sesión sigue
 * abierta), línea de tiempo y la política vigente.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AttendanceDayResponse {
    private Long id;
    private LocalDate date;
    private AttendanceStatus status;
    private LocalDateTime checkInTime;
    private LocalDateTime checkOutTime;
    private WorkMode workMode;
    private CurrentBreakDTO currentBreak;
    private int totalWorkMinutes;
    private int totalBreakMinutes;
    private int totalLunchMinutes;
    private int overtimeMinutes;
    private List<AttendanceEventDTO> events;
    private List<BreakSegmentDTO> breaks;
    private WorkPolicyDTO policy;
}
