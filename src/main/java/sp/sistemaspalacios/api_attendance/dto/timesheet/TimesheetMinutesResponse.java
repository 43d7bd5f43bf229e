package sp.sistemaspalacios.api_attendance.dto.timesheet;

import lombok.Data;

import java.time.LocalDate;

/**
 * Respuesta del módulo de timesheets: minutos reportados por un usuario en un día.
 */
@Data
public class TimesheetMinutesResponse {
    private Long userId;
    private LocalDate date;
    private Integer minutes;
}
