package sp.sistemaspalacios.api_attendance.dto.attendance;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CheckOutSummaryDTO {
    private int workedMinutes;
    private int breakMinutes; // Pausas + almuerzo
    private int overtime;
}
