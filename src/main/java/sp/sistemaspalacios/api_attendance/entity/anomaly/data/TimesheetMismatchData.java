package sp.sistemaspalacios.api_attendance.entity.anomaly.data;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class TimesheetMismatchData extends AnomalyData {

    private LocalDate date;
    private int attendanceMinutes;
    private int timesheetMinutes;
    private double variance;

    @Override
    public AnomalyType getAnomalyType() {
        return AnomalyType.TIMESHEET_MISMATCH;
    }
}
