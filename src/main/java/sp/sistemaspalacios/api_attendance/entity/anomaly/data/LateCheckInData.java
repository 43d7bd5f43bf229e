package sp.sistemaspalacios.api_attendance.entity.anomaly.data;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class LateCheckInData extends AnomalyData {

    private int lateCount;
    private int windowDays;
    private LocalTime expectedStart;
    private int graceMinutes;
    private List<LocalDate> lateDates;

    @Override
    public AnomalyType getAnomalyType() {
        return AnomalyType.REPEATED_LATE_CHECK_IN;
    }
}
