package sp.sistemaspalacios.api_attendance.entity.anomaly.data;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class MissingCheckOutData extends AnomalyData {

    private LocalDate date;
    private LocalDateTime lastCheckIn;

    @Override
    public AnomalyType getAnomalyType() {
        return AnomalyType.MISSING_CHECK_OUT;
    }
}
