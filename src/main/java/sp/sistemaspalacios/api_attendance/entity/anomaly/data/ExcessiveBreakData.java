package sp.sistemaspalacios.api_attendance.entity.anomaly.data;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;

import java.time.LocalDate;

/**
 * Al terminar un descanso se reporta el total del día; en el barrido diario,
 * el descanso individual que superó el límite.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExcessiveBreakData extends AnomalyData {

    private LocalDate date;
    private Integer totalBreakMinutes;
    private Long breakId;
    private Integer durationMinutes;
    private Integer limitMinutes;

    public static ExcessiveBreakData dailyTotal(LocalDate date, int totalBreakMinutes, int limitMinutes) {
        return new ExcessiveBreakData(date, totalBreakMinutes, null, null, limitMinutes);
    }

    public static ExcessiveBreakData singleBreak(LocalDate date, Long breakId, int durationMinutes, int limitMinutes) {
        return new ExcessiveBreakData(date, null, breakId, durationMinutes, limitMinutes);
    }

    @Override
    public AnomalyType getAnomalyType() {
        return AnomalyType.EXCESSIVE_BREAK;
    }
}
