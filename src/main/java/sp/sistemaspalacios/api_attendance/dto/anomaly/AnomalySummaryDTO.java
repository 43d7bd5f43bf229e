package sp.sistemaspalacios.api_attendance.dto.anomaly;

import lombok.Builder;
import lombok.Data;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalySeverity;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;

import java.util.Map;

@Data
@Builder
public class AnomalySummaryDTO {
    private long total;
    private long open;
    private long acknowledged;
    private long resolved;
    private long dismissed;
    private Map<AnomalySeverity, Long> bySeverity;
    private Map<AnomalyType, Long> byType;
}
