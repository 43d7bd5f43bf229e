package sp.sistemaspalacios.api_attendance.dto.anomaly;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cuerpo de reconocer / resolver (notes) y descartar (reason).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyReviewRequest {
    private String notes;
    private String reason;
}
