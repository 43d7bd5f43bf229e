package sp.sistemaspalacios.api_attendance.service.anomaly;

import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;
import sp.sistemaspalacios.api_attendance.entity.anomaly.data.AnomalyData;

import java.time.LocalDate;

/**
 * Anomalía candidata producida por un evaluador, aún sin deduplicar.
 *
 * @param day día al que se refiere la detección; acota la deduplicación de los tipos
 *            diarios. Null = hoy.
 */
public record AnomalyDraft(Long userId, String title, String description, AnomalyData data, LocalDate day) {

    public AnomalyDraft(Long userId, String title, String description, AnomalyData data) {
        this(userId, title, description, data, null);
    }

    public AnomalyType type() {
        return data.getAnomalyType();
    }
}
