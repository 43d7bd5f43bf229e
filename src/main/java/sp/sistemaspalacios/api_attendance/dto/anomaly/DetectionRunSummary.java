package sp.sistemaspalacios.api_attendance.dto.anomaly;

/**
 * Resultado de una corrida del barrido diario de anomalías.
 */
public record DetectionRunSummary(int companies, int rulesEvaluated, int anomaliesCreated, int failures) {
}
