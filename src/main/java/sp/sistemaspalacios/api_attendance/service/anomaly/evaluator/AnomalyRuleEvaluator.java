package sp.sistemaspalacios.api_attendance.service.anomaly.evaluator;

import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyRule;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;
import sp.sistemaspalacios.api_attendance.entity.boundaries.workPolicy.WorkPolicy;
import sp.sistemaspalacios.api_attendance.service.anomaly.AnomalyDraft;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Evaluación por lotes de un tipo de regla. El motor pide primero los usuarios
 * candidatos y luego evalúa cada uno por separado, para que el fallo de un usuario
 * no detenga a los demás.
 */
public interface AnomalyRuleEvaluator {

    AnomalyType getType();

    List<Long> findCandidates(Long companyId, AnomalyRule rule, WorkPolicy policy, LocalDate today);

    Optional<AnomalyDraft> evaluate(Long companyId, Long userId, AnomalyRule rule, WorkPolicy policy, LocalDate today);
}
