package sp.sistemaspalacios.api_attendance.service.anomaly;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_attendance.dto.anomaly.DetectionRunSummary;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyRule;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;
import sp.sistemaspalacios.api_attendance.entity.boundaries.workPolicy.WorkPolicy;
import sp.sistemaspalacios.api_attendance.repository.anomaly.AnomalyRuleRepository;
import sp.sistemaspalacios.api_attendance.service.anomaly.evaluator.AnomalyRuleEvaluator;
import sp.sistemaspalacios.api_attendance.service.boundaries.workPolicy.WorkPolicyService;
import sp.sistemaspalacios.api_attendance.service.common.TimeService;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Barrido diario de reglas de anomalías. Cada empresa, regla y usuario se evalúa por
 * separado: un fallo se registra y el barrido continúa con el siguiente.
 */
@Slf4j
@Service
public class AnomalyDetectionService {

    private final AnomalyRuleRepository anomalyRuleRepository;
    private final WorkPolicyService workPolicyService;
    private final AnomalyRecorder anomalyRecorder;
    private final TimeService timeService;
    private final Map<AnomalyType, AnomalyRuleEvaluator> evaluators = new EnumMap<>(AnomalyType.class);

    public AnomalyDetectionService(AnomalyRuleRepository anomalyRuleRepository,
                                   WorkPolicyService workPolicyService,
                                   AnomalyRecorder anomalyRecorder,
                                   TimeService timeService,
                                   List<AnomalyRuleEvaluator> evaluators) {
        this.anomalyRuleRepository = anomalyRuleRepository;
        this.workPolicyService = workPolicyService;
        this.anomalyRecorder = anomalyRecorder;
        this.timeService = timeService;
        for (AnomalyRuleEvaluator evaluator : evaluators) {
            this.evaluators.put(evaluator.getType(), evaluator);
        }
    }

    /**
     * 🔹 Evalúa las reglas habilitadas de todas las empresas.
     */
    public DetectionRunSummary runDailyDetection() {
        LocalDate today = timeService.today();
        log.info("🔍 Iniciando detección diaria de anomalías ({})", today);

        List<Long> companyIds = anomalyRuleRepository.findCompanyIdsWithEnabledRules();
        Tally tally = new Tally();

        for (Long companyId : companyIds) {
            WorkPolicy policy;
            List<AnomalyRule> rules;
            try {
                policy = workPolicyService.getEffectivePolicy(companyId);
                rules = anomalyRuleRepository.findByCompanyIdAndIsEnabledTrueOrderByIdAsc(companyId);
            } catch (RuntimeException e) {
                tally.failures++;
                log.error("❌ No se pudo cargar la configuración de la empresa {}; se omite", companyId, e);
                continue;
            }

            for (AnomalyRule rule : rules) {
                evaluateRule(companyId, rule, policy, today, tally);
            }
        }

        DetectionRunSummary summary = new DetectionRunSummary(
                companyIds.size(), tally.rulesEvaluated, tally.anomaliesCreated, tally.failures);
        log.info("✅ Detección diaria terminada: {}", summary);
        return summary;
    }

    private void evaluateRule(Long companyId, AnomalyRule rule, WorkPolicy policy, LocalDate today, Tally tally) {
        AnomalyRuleEvaluator evaluator = evaluators.get(rule.getType());
        if (evaluator == null) {
            // GEOFENCE_FAILURE solo se detecta al marcar entrada
            return;
        }
        tally.rulesEvaluated++;

        List<Long> candidates;
        try {
            candidates = evaluator.findCandidates(companyId, rule, policy, today);
        } catch (RuntimeException e) {
            tally.failures++;
            log.error("❌ Falló la búsqueda de candidatos: empresa {} regla {}", companyId, rule.getId(), e);
            return;
        }

        for (Long userId : candidates) {
            try {
                Optional<AnomalyDraft> draft = evaluator.evaluate(companyId, userId, rule, policy, today);
                if (draft.isPresent() && anomalyRecorder.record(rule, draft.get()).isPresent()) {
                    tally.anomaliesCreated++;
                }
            } catch (RuntimeException e) {
                tally.failures++;
                log.error("❌ Falló la evaluación: empresa {} regla {} usuario {}", companyId, rule.getId(), userId, e);
            }
        }
    }

    private static final class Tally {
        int rulesEvaluated;
        int anomaliesCreated;
        int failures;
    }
}
