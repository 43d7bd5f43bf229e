package sp.sistemaspalacios.api_attendance.service.anomaly;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyEvent;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyRule;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;
import sp.sistemaspalacios.api_attendance.entity.anomaly.data.ExcessiveBreakData;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceDay;
import sp.sistemaspalacios.api_attendance.entity.attendance.BreakSegment;
import sp.sistemaspalacios.api_attendance.entity.boundaries.workPolicy.WorkPolicy;
import sp.sistemaspalacios.api_attendance.repository.anomaly.AnomalyRuleRepository;
import sp.sistemaspalacios.api_attendance.service.boundaries.workPolicy.WorkPolicyService;

import java.util.List;
import java.util.Optional;

/**
 * Revisión inmediata al terminar un descanso: si el total de descansos cerrados del día
 * supera pausas + almuerzo de la política, registra una anomalía de descanso excesivo.
 * Solo aplica a empresas con política propia y la regla habilitada.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BreakPolicyChecker {

    private final WorkPolicyService workPolicyService;
    private final AnomalyRuleRepository anomalyRuleRepository;
    private final AnomalyRecorder anomalyRecorder;

    public Optional<AnomalyEvent> check(Long companyId, AttendanceDay day, List<BreakSegment> breaks) {
        Optional<WorkPolicy> policy = workPolicyService.findPolicy(companyId);
        if (policy.isEmpty()) {
            return Optional.empty();
        }

        int totalBreakMinutes = breaks.stream()
                .filter(b -> !b.isOpen())
                .mapToInt(b -> b.getDurationMinutes() == null ? 0 : b.getDurationMinutes())
                .sum();
        int limit = policy.get().dailyBreakAllowance();
        if (totalBreakMinutes <= limit) {
            return Optional.empty();
        }

        Optional<AnomalyRule> rule = anomalyRuleRepository
                .findFirstByCompanyIdAndTypeAndIsEnabledTrueOrderByIdAsc(companyId, AnomalyType.EXCESSIVE_BREAK);
        if (rule.isEmpty()) {
            return Optional.empty();
        }

        log.info("⚠️ Usuario {} superó el descanso permitido: {} de {} minutos", day.getUserId(), totalBreakMinutes, limit);
        AnomalyDraft draft = new AnomalyDraft(day.getUserId(),
                "Descanso excesivo",
                "El tiempo de descanso superó el límite de la política: " + totalBreakMinutes
                        + " minutos (límite: " + limit + " minutos)",
                ExcessiveBreakData.dailyTotal(day.getDate(), totalBreakMinutes, limit),
                day.getDate());
        return anomalyRecorder.record(rule.get(), draft);
    }
}
