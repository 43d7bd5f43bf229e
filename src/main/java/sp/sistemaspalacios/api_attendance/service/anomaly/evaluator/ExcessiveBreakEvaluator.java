package sp.sistemaspalacios.api_attendance.service.anomaly.evaluator;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyRule;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;
import sp.sistemaspalacios.api_attendance.entity.anomaly.data.ExcessiveBreakData;
import sp.sistemaspalacios.api_attendance.entity.attendance.BreakSegment;
import sp.sistemaspalacios.api_attendance.entity.boundaries.workPolicy.WorkPolicy;
import sp.sistemaspalacios.api_attendance.repository.attendance.BreakSegmentRepository;
import sp.sistemaspalacios.api_attendance.service.anomaly.AnomalyDraft;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Un descanso de hoy más largo que el porcentaje de la pausa estándar fijado en la regla
 * (umbral 150 = 1,5 veces la pausa).
 */
@Component
@RequiredArgsConstructor
public class ExcessiveBreakEvaluator implements AnomalyRuleEvaluator {

    private final BreakSegmentRepository breakRepository;

    @Override
    public AnomalyType getType() {
        return AnomalyType.EXCESSIVE_BREAK;
    }

    @Override
    public List<Long> findCandidates(Long companyId, AnomalyRule rule, WorkPolicy policy, LocalDate today) {
        return breakRepository.findClosedLongerThan(companyId, today, minMinutes(rule, policy)).stream()
                .map(b -> b.getAttendanceDay().getUserId())
                .distinct()
                .toList();
    }

    @Override
    public Optional<AnomalyDraft> evaluate(Long companyId, Long userId, AnomalyRule rule, WorkPolicy policy, LocalDate today) {
        // Viene ordenado por duración descendente: el primero es el más largo
        Optional<BreakSegment> longest = breakRepository.findClosedLongerThan(companyId, today, minMinutes(rule, policy))
                .stream()
                .filter(b -> userId.equals(b.getAttendanceDay().getUserId()))
                .findFirst();
        if (longest.isEmpty()) {
            return Optional.empty();
        }

        BreakSegment segment = longest.get();
        int limit = (int) Math.ceil(limit(rule, policy));
        return Optional.of(new AnomalyDraft(userId,
                "Descanso excesivo",
                "Un descanso de " + segment.getDurationMinutes() + " minutos superó el límite",
                ExcessiveBreakData.singleBreak(today, segment.getId(), segment.getDurationMinutes(), limit),
                today));
    }

    private double limit(AnomalyRule rule, WorkPolicy policy) {
        return policy.getBreakDurationMinutes() * (rule.getThreshold() / 100.0);
    }

    /** Las duraciones son enteras: "mayor que 22.5" equivale a "mayor que 22". */
    private int minMinutes(AnomalyRule rule, WorkPolicy policy) {
        return (int) Math.floor(limit(rule, policy));
    }
}
