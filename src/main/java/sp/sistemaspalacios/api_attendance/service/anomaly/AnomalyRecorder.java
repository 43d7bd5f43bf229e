package sp.sistemaspalacios.api_attendance.service.anomaly;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyEvent;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyRule;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyStatus;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;
import sp.sistemaspalacios.api_attendance.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_attendance.repository.anomaly.AnomalyEventRepository;
import sp.sistemaspalacios.api_attendance.repository.anomaly.AnomalyRuleRepository;
import sp.sistemaspalacios.api_attendance.service.common.TimeService;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Único punto de creación de anomalías. No crea una segunda anomalía abierta del mismo
 * tipo para el mismo usuario; en los tipos diarios la comparación se limita al día.
 * La fila de la regla se bloquea antes de comprobar duplicados, así que dos registros
 * simultáneos de la misma regla se serializan.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyRecorder {

    private final AnomalyEventRepository anomalyEventRepository;
    private final AnomalyRuleRepository anomalyRuleRepository;
    private final TimeService timeService;

    /**
     * 🔹 Registra la anomalía si no hay otra abierta equivalente.
     *
     * @return la anomalía creada, o vacío si se suprimió por duplicada
     */
    @Transactional
    public Optional<AnomalyEvent> record(AnomalyRule rule, AnomalyDraft draft) {
        AnomalyType type = draft.type();
        if (rule.getType() != type) {
            throw new IllegalArgumentException("La regla " + rule.getId() + " es de tipo " + rule.getType()
                    + " y no puede registrar una anomalía " + type);
        }

        anomalyRuleRepository.findLockedById(rule.getId())
                .orElseThrow(() -> new ResourceNotFoundException("Regla con ID " + rule.getId() + " no encontrada"));

        if (isDuplicate(draft.userId(), type, draft.day())) {
            log.debug("Anomalía {} suprimida para usuario {}: ya hay una abierta", type, draft.userId());
            return Optional.empty();
        }

        AnomalyEvent event = new AnomalyEvent();
        event.setUserId(draft.userId());
        event.setCompanyId(rule.getCompanyId());
        event.setRule(rule);
        event.setType(type);
        event.setSeverity(rule.getSeverity());
        event.setStatus(AnomalyStatus.OPEN);
        event.setTitle(draft.title());
        event.setDescription(draft.description());
        event.setData(draft.data());
        event.setDetectedAt(timeService.now());

        AnomalyEvent saved = anomalyEventRepository.save(event);
        log.info("⚠️ Anomalía {} registrada para usuario {} (regla {}, id {})",
                type, draft.userId(), rule.getId(), saved.getId());
        return Optional.of(saved);
    }

    public boolean isDuplicate(Long userId, AnomalyType type, LocalDate day) {
        if (!type.isDayScoped()) {
            return anomalyEventRepository.existsByUserIdAndTypeAndStatus(userId, type, AnomalyStatus.OPEN);
        }
        LocalDate scope = day != null ? day : timeService.today();
        return anomalyEventRepository.existsByUserIdAndTypeAndStatusAndDetectedAtGreaterThanEqualAndDetectedAtLessThan(
                userId, type, AnomalyStatus.OPEN, timeService.startOfDay(scope), timeService.endOfDay(scope));
    }
}
