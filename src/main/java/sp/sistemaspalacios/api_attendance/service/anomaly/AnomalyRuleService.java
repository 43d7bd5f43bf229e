package sp.sistemaspalacios.api_attendance.service.anomaly;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyRule;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalySeverity;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;
import sp.sistemaspalacios.api_attendance.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_attendance.exception.ValidationException;
import sp.sistemaspalacios.api_attendance.repository.anomaly.AnomalyRuleRepository;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyRuleService {

    private final AnomalyRuleRepository repository;

    public List<AnomalyRule> findAll(Long companyId) {
        return repository.findByCompanyIdOrderByIdAsc(companyId);
    }

    public AnomalyRule findById(Long companyId, Long id) {
        return repository.findById(id)
                .filter(rule -> rule.getCompanyId().equals(companyId))
                .orElseThrow(() -> new ResourceNotFoundException("Regla con ID " + id + " no encontrada"));
    }

    @Transactional
    public AnomalyRule create(Long companyId, AnomalyRule rule) {
        rule.setId(null);
        rule.setCompanyId(companyId);
        if (rule.getIsEnabled() == null) rule.setIsEnabled(true);
        validate(rule);
        AnomalyRule saved = repository.save(rule);
        log.info("➕ Regla {} creada para empresa {}", saved.getType(), companyId);
        return saved;
    }

    @Transactional
    public AnomalyRule update(Long companyId, Long id, AnomalyRule changes) {
        AnomalyRule rule = findById(companyId, id);
        if (changes.getType() != null) rule.setType(changes.getType());
        if (changes.getName() != null) rule.setName(changes.getName());
        if (changes.getDescription() != null) rule.setDescription(changes.getDescription());
        if (changes.getSeverity() != null) rule.setSeverity(changes.getSeverity());
        if (changes.getThreshold() != null) rule.setThreshold(changes.getThreshold());
        if (changes.getWindowDays() != null) rule.setWindowDays(changes.getWindowDays());
        if (changes.getIsEnabled() != null) rule.setIsEnabled(changes.getIsEnabled());
        validate(rule);
        return repository.save(rule);
    }

    @Transactional
    public AnomalyRule toggleEnabled(Long companyId, Long id, Boolean isEnabled) {
        if (isEnabled == null) {
            throw new ValidationException("El estado de la regla es obligatorio");
        }
        AnomalyRule rule = findById(companyId, id);
        rule.setIsEnabled(isEnabled);
        return repository.save(rule);
    }

    @Transactional
    public void delete(Long companyId, Long id) {
        repository.delete(findById(companyId, id));
    }

    /**
     * 🔹 Crea las reglas por defecto que falten para la empresa.
     */
    @Transactional
    public List<AnomalyRule> initializeDefaultRules(Long companyId) {
        log.info("🔧 Inicializando reglas de anomalías por defecto para empresa {}...", companyId);

        createIfNotExists(companyId, AnomalyType.REPEATED_LATE_CHECK_IN, "Tardanzas repetidas",
                "3 o más llegadas tarde en 7 días", AnomalySeverity.MEDIUM, 3, 7);
        createIfNotExists(companyId, AnomalyType.MISSING_CHECK_OUT, "Salida sin marcar",
                "Jornada sin salida al cierre del día", AnomalySeverity.LOW, 1, 1);
        createIfNotExists(companyId, AnomalyType.EXCESSIVE_BREAK, "Descanso excesivo",
                "Descanso mayor al 150% de la pausa estándar", AnomalySeverity.LOW, 150, 1);
        createIfNotExists(companyId, AnomalyType.TIMESHEET_MISMATCH, "Diferencia con timesheet",
                "Más de 20% de diferencia entre asistencia y timesheet", AnomalySeverity.MEDIUM, 20, 1);
        createIfNotExists(companyId, AnomalyType.GEOFENCE_FAILURE, "Entrada fuera de geocerca",
                "Entrada en oficina fuera del radio configurado", AnomalySeverity.HIGH, 1, 1);

        log.info("✅ Reglas de anomalías inicializadas");
        return findAll(companyId);
    }

    private void createIfNotExists(Long companyId, AnomalyType type, String name, String description,
                                   AnomalySeverity severity, Integer threshold, Integer windowDays) {
        if (repository.findFirstByCompanyIdAndTypeOrderByIdAsc(companyId, type).isEmpty()) {
            AnomalyRule rule = new AnomalyRule();
            rule.setCompanyId(companyId);
            rule.setType(type);
            rule.setName(name);
            rule.setDescription(description);
            rule.setSeverity(severity);
            rule.setThreshold(threshold);
            rule.setWindowDays(windowDays);
            rule.setIsEnabled(true);

            repository.save(rule);
            log.info("  ➕ Creada: {}", type);
        }
    }

    private void validate(AnomalyRule rule) {
        if (rule.getType() == null) {
            throw new ValidationException("El tipo de regla es obligatorio");
        }
        if (rule.getName() == null || rule.getName().isBlank()) {
            throw new ValidationException("El nombre de la regla es obligatorio");
        }
        if (rule.getSeverity() == null) {
            throw new ValidationException("La severidad es obligatoria");
        }
        if (rule.getThreshold() == null || rule.getThreshold() < 0) {
            throw new ValidationException("El umbral debe ser un número positivo");
        }
        if (rule.getWindowDays() == null || rule.getWindowDays() < 1) {
            throw new ValidationException("La ventana debe ser de al menos un día");
        }
    }
}
