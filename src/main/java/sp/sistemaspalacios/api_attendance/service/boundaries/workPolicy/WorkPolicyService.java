package sp.sistemaspalacios.api_attendance.service.boundaries.workPolicy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_attendance.config.AttendanceProperties;
import sp.sistemaspalacios.api_attendance.dto.boundaries.WorkPolicyDTO;
import sp.sistemaspalacios.api_attendance.entity.boundaries.workPolicy.WorkPolicy;
import sp.sistemaspalacios.api_attendance.exception.ValidationException;
import sp.sistemaspalacios.api_attendance.repository.boundaries.workPolicy.WorkPolicyRepository;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class WorkPolicyService {

    private final WorkPolicyRepository workPolicyRepository;
    private final AttendanceProperties properties;

    /**
     * 🔹 Política de la empresa, o la configurada por defecto si no tiene una.
     * La política por defecto no se guarda.
     */
    public WorkPolicy getEffectivePolicy(Long companyId) {
        return workPolicyRepository.findByCompanyId(companyId)
                .orElseGet(() -> defaultPolicy(companyId));
    }

    /**
     * 🔹 Solo la política guardada de la empresa.
     */
    public Optional<WorkPolicy> findPolicy(Long companyId) {
        return workPolicyRepository.findByCompanyId(companyId);
    }

    /**
     * 🔹 Guardar o actualizar la política de la empresa.
     * Los campos nulos conservan el valor actual (o el de defecto al crear).
     */
    @Transactional
    public WorkPolicy saveOrUpdate(Long companyId, WorkPolicyDTO dto) {
        WorkPolicy policy = workPolicyRepository.findByCompanyId(companyId)
                .orElseGet(() -> defaultPolicy(companyId));

        if (dto.getBreakDurationMinutes() != null) policy.setBreakDurationMinutes(dto.getBreakDurationMinutes());
        if (dto.getLunchDurationMinutes() != null) policy.setLunchDurationMinutes(dto.getLunchDurationMinutes());
        if (dto.getOvertimeThresholdMinutes() != null) policy.setOvertimeThresholdMinutes(dto.getOvertimeThresholdMinutes());
        if (dto.getMaxOvertimeMinutes() != null) policy.setMaxOvertimeMinutes(dto.getMaxOvertimeMinutes());
        if (dto.getStandardWorkHours() != null) policy.setStandardWorkHours(dto.getStandardWorkHours());
        if (dto.getGraceMinutesLate() != null) policy.setGraceMinutesLate(dto.getGraceMinutesLate());
        if (dto.getWorkStartTime() != null) policy.setWorkStartTime(dto.getWorkStartTime());

        validate(policy);

        WorkPolicy saved = workPolicyRepository.save(policy);
        log.info("✅ Política laboral guardada para empresa {}", companyId);
        return saved;
    }

    WorkPolicy defaultPolicy(Long companyId) {
        AttendanceProperties.Defaults defaults = properties.getDefaults();
        WorkPolicy policy = new WorkPolicy();
        policy.setCompanyId(companyId);
        policy.setBreakDurationMinutes(defaults.getBreakDurationMinutes());
        policy.setLunchDurationMinutes(defaults.getLunchDurationMinutes());
        policy.setOvertimeThresholdMinutes(defaults.getOvertimeThresholdMinutes());
        policy.setMaxOvertimeMinutes(defaults.getMaxOvertimeMinutes());
        policy.setStandardWorkHours(defaults.getStandardWorkHours());
        policy.setGraceMinutesLate(defaults.getGraceMinutesLate());
        policy.setWorkStartTime(defaults.getWorkStartTime());
        return policy;
    }

    /**
     * 🔹 Validaciones de negocio
     */
    private void validate(WorkPolicy policy) {
        requireNonNegative(policy.getBreakDurationMinutes(), "Los minutos de descanso");
        requireNonNegative(policy.getLunchDurationMinutes(), "Los minutos de almuerzo");
        requireNonNegative(policy.getGraceMinutesLate(), "Los minutos de gracia");
        requirePositive(policy.getOvertimeThresholdMinutes(), "El umbral de horas extra");
        requirePositive(policy.getMaxOvertimeMinutes(), "El máximo de horas extra");
        requirePositive(policy.getStandardWorkHours(), "Las horas estándar");
        if (policy.getStandardWorkHours() > 24) {
            throw new ValidationException("Las horas estándar no pueden exceder 24");
        }
    }

    private void requireNonNegative(Integer value, String field) {
        if (value == null || value < 0) {
            throw new ValidationException(field + " no pueden ser negativos");
        }
    }

    private void requirePositive(Integer value, String field) {
        if (value == null || value <= 0) {
            throw new ValidationException(field + " debe ser mayor que cero");
        }
    }
}
