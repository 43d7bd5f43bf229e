package sp.sistemaspalacios.api_attendance.service.anomaly;

import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_attendance.dto.PagedResponse;
import sp.sistemaspalacios.api_attendance.dto.anomaly.AnomalyEventDTO;
import sp.sistemaspalacios.api_attendance.dto.anomaly.AnomalySummaryDTO;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyEvent;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalySeverity;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyStatus;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;
import sp.sistemaspalacios.api_attendance.exception.ConflictException;
import sp.sistemaspalacios.api_attendance.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_attendance.exception.ValidationException;
import sp.sistemaspalacios.api_attendance.repository.anomaly.AnomalyEventRepository;
import sp.sistemaspalacios.api_attendance.service.common.TimeService;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Consulta y revisión de anomalías por Gestión Humana.
 * OPEN → ACKNOWLEDGED → RESOLVED | DISMISSED (también directo desde OPEN).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyEventService {

    private static final int DEFAULT_LIMIT = 20;

    private final AnomalyEventRepository anomalyEventRepository;
    private final TimeService timeService;

    @Transactional(readOnly = true)
    public PagedResponse<AnomalyEventDTO> findAll(Long companyId, Long userId, AnomalyStatus status,
                                                  AnomalyType type, AnomalySeverity severity,
                                                  Integer page, Integer limit) {
        int pageNumber = page != null ? page : 1;
        int pageSize = limit != null ? limit : DEFAULT_LIMIT;
        if (pageNumber < 1 || pageSize < 1) {
            throw new ValidationException("La página y el límite deben ser mayores que cero");
        }

        Specification<AnomalyEvent> filters = (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("companyId"), companyId));
            if (userId != null) predicates.add(cb.equal(root.get("userId"), userId));
            if (status != null) predicates.add(cb.equal(root.get("status"), status));
            if (type != null) predicates.add(cb.equal(root.get("type"), type));
            if (severity != null) predicates.add(cb.equal(root.get("severity"), severity));
            return cb.and(predicates.toArray(new Predicate[0]));
        };

        Page<AnomalyEvent> result = anomalyEventRepository.findAll(filters,
                PageRequest.of(pageNumber - 1, pageSize, Sort.by(Sort.Direction.DESC, "detectedAt")));
        List<AnomalyEventDTO> data = result.getContent().stream().map(AnomalyEventDTO::from).toList();
        return PagedResponse.of(data, pageNumber, pageSize, result.getTotalElements());
    }

    /**
     * 🔹 Totales de la empresa por estado, severidad y tipo.
     */
    @Transactional(readOnly = true)
    public AnomalySummaryDTO getSummary(Long companyId) {
        Map<AnomalyStatus, Long> byStatus = toCounts(anomalyEventRepository.countByStatus(companyId), AnomalyStatus.class);
        Map<AnomalySeverity, Long> bySeverity = toCounts(anomalyEventRepository.countBySeverity(companyId), AnomalySeverity.class);
        Map<AnomalyType, Long> byType = toCounts(anomalyEventRepository.countByType(companyId), AnomalyType.class);

        return AnomalySummaryDTO.builder()
                .total(anomalyEventRepository.countByCompanyId(companyId))
                .open(byStatus.getOrDefault(AnomalyStatus.OPEN, 0L))
                .acknowledged(byStatus.getOrDefault(AnomalyStatus.ACKNOWLEDGED, 0L))
                .resolved(byStatus.getOrDefault(AnomalyStatus.RESOLVED, 0L))
                .dismissed(byStatus.getOrDefault(AnomalyStatus.DISMISSED, 0L))
                .bySeverity(bySeverity)
                .byType(byType)
                .build();
    }

    @Transactional
    public AnomalyEventDTO acknowledge(Long companyId, Long id, String actorId, String notes) {
        AnomalyEvent anomaly = find(companyId, id);
        if (anomaly.getStatus() != AnomalyStatus.OPEN) {
            throw new ConflictException("Solo se pueden reconocer anomalías abiertas (estado actual: " + anomaly.getStatus() + ")");
        }

        anomaly.setStatus(AnomalyStatus.ACKNOWLEDGED);
        anomaly.setAcknowledgedBy(actorId);
        anomaly.setAcknowledgedAt(timeService.now());
        if (notes != null && !notes.isBlank()) {
            anomaly.setResolutionNotes(notes.trim());
        }
        log.info("👁️ Anomalía {} reconocida por {}", id, actorId);
        return AnomalyEventDTO.from(anomalyEventRepository.save(anomaly));
    }

    @Transactional
    public AnomalyEventDTO resolve(Long companyId, Long id, String actorId, String notes) {
        if (notes == null || notes.isBlank()) {
            throw new ValidationException("Las notas de resolución son obligatorias");
        }
        return close(companyId, id, actorId, notes.trim(), AnomalyStatus.RESOLVED);
    }

    @Transactional
    public AnomalyEventDTO dismiss(Long companyId, Long id, String actorId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("El motivo para descartar es obligatorio");
        }
        return close(companyId, id, actorId, reason.trim(), AnomalyStatus.DISMISSED);
    }

    private AnomalyEventDTO close(Long companyId, Long id, String actorId, String notes, AnomalyStatus target) {
        AnomalyEvent anomaly = find(companyId, id);
        if (anomaly.getStatus() != AnomalyStatus.OPEN && anomaly.getStatus() != AnomalyStatus.ACKNOWLEDGED) {
            throw new ConflictException("La anomalía ya está cerrada (estado actual: " + anomaly.getStatus() + ")");
        }

        anomaly.setStatus(target);
        anomaly.setResolvedBy(actorId);
        anomaly.setResolvedAt(timeService.now());
        anomaly.setResolutionNotes(notes);
        log.info("✅ Anomalía {} → {} por {}", id, target, actorId);
        return AnomalyEventDTO.from(anomalyEventRepository.save(anomaly));
    }

    private AnomalyEvent find(Long companyId, Long id) {
        return anomalyEventRepository.findById(id)
                .filter(a -> a.getCompanyId().equals(companyId))
                .orElseThrow(() -> new ResourceNotFoundException("Anomalía con ID " + id + " no encontrada"));
    }

    private <E extends Enum<E>> Map<E, Long> toCounts(List<Object[]> rows, Class<E> type) {
        Map<E, Long> counts = new EnumMap<>(type);
        for (Object[] row : rows) {
            counts.put(type.cast(row[0]), ((Number) row[1]).longValue());
        }
        return counts;
    }
}
