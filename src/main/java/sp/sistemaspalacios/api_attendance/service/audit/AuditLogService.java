package sp.sistemaspalacios.api_attendance.service.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_attendance.entity.audit.AuditLog;
import sp.sistemaspalacios.api_attendance.repository.audit.AuditLogRepository;
import sp.sistemaspalacios.api_attendance.service.common.TimeService;

import java.util.List;

/**
 * Registro de auditoría de cada transición de la jornada y de las correcciones.
 * Se escribe dentro de la transacción de quien llama.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditLogService {

    public static final String ACTOR_SYSTEM = "system";

    private final AuditLogRepository repository;
    private final ObjectMapper objectMapper;
    private final TimeService timeService;

    public AuditLog record(String actorId, String action, String entityType, Long entityId,
                           Object before, Object after, String reason) {
        AuditLog entry = AuditLog.builder()
                .actorId(actorId)
                .action(action)
                .entityType(entityType)
                .entityId(entityId)
                .before(toJson(before))
                .after(toJson(after))
                .reason(reason)
                .createdAt(timeService.now())
                .build();

        AuditLog saved = repository.save(entry);
        log.debug("📝 Auditoría {} {}#{} por {}", action, entityType, entityId, actorId);
        return saved;
    }

    public AuditLog record(String actorId, String action, String entityType, Long entityId, Object after) {
        return record(actorId, action, entityType, entityId, null, after, null);
    }

    public List<AuditLog> findByEntity(String entityType, Long entityId) {
        return repository.findByEntityTypeAndEntityIdOrderByIdAsc(entityType, entityId);
    }

    private String toJson(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("No se pudo serializar el registro de auditoría", e);
        }
    }
}
