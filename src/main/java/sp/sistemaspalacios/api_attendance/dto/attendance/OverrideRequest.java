package sp.sistemaspalacios.api_attendance.dto.attendance;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_attendance.entity.attendance.WorkMode;

import java.time.LocalDateTime;

/**
 * Corrección administrativa de una marcación (Gestión Humana).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OverrideRequest {
    private LocalDateTime timestamp; // Opcional
    private WorkMode workMode;       // Opcional
    private String reason;           // Obligatorio
}
