package sp.sistemaspalacios.api_attendance.dto.attendance;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_attendance.entity.attendance.BreakType;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StartBreakRequest {
    @NotNull(message = "type es requerido")
    private BreakType type;
}
