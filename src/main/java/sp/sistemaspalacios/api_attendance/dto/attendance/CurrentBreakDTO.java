package sp.sistemaspalacios.api_attendance.dto.attendance;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_attendance.entity.attendance.BreakType;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CurrentBreakDTO {
    private Long id;
    private BreakType type;
    private LocalDateTime startTime;
}
