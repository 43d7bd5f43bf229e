package sp.sistemaspalacios.api_attendance.entity.boundaries.workPolicy;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.time.LocalTime;

@Entity
@Data
@Table(name = "work_policies")
public class WorkPolicy {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false, unique = true)
    private Long companyId;

    @Column(name = "break_duration_minutes", nullable = false)
    private Integer breakDurationMinutes; // Puede ser 0

    @Column(name = "lunch_duration_minutes", nullable = false)
    private Integer lunchDurationMinutes; // Puede ser 0

    @Column(name = "overtime_threshold_minutes", nullable = false)
    private Integer overtimeThresholdMinutes;

    @Column(name = "max_overtime_minutes", nullable = false)
    private Integer maxOvertimeMinutes;

    @Column(name = "standard_work_hours", nullable = false)
    private Integer standardWorkHours;

    @Column(name = "grace_minutes_late", nullable = false)
    private Integer graceMinutesLate;

    // Hora de entrada esperada para calcular tardanzas
    @Column(name = "work_start_time", nullable = false)
    private LocalTime workStartTime;

    @Column(name = "created_at", nullable = false, updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    @UpdateTimestamp
    private LocalDateTime updatedAt;

    /** Minutos de descanso permitidos en el día (pausas + almuerzo). */
    public int dailyBreakAllowance() {
        return breakDurationMinutes + lunchDurationMinutes;
    }
}
