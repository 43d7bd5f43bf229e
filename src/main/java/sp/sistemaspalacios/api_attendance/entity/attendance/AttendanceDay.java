package sp.sistemaspalacios.api_attendance.entity.attendance;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "attendance_days",
        uniqueConstraints = @UniqueConstraint(name = "uk_attendance_day_user_date",
                columnNames = {"user_id", "attendance_date"}))
@Getter
@Setter
@NoArgsConstructor
public class AttendanceDay {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "company_id", nullable = false)
    private Long companyId;

    @Column(name = "attendance_date", nullable = false)
    private LocalDate date;

    @Column(name = "is_complete", nullable = false)
    private Boolean isComplete = false;

    @Column(name = "total_work_minutes", nullable = false)
    private Integer totalWorkMinutes = 0;

    @Column(name = "total_break_minutes", nullable = false)
    private Integer totalBreakMinutes = 0;

    @Column(name = "total_lunch_minutes", nullable = false)
    private Integer totalLunchMinutes = 0;

    @Column(name = "overtime_minutes", nullable = false)
    private Integer overtimeMinutes = 0;

    // Cada nueva entrada incrementa la versión; dos entradas simultáneas no pueden confirmar ambas
    @Version
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public AttendanceDay(Long userId, Long companyId, LocalDate date) {
        this.userId = userId;
        this.companyId = companyId;
        this.date = date;
    }
}
