package sp.sistemaspalacios.api_attendance.entity.attendance;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "break_segments")
@Getter
@Setter
public class BreakSegment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "attendance_day_id", nullable = false)
    private AttendanceDay attendanceDay;

    @Enumerated(EnumType.STRING)
    @Column(name = "break_type", nullable = false)
    private BreakType type;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time")
    private LocalDateTime endTime;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    // Cerrado por el barrido de descansos olvidados, no por el empleado
    @Column(name = "auto_closed", nullable = false)
    private Boolean autoClosed = false;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isOpen() {
        return endTime == null;
    }
}
