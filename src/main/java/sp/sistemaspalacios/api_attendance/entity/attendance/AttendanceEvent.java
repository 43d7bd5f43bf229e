package sp.sistemaspalacios.api_attendance.entity.attendance;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "attendance_events", indexes = {
        @Index(name = "idx_attendance_event_day", columnList = "attendance_day_id, event_timestamp")
})
@Getter
@Setter
public class AttendanceEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "attendance_day_id", nullable = false)
    private AttendanceDay attendanceDay;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false)
    private AttendanceEventType type;

    @Column(name = "event_timestamp", nullable = false)
    private LocalDateTime timestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "work_mode", nullable = false)
    private WorkMode workMode;

    private Double latitude;
    private Double longitude;

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_status", nullable = false)
    private VerificationStatus verificationStatus = VerificationStatus.NONE;

    @Column(name = "device_fingerprint")
    private String deviceFingerprint;

    private String notes;

    @Column(name = "is_override", nullable = false)
    private Boolean isOverride = false;

    @Column(name = "override_reason")
    private String overrideReason;

    @Column(name = "override_by")
    private String overrideBy;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public boolean isCheckIn() {
        return type == AttendanceEventType.CHECK_IN;
    }

    public boolean isCheckOut() {
        return type == AttendanceEventType.CHECK_OUT;
    }
}
