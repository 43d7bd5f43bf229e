package sp.sistemaspalacios.api_attendance.service.attendance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import sp.sistemaspalacios.api_attendance.dto.attendance.BreakSegmentDTO;
import sp.sistemaspalacios.api_attendance.dto.attendance.CheckInRequest;
import sp.sistemaspalacios.api_attendance.dto.attendance.StartBreakRequest;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceDay;
import sp.sistemaspalacios.api_attendance.entity.attendance.BreakSegment;
import sp.sistemaspalacios.api_attendance.entity.attendance.BreakType;
import sp.sistemaspalacios.api_attendance.entity.attendance.WorkMode;
import sp.sistemaspalacios.api_attendance.entity.audit.AuditLog;
import sp.sistemaspalacios.api_attendance.service.audit.AuditLogService;
import sp.sistemaspalacios.api_attendance.support.AbstractIntegrationTest;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Barrido de descansos olvidados")
class StaleBreakSweepServiceIntegrationTest extends AbstractIntegrationTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 4);

    @Autowired
    private AttendanceService attendanceService;
    @Autowired
    private StaleBreakSweepService sweepService;

    @Test
    @DisplayName("Un almuerzo abierto de ayer se cierra con la duración permitida")
    void closesYesterdaysOpenLunch() {
        attendanceService.checkIn(USER_ID, COMPANY_ID, CheckInRequest.of(WorkMode.REMOTE));
        clock.set(DAY.atTime(12, 0));
        BreakSegmentDTO lunch = attendanceService.startBreak(USER_ID, new StartBreakRequest(BreakType.LUNCH));

        clock.set(DAY.plusDays(1).atTime(1, 0));
        assertThat(sweepService.closeStaleBreaks()).isEqualTo(1);

        BreakSegment closed = breakRepository.findById(lunch.getId()).orElseThrow();
        assertThat(closed.getEndTime()).isEqualTo(DAY.atTime(13, 0));
        assertThat(closed.getDurationMinutes()).isEqualTo(60);
        assertThat(closed.getAutoClosed()).isTrue();

        AttendanceDay day = dayRepository.findByUserIdAndDate(USER_ID, DAY).orElseThrow();
        assertThat(day.getTotalLunchMinutes()).isEqualTo(60);

        assertThat(auditLogRepository.findByActionOrderByIdAsc("BreakAutoClosed")).singleElement()
                .extracting(AuditLog::getActorId).isEqualTo(AuditLogService.ACTOR_SYSTEM);
        assertThat(sweepService.closeStaleBreaks()).isZero();
    }

    @Test
    @DisplayName("Los descansos abiertos de hoy no se tocan")
    void leavesTodaysBreaks() {
        attendanceService.checkIn(USER_ID, COMPANY_ID, CheckInRequest.of(WorkMode.REMOTE));
        attendanceService.startBreak(USER_ID, new StartBreakRequest(BreakType.BREAK));
        clock.advanceMinutes(120);

        assertThat(sweepService.closeStaleBreaks()).isZero();
        assertThat(breakRepository.findAll()).singleElement()
                .satisfies(b -> assertThat(b.isOpen()).isTrue());
    }
}
