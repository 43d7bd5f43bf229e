package sp.sistemaspalacios.api_attendance.service.attendance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.springframework.beans.factory.annotation.Autowired;
import sp.sistemaspalacios.api_attendance.dto.attendance.CheckInRequest;
import sp.sistemaspalacios.api_attendance.dto.attendance.StartBreakRequest;
import sp.sistemaspalacios.api_attendance.entity.attendance.BreakSegment;
import sp.sistemaspalacios.api_attendance.entity.attendance.BreakType;
import sp.sistemaspalacios.api_attendance.entity.attendance.WorkMode;
import sp.sistemaspalacios.api_attendance.exception.ConflictException;
import sp.sistemaspalacios.api_attendance.support.AbstractIntegrationTest;
import sp.sistemaspalacios.api_attendance.support.ConcurrentCalls;

import java.util.concurrent.atomic.AtomicInteger;

import org.assertj.core.api.InstanceOfAssertFactories;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Descansos simultáneos")
class ConcurrentBreakIntegrationTest extends AbstractIntegrationTest {

    private static final int THREADS = 2;

    @Autowired
    private AttendanceService attendanceService;

    @RepeatedTest(5)
    @DisplayName("Dos inicios de descanso a la vez dejan un solo descanso abierto")
    void onlyOneBreakStarts() throws Exception {
        attendanceService.checkIn(USER_ID, COMPANY_ID, CheckInRequest.of(WorkMode.REMOTE));
        clock.advanceMinutes(30);

        ConcurrentCalls.Outcome outcome = ConcurrentCalls.run(THREADS,
                () -> attendanceService.startBreak(USER_ID, new StartBreakRequest(BreakType.BREAK)));

        assertThat(outcome.successes()).isEqualTo(1);
        assertThat(outcome.failures()).singleElement(InstanceOfAssertFactories.THROWABLE)
                .isInstanceOf(ConflictException.class)
                .hasMessage("Ya tiene un descanso en curso");
        assertThat(breakRepository.findAll()).filteredOn(BreakSegment::isOpen).hasSize(1);
        assertThat(auditLogRepository.findByActionOrderByIdAsc("BreakStarted")).hasSize(1);
    }

    @RepeatedTest(3)
    @DisplayName("Salida e inicio de descanso a la vez no dejan un descanso abierto tras la salida")
    void checkOutAndBreakStartDoNotInterleave() throws Exception {
        attendanceService.checkIn(USER_ID, COMPANY_ID, CheckInRequest.of(WorkMode.REMOTE));
        clock.advanceMinutes(30);

        AtomicInteger turn = new AtomicInteger();
        ConcurrentCalls.Outcome outcome = ConcurrentCalls.run(THREADS, () -> {
            if (turn.getAndIncrement() == 0) {
                attendanceService.checkOut(USER_ID, COMPANY_ID, null);
            } else {
                attendanceService.startBreak(USER_ID, new StartBreakRequest(BreakType.BREAK));
            }
        });

        assertThat(outcome.failures()).allMatch(ConflictException.class::isInstance);
        assertThat(breakRepository.findAll()).noneMatch(BreakSegment::isOpen);
    }
}
