package sp.sistemaspalacios.api_attendance.repository.attendance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceDay;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceEvent;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceEventType;
import sp.sistemaspalacios.api_attendance.entity.attendance.BreakSegment;
import sp.sistemaspalacios.api_attendance.entity.attendance.BreakType;
import sp.sistemaspalacios.api_attendance.entity.attendance.WorkMode;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
class AttendanceDayRepositoryTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 4);

    @Autowired
    private AttendanceDayRepository dayRepository;
    @Autowired
    private AttendanceEventRepository eventRepository;
    @Autowired
    private BreakSegmentRepository breakRepository;

    private AttendanceDay day(Long userId, LocalDate date) {
        return dayRepository.saveAndFlush(new AttendanceDay(userId, 1L, date));
    }

    private AttendanceEvent event(AttendanceDay day, AttendanceEventType type, LocalDateTime at) {
        AttendanceEvent event = new AttendanceEvent();
        event.setAttendanceDay(day);
        event.setType(type);
        event.setTimestamp(at);
        event.setWorkMode(WorkMode.OFFICE);
        return eventRepository.saveAndFlush(event);
    }

    @Test
    @DisplayName("Un solo registro de jornada por usuario y fecha")
    void oneDayPerUserAndDate() {
        day(7L, DAY);

        assertThatThrownBy(() -> day(7L, DAY)).isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void incompleteDaysWithCheckIn() {
        AttendanceDay open = day(7L, DAY);
        event(open, AttendanceEventType.CHECK_IN, DAY.atTime(9, 0));

        AttendanceDay closed = day(8L, DAY);
        event(closed, AttendanceEventType.CHECK_IN, DAY.atTime(9, 0));
        event(closed, AttendanceEventType.CHECK_OUT, DAY.atTime(17, 0));
        closed.setIsComplete(true);
        dayRepository.saveAndFlush(closed);

        day(9L, DAY);

        assertThat(dayRepository.findIncompleteWithEventType(1L, DAY, AttendanceEventType.CHECK_IN))
                .extracting(AttendanceDay::getUserId).containsExactly(7L);
    }

    @Test
    void usersWithAttendanceInWindow() {
        day(7L, DAY.minusDays(6));
        day(7L, DAY);
        day(8L, DAY.minusDays(7));

        assertThat(dayRepository.findUserIdsWithAttendance(1L, DAY.minusDays(6), DAY)).containsExactly(7L);
    }

    @Test
    @DisplayName("Eventos del rango ordenados por hora con la jornada cargada")
    void eventsByUserAndType() {
        AttendanceDay first = day(7L, DAY);
        AttendanceDay second = day(7L, DAY.plusDays(1));
        event(second, AttendanceEventType.CHECK_IN, DAY.plusDays(1).atTime(9, 30));
        event(first, AttendanceEventType.CHECK_IN, DAY.atTime(8, 45));
        event(first, AttendanceEventType.CHECK_OUT, DAY.atTime(17, 0));

        assertThat(eventRepository.findByUserAndDateRangeAndType(7L, DAY, DAY.plusDays(1), AttendanceEventType.CHECK_IN))
                .extracting(e -> e.getAttendanceDay().getDate())
                .containsExactly(DAY, DAY.plusDays(1));
    }

    @Test
    @DisplayName("Solo descansos abiertos de días anteriores")
    void openBreaksBeforeDate() {
        AttendanceDay yesterday = day(7L, DAY.minusDays(1));
        AttendanceDay today = day(7L, DAY);
        breakRepository.saveAndFlush(segment(yesterday, DAY.minusDays(1).atTime(12, 0), null));
        breakRepository.saveAndFlush(segment(yesterday, DAY.minusDays(1).atTime(10, 0), DAY.minusDays(1).atTime(10, 15)));
        breakRepository.saveAndFlush(segment(today, DAY.atTime(12, 0), null));

        assertThat(breakRepository.findOpenBefore(DAY)).singleElement()
                .satisfies(b -> assertThat(b.getStartTime()).isEqualTo(DAY.minusDays(1).atTime(12, 0)));
    }

    private BreakSegment segment(AttendanceDay day, LocalDateTime start, LocalDateTime end) {
        BreakSegment segment = new BreakSegment();
        segment.setAttendanceDay(day);
        segment.setType(BreakType.LUNCH);
        segment.setStartTime(start);
        segment.setEndTime(end);
        segment.setDurationMinutes(end == null ? null : 15);
        return segment;
    }
}
