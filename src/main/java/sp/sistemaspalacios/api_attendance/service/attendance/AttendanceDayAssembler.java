package sp.sistemaspalacios.api_attendance.service.attendance;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_attendance.dto.attendance.AttendanceDayResponse;
import sp.sistemaspalacios.api_attendance.dto.attendance.AttendanceEventDTO;
import sp.sistemaspalacios.api_attendance.dto.attendance.BreakSegmentDTO;
import sp.sistemaspalacios.api_attendance.dto.attendance.CurrentBreakDTO;
import sp.sistemaspalacios.api_attendance.dto.boundaries.WorkPolicyDTO;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceDay;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceEvent;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceStatus;
import sp.sistemaspalacios.api_attendance.entity.attendance.BreakSegment;
import sp.sistemaspalacios.api_attendance.entity.boundaries.workPolicy.WorkPolicy;
import sp.sistemaspalacios.api_attendance.service.common.TimeService;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Arma la vista de una jornada. Con la sesión abierta, el tiempo trabajado se calcula
 * en vivo contra {@code now}; no se persiste.
 */
@Component
@RequiredArgsConstructor
public class AttendanceDayAssembler {

    private final AttendanceStatusResolver statusResolver;
    private final DayTotalsCalculator totalsCalculator;

    public AttendanceDayResponse empty(LocalDate date, WorkPolicy policy) {
        return AttendanceDayResponse.builder()
                .date(date)
                .status(AttendanceStatus.NOT_CHECKED_IN)
                .events(List.of())
                .breaks(List.of())
                .policy(WorkPolicyDTO.from(policy))
                .build();
    }

    /**
     * @param liveAt instante para los totales en vivo; null para usar solo lo persistido
     */
    public AttendanceDayResponse assemble(AttendanceDay day, List<AttendanceEvent> events,
                                          List<BreakSegment> breaks, WorkPolicy policy, LocalDateTime liveAt) {
        AttendanceStatus status = statusResolver.resolve(events, breaks);
        Optional<AttendanceEvent> latestCheckIn = statusResolver.latestCheckIn(events);
        Optional<AttendanceEvent> checkOut = latestCheckIn.flatMap(ci -> statusResolver.checkOutAfter(events, ci));
        Optional<BreakSegment> openBreak = statusResolver.openBreak(breaks);

        int workMinutes = day.getTotalWorkMinutes();
        if (liveAt != null && latestCheckIn.isPresent()) {
            int closedBreakMinutes = totalsCalculator.breakTotals(breaks).total();
            LocalDateTime checkInTime = latestCheckIn.get().getTimestamp();
            if (status == AttendanceStatus.WORKING) {
                workMinutes = Math.max(0, TimeService.minutesBetween(checkInTime, liveAt) - closedBreakMinutes);
            } else if (status == AttendanceStatus.ON_BREAK) {
                LocalDateTime breakStart = openBreak.get().getStartTime();
                workMinutes = Math.max(0, TimeService.minutesBetween(checkInTime, breakStart) - closedBreakMinutes);
            }
        }

        return AttendanceDayResponse.builder()
                .id(day.getId())
                .date(day.getDate())
                .status(status)
                .checkInTime(latestCheckIn.map(AttendanceEvent::getTimestamp).orElse(null))
                .checkOutTime(checkOut.map(AttendanceEvent::getTimestamp).orElse(null))
                .workMode(latestCheckIn.map(AttendanceEvent::getWorkMode).orElse(null))
                .currentBreak(openBreak
                        .map(b -> new CurrentBreakDTO(b.getId(), b.getType(), b.getStartTime()))
                        .orElse(null))
                .totalWorkMinutes(workMinutes)
                .totalBreakMinutes(day.getTotalBreakMinutes())
                .totalLunchMinutes(day.getTotalLunchMinutes())
                .overtimeMinutes(day.getOvertimeMinutes())
                .events(events.stream().map(AttendanceEventDTO::from).toList())
                .breaks(breaks.stream().map(BreakSegmentDTO::from).toList())
                .policy(policy == null ? null : WorkPolicyDTO.from(policy))
                .build();
    }
}
