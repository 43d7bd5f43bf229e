package sp.sistemaspalacios.api_attendance.service.attendance;

import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceEvent;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceStatus;
import sp.sistemaspalacios.api_attendance.entity.attendance.BreakSegment;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Estado derivado de la jornada. La referencia es siempre la entrada más reciente,
 * así una segunda sesión en el mismo día vuelve a WORKING.
 */
@Component
public class AttendanceStatusResolver {

    public AttendanceStatus resolve(List<AttendanceEvent> events, List<BreakSegment> breaks) {
        Optional<AttendanceEvent> latestCheckIn = latestCheckIn(events);
        if (latestCheckIn.isEmpty()) {
            return AttendanceStatus.NOT_CHECKED_IN;
        }
        if (checkOutAfter(events, latestCheckIn.get()).isPresent()) {
            return AttendanceStatus.CHECKED_OUT;
        }
        return openBreak(breaks).isPresent() ? AttendanceStatus.ON_BREAK : AttendanceStatus.WORKING;
    }

    /** Entrada más reciente por hora; a igual hora, la de mayor id. */
    public Optional<AttendanceEvent> latestCheckIn(List<AttendanceEvent> events) {
        return events.stream()
                .filter(AttendanceEvent::isCheckIn)
                .max(DayTotalsCalculator.BY_TIMESTAMP);
    }

    /** Primera salida estrictamente posterior a la entrada dada. */
    public Optional<AttendanceEvent> checkOutAfter(List<AttendanceEvent> events, AttendanceEvent checkIn) {
        return events.stream()
                .filter(AttendanceEvent::isCheckOut)
                .filter(e -> e.getTimestamp().isAfter(checkIn.getTimestamp()))
                .min(DayTotalsCalculator.BY_TIMESTAMP);
    }

    /** Hay una entrada sin salida posterior. */
    public boolean hasOpenSession(List<AttendanceEvent> events) {
        return latestCheckIn(events)
                .map(checkIn -> checkOutAfter(events, checkIn).isEmpty())
                .orElse(false);
    }

    public Optional<BreakSegment> openBreak(List<BreakSegment> breaks) {
        return breaks.stream()
                .filter(BreakSegment::isOpen)
                .min(Comparator.comparing(BreakSegment::getStartTime));
    }
}
