package sp.sistemaspalacios.api_attendance.service.attendance;

import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceEvent;
import sp.sistemaspalacios.api_attendance.entity.attendance.BreakSegment;
import sp.sistemaspalacios.api_attendance.entity.attendance.BreakType;
import sp.sistemaspalacios.api_attendance.entity.boundaries.workPolicy.WorkPolicy;
import sp.sistemaspalacios.api_attendance.service.common.TimeService;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Cálculo puro de los totales de una jornada a partir de sus marcaciones y descansos.
 * No toca la base de datos.
 */
@Component
public class DayTotalsCalculator {

    static final Comparator<AttendanceEvent> BY_TIMESTAMP = Comparator
            .comparing(AttendanceEvent::getTimestamp)
            .thenComparing(AttendanceEvent::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    public record BreakTotals(int breakMinutes, int lunchMinutes) {
        public int total() {
            return breakMinutes + lunchMinutes;
        }
    }

    public record DayTotals(int workMinutes, int breakMinutes, int lunchMinutes, int overtimeMinutes) {
        public int totalBreakAndLunch() {
            return breakMinutes + lunchMinutes;
        }
    }

    /**
     * Totales del día, o vacío si no hay ninguna entrada.
     */
    public Optional<DayTotals> calculate(List<AttendanceEvent> events, List<BreakSegment> breaks, WorkPolicy policy) {
        if (events.stream().noneMatch(AttendanceEvent::isCheckIn)) {
            return Optional.empty();
        }

        int gross = grossMinutes(events);
        BreakTotals breakTotals = breakTotals(breaks);
        int work = Math.max(0, gross - breakTotals.breakMinutes() - breakTotals.lunchMinutes());

        int threshold = policy.getOvertimeThresholdMinutes();
        int overtime = work > threshold ? Math.min(work - threshold, policy.getMaxOvertimeMinutes()) : 0;

        return Optional.of(new DayTotals(work, breakTotals.breakMinutes(), breakTotals.lunchMinutes(), overtime));
    }

    /**
     * Suma de los pares entrada/salida. Cada entrada se empareja con la primera salida
     * posterior aún sin usar; salidas sobrantes y entradas sin salida no suman.
     */
    public int grossMinutes(List<AttendanceEvent> events) {
        List<AttendanceEvent> sorted = new ArrayList<>(events);
        sorted.sort(BY_TIMESTAMP);

        Deque<AttendanceEvent> checkOuts = new ArrayDeque<>();
        for (AttendanceEvent event : sorted) {
            if (event.isCheckOut()) checkOuts.addLast(event);
        }

        int total = 0;
        for (AttendanceEvent checkIn : sorted) {
            if (!checkIn.isCheckIn()) continue;

            while (!checkOuts.isEmpty() && !checkOuts.peekFirst().getTimestamp().isAfter(checkIn.getTimestamp())) {
                checkOuts.pollFirst();
            }
            if (checkOuts.isEmpty()) break;

            AttendanceEvent checkOut = checkOuts.pollFirst();
            total += TimeService.minutesBetween(checkIn.getTimestamp(), checkOut.getTimestamp());
        }
        return total;
    }

    public BreakTotals breakTotals(List<BreakSegment> breaks) {
        int breakMinutes = 0;
        int lunchMinutes = 0;
        for (BreakSegment segment : breaks) {
            int minutes = segment.getDurationMinutes() == null ? 0 : segment.getDurationMinutes();
            if (segment.getType() == BreakType.LUNCH) {
                lunchMinutes += minutes;
            } else {
                breakMinutes += minutes;
            }
        }
        return new BreakTotals(Math.max(0, breakMinutes), Math.max(0, lunchMinutes));
    }
}
