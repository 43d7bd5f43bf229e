package sp.sistemaspalacios.api_attendance.service.anomaly.evaluator;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyRule;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;
import sp.sistemaspalacios.api_attendance.entity.anomaly.data.TimesheetMismatchData;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceDay;
import sp.sistemaspalacios.api_attendance.entity.boundaries.workPolicy.WorkPolicy;
import sp.sistemaspalacios.api_attendance.repository.attendance.AttendanceDayRepository;
import sp.sistemaspalacios.api_attendance.service.anomaly.AnomalyDraft;
import sp.sistemaspalacios.api_attendance.service.timesheet.TimesheetClient;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Compara el tiempo trabajado de ayer con las horas reportadas en timesheets.
 */
@Component
@RequiredArgsConstructor
public class TimesheetMismatchEvaluator implements AnomalyRuleEvaluator {

    private final AttendanceDayRepository dayRepository;
    private final TimesheetClient timesheetClient;

    @Override
    public AnomalyType getType() {
        return AnomalyType.TIMESHEET_MISMATCH;
    }

    @Override
    public List<Long> findCandidates(Long companyId, AnomalyRule rule, WorkPolicy policy, LocalDate today) {
        return dayRepository.findByCompanyIdAndDateAndTotalWorkMinutesGreaterThan(companyId, today.minusDays(1), 0)
                .stream()
                .map(AttendanceDay::getUserId)
                .distinct()
                .toList();
    }

    @Override
    public Optional<AnomalyDraft> evaluate(Long companyId, Long userId, AnomalyRule rule, WorkPolicy policy, LocalDate today) {
        LocalDate yesterday = today.minusDays(1);
        int attendanceMinutes = dayRepository.findByUserIdAndDate(userId, yesterday)
                .map(AttendanceDay::getTotalWorkMinutes)
                .orElse(0);
        if (attendanceMinutes <= 0) {
            return Optional.empty();
        }

        int timesheetMinutes = timesheetClient.getLoggedMinutes(userId, yesterday);
        double variance = Math.abs(attendanceMinutes - timesheetMinutes) / (double) attendanceMinutes;
        if (variance <= rule.getThreshold() / 100.0) {
            return Optional.empty();
        }

        return Optional.of(new AnomalyDraft(userId,
                "Diferencia con timesheet",
                String.format("Asistencia: %dh, Timesheet: %dh",
                        Math.round(attendanceMinutes / 60.0), Math.round(timesheetMinutes / 60.0)),
                new TimesheetMismatchData(yesterday, attendanceMinutes, timesheetMinutes, variance),
                yesterday));
    }
}
