package sp.sistemaspalacios.api_attendance.service.anomaly.evaluator;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyRule;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;
import sp.sistemaspalacios.api_attendance.entity.anomaly.data.LateCheckInData;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceEvent;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceEventType;
import sp.sistemaspalacios.api_attendance.entity.boundaries.workPolicy.WorkPolicy;
import sp.sistemaspalacios.api_attendance.repository.attendance.AttendanceDayRepository;
import sp.sistemaspalacios.api_attendance.repository.attendance.AttendanceEventRepository;
import sp.sistemaspalacios.api_attendance.service.anomaly.AnomalyDraft;
import sp.sistemaspalacios.api_attendance.service.common.TimeService;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tardanzas repetidas: días de la ventana cuya primera entrada pasa de la hora de
 * inicio más los minutos de gracia.
 */
@Component
@RequiredArgsConstructor
public class LateCheckInEvaluator implements AnomalyRuleEvaluator {

    private final AttendanceDayRepository dayRepository;
    private final AttendanceEventRepository eventRepository;
    private final TimeService timeService;

    @Override
    public AnomalyType getType() {
        return AnomalyType.REPEATED_LATE_CHECK_IN;
    }

    @Override
    public List<Long> findCandidates(Long companyId, AnomalyRule rule, WorkPolicy policy, LocalDate today) {
        return dayRepository.findUserIdsWithAttendance(companyId, windowStart(rule, today), today);
    }

    @Override
    public Optional<AnomalyDraft> evaluate(Long companyId, Long userId, AnomalyRule rule, WorkPolicy policy, LocalDate today) {
        List<AttendanceEvent> checkIns = eventRepository.findByUserAndDateRangeAndType(
                userId, windowStart(rule, today), today, AttendanceEventType.CHECK_IN);

        // Ordenadas por hora: la primera de cada día queda en el mapa
        Map<LocalDate, AttendanceEvent> firstByDay = new LinkedHashMap<>();
        for (AttendanceEvent checkIn : checkIns) {
            firstByDay.putIfAbsent(checkIn.getAttendanceDay().getDate(), checkIn);
        }

        int limit = timeService.toMinutes(policy.getWorkStartTime()) + policy.getGraceMinutesLate();
        List<LocalDate> lateDates = new ArrayList<>();
        firstByDay.forEach((date, checkIn) -> {
            if (timeService.toMinutes(checkIn.getTimestamp().toLocalTime()) > limit) {
                lateDates.add(date);
            }
        });

        if (lateDates.size() < rule.getThreshold()) {
            return Optional.empty();
        }

        LateCheckInData data = new LateCheckInData(lateDates.size(), rule.getWindowDays(),
                policy.getWorkStartTime(), policy.getGraceMinutesLate(), lateDates);
        return Optional.of(new AnomalyDraft(userId,
                "Tardanzas repetidas",
                lateDates.size() + " llegadas tarde en los últimos " + rule.getWindowDays() + " días",
                data));
    }

    /** Primer día de la ventana: los últimos windowDays días, hoy incluido. */
    private LocalDate windowStart(AnomalyRule rule, LocalDate today) {
        return today.minusDays(rule.getWindowDays() - 1L);
    }
}
