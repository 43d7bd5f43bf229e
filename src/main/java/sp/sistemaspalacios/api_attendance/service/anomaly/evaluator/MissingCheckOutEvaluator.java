package sp.sistemaspalacios.api_attendance.service.anomaly.evaluator;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyRule;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;
import sp.sistemaspalacios.api_attendance.entity.anomaly.data.MissingCheckOutData;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceDay;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceEvent;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceEventType;
import sp.sistemaspalacios.api_attendance.entity.boundaries.workPolicy.WorkPolicy;
import sp.sistemaspalacios.api_attendance.repository.attendance.AttendanceDayRepository;
import sp.sistemaspalacios.api_attendance.repository.attendance.AttendanceEventRepository;
import sp.sistemaspalacios.api_attendance.service.anomaly.AnomalyDraft;
import sp.sistemaspalacios.api_attendance.service.attendance.AttendanceStatusResolver;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Jornadas de hoy con entrada y sin cerrar.
 */
@Component
@RequiredArgsConstructor
public class MissingCheckOutEvaluator implements AnomalyRuleEvaluator {

    private final AttendanceDayRepository dayRepository;
    private final AttendanceEventRepository eventRepository;
    private final AttendanceStatusResolver statusResolver;

    @Override
    public AnomalyType getType() {
        return AnomalyType.MISSING_CHECK_OUT;
    }

    @Override
    public List<Long> findCandidates(Long companyId, AnomalyRule rule, WorkPolicy policy, LocalDate today) {
        return dayRepository.findIncompleteWithEventType(companyId, today, AttendanceEventType.CHECK_IN).stream()
                .map(AttendanceDay::getUserId)
                .distinct()
                .toList();
    }

    @Override
    public Optional<AnomalyDraft> evaluate(Long companyId, Long userId, AnomalyRule rule, WorkPolicy policy, LocalDate today) {
        Optional<AttendanceDay> day = dayRepository.findByUserIdAndDate(userId, today);
        if (day.isEmpty() || Boolean.TRUE.equals(day.get().getIsComplete())) {
            return Optional.empty();
        }

        List<AttendanceEvent> events = eventRepository.findByAttendanceDayIdOrderByTimestampAscIdAsc(day.get().getId());
        Optional<LocalDateTime> lastCheckIn = statusResolver.latestCheckIn(events).map(AttendanceEvent::getTimestamp);
        if (lastCheckIn.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(new AnomalyDraft(userId,
                "Salida sin marcar",
                "No se registró salida el " + today,
                new MissingCheckOutData(today, lastCheckIn.get()),
                today));
    }
}
