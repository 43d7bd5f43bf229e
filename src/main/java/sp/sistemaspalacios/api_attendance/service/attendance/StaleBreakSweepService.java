package sp.sistemaspalacios.api_attendance.service.attendance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import sp.sistemaspalacios.api_attendance.dto.attendance.BreakSegmentDTO;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceDay;
import sp.sistemaspalacios.api_attendance.entity.attendance.BreakSegment;
import sp.sistemaspalacios.api_attendance.entity.attendance.BreakType;
import sp.sistemaspalacios.api_attendance.entity.boundaries.workPolicy.WorkPolicy;
import sp.sistemaspalacios.api_attendance.repository.attendance.AttendanceDayRepository;
import sp.sistemaspalacios.api_attendance.repository.attendance.BreakSegmentRepository;
import sp.sistemaspalacios.api_attendance.service.audit.AuditLogService;
import sp.sistemaspalacios.api_attendance.service.boundaries.workPolicy.WorkPolicyService;
import sp.sistemaspalacios.api_attendance.service.common.TimeService;

import java.util.List;

/**
 * Cierra los descansos que quedaron abiertos en días anteriores. El descanso se cierra
 * con la duración permitida para su tipo y queda marcado como cerrado automáticamente.
 */
@Slf4j
@Service
public class StaleBreakSweepService {

    private final BreakSegmentRepository breakRepository;
    private final AttendanceDayRepository dayRepository;
    private final WorkPolicyService workPolicyService;
    private final DayTotalsCalculator totalsCalculator;
    private final AuditLogService auditLogService;
    private final TimeService timeService;
    private final TransactionTemplate perBreakTransaction;

    public StaleBreakSweepService(BreakSegmentRepository breakRepository,
                                  AttendanceDayRepository dayRepository,
                                  WorkPolicyService workPolicyService,
                                  DayTotalsCalculator totalsCalculator,
                                  AuditLogService auditLogService,
                                  TimeService timeService,
                                  PlatformTransactionManager transactionManager) {
        this.breakRepository = breakRepository;
        this.dayRepository = dayRepository;
        this.workPolicyService = workPolicyService;
        this.totalsCalculator = totalsCalculator;
        this.auditLogService = auditLogService;
        this.timeService = timeService;

        this.perBreakTransaction = new TransactionTemplate(transactionManager);
        this.perBreakTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * 🔹 Cierra los descansos olvidados.
     *
     * @return cantidad de descansos cerrados
     */
    public int closeStaleBreaks() {
        List<BreakSegment> stale = breakRepository.findOpenBefore(timeService.today());
        if (stale.isEmpty()) {
            return 0;
        }
        log.info("🔍 {} descansos abiertos de días anteriores", stale.size());

        int closed = 0;
        for (BreakSegment segment : stale) {
            try {
                perBreakTransaction.executeWithoutResult(tx -> close(segment.getId()));
                closed++;
            } catch (RuntimeException e) {
                log.error("❌ No se pudo cerrar el descanso {}", segment.getId(), e);
            }
        }

        log.info("✅ {} descansos cerrados automáticamente", closed);
        return closed;
    }

    private void close(Long breakId) {
        BreakSegment segment = breakRepository.findWithDayById(breakId)
                .orElseThrow(() -> new IllegalStateException("Descanso " + breakId + " no existe"));
        if (!segment.isOpen()) {
            return;
        }

        AttendanceDay day = segment.getAttendanceDay();
        WorkPolicy policy = workPolicyService.getEffectivePolicy(day.getCompanyId());
        int allowance = segment.getType() == BreakType.LUNCH
                ? policy.getLunchDurationMinutes()
                : policy.getBreakDurationMinutes();

        segment.setEndTime(segment.getStartTime().plusMinutes(allowance));
        segment.setDurationMinutes(allowance);
        segment.setAutoClosed(true);
        breakRepository.save(segment);

        DayTotalsCalculator.BreakTotals totals = totalsCalculator.breakTotals(
                breakRepository.findByAttendanceDayIdOrderByStartTimeAsc(day.getId()));
        day.setTotalBreakMinutes(totals.breakMinutes());
        day.setTotalLunchMinutes(totals.lunchMinutes());
        dayRepository.save(day);

        auditLogService.record(AuditLogService.ACTOR_SYSTEM, "BreakAutoClosed", AttendanceService.ENTITY_BREAK,
                segment.getId(), BreakSegmentDTO.from(segment));
        log.info("⏹️ Descanso {} del usuario {} ({}) cerrado con {} min",
                segment.getId(), day.getUserId(), day.getDate(), allowance);
    }
}
