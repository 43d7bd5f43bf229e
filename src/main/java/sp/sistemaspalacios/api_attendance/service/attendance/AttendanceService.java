package sp.sistemaspalacios.api_attendance.service.attendance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import sp.sistemaspalacios.api_attendance.dto.PagedResponse;
import sp.sistemaspalacios.api_attendance.dto.attendance.AttendanceDayResponse;
import sp.sistemaspalacios.api_attendance.dto.attendance.AttendanceEventDTO;
import sp.sistemaspalacios.api_attendance.dto.attendance.AttendanceSummaryResponse;
import sp.sistemaspalacios.api_attendance.dto.attendance.BreakSegmentDTO;
import sp.sistemaspalacios.api_attendance.dto.attendance.CheckInLocationDTO;
import sp.sistemaspalacios.api_attendance.dto.attendance.CheckInRequest;
import sp.sistemaspalacios.api_attendance.dto.attendance.CheckInResponse;
import sp.sistemaspalacios.api_attendance.dto.attendance.CheckOutRequest;
import sp.sistemaspalacios.api_attendance.dto.attendance.CheckOutResponse;
import sp.sistemaspalacios.api_attendance.dto.attendance.CheckOutSummaryDTO;
import sp.sistemaspalacios.api_attendance.dto.attendance.OverrideRequest;
import sp.sistemaspalacios.api_attendance.dto.attendance.StartBreakRequest;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceDay;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceEvent;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceEventType;
import sp.sistemaspalacios.api_attendance.entity.attendance.BreakSegment;
import sp.sistemaspalacios.api_attendance.entity.attendance.VerificationStatus;
import sp.sistemaspalacios.api_attendance.entity.attendance.WorkMode;
import sp.sistemaspalacios.api_attendance.entity.boundaries.workPolicy.WorkPolicy;
import sp.sistemaspalacios.api_attendance.exception.ConflictException;
import sp.sistemaspalacios.api_attendance.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_attendance.exception.ValidationException;
import sp.sistemaspalacios.api_attendance.repository.attendance.AttendanceDayRepository;
import sp.sistemaspalacios.api_attendance.repository.attendance.AttendanceEventRepository;
import sp.sistemaspalacios.api_attendance.repository.attendance.BreakSegmentRepository;
import sp.sistemaspalacios.api_attendance.service.anomaly.BreakPolicyChecker;
import sp.sistemaspalacios.api_attendance.service.audit.AuditLogService;
import sp.sistemaspalacios.api_attendance.service.boundaries.workPolicy.WorkPolicyService;
import sp.sistemaspalacios.api_attendance.service.common.TimeService;
import sp.sistemaspalacios.api_attendance.service.geofence.GeofenceService;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Máquina de estados de la jornada:
 * NOT_CHECKED_IN → WORKING ⇄ ON_BREAK → CHECKED_OUT → WORKING (nueva entrada el mismo día).
 */
@Slf4j
@Service
public class AttendanceService {

    public static final String ENTITY_EVENT = "AttendanceEvent";
    public static final String ENTITY_BREAK = "BreakSegment";

    private static final int DEFAULT_PAGE = 1;
    private static final int DEFAULT_LIMIT = 20;

    private final AttendanceDayRepository dayRepository;
    private final AttendanceEventRepository eventRepository;
    private final BreakSegmentRepository breakRepository;
    private final GeofenceService geofenceService;
    private final WorkPolicyService workPolicyService;
    private final BreakPolicyChecker breakPolicyChecker;
    private final AuditLogService auditLogService;
    private final DayTotalsCalculator totalsCalculator;
    private final AttendanceStatusResolver statusResolver;
    private final AttendanceDayAssembler dayAssembler;
    private final TimeService timeService;
    private final TransactionTemplate checkInTransaction;

    public AttendanceService(AttendanceDayRepository dayRepository,
                             AttendanceEventRepository eventRepository,
                             BreakSegmentRepository breakRepository,
                             GeofenceService geofenceService,
                             WorkPolicyService workPolicyService,
                             BreakPolicyChecker breakPolicyChecker,
                             AuditLogService auditLogService,
                             DayTotalsCalculator totalsCalculator,
                             AttendanceStatusResolver statusResolver,
                             AttendanceDayAssembler dayAssembler,
                             TimeService timeService,
                             PlatformTransactionManager transactionManager) {
        this.dayRepository = dayRepository;
        this.eventRepository = eventRepository;
        this.breakRepository = breakRepository;
        this.geofenceService = geofenceService;
        this.workPolicyService = workPolicyService;
        this.breakPolicyChecker = breakPolicyChecker;
        this.auditLogService = auditLogService;
        this.totalsCalculator = totalsCalculator;
        this.statusResolver = statusResolver;
        this.dayAssembler = dayAssembler;
        this.timeService = timeService;

        this.checkInTransaction = new TransactionTemplate(transactionManager);
        this.checkInTransaction.setIsolationLevel(TransactionDefinition.ISOLATION_SERIALIZABLE);
    }

    // =================== ENTRADA ===================

    /**
     * 🔹 Marcar entrada.
     * La verificación previa va fuera de la transacción; dentro se vuelve a comprobar la
     * sesión abierta con la fila del día bloqueada y solo entonces se resuelve la geocerca,
     * así que una entrada rechazada no deja anomalía de geocerca.
     */
    public CheckInResponse checkIn(Long userId, Long companyId, CheckInRequest request) {
        if (request == null || request.getWorkMode() == null) {
            throw new ValidationException("El modo de trabajo es obligatorio");
        }
        GeofenceService.validateCoordinates(request.getLatitude(), request.getLongitude());

        LocalDate today = timeService.today();
        log.info("🔍 Entrada usuario {} empresa {} ({})", userId, companyId, request.getWorkMode());

        if (hasOpenSession(userId, today)) {
            throw new ConflictException("Ya tiene una sesión abierta. Marque salida antes de volver a marcar entrada");
        }

        AttendanceEvent event;
        try {
            event = checkInTransaction.execute(tx -> doCheckIn(userId, companyId, today, request));
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            log.warn("Entrada concurrente rechazada para usuario {}: {}", userId, e.getMessage());
            throw new ConflictException("Ya existe una entrada registrada en paralelo para hoy", e);
        } catch (DataAccessException | TransactionException e) {
            if (hasOpenSession(userId, today)) {
                log.warn("Entrada concurrente rechazada para usuario {}: {}", userId, e.getMessage());
                throw new ConflictException("Ya existe una entrada registrada en paralelo para hoy", e);
            }
            throw e;
        }

        log.info("✅ Entrada registrada: usuario {} evento {} ({})", userId, event.getId(), event.getVerificationStatus());
        return new CheckInResponse(AttendanceEventDTO.from(event), getDay(userId, companyId, today));
    }

    private AttendanceEvent doCheckIn(Long userId, Long companyId, LocalDate today,
                                      CheckInRequest request) {
        AttendanceDay day = dayRepository.findForCheckIn(userId, today).orElse(null);
        if (day != null) {
            List<AttendanceEvent> events = eventRepository.findByAttendanceDayIdOrderByTimestampAscIdAsc(day.getId());
            if (statusResolver.hasOpenSession(events)) {
                throw new ConflictException("Ya tiene una sesión abierta. Marque salida antes de volver a marcar entrada");
            }
            day.setIsComplete(false);
        } else {
            day = new AttendanceDay(userId, companyId, today);
        }
        day = dayRepository.saveAndFlush(day);

        VerificationStatus verification = request.getWorkMode() == WorkMode.OFFICE
                ? geofenceService.validateAndFlag(userId, companyId, request.getLatitude(), request.getLongitude())
                : VerificationStatus.NONE;

        AttendanceEvent event = new AttendanceEvent();
        event.setAttendanceDay(day);
        event.setType(AttendanceEventType.CHECK_IN);
        event.setTimestamp(timeService.now());
        event.setWorkMode(request.getWorkMode());
        event.setLatitude(request.getLatitude());
        event.setLongitude(request.getLongitude());
        event.setVerificationStatus(verification);
        event.setDeviceFingerprint(request.getDeviceFingerprint());
        event.setNotes(request.getNotes());
        event = eventRepository.saveAndFlush(event);

        auditLogService.record(userId.toString(), "AttendanceCheckIn", ENTITY_EVENT, event.getId(),
                AttendanceEventDTO.from(event));
        return event;
    }

    // =================== SALIDA ===================

    /**
     * 🔹 Marcar salida. Cierra los descansos abiertos y consolida los totales del día.
     */
    @Transactional
    public CheckOutResponse checkOut(Long userId, Long companyId, CheckOutRequest request) {
        CheckOutRequest body = request != null ? request : new CheckOutRequest();
        GeofenceService.validateCoordinates(body.getLatitude(), body.getLongitude());

        AttendanceDay day = dayRepository.findLockedByUserIdAndDate(userId, timeService.today())
                .orElseThrow(() -> new ConflictException("No ha marcado entrada hoy"));

        List<AttendanceEvent> events = new ArrayList<>(eventRepository.findByAttendanceDayIdOrderByTimestampAscIdAsc(day.getId()));
        AttendanceEvent latestCheckIn = statusResolver.latestCheckIn(events)
                .orElseThrow(() -> new ConflictException("No ha marcado entrada hoy"));
        if (statusResolver.checkOutAfter(events, latestCheckIn).isPresent()) {
            throw new ConflictException("Ya marcó salida. Marque entrada para iniciar otra sesión");
        }

        LocalDateTime now = timeService.now();
        List<BreakSegment> breaks = breakRepository.findByAttendanceDayIdOrderByStartTimeAsc(day.getId());
        for (BreakSegment segment : breaks) {
            if (segment.isOpen()) {
                closeBreak(userId, companyId, day, segment, now, breaks);
            }
        }

        AttendanceEvent event = new AttendanceEvent();
        event.setAttendanceDay(day);
        event.setType(AttendanceEventType.CHECK_OUT);
        event.setTimestamp(now);
        event.setWorkMode(latestCheckIn.getWorkMode());
        event.setLatitude(body.getLatitude());
        event.setLongitude(body.getLongitude());
        event.setNotes(body.getNotes());
        event = eventRepository.save(event);
        events.add(event);

        WorkPolicy policy = workPolicyService.getEffectivePolicy(day.getCompanyId());
        DayTotalsCalculator.DayTotals totals = applyTotals(day, events, breaks, policy);

        auditLogService.record(userId.toString(), "AttendanceCheckOut", ENTITY_EVENT, event.getId(),
                AttendanceEventDTO.from(event));
        log.info("✅ Salida registrada: usuario {} trabajó {} min, descanso {} min, extra {} min",
                userId, totals.workMinutes(), totals.totalBreakAndLunch(), totals.overtimeMinutes());

        CheckOutSummaryDTO summary = new CheckOutSummaryDTO(
                totals.workMinutes(), totals.totalBreakAndLunch(), totals.overtimeMinutes());
        return new CheckOutResponse(AttendanceEventDTO.from(event),
                dayAssembler.assemble(day, events, breaks, policy, null), summary);
    }

    // =================== DESCANSOS ===================

    /**
     * 🔹 Iniciar descanso o almuerzo. Requiere sesión abierta y ningún descanso en curso.
     * La jornada se lee bloqueada, así que un segundo inicio simultáneo espera y ve el
     * descanso ya abierto.
     */
    @Transactional
    public BreakSegmentDTO startBreak(Long userId, StartBreakRequest request) {
        if (request == null || request.getType() == null) {
            throw new ValidationException("El tipo de descanso es obligatorio");
        }

        AttendanceDay day = dayRepository.findLockedByUserIdAndDate(userId, timeService.today())
                .orElseThrow(() -> new ConflictException("No ha marcado entrada hoy"));

        List<AttendanceEvent> events = eventRepository.findByAttendanceDayIdOrderByTimestampAscIdAsc(day.getId());
        if (!statusResolver.hasOpenSession(events)) {
            throw new ConflictException("No tiene una sesión abierta. Marque entrada para iniciar un descanso");
        }

        List<BreakSegment> breaks = breakRepository.findByAttendanceDayIdOrderByStartTimeAsc(day.getId());
        if (statusResolver.openBreak(breaks).isPresent()) {
            throw new ConflictException("Ya tiene un descanso en curso");
        }

        BreakSegment segment = new BreakSegment();
        segment.setAttendanceDay(day);
        segment.setType(request.getType());
        segment.setStartTime(timeService.now());
        segment = breakRepository.save(segment);

        BreakSegmentDTO dto = BreakSegmentDTO.from(segment);
        auditLogService.record(userId.toString(), "BreakStarted", ENTITY_BREAK, segment.getId(), dto);
        log.info("⏸️ Descanso {} iniciado: usuario {}", request.getType(), userId);
        return dto;
    }

    /**
     * 🔹 Terminar un descanso propio que siga abierto.
     */
    @Transactional
    public BreakSegmentDTO endBreak(Long userId, Long companyId, Long breakId) {
        BreakSegment segment = breakRepository.findWithDayById(breakId)
                .orElseThrow(() -> new ResourceNotFoundException("Descanso con ID " + breakId + " no encontrado"));
        AttendanceDay day = segment.getAttendanceDay();

        if (!Objects.equals(day.getUserId(), userId)) {
            throw new ConflictException("El descanso no pertenece al usuario");
        }
        if (!segment.isOpen()) {
            throw new ConflictException("El descanso ya terminó");
        }

        List<BreakSegment> breaks = breakRepository.findByAttendanceDayIdOrderByStartTimeAsc(day.getId());
        BreakSegment closed = closeBreak(userId, companyId, day, segment, timeService.now(), breaks);
        return BreakSegmentDTO.from(closed);
    }

    /**
     * Cierra el descanso, actualiza los totales de descanso del día y revisa el límite
     * de la política. {@code dayBreaks} es la lista de descansos del día que se mantiene
     * sincronizada con el cierre.
     */
    private BreakSegment closeBreak(Long userId, Long companyId, AttendanceDay day, BreakSegment segment,
                                    LocalDateTime end, List<BreakSegment> dayBreaks) {
        segment.setEndTime(end);
        segment.setDurationMinutes(Math.max(0, TimeService.minutesBetween(segment.getStartTime(), end)));
        BreakSegment saved = breakRepository.save(segment);

        List<BreakSegment> current = dayBreaks.stream()
                .map(b -> Objects.equals(b.getId(), saved.getId()) ? saved : b)
                .toList();
        applyBreakTotals(day, current);
        breakPolicyChecker.check(companyId, day, current);

        auditLogService.record(userId.toString(), "BreakEnded", ENTITY_BREAK, saved.getId(), BreakSegmentDTO.from(saved));
        log.info("▶️ Descanso {} terminado: usuario {} ({} min)", saved.getType(), userId, saved.getDurationMinutes());
        return saved;
    }

    // =================== CORRECCIONES ===================

    /**
     * 🔹 Corrección administrativa de una marcación. Siempre recalcula el día.
     */
    @Transactional
    public AttendanceEventDTO overrideEvent(Long eventId, OverrideRequest request, String actorId) {
        if (request == null || request.getReason() == null || request.getReason().isBlank()) {
            throw new ValidationException("El motivo de la corrección es obligatorio");
        }
        if (request.getTimestamp() != null && request.getTimestamp().isAfter(timeService.now())) {
            throw new ValidationException("La hora corregida no puede estar en el futuro");
        }

        AttendanceEvent event = eventRepository.findWithDayById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Marcación con ID " + eventId + " no encontrada"));
        AttendanceEventDTO before = AttendanceEventDTO.from(event);

        if (request.getTimestamp() != null) event.setTimestamp(request.getTimestamp());
        if (request.getWorkMode() != null) event.setWorkMode(request.getWorkMode());
        event.setIsOverride(true);
        event.setOverrideReason(request.getReason().trim());
        event.setOverrideBy(actorId);
        AttendanceEvent saved = eventRepository.saveAndFlush(event);

        AttendanceDay day = saved.getAttendanceDay();
        List<AttendanceEvent> events = eventRepository.findByAttendanceDayIdOrderByTimestampAscIdAsc(day.getId());
        List<BreakSegment> breaks = breakRepository.findByAttendanceDayIdOrderByStartTimeAsc(day.getId());
        applyTotals(day, events, breaks, workPolicyService.getEffectivePolicy(day.getCompanyId()));

        AttendanceEventDTO after = AttendanceEventDTO.from(saved);
        auditLogService.record(actorId, "AttendanceOverride", ENTITY_EVENT, saved.getId(),
                before, after, request.getReason().trim());
        log.info("✏️ Marcación {} corregida por {}", eventId, actorId);
        return after;
    }

    // =================== CONSULTAS ===================

    /**
     * 🔹 Jornada de hoy con estado y totales en vivo.
     */
    @Transactional(readOnly = true)
    public AttendanceDayResponse getToday(Long userId, Long companyId) {
        return getDay(userId, companyId, timeService.today());
    }

    private AttendanceDayResponse getDay(Long userId, Long companyId, LocalDate date) {
        WorkPolicy policy = workPolicyService.getEffectivePolicy(companyId);
        AttendanceDay day = dayRepository.findByUserIdAndDate(userId, date).orElse(null);
        if (day == null) {
            return dayAssembler.empty(date, policy);
        }
        List<AttendanceEvent> events = eventRepository.findByAttendanceDayIdOrderByTimestampAscIdAsc(day.getId());
        List<BreakSegment> breaks = breakRepository.findByAttendanceDayIdOrderByStartTimeAsc(day.getId());
        LocalDateTime liveAt = date.equals(timeService.today()) ? timeService.now() : null;
        return dayAssembler.assemble(day, events, breaks, policy, liveAt);
    }

    /**
     * 🔹 Historial paginado, del día más reciente al más antiguo.
     */
    @Transactional(readOnly = true)
    public PagedResponse<AttendanceDayResponse> getHistory(Long userId, LocalDate from, LocalDate to,
                                                           Integer page, Integer limit) {
        LocalDate end = to != null ? to : timeService.today();
        LocalDate start = from != null ? from : end.minusDays(30);
        validateRange(start, end);

        int pageNumber = page != null ? page : DEFAULT_PAGE;
        int pageSize = limit != null ? limit : DEFAULT_LIMIT;
        if (pageNumber < 1 || pageSize < 1) {
            throw new ValidationException("La página y el límite deben ser mayores que cero");
        }

        Page<AttendanceDay> days = dayRepository.findByUserIdAndDateBetween(userId, start, end,
                PageRequest.of(pageNumber - 1, pageSize, Sort.by(Sort.Direction.DESC, "date")));

        List<AttendanceDayResponse> data = days.getContent().stream()
                .map(day -> dayAssembler.assemble(day,
                        eventRepository.findByAttendanceDayIdOrderByTimestampAscIdAsc(day.getId()),
                        breakRepository.findByAttendanceDayIdOrderByStartTimeAsc(day.getId()),
                        null, null))
                .toList();
        return PagedResponse.of(data, pageNumber, pageSize, days.getTotalElements());
    }

    /**
     * 🔹 Resumen de asistencia del periodo. Los días totales se cuentan sin incluir el último.
     * Las ausencias no descuentan permisos: esos datos viven en el módulo de novedades.
     */
    @Transactional(readOnly = true)
    public AttendanceSummaryResponse getSummary(Long userId, LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new ValidationException("Las fechas de inicio y fin son obligatorias");
        }
        validateRange(from, to);

        List<AttendanceDay> days = dayRepository.findByUserIdAndDateBetweenOrderByDateAsc(userId, from, to);
        List<AttendanceEvent> events = eventRepository.findByUserAndDateRange(userId, from, to);

        long presentDays = events.stream()
                .filter(AttendanceEvent::isCheckIn)
                .map(e -> e.getAttendanceDay().getId())
                .distinct()
                .count();
        long totalDays = ChronoUnit.DAYS.between(from, to);
        int workMinutes = days.stream().mapToInt(AttendanceDay::getTotalWorkMinutes).sum();
        int overtimeMinutes = days.stream().mapToInt(AttendanceDay::getOvertimeMinutes).sum();

        return AttendanceSummaryResponse.builder()
                .totalDays(totalDays)
                .presentDays(presentDays)
                .absentDays(Math.max(0, totalDays - presentDays))
                .totalWorkHours(toHours(workMinutes))
                .totalOvertimeHours(toHours(overtimeMinutes))
                .averageCheckInTime(timeService.averageTimeOfDay(events.stream()
                        .filter(AttendanceEvent::isCheckIn).map(AttendanceEvent::getTimestamp).toList()))
                .averageCheckOutTime(timeService.averageTimeOfDay(events.stream()
                        .filter(AttendanceEvent::isCheckOut).map(AttendanceEvent::getTimestamp).toList()))
                .build();
    }

    /**
     * 🔹 Entradas con coordenadas de la empresa en el periodo, para el mapa.
     */
    @Transactional(readOnly = true)
    public List<CheckInLocationDTO> getCheckInLocations(Long companyId, LocalDate from, LocalDate to) {
        LocalDate end = to != null ? to : timeService.today();
        LocalDate start = from != null ? from : end;
        validateRange(start, end);

        return eventRepository.findLocatedEvents(companyId, AttendanceEventType.CHECK_IN,
                        timeService.startOfDay(start), timeService.endOfDay(end))
                .stream()
                .map(e -> CheckInLocationDTO.builder()
                        .id(e.getId())
                        .userId(e.getAttendanceDay().getUserId())
                        .latitude(e.getLatitude())
                        .longitude(e.getLongitude())
                        .timestamp(e.getTimestamp())
                        .workMode(e.getWorkMode())
                        .verificationStatus(e.getVerificationStatus())
                        .build())
                .toList();
    }

    // =================== TOTALES ===================

    /**
     * Aplica los cuatro totales y el indicador de completitud en una sola actualización.
     * Sin entradas el día queda como está.
     */
    DayTotalsCalculator.DayTotals applyTotals(AttendanceDay day, List<AttendanceEvent> events,
                                              List<BreakSegment> breaks, WorkPolicy policy) {
        return totalsCalculator.calculate(events, breaks, policy)
                .map(totals -> {
                    day.setTotalWorkMinutes(totals.workMinutes());
                    day.setTotalBreakMinutes(totals.breakMinutes());
                    day.setTotalLunchMinutes(totals.lunchMinutes());
                    day.setOvertimeMinutes(totals.overtimeMinutes());
                    day.setIsComplete(!statusResolver.hasOpenSession(events));
                    dayRepository.save(day);
                    return totals;
                })
                .orElseGet(() -> new DayTotalsCalculator.DayTotals(day.getTotalWorkMinutes(),
                        day.getTotalBreakMinutes(), day.getTotalLunchMinutes(), day.getOvertimeMinutes()));
    }

    void applyBreakTotals(AttendanceDay day, List<BreakSegment> breaks) {
        DayTotalsCalculator.BreakTotals totals = totalsCalculator.breakTotals(breaks);
        day.setTotalBreakMinutes(totals.breakMinutes());
        day.setTotalLunchMinutes(totals.lunchMinutes());
        dayRepository.save(day);
    }

    private boolean hasOpenSession(Long userId, LocalDate date) {
        return dayRepository.findByUserIdAndDate(userId, date)
                .map(day -> statusResolver.hasOpenSession(
                        eventRepository.findByAttendanceDayIdOrderByTimestampAscIdAsc(day.getId())))
                .orElse(false);
    }

    private void validateRange(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new ValidationException("La fecha inicial no puede ser posterior a la final");
        }
    }

    private double toHours(int minutes) {
        return Math.round(minutes / 60.0 * 10) / 10.0;
    }
}
