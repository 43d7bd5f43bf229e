package sp.sistemaspalacios.api_attendance.support;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import sp.sistemaspalacios.api_attendance.repository.anomaly.AnomalyEventRepository;
import sp.sistemaspalacios.api_attendance.repository.anomaly.AnomalyRuleRepository;
import sp.sistemaspalacios.api_attendance.repository.attendance.AttendanceDayRepository;
import sp.sistemaspalacios.api_attendance.repository.attendance.AttendanceEventRepository;
import sp.sistemaspalacios.api_attendance.repository.attendance.BreakSegmentRepository;
import sp.sistemaspalacios.api_attendance.repository.audit.AuditLogRepository;
import sp.sistemaspalacios.api_attendance.repository.boundaries.geofence.GeofencePolicyRepository;
import sp.sistemaspalacios.api_attendance.repository.boundaries.geofence.OfficeLocationRepository;
import sp.sistemaspalacios.api_attendance.repository.boundaries.workPolicy.WorkPolicyRepository;

/**
 * Contexto completo sobre H2 con el reloj de pruebas. Cada prueba empieza con la base vacía
 * y el reloj en {@link TestClockConfig#START}.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
public abstract class AbstractIntegrationTest {

    protected static final Long COMPANY_ID = 1L;
    protected static final Long USER_ID = 7L;

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected AttendanceDayRepository dayRepository;
    @Autowired
    protected AttendanceEventRepository eventRepository;
    @Autowired
    protected BreakSegmentRepository breakRepository;
    @Autowired
    protected AnomalyEventRepository anomalyEventRepository;
    @Autowired
    protected AnomalyRuleRepository anomalyRuleRepository;
    @Autowired
    protected AuditLogRepository auditLogRepository;
    @Autowired
    protected WorkPolicyRepository workPolicyRepository;
    @Autowired
    protected GeofencePolicyRepository geofencePolicyRepository;
    @Autowired
    protected OfficeLocationRepository officeLocationRepository;

    @BeforeEach
    void resetDatabaseAndClock() {
        anomalyEventRepository.deleteAllInBatch();
        anomalyRuleRepository.deleteAllInBatch();
        auditLogRepository.deleteAllInBatch();
        breakRepository.deleteAllInBatch();
        eventRepository.deleteAllInBatch();
        dayRepository.deleteAllInBatch();
        workPolicyRepository.deleteAllInBatch();
        geofencePolicyRepository.deleteAllInBatch();
        officeLocationRepository.deleteAllInBatch();
        clock.set(TestClockConfig.START);
    }
}
