package sp.sistemaspalacios.api_attendance.service.attendance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.springframework.beans.factory.annotation.Autowired;
import sp.sistemaspalacios.api_attendance.dto.attendance.CheckInRequest;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceEventType;
import sp.sistemaspalacios.api_attendance.entity.attendance.WorkMode;
import sp.sistemaspalacios.api_attendance.entity.boundaries.geofence.GeofencePolicy;
import sp.sistemaspalacios.api_attendance.entity.boundaries.geofence.OfficeLocation;
import sp.sistemaspalacios.api_attendance.exception.ConflictException;
import sp.sistemaspalacios.api_attendance.service.anomaly.AnomalyRuleService;
import sp.sistemaspalacios.api_attendance.support.AbstractIntegrationTest;
import sp.sistemaspalacios.api_attendance.support.ConcurrentCalls;
import sp.sistemaspalacios.api_attendance.support.TestClockConfig;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Entradas simultáneas")
class ConcurrentCheckInIntegrationTest extends AbstractIntegrationTest {

    private static final int THREADS = 2;

    @Autowired
    private AttendanceService attendanceService;
    @Autowired
    private AnomalyRuleService anomalyRuleService;

    @RepeatedTest(3)
    @DisplayName("Dos entradas a la vez: una gana y la otra recibe conflicto")
    void onlyOneCheckInWins() throws Exception {
        ConcurrentCalls.Outcome outcome = ConcurrentCalls.run(THREADS,
                () -> attendanceService.checkIn(USER_ID, COMPANY_ID, CheckInRequest.of(WorkMode.REMOTE)));

        assertOneWinner(outcome);
        assertThat(dayRepository.count()).isEqualTo(1);
        assertThat(eventRepository.count()).isEqualTo(1);
        assertThat(auditLogRepository.findByActionOrderByIdAsc("AttendanceCheckIn")).hasSize(1);
    }

    @RepeatedTest(3)
    @DisplayName("Sobre una jornada ya creada, la segunda entrada simultánea también recibe conflicto")
    void onlyOneCheckInWinsOnExistingDay() throws Exception {
        attendanceService.checkIn(USER_ID, COMPANY_ID, CheckInRequest.of(WorkMode.REMOTE));
        clock.advanceMinutes(60);
        attendanceService.checkOut(USER_ID, COMPANY_ID, null);
        clock.advanceMinutes(30);

        ConcurrentCalls.Outcome outcome = ConcurrentCalls.run(THREADS,
                () -> attendanceService.checkIn(USER_ID, COMPANY_ID, CheckInRequest.of(WorkMode.REMOTE)));

        assertOneWinner(outcome);
        assertThat(dayRepository.count()).isEqualTo(1);
        assertThat(eventRepository.findAll())
                .filteredOn(e -> e.getType() == AttendanceEventType.CHECK_IN)
                .hasSize(2);
        assertThat(dayRepository.findByUserIdAndDate(USER_ID, TestClockConfig.START.toLocalDate()))
                .hasValueSatisfying(day -> assertThat(day.getIsComplete()).isFalse());
    }

    @RepeatedTest(3)
    @DisplayName("Dos entradas fuera de geocerca a la vez dejan una sola anomalía, la de la entrada ganadora")
    void geofenceFailureFlaggedOnceUnderRace() throws Exception {
        GeofencePolicy geofence = new GeofencePolicy();
        geofence.setCompanyId(COMPANY_ID);
        geofence.setIsEnabled(true);
        geofencePolicyRepository.save(geofence);

        OfficeLocation office = new OfficeLocation();
        office.setCompanyId(COMPANY_ID);
        office.setName("Sede principal");
        office.setLatitude(4.6097);
        office.setLongitude(-74.0817);
        office.setRadiusMeters(100);
        officeLocationRepository.save(office);
        anomalyRuleService.initializeDefaultRules(COMPANY_ID);

        ConcurrentCalls.Outcome outcome = ConcurrentCalls.run(THREADS,
                () -> attendanceService.checkIn(USER_ID, COMPANY_ID, CheckInRequest.at(WorkMode.OFFICE, 4.6142, -74.0817)));

        assertOneWinner(outcome);
        assertThat(eventRepository.count()).isEqualTo(1);
        assertThat(anomalyEventRepository.findAll())
                .filteredOn(a -> a.getType() == AnomalyType.GEOFENCE_FAILURE)
                .hasSize(1);
    }

    private static void assertOneWinner(ConcurrentCalls.Outcome outcome) {
        assertThat(outcome.successes()).isEqualTo(1);
        assertThat(outcome.failures()).singleElement().isInstanceOf(ConflictException.class);
    }
}
