package sp.sistemaspalacios.api_attendance.service.geofence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.InjectMocks;
import org.mockito.junit.jupiter.MockitoExtension;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyRule;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;
import sp.sistemaspalacios.api_attendance.entity.anomaly.data.GeofenceFailureData;
import sp.sistemaspalacios.api_attendance.entity.attendance.VerificationStatus;
import sp.sistemaspalacios.api_attendance.entity.boundaries.geofence.GeofencePolicy;
import sp.sistemaspalacios.api_attendance.entity.boundaries.geofence.OfficeLocation;
import sp.sistemaspalacios.api_attendance.exception.ValidationException;
import sp.sistemaspalacios.api_attendance.repository.anomaly.AnomalyRuleRepository;
import sp.sistemaspalacios.api_attendance.repository.boundaries.geofence.GeofencePolicyRepository;
import sp.sistemaspalacios.api_attendance.repository.boundaries.geofence.OfficeLocationRepository;
import sp.sistemaspalacios.api_attendance.service.anomaly.AnomalyDraft;
import sp.sistemaspalacios.api_attendance.service.anomaly.AnomalyRecorder;
import sp.sistemaspalacios.api_attendance.service.common.TimeService;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static sp.sistemaspalacios.api_attendance.support.AttendanceFixtures.rule;

@ExtendWith(MockitoExtension.class)
@DisplayName("GeofenceService")
class GeofenceServiceTest {

    private static final Long COMPANY = 1L;
    private static final double OFFICE_LAT = 4.6097;
    private static final double OFFICE_LON = -74.0817;
    // ~0.000449 grados de latitud son 50 m; ~0.0045 son 500 m
    private static final double LAT_50M = OFFICE_LAT + 0.000449;
    private static final double LAT_500M = OFFICE_LAT + 0.0045;

    @Mock
    private GeofencePolicyRepository geofencePolicyRepository;
    @Mock
    private OfficeLocationRepository officeLocationRepository;
    @Mock
    private AnomalyRuleRepository anomalyRuleRepository;
    @Mock
    private AnomalyRecorder anomalyRecorder;
    @Spy
    private GeoDistanceCalculator distanceCalculator = new GeoDistanceCalculator();
    @Mock
    private TimeService timeService;

    @InjectMocks
    private GeofenceService geofenceService;

    private GeofencePolicy policy;

    @BeforeEach
    void setUp() {
        policy = new GeofencePolicy();
        policy.setCompanyId(COMPANY);
        policy.setIsEnabled(true);
    }

    private OfficeLocation office(int radius) {
        OfficeLocation office = new OfficeLocation();
        office.setCompanyId(COMPANY);
        office.setName("Sede principal");
        office.setLatitude(OFFICE_LAT);
        office.setLongitude(OFFICE_LON);
        office.setRadiusMeters(radius);
        return office;
    }

    @Test
    @DisplayName("Sin política no se verifica")
    void noPolicyMeansNone() {
        when(geofencePolicyRepository.findByCompanyId(COMPANY)).thenReturn(Optional.empty());

        assertThat(geofenceService.validate(COMPANY, LAT_500M, OFFICE_LON)).isEqualTo(VerificationStatus.NONE);
        verifyNoInteractions(officeLocationRepository);
    }

    @Test
    void disabledPolicyMeansNone() {
        policy.setIsEnabled(false);
        when(geofencePolicyRepository.findByCompanyId(COMPANY)).thenReturn(Optional.of(policy));

        assertThat(geofenceService.validate(COMPANY, LAT_500M, OFFICE_LON)).isEqualTo(VerificationStatus.NONE);
    }

    @Test
    @DisplayName("Sin coordenadas falla solo si la política las exige")
    void missingCoordinates() {
        when(geofencePolicyRepository.findByCompanyId(COMPANY)).thenReturn(Optional.of(policy));
        assertThat(geofenceService.validate(COMPANY, null, null)).isEqualTo(VerificationStatus.NONE);

        policy.setRequireGeofenceForOffice(true);
        assertThat(geofenceService.validate(COMPANY, null, null)).isEqualTo(VerificationStatus.GEOFENCE_FAILED);
    }

    @Test
    @DisplayName("A 50 m de una oficina de 100 m pasa; a 500 m falla")
    void distanceAgainstRadius() {
        when(geofencePolicyRepository.findByCompanyId(COMPANY)).thenReturn(Optional.of(policy));
        when(officeLocationRepository.findByCompanyIdAndIsActiveTrue(COMPANY)).thenReturn(List.of(office(100)));

        assertThat(geofenceService.validate(COMPANY, LAT_50M, OFFICE_LON)).isEqualTo(VerificationStatus.GEOFENCE_PASSED);
        assertThat(geofenceService.validate(COMPANY, LAT_500M, OFFICE_LON)).isEqualTo(VerificationStatus.GEOFENCE_FAILED);
    }

    @Test
    @DisplayName("Sin oficinas activas no se verifica")
    void noActiveOffices() {
        when(geofencePolicyRepository.findByCompanyId(COMPANY)).thenReturn(Optional.of(policy));
        when(officeLocationRepository.findByCompanyIdAndIsActiveTrue(COMPANY)).thenReturn(List.of());

        assertThat(geofenceService.validate(COMPANY, LAT_500M, OFFICE_LON)).isEqualTo(VerificationStatus.NONE);
    }

    @Test
    @DisplayName("Coordenadas fuera de rango o incompletas son inválidas")
    void invalidCoordinates() {
        assertThatThrownBy(() -> geofenceService.validate(COMPANY, 91.0, 0.0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> geofenceService.validate(COMPANY, 0.0, -180.5)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> geofenceService.validate(COMPANY, 10.0, null)).isInstanceOf(ValidationException.class);
        verifyNoInteractions(geofencePolicyRepository);
    }

    @Test
    @DisplayName("Un fallo con la regla habilitada registra la anomalía de geocerca")
    void failureIsFlagged() {
        AnomalyRule geofenceRule = rule(9L, AnomalyType.GEOFENCE_FAILURE, 1, 1);
        when(anomalyRuleRepository.findFirstByCompanyIdAndTypeAndIsEnabledTrueOrderByIdAsc(COMPANY, AnomalyType.GEOFENCE_FAILURE))
                .thenReturn(Optional.of(geofenceRule));
        when(timeService.now()).thenReturn(LocalDateTime.of(2024, 3, 4, 9, 0));

        geofenceService.flagFailure(7L, COMPANY, LAT_500M, OFFICE_LON);

        ArgumentCaptor<AnomalyDraft> draft = ArgumentCaptor.forClass(AnomalyDraft.class);
        verify(anomalyRecorder).record(eq(geofenceRule), draft.capture());
        assertThat(draft.getValue().userId()).isEqualTo(7L);
        assertThat(draft.getValue().data()).isInstanceOf(GeofenceFailureData.class);
        assertThat(((GeofenceFailureData) draft.getValue().data()).getLatitude()).isEqualTo(LAT_500M);
        assertThat(((GeofenceFailureData) draft.getValue().data()).getVerificationStatus()).isEqualTo(VerificationStatus.GEOFENCE_FAILED);
    }

    @Test
    @DisplayName("Validar no consulta reglas ni registra anomalías")
    void validateDoesNotFlag() {
        when(geofencePolicyRepository.findByCompanyId(COMPANY)).thenReturn(Optional.of(policy));
        when(officeLocationRepository.findByCompanyIdAndIsActiveTrue(COMPANY)).thenReturn(List.of(office(100)));

        assertThat(geofenceService.validate(COMPANY, LAT_50M, OFFICE_LON))
                .isEqualTo(VerificationStatus.GEOFENCE_PASSED);
        assertThat(geofenceService.validate(COMPANY, LAT_500M, OFFICE_LON))
                .isEqualTo(VerificationStatus.GEOFENCE_FAILED);
        verifyNoInteractions(anomalyRuleRepository, anomalyRecorder);
    }

    @Test
    @DisplayName("Validar y marcar registra la anomalía solo cuando la entrada falla")
    void validateAndFlagOnlyFlagsFailures() {
        AnomalyRule geofenceRule = rule(9L, AnomalyType.GEOFENCE_FAILURE, 1, 1);
        when(geofencePolicyRepository.findByCompanyId(COMPANY)).thenReturn(Optional.of(policy));
        when(officeLocationRepository.findByCompanyIdAndIsActiveTrue(COMPANY)).thenReturn(List.of(office(100)));
        when(anomalyRuleRepository.findFirstByCompanyIdAndTypeAndIsEnabledTrueOrderByIdAsc(COMPANY, AnomalyType.GEOFENCE_FAILURE))
                .thenReturn(Optional.of(geofenceRule));
        when(timeService.now()).thenReturn(LocalDateTime.of(2024, 3, 4, 9, 0));

        assertThat(geofenceService.validateAndFlag(7L, COMPANY, LAT_50M, OFFICE_LON))
                .isEqualTo(VerificationStatus.GEOFENCE_PASSED);
        verifyNoInteractions(anomalyRecorder);

        assertThat(geofenceService.validateAndFlag(7L, COMPANY, LAT_500M, OFFICE_LON))
                .isEqualTo(VerificationStatus.GEOFENCE_FAILED);
        verify(anomalyRecorder).record(eq(geofenceRule), any(AnomalyDraft.class));
    }

    @Test
    @DisplayName("Sin regla habilitada el fallo no crea anomalía")
    void failureWithoutRule() {
        when(anomalyRuleRepository.findFirstByCompanyIdAndTypeAndIsEnabledTrueOrderByIdAsc(COMPANY, AnomalyType.GEOFENCE_FAILURE))
                .thenReturn(Optional.empty());

        assertThat(geofenceService.flagFailure(7L, COMPANY, LAT_500M, OFFICE_LON)).isEmpty();
        verify(anomalyRecorder, never()).record(any(), any());
    }

    @Test
    void exposesPolicyAndOffices() {
        when(geofencePolicyRepository.findByCompanyId(COMPANY)).thenReturn(Optional.of(policy));
        when(officeLocationRepository.findByCompanyIdAndIsActiveTrue(COMPANY)).thenReturn(List.of(office(100)));

        assertThat(geofenceService.getPolicy(COMPANY)).contains(policy);
        assertThat(geofenceService.getOfficeLocations(COMPANY)).hasSize(1);
    }
}
