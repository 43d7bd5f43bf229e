package sp.sistemaspalacios.api_attendance.service.geofence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyEvent;
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

import java.util.List;
import java.util.Optional;

/**
 * Validación de entradas en oficina contra las geocercas de la empresa.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GeofenceService {

    private final GeofencePolicyRepository geofencePolicyRepository;
    private final OfficeLocationRepository officeLocationRepository;
    private final AnomalyRuleRepository anomalyRuleRepository;
    private final AnomalyRecorder anomalyRecorder;
    private final GeoDistanceCalculator distanceCalculator;
    private final TimeService timeService;

    /**
     * 🔹 Resultado de la verificación para unas coordenadas.
     * Sin política o con la política deshabilitada no se verifica nada.
     */
    public VerificationStatus validate(Long companyId, Double latitude, Double longitude) {
        validateCoordinates(latitude, longitude);

        GeofencePolicy policy = geofencePolicyRepository.findByCompanyId(companyId).orElse(null);
        if (policy == null || !Boolean.TRUE.equals(policy.getIsEnabled())) {
            return VerificationStatus.NONE;
        }

        if (latitude == null) {
            return Boolean.TRUE.equals(policy.getRequireGeofenceForOffice())
                    ? VerificationStatus.GEOFENCE_FAILED
                    : VerificationStatus.NONE;
        }

        List<OfficeLocation> offices = officeLocationRepository.findByCompanyIdAndIsActiveTrue(companyId);
        if (offices.isEmpty()) {
            log.warn("Geocerca habilitada para empresa {} pero sin oficinas activas", companyId);
            return VerificationStatus.NONE;
        }

        for (OfficeLocation office : offices) {
            double distance = distanceCalculator.distanceMeters(
                    latitude, longitude, office.getLatitude(), office.getLongitude());
            if (distance <= office.getRadiusMeters()) {
                log.debug("✅ Dentro de la oficina '{}' ({} m)", office.getName(), Math.round(distance));
                return VerificationStatus.GEOFENCE_PASSED;
            }
        }
        return VerificationStatus.GEOFENCE_FAILED;
    }

    /**
     * 🔹 Igual que {@link #validate}, y si falla registra la anomalía de geocerca.
     * Debe llamarse dentro de la transacción de entrada, después de confirmar que la
     * entrada procede.
     */
    public VerificationStatus validateAndFlag(Long userId, Long companyId, Double latitude, Double longitude) {
        VerificationStatus status = validate(companyId, latitude, longitude);
        if (status == VerificationStatus.GEOFENCE_FAILED) {
            flagFailure(userId, companyId, latitude, longitude);
        }
        return status;
    }

    /**
     * Registra la anomalía de geocerca si la empresa tiene la regla habilitada.
     */
    public Optional<AnomalyEvent> flagFailure(Long userId, Long companyId, Double latitude, Double longitude) {
        log.warn("❌ Entrada fuera de geocerca: usuario {} empresa {} ({}, {})", userId, companyId, latitude, longitude);

        Optional<AnomalyRule> rule = anomalyRuleRepository
                .findFirstByCompanyIdAndTypeAndIsEnabledTrueOrderByIdAsc(companyId, AnomalyType.GEOFENCE_FAILURE);
        if (rule.isEmpty()) {
            return Optional.empty();
        }

        GeofenceFailureData data = new GeofenceFailureData(latitude, longitude, timeService.now(),
                VerificationStatus.GEOFENCE_FAILED);
        AnomalyDraft draft = new AnomalyDraft(userId,
                "Entrada fuera de geocerca",
                "El usuario intentó marcar entrada en oficina desde una ubicación fuera del radio configurado",
                data);
        return anomalyRecorder.record(rule.get(), draft);
    }

    public List<OfficeLocation> getOfficeLocations(Long companyId) {
        return officeLocationRepository.findByCompanyIdAndIsActiveTrue(companyId);
    }

    public Optional<GeofencePolicy> getPolicy(Long companyId) {
        return geofencePolicyRepository.findByCompanyId(companyId);
    }

    /**
     * Ambas coordenadas o ninguna, dentro de rango.
     */
    public static void validateCoordinates(Double latitude, Double longitude) {
        if (latitude == null && longitude == null) {
            return;
        }
        if (latitude == null || longitude == null) {
            throw new ValidationException("Latitud y longitud deben enviarse juntas");
        }
        if (latitude.isNaN() || latitude < -90 || latitude > 90) {
            throw new ValidationException("Latitud fuera de rango: " + latitude);
        }
        if (longitude.isNaN() || longitude < -180 || longitude > 180) {
            throw new ValidationException("Longitud fuera de rango: " + longitude);
        }
    }
}
