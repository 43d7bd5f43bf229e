package sp.sistemaspalacios.api_attendance.service.boundaries.geofence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_attendance.dto.boundaries.GeofencePolicyDTO;
import sp.sistemaspalacios.api_attendance.entity.boundaries.geofence.GeofencePolicy;
import sp.sistemaspalacios.api_attendance.repository.boundaries.geofence.GeofencePolicyRepository;

@Slf4j
@Service
@RequiredArgsConstructor
public class GeofencePolicyService {

    private final GeofencePolicyRepository geofencePolicyRepository;

    /**
     * 🔹 Política de geocerca de la empresa. Sin registro equivale a deshabilitada.
     */
    public GeofencePolicy getPolicy(Long companyId) {
        return geofencePolicyRepository.findByCompanyId(companyId).orElseGet(() -> {
            GeofencePolicy disabled = new GeofencePolicy();
            disabled.setCompanyId(companyId);
            return disabled;
        });
    }

    @Transactional
    public GeofencePolicy saveOrUpdate(Long companyId, GeofencePolicyDTO dto) {
        GeofencePolicy policy = geofencePolicyRepository.findByCompanyId(companyId).orElseGet(() -> {
            GeofencePolicy created = new GeofencePolicy();
            created.setCompanyId(companyId);
            return created;
        });

        if (dto.getIsEnabled() != null) policy.setIsEnabled(dto.getIsEnabled());
        if (dto.getRequireGeofenceForOffice() != null) policy.setRequireGeofenceForOffice(dto.getRequireGeofenceForOffice());

        GeofencePolicy saved = geofencePolicyRepository.save(policy);
        log.info("✅ Geocerca {} para empresa {}", saved.getIsEnabled() ? "habilitada" : "deshabilitada", companyId);
        return saved;
    }
}
