package sp.sistemaspalacios.api_attendance.service.boundaries.geofence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_attendance.dto.boundaries.OfficeLocationDTO;
import sp.sistemaspalacios.api_attendance.entity.boundaries.geofence.OfficeLocation;
import sp.sistemaspalacios.api_attendance.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_attendance.exception.ValidationException;
import sp.sistemaspalacios.api_attendance.repository.boundaries.geofence.OfficeLocationRepository;
import sp.sistemaspalacios.api_attendance.service.geofence.GeofenceService;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class OfficeLocationService {

    private final OfficeLocationRepository officeLocationRepository;

    public List<OfficeLocation> findAll(Long companyId) {
        return officeLocationRepository.findByCompanyIdOrderByNameAsc(companyId);
    }

    public OfficeLocation findById(Long companyId, Long id) {
        return officeLocationRepository.findById(id)
                .filter(location -> location.getCompanyId().equals(companyId))
                .orElseThrow(() -> new ResourceNotFoundException("Oficina con ID " + id + " no encontrada"));
    }

    @Transactional
    public OfficeLocation create(Long companyId, OfficeLocationDTO dto) {
        if (dto.getName() == null || dto.getName().isBlank()) {
            throw new ValidationException("El nombre de la oficina es obligatorio");
        }
        if (dto.getLatitude() == null || dto.getLongitude() == null) {
            throw new ValidationException("Las coordenadas de la oficina son obligatorias");
        }
        if (dto.getRadiusMeters() == null) {
            throw new ValidationException("El radio de la oficina es obligatorio");
        }

        OfficeLocation location = new OfficeLocation();
        location.setCompanyId(companyId);
        apply(location, dto);

        OfficeLocation saved = officeLocationRepository.save(location);
        log.info("➕ Oficina '{}' creada para empresa {}", saved.getName(), companyId);
        return saved;
    }

    @Transactional
    public OfficeLocation update(Long companyId, Long id, OfficeLocationDTO dto) {
        OfficeLocation location = findById(companyId, id);
        apply(location, dto);
        return officeLocationRepository.save(location);
    }

    /**
     * 🔹 Baja lógica: la oficina deja de usarse para validar geocercas.
     */
    @Transactional
    public OfficeLocation deactivate(Long companyId, Long id) {
        OfficeLocation location = findById(companyId, id);
        location.setIsActive(false);
        log.info("Oficina '{}' desactivada", location.getName());
        return officeLocationRepository.save(location);
    }

    private void apply(OfficeLocation location, OfficeLocationDTO dto) {
        if (dto.getName() != null) location.setName(dto.getName().trim());
        if (dto.getAddress() != null) location.setAddress(dto.getAddress());
        if (dto.getLatitude() != null || dto.getLongitude() != null) {
            GeofenceService.validateCoordinates(dto.getLatitude(), dto.getLongitude());
            location.setLatitude(dto.getLatitude());
            location.setLongitude(dto.getLongitude());
        }
        if (dto.getRadiusMeters() != null) {
            if (dto.getRadiusMeters() <= 0) {
                throw new ValidationException("El radio debe ser mayor que cero");
            }
            location.setRadiusMeters(dto.getRadiusMeters());
        }
        if (dto.getIsActive() != null) location.setIsActive(dto.getIsActive());
    }
}
