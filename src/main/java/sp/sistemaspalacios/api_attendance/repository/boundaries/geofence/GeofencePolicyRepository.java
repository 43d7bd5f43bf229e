package sp.sistemaspalacios.api_attendance.repository.boundaries.geofence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_attendance.entity.boundaries.geofence.GeofencePolicy;

import java.util.Optional;

@Repository
public interface GeofencePolicyRepository extends JpaRepository<GeofencePolicy, Long> {

    Optional<GeofencePolicy> findByCompanyId(Long companyId);
}
