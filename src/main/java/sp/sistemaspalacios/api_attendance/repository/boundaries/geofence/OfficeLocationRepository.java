package sp.sistemaspalacios.api_attendance.repository.boundaries.geofence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_attendance.entity.boundaries.geofence.OfficeLocation;

import java.util.List;

@Repository
public interface OfficeLocationRepository extends JpaRepository<OfficeLocation, Long> {

    List<OfficeLocation> findByCompanyIdAndIsActiveTrue(Long companyId);

    List<OfficeLocation> findByCompanyIdOrderByNameAsc(Long companyId);
}
