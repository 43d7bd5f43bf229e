package sp.sistemaspalacios.api_attendance.repository.boundaries.workPolicy;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_attendance.entity.boundaries.workPolicy.WorkPolicy;

import java.util.Optional;

@Repository
public interface WorkPolicyRepository extends JpaRepository<WorkPolicy, Long> {

    Optional<WorkPolicy> findByCompanyId(Long companyId);
}
