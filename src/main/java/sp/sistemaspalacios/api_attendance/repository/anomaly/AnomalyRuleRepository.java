package sp.sistemaspalacios.api_attendance.repository.anomaly;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyRule;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;

import java.util.List;
import java.util.Optional;

@Repository
public interface AnomalyRuleRepository extends JpaRepository<AnomalyRule, Long> {

    List<AnomalyRule> findByCompanyIdOrderByIdAsc(Long companyId);

    List<AnomalyRule> findByCompanyIdAndIsEnabledTrueOrderByIdAsc(Long companyId);

    Optional<AnomalyRule> findFirstByCompanyIdAndTypeAndIsEnabledTrueOrderByIdAsc(Long companyId, AnomalyType type);

    Optional<AnomalyRule> findFirstByCompanyIdAndTypeOrderByIdAsc(Long companyId, AnomalyType type);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM AnomalyRule r WHERE r.id = :id")
    Optional<AnomalyRule> findLockedById(@Param("id") Long id);

    @Query("SELECT DISTINCT r.companyId FROM AnomalyRule r WHERE r.isEnabled = true ORDER BY r.companyId")
    List<Long> findCompanyIdsWithEnabledRules();
}
