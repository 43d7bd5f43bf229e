package sp.sistemaspalacios.api_attendance.repository.anomaly;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyEvent;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyStatus;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface AnomalyEventRepository extends JpaRepository<AnomalyEvent, Long>,
        JpaSpecificationExecutor<AnomalyEvent> {

    boolean existsByUserIdAndTypeAndStatus(Long userId, AnomalyType type, AnomalyStatus status);

    boolean existsByUserIdAndTypeAndStatusAndDetectedAtGreaterThanEqualAndDetectedAtLessThan(
            Long userId, AnomalyType type, AnomalyStatus status, LocalDateTime from, LocalDateTime to);

    List<AnomalyEvent> findByUserIdAndTypeOrderByDetectedAtDesc(Long userId, AnomalyType type);

    long countByCompanyId(Long companyId);

    @Query("SELECT a.status, COUNT(a) FROM AnomalyEvent a WHERE a.companyId = :companyId GROUP BY a.status")
    List<Object[]> countByStatus(@Param("companyId") Long companyId);

    @Query("SELECT a.severity, COUNT(a) FROM AnomalyEvent a WHERE a.companyId = :companyId GROUP BY a.severity")
    List<Object[]> countBySeverity(@Param("companyId") Long companyId);

    @Query("SELECT a.type, COUNT(a) FROM AnomalyEvent a WHERE a.companyId = :companyId GROUP BY a.type")
    List<Object[]> countByType(@Param("companyId") Long companyId);
}
