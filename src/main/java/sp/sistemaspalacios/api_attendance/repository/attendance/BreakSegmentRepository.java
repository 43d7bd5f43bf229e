package sp.sistemaspalacios.api_attendance.repository.attendance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_attendance.entity.attendance.BreakSegment;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface BreakSegmentRepository extends JpaRepository<BreakSegment, Long> {

    List<BreakSegment> findByAttendanceDayIdOrderByStartTimeAsc(Long attendanceDayId);

    @Query("SELECT b FROM BreakSegment b JOIN FETCH b.attendanceDay WHERE b.id = :id")
    Optional<BreakSegment> findWithDayById(@Param("id") Long id);

    /**
     * Descansos cerrados del día cuya duración supera el mínimo indicado.
     */
    @Query("SELECT b FROM BreakSegment b JOIN FETCH b.attendanceDay d " +
            "WHERE d.companyId = :companyId AND d.date = :date " +
            "AND b.endTime IS NOT NULL AND b.durationMinutes > :minMinutes " +
            "ORDER BY b.durationMinutes DESC")
    List<BreakSegment> findClosedLongerThan(@Param("companyId") Long companyId,
                                            @Param("date") LocalDate date,
                                            @Param("minMinutes") int minMinutes);

    /**
     * Descansos que siguen abiertos en jornadas anteriores a la fecha dada.
     */
    @Query("SELECT b FROM BreakSegment b JOIN FETCH b.attendanceDay d " +
            "WHERE b.endTime IS NULL AND d.date < :date ORDER BY b.startTime ASC")
    List<BreakSegment> findOpenBefore(@Param("date") LocalDate date);
}
