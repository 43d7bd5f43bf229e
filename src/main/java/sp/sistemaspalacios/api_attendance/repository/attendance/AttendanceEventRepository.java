package sp.sistemaspalacios.api_attendance.repository.attendance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceEvent;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceEventType;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface AttendanceEventRepository extends JpaRepository<AttendanceEvent, Long> {

    List<AttendanceEvent> findByAttendanceDayIdOrderByTimestampAscIdAsc(Long attendanceDayId);

    @Query("SELECT e FROM AttendanceEvent e JOIN FETCH e.attendanceDay WHERE e.id = :id")
    Optional<AttendanceEvent> findWithDayById(@Param("id") Long id);

    @Query("SELECT e FROM AttendanceEvent e JOIN FETCH e.attendanceDay d " +
            "WHERE d.userId = :userId AND d.date BETWEEN :from AND :to " +
            "ORDER BY e.timestamp ASC")
    List<AttendanceEvent> findByUserAndDateRange(@Param("userId") Long userId,
                                                 @Param("from") LocalDate from,
                                                 @Param("to") LocalDate to);

    @Query("SELECT e FROM AttendanceEvent e JOIN FETCH e.attendanceDay d " +
            "WHERE d.userId = :userId AND d.date BETWEEN :from AND :to AND e.type = :type " +
            "ORDER BY e.timestamp ASC")
    List<AttendanceEvent> findByUserAndDateRangeAndType(@Param("userId") Long userId,
                                                        @Param("from") LocalDate from,
                                                        @Param("to") LocalDate to,
                                                        @Param("type") AttendanceEventType type);

    @Query("SELECT e FROM AttendanceEvent e JOIN FETCH e.attendanceDay d " +
            "WHERE d.companyId = :companyId AND e.type = :type " +
            "AND e.timestamp >= :from AND e.timestamp < :to " +
            "AND e.latitude IS NOT NULL AND e.longitude IS NOT NULL " +
            "ORDER BY e.timestamp DESC")
    List<AttendanceEvent> findLocatedEvents(@Param("companyId") Long companyId,
                                            @Param("type") AttendanceEventType type,
                                            @Param("from") LocalDateTime from,
                                            @Param("to") LocalDateTime to);
}
