package sp.sistemaspalacios.api_attendance.repository.attendance;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceDay;
import sp.sistemaspalacios.api_attendance.entity.attendance.AttendanceEventType;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface AttendanceDayRepository extends JpaRepository<AttendanceDay, Long> {

    Optional<AttendanceDay> findByUserIdAndDate(Long userId, LocalDate date);

    /**
     * Lectura de la jornada dentro de la transacción de entrada: bloquea la fila y
     * fuerza el incremento de versión, de modo que dos entradas simultáneas no
     * puedan confirmar ambas.
     */
    @Lock(LockModeType.PESSIMISTIC_FORCE_INCREMENT)
    @Query("SELECT d FROM AttendanceDay d WHERE d.userId = :userId AND d.date = :date")
    Optional<AttendanceDay> findForCheckIn(@Param("userId") Long userId, @Param("date") LocalDate date);

    /**
     * Jornada bloqueada para escritura. Descansos y salida la usan para que dos
     * transiciones simultáneas del mismo usuario se apliquen una detrás de otra.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM AttendanceDay d WHERE d.userId = :userId AND d.date = :date")
    Optional<AttendanceDay> findLockedByUserIdAndDate(@Param("userId") Long userId, @Param("date") LocalDate date);

    Page<AttendanceDay> findByUserIdAndDateBetween(Long userId, LocalDate from, LocalDate to, Pageable pageable);

    List<AttendanceDay> findByUserIdAndDateBetweenOrderByDateAsc(Long userId, LocalDate from, LocalDate to);

    @Query("SELECT DISTINCT d.userId FROM AttendanceDay d " +
            "WHERE d.companyId = :companyId AND d.date BETWEEN :from AND :to")
    List<Long> findUserIdsWithAttendance(@Param("companyId") Long companyId,
                                         @Param("from") LocalDate from,
                                         @Param("to") LocalDate to);

    /**
     * Jornadas del día sin cerrar que tienen al menos una entrada.
     */
    @Query("SELECT d FROM AttendanceDay d " +
            "WHERE d.companyId = :companyId AND d.date = :date AND d.isComplete = false " +
            "AND EXISTS (SELECT e.id FROM AttendanceEvent e WHERE e.attendanceDay = d AND e.type = :type)")
    List<AttendanceDay> findIncompleteWithEventType(@Param("companyId") Long companyId,
                                                    @Param("date") LocalDate date,
                                                    @Param("type") AttendanceEventType type);

    List<AttendanceDay> findByCompanyIdAndDateAndTotalWorkMinutesGreaterThan(Long companyId, LocalDate date, Integer minutes);
}
