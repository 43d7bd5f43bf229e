package sp.sistemaspalacios.api_attendance.service.common;

import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Reloj y utilidades de tiempo. Toda fecha de "hoy" y todo instante de marcación
 * salen de aquí, así que las pruebas pueden mover el reloj.
 */
@Service
public class TimeService {

    private static final DateTimeFormatter HH_MM_SS = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Clock clock;

    public TimeService(Clock clock) {
        this.clock = clock;
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /** Minutos entre dos instantes, redondeados al minuto más cercano. */
    public static int minutesBetween(LocalDateTime start, LocalDateTime end) {
        long millis = Duration.between(start, end).toMillis();
        return (int) Math.round(millis / 60000.0);
    }

    /** Convierte LocalTime a minutos desde 00:00. */
    public int toMinutes(LocalTime t) {
        return t.getHour() * 60 + t.getMinute();
    }

    public LocalDateTime startOfDay(LocalDate date) {
        return date.atStartOfDay();
    }

    /** Inicio del día siguiente; límite superior exclusivo de la ventana del día. */
    public LocalDateTime endOfDay(LocalDate date) {
        return date.plusDays(1).atStartOfDay();
    }

    /**
     * Promedio de la hora del día (al minuto) de los instantes dados, como "HH:mm:00".
     * Null si no hay instantes.
     */
    public String averageTimeOfDay(Collection<LocalDateTime> instants) {
        List<LocalDateTime> present = instants.stream().filter(Objects::nonNull).toList();
        if (present.isEmpty()) return null;

        long totalMinutes = present.stream()
                .mapToLong(i -> toMinutes(i.toLocalTime()))
                .sum();
        int average = (int) Math.round((double) totalMinutes / present.size());
        return LocalTime.of(average / 60, average % 60).format(HH_MM_SS);
    }
}
