package sp.sistemaspalacios.api_attendance.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TimeConfig {

    /**
     * Reloj de la aplicación en la zona configurada. Todas las marcaciones y el
     * día calendario se derivan de aquí.
     */
    @Bean
    public Clock clock(AttendanceProperties properties) {
        return Clock.system(properties.zoneId());
    }
}
