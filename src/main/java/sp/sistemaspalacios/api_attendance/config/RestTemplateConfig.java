package sp.sistemaspalacios.api_attendance.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class RestTemplateConfig {

    // El módulo de timesheets vive en otro servicio; no bloquear el barrido diario
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, AttendanceProperties properties) {
        return builder
                .setConnectTimeout(Duration.ofMillis(properties.getTimesheet().getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(properties.getTimesheet().getReadTimeoutMs()))
                .build();
    }
}
