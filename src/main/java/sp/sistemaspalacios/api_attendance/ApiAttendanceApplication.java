package sp.sistemaspalacios.api_attendance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class ApiAttendanceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiAttendanceApplication.class, args);
    }
}
