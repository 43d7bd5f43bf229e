package sp.sistemaspalacios.api_attendance.service.timesheet;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;
import sp.sistemaspalacios.api_attendance.config.AttendanceProperties;
import sp.sistemaspalacios.api_attendance.dto.timesheet.TimesheetMinutesResponse;

import java.time.LocalDate;
import java.util.List;

/**
 * Cliente del módulo de timesheets. Los errores de red o HTTP se propagan: un total
 * desconocido no debe compararse como si fuera cero.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TimesheetClient {

    private final RestTemplate restTemplate;
    private final AttendanceProperties properties;

    /**
     * 🔹 Minutos reportados en timesheets por el usuario en el día.
     */
    public int getLoggedMinutes(Long userId, LocalDate date) {
        String url = UriComponentsBuilder
                .fromHttpUrl(properties.getTimesheet().getBaseUrl() + properties.getTimesheet().getEndpoint())
                .queryParam("userId", userId)
                .queryParam("date", date)
                .toUriString();

        log.debug("📤 Consultando timesheet: {}", url);

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<TimesheetMinutesResponse> response = restTemplate.exchange(
                url,
                HttpMethod.GET,
                new HttpEntity<>(headers),
                TimesheetMinutesResponse.class
        );

        TimesheetMinutesResponse body = response.getBody();
        if (body == null || body.getMinutes() == null) {
            return 0;
        }
        return body.getMinutes();
    }
}
