package sp.sistemaspalacios.api_attendance.service.timesheet;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;
import sp.sistemaspalacios.api_attendance.config.AttendanceProperties;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TimesheetClientTest {

    private static final String URL = "http://timesheets.local/api/timesheets/minutes?userId=7&date=2024-03-04";

    private MockRestServiceServer server;
    private TimesheetClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        AttendanceProperties properties = new AttendanceProperties();
        properties.getTimesheet().setBaseUrl("http://timesheets.local");
        client = new TimesheetClient(restTemplate, properties);
    }

    @Test
    void readsLoggedMinutes() {
        server.expect(requestTo(URL)).andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"userId\":7,\"date\":\"2024-03-04\",\"minutes\":300}", MediaType.APPLICATION_JSON));

        assertThat(client.getLoggedMinutes(7L, LocalDate.of(2024, 3, 4))).isEqualTo(300);
        server.verify();
    }

    @Test
    void missingMinutesCountAsZero() {
        server.expect(requestTo(URL)).andRespond(withSuccess("{\"userId\":7}", MediaType.APPLICATION_JSON));

        assertThat(client.getLoggedMinutes(7L, LocalDate.of(2024, 3, 4))).isZero();
    }

    @Test
    void serverErrorsPropagate() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThatThrownBy(() -> client.getLoggedMinutes(7L, LocalDate.of(2024, 3, 4)))
                .isInstanceOf(HttpServerErrorException.class);
    }
}
