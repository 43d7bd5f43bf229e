package sp.sistemaspalacios.api_attendance.service.anomaly;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import sp.sistemaspalacios.api_attendance.dto.PagedResponse;
import sp.sistemaspalacios.api_attendance.dto.anomaly.AnomalyEventDTO;
import sp.sistemaspalacios.api_attendance.dto.anomaly.AnomalySummaryDTO;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyEvent;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalySeverity;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyStatus;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;
import sp.sistemaspalacios.api_attendance.exception.ConflictException;
import sp.sistemaspalacios.api_attendance.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_attendance.exception.ValidationException;
import sp.sistemaspalacios.api_attendance.repository.anomaly.AnomalyEventRepository;
import sp.sistemaspalacios.api_attendance.service.common.TimeService;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static sp.sistemaspalacios.api_attendance.support.AttendanceFixtures.rule;

@ExtendWith(MockitoExtension.class)
@DisplayName("AnomalyEventService")
class AnomalyEventServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 4, 15, 0);

    @Mock
    private AnomalyEventRepository anomalyEventRepository;
    @Mock
    private TimeService timeService;

    @InjectMocks
    private AnomalyEventService service;

    private static AnomalyEvent anomaly(Long id, AnomalyStatus status) {
        AnomalyEvent event = new AnomalyEvent();
        event.setId(id);
        event.setCompanyId(1L);
        event.setUserId(7L);
        event.setRule(rule(3L, AnomalyType.MISSING_CHECK_OUT, 1, 1));
        event.setType(AnomalyType.MISSING_CHECK_OUT);
        event.setSeverity(AnomalySeverity.LOW);
        event.setStatus(status);
        event.setTitle("Salida sin marcar");
        event.setDescription("Sin salida");
        event.setDetectedAt(NOW.minusHours(1));
        return event;
    }

    @Test
    @DisplayName("Reconocer una anomalía abierta guarda quién y cuándo")
    void acknowledgeOpen() {
        when(anomalyEventRepository.findById(5L)).thenReturn(Optional.of(anomaly(5L, AnomalyStatus.OPEN)));
        when(anomalyEventRepository.save(any(AnomalyEvent.class))).thenAnswer(inv -> inv.getArgument(0));
        when(timeService.now()).thenReturn(NOW);

        AnomalyEventDTO dto = service.acknowledge(1L, 5L, "hr-1", "  revisando ");

        assertThat(dto.getStatus()).isEqualTo(AnomalyStatus.ACKNOWLEDGED);
        assertThat(dto.getAcknowledgedBy()).isEqualTo("hr-1");
        assertThat(dto.getAcknowledgedAt()).isEqualTo(NOW);
        assertThat(dto.getResolutionNotes()).isEqualTo("revisando");
    }

    @Test
    void acknowledgeTwiceIsConflict() {
        when(anomalyEventRepository.findById(5L)).thenReturn(Optional.of(anomaly(5L, AnomalyStatus.ACKNOWLEDGED)));

        assertThatThrownBy(() -> service.acknowledge(1L, 5L, "hr-1", null)).isInstanceOf(ConflictException.class);
        verify(anomalyEventRepository, never()).save(any());
    }

    @Test
    @DisplayName("Resolver exige notas")
    void resolveRequiresNotes() {
        assertThatThrownBy(() -> service.resolve(1L, 5L, "hr-1", " ")).isInstanceOf(ValidationException.class);
        verifyNoInteractions(anomalyEventRepository);
    }

    @Test
    void resolveFromAcknowledged() {
        when(anomalyEventRepository.findById(5L)).thenReturn(Optional.of(anomaly(5L, AnomalyStatus.ACKNOWLEDGED)));
        when(anomalyEventRepository.save(any(AnomalyEvent.class))).thenAnswer(inv -> inv.getArgument(0));
        when(timeService.now()).thenReturn(NOW);

        AnomalyEventDTO dto = service.resolve(1L, 5L, "hr-1", "Olvidó marcar");

        assertThat(dto.getStatus()).isEqualTo(AnomalyStatus.RESOLVED);
        assertThat(dto.getResolvedBy()).isEqualTo("hr-1");
        assertThat(dto.getResolutionNotes()).isEqualTo("Olvidó marcar");
    }

    @Test
    @DisplayName("Descartar directamente desde OPEN")
    void dismissFromOpen() {
        when(anomalyEventRepository.findById(5L)).thenReturn(Optional.of(anomaly(5L, AnomalyStatus.OPEN)));
        when(anomalyEventRepository.save(any(AnomalyEvent.class))).thenAnswer(inv -> inv.getArgument(0));
        when(timeService.now()).thenReturn(NOW);

        assertThat(service.dismiss(1L, 5L, "hr-1", "Falso positivo").getStatus()).isEqualTo(AnomalyStatus.DISMISSED);
    }

    @Test
    @DisplayName("Una anomalía cerrada no se puede volver a cerrar")
    void closedIsFinal() {
        when(anomalyEventRepository.findById(5L)).thenReturn(Optional.of(anomaly(5L, AnomalyStatus.RESOLVED)));

        assertThatThrownBy(() -> service.dismiss(1L, 5L, "hr-1", "otra vez")).isInstanceOf(ConflictException.class);
    }

    @Test
    @DisplayName("Anomalías de otra empresa no se encuentran")
    void otherCompany() {
        when(anomalyEventRepository.findById(5L)).thenReturn(Optional.of(anomaly(5L, AnomalyStatus.OPEN)));

        assertThatThrownBy(() -> service.acknowledge(2L, 5L, "hr-1", null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void pagedListing() {
        when(anomalyEventRepository.findAll(any(Specification.class), any(Pageable.class)))
                .thenAnswer(inv -> new PageImpl<>(List.of(anomaly(5L, AnomalyStatus.OPEN)), inv.getArgument(1), 21));

        PagedResponse<AnomalyEventDTO> page = service.findAll(1L, null, AnomalyStatus.OPEN, null, null, 2, 20);

        assertThat(page.getData()).hasSize(1);
        assertThat(page.getMeta().getTotal()).isEqualTo(21);
        assertThat(page.getMeta().getTotalPages()).isEqualTo(2);
        assertThat(page.getMeta().getPage()).isEqualTo(2);
    }

    @Test
    void invalidPage() {
        assertThatThrownBy(() -> service.findAll(1L, null, null, null, null, 0, 20))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void summaryFillsMissingStatusesWithZero() {
        when(anomalyEventRepository.countByCompanyId(1L)).thenReturn(3L);
        when(anomalyEventRepository.countByStatus(1L)).thenReturn(List.<Object[]>of(
                new Object[]{AnomalyStatus.OPEN, 2L}, new Object[]{AnomalyStatus.RESOLVED, 1L}));
        when(anomalyEventRepository.countBySeverity(1L)).thenReturn(List.<Object[]>of(
                new Object[]{AnomalySeverity.LOW, 3L}));
        when(anomalyEventRepository.countByType(1L)).thenReturn(List.<Object[]>of(
                new Object[]{AnomalyType.MISSING_CHECK_OUT, 3L}));

        AnomalySummaryDTO summary = service.getSummary(1L);

        assertThat(summary.getTotal()).isEqualTo(3);
        assertThat(summary.getOpen()).isEqualTo(2);
        assertThat(summary.getAcknowledged()).isZero();
        assertThat(summary.getResolved()).isEqualTo(1);
        assertThat(summary.getBySeverity()).containsEntry(AnomalySeverity.LOW, 3L);
        assertThat(summary.getByType()).containsEntry(AnomalyType.MISSING_CHECK_OUT, 3L);
    }
}
