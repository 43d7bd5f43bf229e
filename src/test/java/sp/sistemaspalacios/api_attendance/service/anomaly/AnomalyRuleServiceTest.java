package sp.sistemaspalacios.api_attendance.service.anomaly;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyRule;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalySeverity;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;
import sp.sistemaspalacios.api_attendance.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_attendance.exception.ValidationException;
import sp.sistemaspalacios.api_attendance.repository.anomaly.AnomalyRuleRepository;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static sp.sistemaspalacios.api_attendance.support.AttendanceFixtures.rule;

@ExtendWith(MockitoExtension.class)
@DisplayName("AnomalyRuleService")
class AnomalyRuleServiceTest {

    @Mock
    private AnomalyRuleRepository repository;

    @InjectMocks
    private AnomalyRuleService service;

    @Test
    @DisplayName("Inicializar crea solo los tipos que faltan")
    void initializeCreatesMissingOnly() {
        when(repository.findFirstByCompanyIdAndTypeOrderByIdAsc(eq(1L), any())).thenReturn(Optional.empty());
        when(repository.findFirstByCompanyIdAndTypeOrderByIdAsc(1L, AnomalyType.GEOFENCE_FAILURE))
                .thenReturn(Optional.of(rule(9L, AnomalyType.GEOFENCE_FAILURE, 1, 1)));
        when(repository.findByCompanyIdOrderByIdAsc(1L)).thenReturn(List.of());

        service.initializeDefaultRules(1L);

        ArgumentCaptor<AnomalyRule> saved = ArgumentCaptor.forClass(AnomalyRule.class);
        verify(repository, times(4)).save(saved.capture());
        assertThat(saved.getAllValues()).extracting(AnomalyRule::getType).containsExactly(
                AnomalyType.REPEATED_LATE_CHECK_IN, AnomalyType.MISSING_CHECK_OUT,
                AnomalyType.EXCESSIVE_BREAK, AnomalyType.TIMESHEET_MISMATCH);
        AnomalyRule late = saved.getAllValues().get(0);
        assertThat(late.getThreshold()).isEqualTo(3);
        assertThat(late.getWindowDays()).isEqualTo(7);
        assertThat(late.getSeverity()).isEqualTo(AnomalySeverity.MEDIUM);
        assertThat(saved.getAllValues().get(2).getThreshold()).isEqualTo(150);
    }

    @Test
    void createAssignsCompanyAndValidates() {
        when(repository.save(any(AnomalyRule.class))).thenAnswer(inv -> inv.getArgument(0));
        AnomalyRule incoming = rule(99L, AnomalyType.EXCESSIVE_BREAK, 200, 1);
        incoming.setCompanyId(null);
        incoming.setIsEnabled(null);

        AnomalyRule created = service.create(4L, incoming);

        assertThat(created.getId()).isNull();
        assertThat(created.getCompanyId()).isEqualTo(4L);
        assertThat(created.getIsEnabled()).isTrue();
    }

    @Test
    void createRejectsInvalidWindow() {
        AnomalyRule incoming = rule(null, AnomalyType.REPEATED_LATE_CHECK_IN, 3, 0);

        assertThatThrownBy(() -> service.create(1L, incoming)).isInstanceOf(ValidationException.class);
        verify(repository, never()).save(any());
    }

    @Test
    @DisplayName("Reglas de otra empresa no se encuentran")
    void otherCompanyRule() {
        when(repository.findById(5L)).thenReturn(Optional.of(rule(5L, AnomalyType.MISSING_CHECK_OUT, 1, 1)));

        assertThatThrownBy(() -> service.toggleEnabled(2L, 5L, false)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void toggle() {
        when(repository.findById(5L)).thenReturn(Optional.of(rule(5L, AnomalyType.MISSING_CHECK_OUT, 1, 1)));
        when(repository.save(any(AnomalyRule.class))).thenAnswer(inv -> inv.getArgument(0));

        assertThat(service.toggleEnabled(1L, 5L, false).getIsEnabled()).isFalse();
    }
}
