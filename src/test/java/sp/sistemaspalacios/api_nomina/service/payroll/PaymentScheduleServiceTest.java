package sp.sistemaspalacios.api_nomina.service.payroll;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import sp.sistemaspalacios.api_nomina.entity.orgStructure.OrgUnit;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentSchedule;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentScheduleInstance;
import sp.sistemaspalacios.api_nomina.entity.workObject.WorkObject;
import sp.sistemaspalacios.api_nomina.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_nomina.repository.paymentSchedule.PaymentScheduleRepository;
import sp.sistemaspalacios.api_nomina.repository.workObject.WorkObjectRepository;
import sp.sistemaspalacios.api_nomina.service.settings.SettingsResolver;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static sp.sistemaspalacios.api_nomina.TestFixtures.OWNER_ID;
import static sp.sistemaspalacios.api_nomina.TestFixtures.monthly;
import static sp.sistemaspalacios.api_nomina.TestFixtures.object;
import static sp.sistemaspalacios.api_nomina.TestFixtures.unit;
import static sp.sistemaspalacios.api_nomina.TestFixtures.weekly;

@ExtendWith(MockitoExtension.class)
class PaymentScheduleServiceTest {

    @Mock
    private PaymentScheduleRepository scheduleRepository;
    @Mock
    private WorkObjectRepository workObjectRepository;

    private PaymentScheduleService service;

    @BeforeEach
    void setUp() {
        service = new PaymentScheduleService(scheduleRepository, workObjectRepository,
                new PeriodCalculator(), new SettingsResolver(64));
    }

    @Test
    void childScheduleTakesObjectsAwayFromParentSchedule() {
        PaymentSchedule parentSchedule = weekly(1L, 2, -22, -16);
        PaymentSchedule childSchedule = weekly(2L, 2, -15, -9);
        OrgUnit parent = unit(1L, "Red", null);
        parent.setPaymentSchedule(parentSchedule);
        OrgUnit child = unit(2L, "Tienda norte", parent);
        child.setPaymentSchedule(childSchedule);
        WorkObject underParent = object(10L, parent, "300.00");
        WorkObject underChild = object(11L, child, "300.00");
        WorkObject withoutSchedule = object(12L, unit(3L, "Suelta", null), "300.00");
        when(workObjectRepository.findByOwnerIdAndIsActiveTrueOrderByIdAsc(OWNER_ID))
                .thenReturn(List.of(underParent, underChild, withoutSchedule));

        assertThat(service.governedObjectIds(parentSchedule)).containsExactly(10L);
        assertThat(service.governedObjectIds(childSchedule)).containsExactly(11L);
    }

    @Test
    void advancingInstanceMovesItOneMonthOnlyOnce() {
        PaymentSchedule schedule = monthly(5L);
        PaymentScheduleInstance instance = new PaymentScheduleInstance(LocalDate.of(2025, 11, 25), -40, -10);
        instance.setId(50L);
        schedule.addPayment(instance);
        when(scheduleRepository.findById(5L)).thenReturn(Optional.of(schedule));

        service.advanceInstance(5L, 50L, LocalDate.of(2025, 11, 25));
        service.advanceInstance(5L, 50L, LocalDate.of(2025, 11, 25));

        assertThat(instance.getNextPaymentDate()).isEqualTo(LocalDate.of(2025, 12, 25));
        assertThat(instance.getLastPaymentDate()).isEqualTo(LocalDate.of(2025, 11, 25));
        verify(scheduleRepository, times(2)).save(schedule);
    }

    @Test
    void unknownInstanceIsReported() {
        PaymentSchedule schedule = monthly(5L);
        when(scheduleRepository.findById(5L)).thenReturn(Optional.of(schedule));

        assertThatThrownBy(() -> service.advanceInstance(5L, 99L, LocalDate.of(2025, 11, 25)))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void previewReturnsPeriodOfStoredSchedule() {
        when(scheduleRepository.findById(1L)).thenReturn(Optional.of(weekly(1L, 2, -22, -16)));

        assertThat(service.previewPeriod(1L, LocalDate.of(2025, 11, 18)))
                .hasValueSatisfying(p -> assertThat(p.getPeriodStart()).isEqualTo(LocalDate.of(2025, 10, 27)));
    }
}
