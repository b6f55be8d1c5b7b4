package sp.sistemaspalacios.api_nomina.service.payroll;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import sp.sistemaspalacios.api_nomina.dto.payroll.EntryOutcome;
import sp.sistemaspalacios.api_nomina.dto.payroll.PaymentPeriod;
import sp.sistemaspalacios.api_nomina.entity.contract.Contract;
import sp.sistemaspalacios.api_nomina.entity.contract.ContractStatus;
import sp.sistemaspalacios.api_nomina.entity.contract.ManagerPermission;
import sp.sistemaspalacios.api_nomina.entity.payroll.AdjustmentKind;
import sp.sistemaspalacios.api_nomina.entity.payroll.PayrollAdjustment;
import sp.sistemaspalacios.api_nomina.entity.payroll.PayrollEntry;
import sp.sistemaspalacios.api_nomina.entity.payroll.PayrollEntryStatus;
import sp.sistemaspalacios.api_nomina.event.PayrollEntryCreatedEvent;
import sp.sistemaspalacios.api_nomina.exception.ConflictException;
import sp.sistemaspalacios.api_nomina.exception.ContractInactiveException;
import sp.sistemaspalacios.api_nomina.exception.PermissionDeniedException;
import sp.sistemaspalacios.api_nomina.repository.contract.ContractRepository;
import sp.sistemaspalacios.api_nomina.repository.payroll.PayrollAdjustmentRepository;
import sp.sistemaspalacios.api_nomina.repository.payroll.PayrollEntryRepository;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static sp.sistemaspalacios.api_nomina.TestFixtures.OWNER_ID;
import static sp.sistemaspalacios.api_nomina.TestFixtures.activeContract;

@ExtendWith(MockitoExtension.class)
class PayrollEntryServiceTest {

    private static final PaymentPeriod PERIOD = PaymentPeriod.of(LocalDate.of(2025, 10, 27), LocalDate.of(2025, 11, 2));

    @Mock
    private PayrollEntryRepository entryRepository;
    @Mock
    private PayrollAdjustmentRepository adjustmentRepository;
    @Mock
    private ContractRepository contractRepository;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private PayrollEntryService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-11-18T09:00:00Z"), ZoneOffset.UTC);
        service = new PayrollEntryService(entryRepository, adjustmentRepository, contractRepository, eventPublisher, clock);
    }

    // ==========================================
    // GENERACIÓN
    // ==========================================

    @Test
    void newEntryAggregatesAdjustmentsBySign() {
        PayrollAdjustment base = adjustment(1L, AdjustmentKind.BASE_PAY, "2400.00");
        PayrollAdjustment bonus = adjustment(2L, AdjustmentKind.TASK_BONUS, "40.00");
        PayrollAdjustment penalty = adjustment(3L, AdjustmentKind.TASK_PENALTY, "-50.00");
        PayrollAdjustment late = adjustment(4L, AdjustmentKind.LATE_PENALTY, "-120.00");
        when(entryRepository.findByEmployeeIdAndPeriodStartAndPeriodEnd(100L, PERIOD.getPeriodStart(), PERIOD.getPeriodEnd()))
                .thenReturn(Optional.empty());
        when(adjustmentRepository.findByEmployeeIdAndShiftIdInOrderByIdAsc(100L, List.of(7L)))
                .thenReturn(List.of(base, bonus, penalty, late));
        when(entryRepository.save(any(PayrollEntry.class))).thenAnswer(inv -> {
            PayrollEntry entry = inv.getArgument(0);
            entry.setId(900L);
            return entry;
        });

        EntryOutcome outcome = service.upsertEntry(100L, OWNER_ID, 1L, PERIOD, List.of(7L));

        ArgumentCaptor<PayrollEntry> saved = ArgumentCaptor.forClass(PayrollEntry.class);
        verify(entryRepository).save(saved.capture());
        PayrollEntry entry = saved.getValue();
        assertThat(outcome).isEqualTo(EntryOutcome.CREATED);
        assertThat(entry.getGrossAmount()).isEqualByComparingTo("2400.00");
        assertThat(entry.getTotalBonuses()).isEqualByComparingTo("40.00");
        assertThat(entry.getTotalDeductions()).isEqualByComparingTo("170.00");
        assertThat(entry.getNetAmount()).isEqualByComparingTo("2270.00");
        assertThat(entry.getShiftsCount()).isEqualTo(1);
        assertThat(entry.getStatus()).isEqualTo(PayrollEntryStatus.DRAFT);
        assertThat(base.getPayrollEntry()).isSameAs(entry);
        assertThat(late.getPayrollEntry()).isSameAs(entry);
        verify(eventPublisher).publishEvent(any(PayrollEntryCreatedEvent.class));
    }

    @Test
    void approvedEntryIsNotRecalculated() {
        PayrollEntry approved = entry(900L, PayrollEntryStatus.APPROVED);
        when(entryRepository.findByEmployeeIdAndPeriodStartAndPeriodEnd(100L, PERIOD.getPeriodStart(), PERIOD.getPeriodEnd()))
                .thenReturn(Optional.of(approved));

        EntryOutcome outcome = service.upsertEntry(100L, OWNER_ID, 1L, PERIOD, List.of(7L));

        assertThat(outcome).isEqualTo(EntryOutcome.FROZEN);
        verify(entryRepository, never()).save(any());
        verify(adjustmentRepository, never()).findByEmployeeIdAndShiftIdInOrderByIdAsc(anyLong(), anyCollection());
    }

    @Test
    void draftEntryIsUpdatedAndStaleLinksAreDropped() {
        PayrollEntry draft = entry(900L, PayrollEntryStatus.DRAFT);
        PayrollAdjustment base = adjustment(1L, AdjustmentKind.BASE_PAY, "2400.00");
        PayrollAdjustment stale = adjustment(9L, AdjustmentKind.MANUAL, "-10.00");
        stale.setPayrollEntry(draft);
        PayrollAdjustment paidElsewhere = adjustment(5L, AdjustmentKind.TASK_BONUS, "40.00");
        paidElsewhere.setPayrollEntry(entry(800L, PayrollEntryStatus.PAID));
        when(entryRepository.findByEmployeeIdAndPeriodStartAndPeriodEnd(100L, PERIOD.getPeriodStart(), PERIOD.getPeriodEnd()))
                .thenReturn(Optional.of(draft));
        when(adjustmentRepository.findByEmployeeIdAndShiftIdInOrderByIdAsc(100L, List.of(7L)))
                .thenReturn(List.of(base, paidElsewhere));
        when(entryRepository.save(draft)).thenReturn(draft);
        when(adjustmentRepository.findByPayrollEntryIdOrderByIdAsc(900L)).thenReturn(List.of(stale));

        EntryOutcome outcome = service.upsertEntry(100L, OWNER_ID, 1L, PERIOD, List.of(7L));

        assertThat(outcome).isEqualTo(EntryOutcome.UPDATED);
        assertThat(draft.getNetAmount()).isEqualByComparingTo("2400.00");
        assertThat(stale.getPayrollEntry()).isNull();
        assertThat(paidElsewhere.getPayrollEntry().getId()).isEqualTo(800L);
    }

    @Test
    void shiftlessAdjustmentsOfPeriodAreIncluded() {
        PayrollAdjustment base = adjustment(1L, AdjustmentKind.BASE_PAY, "800.00");
        PayrollAdjustment manual = adjustment(2L, AdjustmentKind.MANUAL, "500.00");
        when(entryRepository.findByEmployeeIdAndPeriodStartAndPeriodEnd(100L, PERIOD.getPeriodStart(), PERIOD.getPeriodEnd()))
                .thenReturn(Optional.empty());
        when(adjustmentRepository.findByEmployeeIdAndShiftIdInOrderByIdAsc(100L, List.of(7L))).thenReturn(List.of(base));
        when(adjustmentRepository.findShiftlessForPeriod(100L,
                LocalDateTime.of(2025, 10, 27, 0, 0), LocalDateTime.of(2025, 11, 3, 0, 0),
                PERIOD.getPeriodStart(), PERIOD.getPeriodEnd())).thenReturn(List.of(manual));
        when(entryRepository.save(any(PayrollEntry.class))).thenAnswer(inv -> inv.getArgument(0));

        service.upsertEntry(100L, OWNER_ID, 1L, PERIOD, List.of(7L));

        assertThat(manual.getPayrollEntry()).isNotNull();
        assertThat(manual.getPayrollEntry().getTotalBonuses()).isEqualByComparingTo("500.00");
        assertThat(manual.getPayrollEntry().getNetAmount()).isEqualByComparingTo("1300.00");
    }

    @Test
    void entryWithoutShiftsSkipsShiftQuery() {
        when(entryRepository.findByEmployeeIdAndPeriodStartAndPeriodEnd(100L, PERIOD.getPeriodStart(), PERIOD.getPeriodEnd()))
                .thenReturn(Optional.empty());
        when(entryRepository.save(any(PayrollEntry.class))).thenAnswer(inv -> inv.getArgument(0));

        service.upsertEntry(100L, OWNER_ID, 1L, PERIOD, List.of());

        verify(adjustmentRepository, never()).findByEmployeeIdAndShiftIdInOrderByIdAsc(anyLong(), anyCollection());
    }

    @Test
    void recalculationKeepsCreatingSchedule() {
        PayrollEntry draft = entry(900L, PayrollEntryStatus.DRAFT);
        when(entryRepository.findByEmployeeIdAndPeriodStartAndPeriodEnd(100L, PERIOD.getPeriodStart(), PERIOD.getPeriodEnd()))
                .thenReturn(Optional.of(draft));
        when(entryRepository.save(draft)).thenReturn(draft);

        service.upsertEntry(100L, OWNER_ID, 2L, PERIOD, List.of(7L));

        assertThat(draft.getPaymentScheduleId()).isEqualTo(1L);
        verify(adjustmentRepository).findByEmployeeIdAndShiftIdInOrderByIdAsc(eq(100L), eq(List.of(7L)));
    }

    // ==========================================
    // APROBACIÓN Y PAGO
    // ==========================================

    @Test
    void approveRequiresManagerPermission() {
        Contract actor = activeContract(50L, 200L);
        when(contractRepository.findById(50L)).thenReturn(Optional.of(actor));

        assertThatThrownBy(() -> service.approve(900L, 50L)).isInstanceOf(PermissionDeniedException.class);
        verify(entryRepository, never()).findById(anyLong());
    }

    @Test
    void approveWithInactiveActorIsRejected() {
        Contract actor = activeContract(50L, 200L);
        actor.setStatus(ContractStatus.TERMINATED);
        when(contractRepository.findById(50L)).thenReturn(Optional.of(actor));

        assertThatThrownBy(() -> service.approve(900L, 50L)).isInstanceOf(ContractInactiveException.class);
    }

    @Test
    void managerApprovesDraftEntry() {
        Contract actor = activeContract(50L, 200L);
        actor.setIsManager(true);
        actor.getManagerPermissions().add(ManagerPermission.APPROVE_PAYROLL);
        PayrollEntry draft = entry(900L, PayrollEntryStatus.DRAFT);
        when(contractRepository.findById(50L)).thenReturn(Optional.of(actor));
        when(entryRepository.findById(900L)).thenReturn(Optional.of(draft));
        when(entryRepository.save(draft)).thenReturn(draft);

        PayrollEntry approved = service.approve(900L, 50L);

        assertThat(approved.getStatus()).isEqualTo(PayrollEntryStatus.APPROVED);
        assertThat(approved.getApprovedAt()).isEqualTo(LocalDateTime.of(2025, 11, 18, 9, 0));
    }

    @Test
    void onlyApprovedEntriesCanBePaid() {
        when(contractRepository.findById(50L)).thenReturn(Optional.of(manager()));
        when(entryRepository.findById(900L)).thenReturn(Optional.of(entry(900L, PayrollEntryStatus.DRAFT)));

        assertThatThrownBy(() -> service.markPaid(900L, 50L)).isInstanceOf(ConflictException.class);
    }

    @Test
    void approvedEntryIsMarkedPaid() {
        PayrollEntry approved = entry(900L, PayrollEntryStatus.APPROVED);
        when(contractRepository.findById(50L)).thenReturn(Optional.of(manager()));
        when(entryRepository.findById(900L)).thenReturn(Optional.of(approved));
        when(entryRepository.save(approved)).thenReturn(approved);

        PayrollEntry paid = service.markPaid(900L, 50L);

        assertThat(paid.getStatus()).isEqualTo(PayrollEntryStatus.PAID);
        assertThat(paid.getPaidAt()).isEqualTo(LocalDateTime.of(2025, 11, 18, 9, 0));
    }

    @Test
    void markPaidRequiresManagerPermission() {
        when(contractRepository.findById(50L)).thenReturn(Optional.of(activeContract(50L, 200L)));

        assertThatThrownBy(() -> service.markPaid(900L, 50L)).isInstanceOf(PermissionDeniedException.class);
        verify(entryRepository, never()).save(any());
    }

    @Test
    void actionsWithoutActorAreDenied() {
        assertThatThrownBy(() -> service.approve(900L, null)).isInstanceOf(PermissionDeniedException.class);
        assertThatThrownBy(() -> service.markPaid(900L, null)).isInstanceOf(PermissionDeniedException.class);
        verify(contractRepository, never()).findById(anyLong());
        verify(entryRepository, never()).findById(anyLong());
    }

    @Test
    void managerOfAnotherOwnerCannotApprove() {
        Contract foreign = manager();
        foreign.setOwnerId(2L);
        when(contractRepository.findById(50L)).thenReturn(Optional.of(foreign));
        when(entryRepository.findById(900L)).thenReturn(Optional.of(entry(900L, PayrollEntryStatus.DRAFT)));

        assertThatThrownBy(() -> service.approve(900L, 50L))
                .isInstanceOf(PermissionDeniedException.class)
                .hasMessageContaining("propietario");
        verify(entryRepository, never()).save(any());
    }

    private static Contract manager() {
        Contract actor = activeContract(50L, 200L);
        actor.setIsManager(true);
        actor.getManagerPermissions().add(ManagerPermission.APPROVE_PAYROLL);
        return actor;
    }

    private static PayrollAdjustment adjustment(Long id, AdjustmentKind kind, String amount) {
        PayrollAdjustment adjustment = new PayrollAdjustment();
        adjustment.setId(id);
        adjustment.setEmployeeId(100L);
        adjustment.setKind(kind);
        adjustment.setAmount(new BigDecimal(amount));
        return adjustment;
    }

    private static PayrollEntry entry(Long id, PayrollEntryStatus status) {
        PayrollEntry entry = new PayrollEntry();
        entry.setId(id);
        entry.setEmployeeId(100L);
        entry.setOwnerId(OWNER_ID);
        entry.setPaymentScheduleId(1L);
        entry.setPeriodStart(PERIOD.getPeriodStart());
        entry.setPeriodEnd(PERIOD.getPeriodEnd());
        entry.setStatus(status);
        return entry;
    }
}
