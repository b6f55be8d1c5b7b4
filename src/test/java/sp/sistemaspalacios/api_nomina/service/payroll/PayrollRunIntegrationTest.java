package sp.sistemaspalacios.api_nomina.service.payroll;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import sp.sistemaspalacios.api_nomina.dto.payroll.AdjustmentResult;
import sp.sistemaspalacios.api_nomina.dto.payroll.PayrollRunResult;
import sp.sistemaspalacios.api_nomina.entity.contract.Contract;
import sp.sistemaspalacios.api_nomina.entity.contract.ContractStatus;
import sp.sistemaspalacios.api_nomina.entity.orgStructure.OrgUnit;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentFrequency;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentSchedule;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentSystem;
import sp.sistemaspalacios.api_nomina.entity.payroll.AdjustmentKind;
import sp.sistemaspalacios.api_nomina.entity.payroll.PayrollAdjustment;
import sp.sistemaspalacios.api_nomina.entity.payroll.PayrollEntry;
import sp.sistemaspalacios.api_nomina.entity.shift.Shift;
import sp.sistemaspalacios.api_nomina.entity.shift.ShiftStatus;
import sp.sistemaspalacios.api_nomina.entity.workObject.WorkObject;
import sp.sistemaspalacios.api_nomina.repository.contract.ContractRepository;
import sp.sistemaspalacios.api_nomina.repository.orgStructure.OrgUnitRepository;
import sp.sistemaspalacios.api_nomina.repository.paymentSchedule.PaymentScheduleRepository;
import sp.sistemaspalacios.api_nomina.repository.paymentSchedule.PaymentSystemRepository;
import sp.sistemaspalacios.api_nomina.repository.payroll.PayrollAdjustmentRepository;
import sp.sistemaspalacios.api_nomina.repository.payroll.PayrollEntryRepository;
import sp.sistemaspalacios.api_nomina.repository.shift.ShiftRepository;
import sp.sistemaspalacios.api_nomina.repository.workObject.WorkObjectRepository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Ejecuciones completas contra H2: ajustes automáticos y generación de nóminas,
 * cada una lanzada dos veces sobre los mismos datos.
 */
@SpringBootTest
class PayrollRunIntegrationTest {

    private static final Long OWNER_ID = 1L;
    private static final LocalDate PAYDAY = LocalDate.of(2025, 11, 18);
    private static final LocalDate PERIOD_START = LocalDate.of(2025, 10, 27);
    private static final LocalDate PERIOD_END = LocalDate.of(2025, 11, 2);

    @Autowired
    private PayrollAdjustmentEngine adjustmentEngine;
    @Autowired
    private PayrollPeriodBuilder periodBuilder;

    @Autowired
    private PaymentSystemRepository paymentSystemRepository;
    @Autowired
    private PaymentScheduleRepository scheduleRepository;
    @Autowired
    private OrgUnitRepository orgUnitRepository;
    @Autowired
    private WorkObjectRepository workObjectRepository;
    @Autowired
    private ContractRepository contractRepository;
    @Autowired
    private ShiftRepository shiftRepository;
    @Autowired
    private PayrollAdjustmentRepository adjustmentRepository;
    @Autowired
    private PayrollEntryRepository entryRepository;

    private OrgUnit parentUnit;
    private OrgUnit childUnit;
    private Shift centralShift;
    private Shift branchShift;

    @AfterEach
    void cleanUp() {
        adjustmentRepository.deleteAll();
        entryRepository.deleteAll();
        shiftRepository.deleteAll();
        contractRepository.deleteAll();
        workObjectRepository.deleteAll();
        if (childUnit != null) {
            orgUnitRepository.deleteById(childUnit.getId());
        }
        if (parentUnit != null) {
            orgUnitRepository.deleteById(parentUnit.getId());
        }
        scheduleRepository.deleteAll();
        paymentSystemRepository.deleteAll();
    }

    // ==========================================
    // AJUSTES AUTOMÁTICOS
    // ==========================================

    @Test
    void secondAdjustmentRunLeavesSameRowsPerKind() {
        givenNetwork(2);

        AdjustmentResult first = adjustmentEngine.processWindow(LocalDate.of(2025, 10, 28));
        Map<AdjustmentKind, Long> afterFirst = countByKind();
        AdjustmentResult second = adjustmentEngine.processWindow(LocalDate.of(2025, 10, 28));

        assertThat(first.getErrors()).isEmpty();
        assertThat(first.getCreated()).isEqualTo(2);
        assertThat(second.getCreated()).isZero();
        assertThat(second.getUpdated()).isZero();
        assertThat(second.getSkippedDuplicate()).isEqualTo(2);
        assertThat(countByKind()).isEqualTo(afterFirst);
        assertThat(afterFirst).containsEntry(AdjustmentKind.BASE_PAY, 2L).containsEntry(AdjustmentKind.MANUAL, 2L);
    }

    // ==========================================
    // GENERACIÓN DE NÓMINAS
    // ==========================================

    @Test
    void schedulesPayingSamePeriodProduceOneEntryPerEmployee() {
        givenNetwork(2);
        adjustmentEngine.processWindow(LocalDate.of(2025, 10, 28));

        PayrollRunResult first = periodBuilder.run(PAYDAY);
        PayrollRunResult second = periodBuilder.run(PAYDAY);

        assertThat(first.getErrors()).isEmpty();
        assertThat(first.getSchedulesDue()).isEqualTo(2);
        assertThat(first.getEntriesCreated()).isEqualTo(2);
        assertThat(second.getEntriesCreated()).isZero();
        assertThat(entryRepository.findAll()).hasSize(2);

        PayrollEntry entry = entryOf(100L);
        assertThat(entry.getGrossAmount()).isEqualByComparingTo("1600.00");
        assertThat(entry.getTotalBonuses()).isEqualByComparingTo("500.00");
        assertThat(entry.getNetAmount()).isEqualByComparingTo("2100.00");
        assertThat(entry.getShiftsCount()).isEqualTo(2);
        assertThat(entry.getOwnerId()).isEqualTo(OWNER_ID);
        assertThat(entry.getPaymentScheduleId()).isEqualTo(parentUnit.getPaymentSchedule().getId());
    }

    @Test
    void employeeWithOnlyManualAdjustmentGetsSingleEntry() {
        givenNetwork(2);
        adjustmentEngine.processWindow(LocalDate.of(2025, 10, 28));

        periodBuilder.run(PAYDAY);
        periodBuilder.run(PAYDAY);

        assertThat(entryRepository.findByEmployeeIdOrderByPeriodStartDesc(101L)).hasSize(1);
        PayrollEntry entry = entryOf(101L);
        assertThat(entry.getGrossAmount()).isEqualByComparingTo("0.00");
        assertThat(entry.getTotalDeductions()).isEqualByComparingTo("300.00");
        assertThat(entry.getNetAmount()).isEqualByComparingTo("-300.00");
        assertThat(entry.getShiftsCount()).isZero();
    }

    @Test
    void childUnitWithOwnScheduleIsLeftOutOfParentRun() {
        // la unidad hija paga los viernes; el martes solo vence el calendario del padre
        givenNetwork(5);
        adjustmentEngine.processWindow(LocalDate.of(2025, 10, 28));

        PayrollRunResult result = periodBuilder.run(PAYDAY);

        assertThat(result.getSchedulesDue()).isEqualTo(1);
        PayrollEntry entry = entryOf(100L);
        assertThat(entry.getGrossAmount()).isEqualByComparingTo("800.00");
        assertThat(entry.getShiftsCount()).isEqualTo(1);
        assertThat(adjustmentRepository.findByShiftIdOrderByIdAsc(branchShift.getId()))
                .hasSize(1)
                .allSatisfy(a -> assertThat(a.getPayrollEntry()).isNull());
        assertThat(adjustmentRepository.findByShiftIdOrderByIdAsc(centralShift.getId()))
                .hasSize(1)
                .allSatisfy(a -> assertThat(a.getPayrollEntry()).isNotNull());
    }

    // ==========================================
    // DATOS
    // ==========================================

    /**
     * Red con unidad padre (calendario de los martes) y unidad hija con calendario propio
     * que paga el día ISO {@code childPaymentDay}. Un turno de 8 h en cada unidad para el
     * empleado 100, un bono manual para él y una multa manual para el empleado 101.
     */
    private void givenNetwork(int childPaymentDay) {
        PaymentSystem hourly = paymentSystemRepository.save(
                PaymentSystem.builder().code("simple_hourly").name("Por hora").build());
        PaymentSchedule parentSchedule = scheduleRepository.save(weekly("Semanal red", 2));
        PaymentSchedule childSchedule = scheduleRepository.save(weekly("Semanal sucursal", childPaymentDay));

        parentUnit = new OrgUnit();
        parentUnit.setOwnerId(OWNER_ID);
        parentUnit.setName("Red");
        parentUnit.setPaymentSystem(hourly);
        parentUnit.setPaymentSchedule(parentSchedule);
        parentUnit = orgUnitRepository.save(parentUnit);

        childUnit = new OrgUnit();
        childUnit.setOwnerId(OWNER_ID);
        childUnit.setName("Sucursal");
        childUnit.setParent(parentUnit);
        childUnit.setLevel(1);
        childUnit.setPaymentSchedule(childSchedule);
        childUnit = orgUnitRepository.save(childUnit);

        WorkObject central = workObjectRepository.save(object("Tienda centro", parentUnit));
        WorkObject branch = workObjectRepository.save(object("Tienda sucursal", childUnit));

        Contract contract = contract(100L, central, branch);
        contract(101L);

        centralShift = shiftRepository.save(completedShift(contract, central, LocalDateTime.of(2025, 10, 27, 6, 0)));
        branchShift = shiftRepository.save(completedShift(contract, branch, LocalDateTime.of(2025, 10, 28, 6, 0)));

        adjustmentRepository.save(manual(100L, "500.00", LocalDateTime.of(2025, 10, 30, 12, 0)));
        adjustmentRepository.save(manual(101L, "-300.00", LocalDateTime.of(2025, 10, 31, 9, 0)));
    }

    private static PaymentSchedule weekly(String name, int paymentDay) {
        PaymentSchedule schedule = new PaymentSchedule();
        schedule.setOwnerId(OWNER_ID);
        schedule.setName(name);
        schedule.setFrequency(PaymentFrequency.WEEKLY);
        schedule.setPaymentDay(paymentDay);
        schedule.setStartOffset(-22);
        schedule.setEndOffset(-16);
        return schedule;
    }

    private static WorkObject object(String name, OrgUnit unit) {
        WorkObject object = new WorkObject();
        object.setOwnerId(OWNER_ID);
        object.setName(name);
        object.setOrgUnit(unit);
        object.setHourlyRate(new BigDecimal("100.00"));
        return object;
    }

    private Contract contract(Long employeeId, WorkObject... allowed) {
        Contract contract = new Contract();
        contract.setOwnerId(OWNER_ID);
        contract.setEmployeeId(employeeId);
        contract.setStatus(ContractStatus.ACTIVE);
        for (WorkObject object : allowed) {
            contract.getAllowedObjectIds().add(object.getId());
        }
        return contractRepository.save(contract);
    }

    private static Shift completedShift(Contract contract, WorkObject object, LocalDateTime start) {
        Shift shift = new Shift();
        shift.setEmployeeId(contract.getEmployeeId());
        shift.setContract(contract);
        shift.setWorkObject(object);
        shift.setStartTime(start);
        shift.setEndTime(start.plusHours(8));
        shift.setStatus(ShiftStatus.COMPLETED);
        shift.setTotalHours(new BigDecimal("8.00"));
        return shift;
    }

    private static PayrollAdjustment manual(Long employeeId, String amount, LocalDateTime createdAt) {
        PayrollAdjustment adjustment = new PayrollAdjustment();
        adjustment.setEmployeeId(employeeId);
        adjustment.setKind(AdjustmentKind.MANUAL);
        adjustment.setAutomatic(false);
        adjustment.setAmount(new BigDecimal(amount));
        adjustment.setDescription("Ajuste manual");
        adjustment.setCreatedAt(createdAt);
        return adjustment;
    }

    private Map<AdjustmentKind, Long> countByKind() {
        return adjustmentRepository.findAll().stream()
                .collect(Collectors.groupingBy(PayrollAdjustment::getKind, Collectors.counting()));
    }

    private PayrollEntry entryOf(Long employeeId) {
        return entryRepository.findByEmployeeIdAndPeriodStartAndPeriodEnd(employeeId, PERIOD_START, PERIOD_END)
                .orElseThrow();
    }
}
