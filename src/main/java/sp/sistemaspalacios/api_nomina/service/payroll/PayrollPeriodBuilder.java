package sp.sistemaspalacios.api_nomina.service.payroll;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_nomina.dto.payroll.EntryOutcome;
import sp.sistemaspalacios.api_nomina.dto.payroll.PaymentPeriod;
import sp.sistemaspalacios.api_nomina.dto.payroll.PayrollRunResult;
import sp.sistemaspalacios.api_nomina.dto.payroll.RunError;
import sp.sistemaspalacios.api_nomina.dto.payroll.RunSkip;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentSchedule;
import sp.sistemaspalacios.api_nomina.entity.shift.Shift;
import sp.sistemaspalacios.api_nomina.entity.shift.ShiftStatus;
import sp.sistemaspalacios.api_nomina.exception.AmbiguousScheduleException;
import sp.sistemaspalacios.api_nomina.repository.paymentSchedule.PaymentScheduleRepository;
import sp.sistemaspalacios.api_nomina.repository.payroll.PayrollAdjustmentRepository;
import sp.sistemaspalacios.api_nomina.repository.shift.ShiftRepository;
import sp.sistemaspalacios.api_nomina.service.settings.SettingsResolver;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Genera las entradas de nómina de los calendarios que pagan en una fecha.
 * <p>
 * Cada objeto pertenece al calendario que le asigna {@link SettingsResolver#resolvePaymentSchedule}.
 * Si dos calendarios reclaman el mismo objeto en una ejecución, el segundo lo omite.
 * Los turnos de todos los calendarios se agrupan por (periodo, empleado) antes de escribir,
 * así cada entrada se calcula una sola vez con todo lo que le corresponde.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PayrollPeriodBuilder {

    private final PaymentScheduleRepository scheduleRepository;
    private final ShiftRepository shiftRepository;
    private final PayrollAdjustmentRepository adjustmentRepository;
    private final PeriodCalculator periodCalculator;
    private final PayrollEntryService entryService;
    private final PaymentScheduleService paymentScheduleService;

    public PayrollRunResult run(LocalDate targetDate) {
        log.info("🔍 Generando nóminas para {}", targetDate);
        PayrollRunResult result = new PayrollRunResult(targetDate);

        // objeto -> calendario que lo reclamó en esta ejecución
        Map<Long, Long> claimedObjects = new HashMap<>();
        Map<String, PeriodBatch> batches = new LinkedHashMap<>();
        Map<Long, Long> consumedInstances = new LinkedHashMap<>();

        for (PaymentSchedule schedule : scheduleRepository.findByIsActiveTrueOrderByIdAsc()) {
            try {
                collectSchedule(schedule, targetDate, claimedObjects, batches, consumedInstances, result);
            } catch (RuntimeException e) {
                log.error("❌ Error procesando calendario {}: {}", schedule.getId(), e.getMessage(), e);
                result.addError(new RunError("PAYMENT_SCHEDULE", schedule.getId(), e.getClass().getSimpleName(), e.getMessage()));
            }
        }

        for (PeriodBatch batch : batches.values()) {
            buildEntries(batch, result);
        }

        for (Map.Entry<Long, Long> consumed : consumedInstances.entrySet()) {
            try {
                paymentScheduleService.advanceInstance(consumed.getKey(), consumed.getValue(), targetDate);
            } catch (RuntimeException e) {
                log.error("❌ Error avanzando la instancia {} del calendario {}: {}",
                        consumed.getValue(), consumed.getKey(), e.getMessage(), e);
                result.addError(new RunError("PAYMENT_SCHEDULE", consumed.getKey(), e.getClass().getSimpleName(), e.getMessage()));
            }
        }

        log.info("✅ Nóminas {}: calendarios={}, creadas={}, actualizadas={}, congeladas={}, omitidos={}, errores={}",
                targetDate, result.getSchedulesDue(), result.getEntriesCreated(), result.getEntriesUpdated(),
                result.getEntriesFrozen(), result.getSkipped().size(), result.getErrors().size());
        return result;
    }

    // ==========================================
    // MÉTODOS PRIVADOS
    // ==========================================

    private void collectSchedule(PaymentSchedule schedule, LocalDate targetDate, Map<Long, Long> claimedObjects,
                                 Map<String, PeriodBatch> batches, Map<Long, Long> consumedInstances,
                                 PayrollRunResult result) {
        Optional<PaymentPeriod> maybePeriod = periodCalculator.periodForDate(schedule, targetDate);
        if (maybePeriod.isEmpty()) {
            return;
        }
        PaymentPeriod period = maybePeriod.get();
        result.scheduleDue();
        log.info("📅 Calendario {} paga el {}: periodo [{} - {}]",
                schedule.getId(), targetDate, period.getPeriodStart(), period.getPeriodEnd());

        List<Long> objectIds = new ArrayList<>();
        for (Long objectId : paymentScheduleService.governedObjectIds(schedule)) {
            Long previous = claimedObjects.putIfAbsent(objectId, schedule.getId());
            if (previous != null && !previous.equals(schedule.getId())) {
                AmbiguousScheduleException conflict = new AmbiguousScheduleException(objectId, previous, schedule.getId());
                log.warn("⚠️ {}", conflict.getMessage());
                result.addSkip(new RunSkip("WORK_OBJECT", objectId, conflict.getMessage()));
                continue;
            }
            objectIds.add(objectId);
        }

        PeriodBatch batch = batches.computeIfAbsent(
                period.getPeriodStart() + "/" + period.getPeriodEnd(), key -> new PeriodBatch(period));
        batch.getScheduleByOwner().putIfAbsent(schedule.getOwnerId(), schedule.getId());

        if (objectIds.isEmpty()) {
            result.addSkip(new RunSkip("PAYMENT_SCHEDULE", schedule.getId(), "Sin objetos gobernados por el calendario"));
        } else {
            List<Shift> shifts = shiftRepository.findByObjectsAndStartBetween(ShiftStatus.COMPLETED, objectIds,
                    period.getPeriodStart().atStartOfDay(), period.getPeriodEnd().plusDays(1).atStartOfDay());
            for (Shift shift : shifts) {
                batch.employee(shift.getEmployeeId(), schedule.getOwnerId(), schedule.getId())
                        .getShiftIds().add(shift.getId());
            }
        }

        if (period.getInstance() != null) {
            consumedInstances.putIfAbsent(schedule.getId(), period.getInstance().getId());
        }
    }

    private void buildEntries(PeriodBatch batch, PayrollRunResult result) {
        PaymentPeriod period = batch.getPeriod();
        LocalDateTime from = period.getPeriodStart().atStartOfDay();
        LocalDateTime to = period.getPeriodEnd().plusDays(1).atStartOfDay();

        // empleados que solo tienen ajustes manuales sin turno en el periodo
        for (Map.Entry<Long, Long> owner : batch.getScheduleByOwner().entrySet()) {
            for (Long employeeId : adjustmentRepository.findEmployeesWithPendingShiftless(owner.getKey(), from, to)) {
                batch.employee(employeeId, owner.getKey(), owner.getValue());
            }
        }

        for (EmployeeBatch employee : batch.getEmployees().values()) {
            Long employeeId = employee.getEmployeeId();
            try {
                EntryOutcome outcome = entryService.upsertEntry(employeeId, employee.getOwnerId(),
                        employee.getScheduleId(), period, employee.getShiftIds());
                result.add(outcome);
            } catch (RuntimeException e) {
                log.error("❌ Error generando nómina del empleado {} [{} - {}]: {}",
                        employeeId, period.getPeriodStart(), period.getPeriodEnd(), e.getMessage(), e);
                result.addError(new RunError("EMPLOYEE", employeeId, e.getClass().getSimpleName(), e.getMessage()));
            }
        }
    }

    @Getter
    private static class PeriodBatch {

        private final PaymentPeriod period;
        // propietario -> primer calendario de ese propietario que paga el periodo
        private final Map<Long, Long> scheduleByOwner = new LinkedHashMap<>();
        private final Map<Long, EmployeeBatch> employees = new LinkedHashMap<>();

        PeriodBatch(PaymentPeriod period) {
            this.period = period;
        }

        EmployeeBatch employee(Long employeeId, Long ownerId, Long scheduleId) {
            return employees.computeIfAbsent(employeeId, id -> new EmployeeBatch(id, ownerId, scheduleId));
        }
    }

    @Getter
    @RequiredArgsConstructor
    private static class EmployeeBatch {

        private final Long employeeId;
        private final Long ownerId;
        private final Long scheduleId;
        private final List<Long> shiftIds = new ArrayList<>();
    }
}
