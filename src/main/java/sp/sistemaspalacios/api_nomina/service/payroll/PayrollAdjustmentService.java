package sp.sistemaspalacios.api_nomina.service.payroll;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_nomina.dto.payroll.PayrollRequests.ManualAdjustmentRequest;
import sp.sistemaspalacios.api_nomina.dto.payroll.ShiftAdjustmentOutcome;
import sp.sistemaspalacios.api_nomina.dto.settings.EffectiveSettings;
import sp.sistemaspalacios.api_nomina.entity.payroll.AdjustmentKind;
import sp.sistemaspalacios.api_nomina.entity.payroll.PayrollAdjustment;
import sp.sistemaspalacios.api_nomina.entity.payroll.PayrollEntry;
import sp.sistemaspalacios.api_nomina.entity.payroll.PayrollEntryStatus;
import sp.sistemaspalacios.api_nomina.entity.shift.Shift;
import sp.sistemaspalacios.api_nomina.entity.shift.ShiftStatus;
import sp.sistemaspalacios.api_nomina.entity.shiftSchedule.TimeSlot;
import sp.sistemaspalacios.api_nomina.entity.task.ShiftTask;
import sp.sistemaspalacios.api_nomina.entity.workObject.WorkObject;
import sp.sistemaspalacios.api_nomina.event.AdjustmentAppliedEvent;
import sp.sistemaspalacios.api_nomina.exception.ConflictException;
import sp.sistemaspalacios.api_nomina.exception.NotActiveException;
import sp.sistemaspalacios.api_nomina.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_nomina.repository.payroll.PayrollAdjustmentRepository;
import sp.sistemaspalacios.api_nomina.repository.shift.ShiftRepository;
import sp.sistemaspalacios.api_nomina.repository.task.ShiftTaskRepository;
import sp.sistemaspalacios.api_nomina.service.settings.SettingsResolver;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Calcula y guarda los ajustes automáticos de un turno completado.
 * <p>
 * Cada (turno, tipo) se guarda como una única fila identificada por su clave natural;
 * reprocesar un turno actualiza esas filas en lugar de insertar nuevas.
 */
@Slf4j
@Service
public class PayrollAdjustmentService {

    static final List<AdjustmentKind> AUTOMATIC_KINDS = List.of(
            AdjustmentKind.BASE_PAY, AdjustmentKind.LATE_PENALTY,
            AdjustmentKind.TASK_BONUS, AdjustmentKind.TASK_PENALTY);

    private final PayrollAdjustmentRepository adjustmentRepository;
    private final ShiftRepository shiftRepository;
    private final ShiftTaskRepository shiftTaskRepository;
    private final SettingsResolver settingsResolver;
    private final ApplicationEventPublisher eventPublisher;
    private final String taskPaymentSystemCode;
    private final BigDecimal defaultTaskPenalty;

    public PayrollAdjustmentService(PayrollAdjustmentRepository adjustmentRepository,
                                    ShiftRepository shiftRepository,
                                    ShiftTaskRepository shiftTaskRepository,
                                    SettingsResolver settingsResolver,
                                    ApplicationEventPublisher eventPublisher,
                                    @Value("${payroll.task-payment-system-code:hourly_bonus}") String taskPaymentSystemCode,
                                    @Value("${payroll.default-task-penalty:50.00}") BigDecimal defaultTaskPenalty) {
        this.adjustmentRepository = adjustmentRepository;
        this.shiftRepository = shiftRepository;
        this.shiftTaskRepository = shiftTaskRepository;
        this.settingsResolver = settingsResolver;
        this.eventPublisher = eventPublisher;
        this.taskPaymentSystemCode = taskPaymentSystemCode;
        this.defaultTaskPenalty = defaultTaskPenalty.abs();
    }

    // ==========================================
    // AJUSTES AUTOMÁTICOS
    // ==========================================

    @Transactional
    public ShiftAdjustmentOutcome applyForShift(Long shiftId) {
        Shift shift = shiftRepository.findById(shiftId)
                .orElseThrow(() -> new ResourceNotFoundException("Turno con ID " + shiftId + " no encontrado"));
        if (shift.getStatus() != ShiftStatus.COMPLETED || shift.getEndTime() == null) {
            throw new NotActiveException("El turno " + shiftId + " no está completado (estado: " + shift.getStatus() + ")");
        }

        Map<AdjustmentKind, ComputedAdjustment> desired = computeAdjustments(shift);

        int created = 0;
        int updated = 0;
        int unchanged = 0;
        int removed = 0;
        List<AdjustmentAppliedEvent> events = new ArrayList<>();

        for (AdjustmentKind kind : AUTOMATIC_KINDS) {
            String key = PayrollAdjustment.naturalKey(shiftId, kind);
            PayrollAdjustment existing = adjustmentRepository.findByNaturalKey(key).orElse(null);
            ComputedAdjustment wanted = desired.get(kind);

            if (existing != null && isFrozen(existing)) {
                // ya forma parte de una nómina aprobada o pagada
                unchanged++;
                continue;
            }

            if (wanted == null) {
                if (existing != null) {
                    adjustmentRepository.delete(existing);
                    removed++;
                    log.info("🗑️ Ajuste {} del turno {} eliminado: ya no aplica", kind, shiftId);
                }
                continue;
            }

            if (existing == null) {
                PayrollAdjustment adjustment = new PayrollAdjustment();
                adjustment.setShift(shift);
                adjustment.setEmployeeId(shift.getEmployeeId());
                adjustment.setObjectId(shift.getWorkObject().getId());
                adjustment.setKind(kind);
                adjustment.setAutomatic(true);
                adjustment.setNaturalKey(key);
                copy(wanted, adjustment);
                PayrollAdjustment saved = adjustmentRepository.save(adjustment);
                events.add(eventFor(saved, shiftId));
                created++;
            } else if (sameAs(existing, wanted)) {
                unchanged++;
            } else {
                copy(wanted, existing);
                PayrollAdjustment saved = adjustmentRepository.save(existing);
                events.add(eventFor(saved, shiftId));
                updated++;
            }
        }

        events.forEach(eventPublisher::publishEvent);
        log.debug("Turno {}: creados={}, actualizados={}, sin cambios={}, eliminados={}",
                shiftId, created, updated, unchanged, removed);
        return new ShiftAdjustmentOutcome(created, updated, unchanged, removed);
    }

    /**
     * Importes automáticos que corresponden al turno en su estado actual. Sin efectos secundarios.
     */
    Map<AdjustmentKind, ComputedAdjustment> computeAdjustments(Shift shift) {
        WorkObject object = shift.getWorkObject();
        TimeSlot slot = shift.getScheduleEntry() != null ? shift.getScheduleEntry().getTimeSlot() : null;
        EffectiveSettings settings = settingsResolver.resolve(shift.getContract(), object, object.getOrgUnit(), slot);

        Map<AdjustmentKind, ComputedAdjustment> result = new EnumMap<>(AdjustmentKind.class);

        BigDecimal hours = shift.getTotalHours() != null ? shift.getTotalHours() : shift.durationHours();
        BigDecimal basePay = money(hours.multiply(settings.getHourlyRate()));
        result.put(AdjustmentKind.BASE_PAY, new ComputedAdjustment(basePay,
                "Pago base: " + hours + " h × " + settings.getHourlyRate(), null));

        computeLatePenalty(shift, settings)
                .ifPresent(penalty -> result.put(AdjustmentKind.LATE_PENALTY, penalty));

        if (taskPaymentSystemCode.equals(settings.getPaymentSystemCode())) {
            computeTaskAdjustments(shift, result);
        }
        return result;
    }

    // ==========================================
    // AJUSTES MANUALES
    // ==========================================

    @Transactional
    public PayrollAdjustment createManual(ManualAdjustmentRequest request) {
        if (request.getAmount() == null || request.getAmount().signum() == 0) {
            throw new IllegalArgumentException("El importe del ajuste manual no puede ser cero");
        }

        PayrollAdjustment adjustment = new PayrollAdjustment();
        if (request.getShiftId() != null) {
            Shift shift = shiftRepository.findById(request.getShiftId())
                    .orElseThrow(() -> new ResourceNotFoundException("Turno con ID " + request.getShiftId() + " no encontrado"));
            adjustment.setShift(shift);
            adjustment.setEmployeeId(shift.getEmployeeId());
            adjustment.setObjectId(shift.getWorkObject().getId());
        } else {
            if (request.getEmployeeId() == null) {
                throw new IllegalArgumentException("Se requiere turno o empleado para un ajuste manual");
            }
            adjustment.setEmployeeId(request.getEmployeeId());
            adjustment.setObjectId(request.getObjectId());
        }
        adjustment.setKind(AdjustmentKind.MANUAL);
        adjustment.setAutomatic(false);
        adjustment.setNaturalKey(null);
        adjustment.setAmount(money(request.getAmount()));
        adjustment.setDescription(request.getDescription());
        adjustment.setCreatedBy(request.getCreatedBy());

        PayrollAdjustment saved = adjustmentRepository.save(adjustment);
        eventPublisher.publishEvent(new AdjustmentAppliedEvent(saved.getId(), request.getShiftId(),
                saved.getEmployeeId(), AdjustmentKind.MANUAL, saved.getAmount(), false));
        log.info("✅ Ajuste manual {} creado para empleado {}: {}", saved.getId(), saved.getEmployeeId(), saved.getAmount());
        return saved;
    }

    @Transactional
    public void deleteManual(Long adjustmentId) {
        PayrollAdjustment adjustment = adjustmentRepository.findById(adjustmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Ajuste con ID " + adjustmentId + " no encontrado"));
        if (Boolean.TRUE.equals(adjustment.getAutomatic())) {
            throw new IllegalArgumentException("Solo se pueden eliminar ajustes manuales");
        }
        if (isFrozen(adjustment)) {
            throw new ConflictException("El ajuste " + adjustmentId + " pertenece a una nómina ya aprobada");
        }
        adjustmentRepository.delete(adjustment);
        log.info("🗑️ Ajuste manual {} eliminado", adjustmentId);
    }

    @Transactional(readOnly = true)
    public List<PayrollAdjustment> adjustmentsOf(Long shiftId) {
        return adjustmentRepository.findByShiftIdOrderByIdAsc(shiftId);
    }

    // ==========================================
    // MÉTODOS PRIVADOS - CÁLCULO
    // ==========================================

    private Optional<ComputedAdjustment> computeLatePenalty(Shift shift, EffectiveSettings settings) {
        if (shift.getPlannedStart() == null) {
            return Optional.empty();
        }
        long latenessMinutes = Math.max(0, Duration.between(shift.getPlannedStart(), shift.getStartTime()).toMinutes());
        if (latenessMinutes <= settings.getLateThresholdMinutes()) {
            return Optional.empty();
        }
        BigDecimal perMinute = settings.getLatePenaltyPerMinute();
        if (perMinute == null || perMinute.signum() == 0) {
            return Optional.empty();
        }
        BigDecimal amount = money(perMinute.abs().multiply(BigDecimal.valueOf(latenessMinutes)).negate());
        return Optional.of(new ComputedAdjustment(amount,
                "Retraso de " + latenessMinutes + " min (umbral " + settings.getLateThresholdMinutes()
                        + " min, " + perMinute + " por minuto)", null));
    }

    private void computeTaskAdjustments(Shift shift, Map<AdjustmentKind, ComputedAdjustment> result) {
        BigDecimal bonusTotal = BigDecimal.ZERO;
        BigDecimal penaltyTotal = BigDecimal.ZERO;
        List<ShiftTask> bonusTasks = new ArrayList<>();
        List<ShiftTask> penaltyTasks = new ArrayList<>();

        for (ShiftTask task : shiftTaskRepository.findByShiftIdOrderByIdAsc(shift.getId())) {
            BigDecimal amount = task.getAmount() != null ? task.getAmount().abs() : BigDecimal.ZERO;
            if (task.mandatory() && !task.completed()) {
                // una tarea obligatoria sin importe recibe la multa por defecto
                penaltyTotal = penaltyTotal.add(amount.signum() == 0 ? defaultTaskPenalty : amount);
                penaltyTasks.add(task);
            } else if (!task.mandatory() && task.completed() && amount.signum() > 0) {
                bonusTotal = bonusTotal.add(amount);
                bonusTasks.add(task);
            }
        }

        if (!penaltyTasks.isEmpty()) {
            result.put(AdjustmentKind.TASK_PENALTY, new ComputedAdjustment(money(penaltyTotal.negate()),
                    "Tareas obligatorias sin completar: " + describe(penaltyTasks),
                    penaltyTasks.size() == 1 ? penaltyTasks.get(0) : null));
        }
        if (!bonusTasks.isEmpty()) {
            result.put(AdjustmentKind.TASK_BONUS, new ComputedAdjustment(money(bonusTotal),
                    "Tareas opcionales completadas: " + describe(bonusTasks),
                    bonusTasks.size() == 1 ? bonusTasks.get(0) : null));
        }
    }

    private static String describe(List<ShiftTask> tasks) {
        List<String> names = new ArrayList<>();
        for (ShiftTask task : tasks) {
            names.add(task.getTaskText());
        }
        return String.join(", ", names);
    }

    // ==========================================
    // MÉTODOS PRIVADOS - PERSISTENCIA
    // ==========================================

    private static boolean isFrozen(PayrollAdjustment adjustment) {
        PayrollEntry entry = adjustment.getPayrollEntry();
        return entry != null && entry.getStatus() != PayrollEntryStatus.DRAFT;
    }

    private static boolean sameAs(PayrollAdjustment existing, ComputedAdjustment wanted) {
        Long existingTaskId = existing.getShiftTask() != null ? existing.getShiftTask().getId() : null;
        Long wantedTaskId = wanted.getTask() != null ? wanted.getTask().getId() : null;
        return existing.getAmount() != null
                && existing.getAmount().compareTo(wanted.getAmount()) == 0
                && Objects.equals(existing.getDescription(), wanted.getDescription())
                && Objects.equals(existingTaskId, wantedTaskId);
    }

    private static void copy(ComputedAdjustment source, PayrollAdjustment target) {
        target.setAmount(source.getAmount());
        target.setDescription(source.getDescription());
        target.setShiftTask(source.getTask());
    }

    private static AdjustmentAppliedEvent eventFor(PayrollAdjustment adjustment, Long shiftId) {
        return new AdjustmentAppliedEvent(adjustment.getId(), shiftId, adjustment.getEmployeeId(),
                adjustment.getKind(), adjustment.getAmount(), true);
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    @Getter
    @RequiredArgsConstructor
    static final class ComputedAdjustment {
        private final BigDecimal amount;
        private final String description;
        private final ShiftTask task;
    }
}
