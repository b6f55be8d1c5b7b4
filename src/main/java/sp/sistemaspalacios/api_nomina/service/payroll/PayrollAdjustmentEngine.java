package sp.sistemaspalacios.api_nomina.service.payroll;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_nomina.dto.payroll.AdjustmentResult;
import sp.sistemaspalacios.api_nomina.dto.payroll.RunError;
import sp.sistemaspalacios.api_nomina.dto.payroll.RunSkip;
import sp.sistemaspalacios.api_nomina.dto.payroll.ShiftAdjustmentOutcome;
import sp.sistemaspalacios.api_nomina.entity.shift.Shift;
import sp.sistemaspalacios.api_nomina.entity.shift.ShiftStatus;
import sp.sistemaspalacios.api_nomina.repository.shift.ShiftRepository;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Ejecución por lotes de los ajustes automáticos.
 * <p>
 * Cada turno se procesa en su propia transacción. Un fallo queda registrado en el
 * resultado y la ejecución continúa con el siguiente turno.
 */
@Slf4j
@Service
public class PayrollAdjustmentEngine {

    private final PayrollAdjustmentService adjustmentService;
    private final ShiftRepository shiftRepository;
    private final int lookbackDays;

    public PayrollAdjustmentEngine(PayrollAdjustmentService adjustmentService,
                                   ShiftRepository shiftRepository,
                                   @Value("${payroll.adjustments.lookback-days:1}") int lookbackDays) {
        this.adjustmentService = adjustmentService;
        this.shiftRepository = shiftRepository;
        this.lookbackDays = lookbackDays;
    }

    /**
     * Procesa los turnos completados cuyo cierre cae entre
     * {@code targetDate - lookbackDays} y el final de {@code targetDate} (UTC).
     */
    public AdjustmentResult processWindow(LocalDate targetDate) {
        LocalDateTime from = targetDate.minusDays(lookbackDays).atStartOfDay();
        LocalDateTime to = targetDate.plusDays(1).atStartOfDay();
        List<Shift> shifts = shiftRepository.findByStatusAndEndTimeBetweenOrderByIdAsc(ShiftStatus.COMPLETED, from, to);
        log.info("🔍 Ajustes automáticos para {}: {} turnos cerrados entre {} y {}", targetDate, shifts.size(), from, to);
        return processWindow(shifts);
    }

    public AdjustmentResult processWindow(List<Shift> completedShifts) {
        AdjustmentResult result = new AdjustmentResult();

        for (Shift shift : completedShifts) {
            if (shift.getStatus() != ShiftStatus.COMPLETED) {
                result.addSkip(new RunSkip("SHIFT", shift.getId(), "Turno en estado " + shift.getStatus()));
                continue;
            }
            try {
                ShiftAdjustmentOutcome outcome = adjustmentService.applyForShift(shift.getId());
                result.add(outcome);
            } catch (RuntimeException e) {
                log.error("❌ Error calculando ajustes del turno {}: {}", shift.getId(), e.getMessage(), e);
                result.addError(new RunError("SHIFT", shift.getId(), e.getClass().getSimpleName(), e.getMessage()));
            }
        }

        log.info("✅ Ajustes: turnos={}, creados={}, actualizados={}, sin cambios={}, eliminados={}, errores={}",
                result.getProcessedShifts(), result.getCreated(), result.getUpdated(),
                result.getSkippedDuplicate(), result.getRemoved(), result.getErrors().size());
        return result;
    }
}
