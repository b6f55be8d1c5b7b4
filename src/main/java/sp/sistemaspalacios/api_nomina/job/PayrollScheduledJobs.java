package sp.sistemaspalacios.api_nomina.job;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_nomina.config.BusinessClock;
import sp.sistemaspalacios.api_nomina.dto.payroll.AdjustmentResult;
import sp.sistemaspalacios.api_nomina.dto.payroll.PayrollRunResult;
import sp.sistemaspalacios.api_nomina.service.payroll.PayrollAdjustmentEngine;
import sp.sistemaspalacios.api_nomina.service.payroll.PayrollPeriodBuilder;
import sp.sistemaspalacios.api_nomina.service.shift.ShiftLifecycleCoordinator;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Disparadores periódicos. Solo calculan la fecha objetivo y delegan;
 * los mismos puntos de entrada se pueden invocar a mano para reprocesar una fecha.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PayrollScheduledJobs {

    private final ShiftLifecycleCoordinator shiftLifecycleCoordinator;
    private final PayrollAdjustmentEngine adjustmentEngine;
    private final PayrollPeriodBuilder periodBuilder;
    private final BusinessClock businessClock;
    private final Clock clock;

    @Value("${scheduler.auto-close.enabled:true}")
    private boolean autoCloseEnabled;

    @Value("${scheduler.adjustments.enabled:true}")
    private boolean adjustmentsEnabled;

    @Value("${scheduler.payroll.enabled:true}")
    private boolean payrollEnabled;

    /**
     * Cierra los turnos activos cuya hora de corte ya pasó. Cada 10 minutos por defecto.
     */
    @Scheduled(cron = "${scheduler.auto-close.cron:0 */10 * * * *}")
    public void autoCloseShifts() {
        if (!autoCloseEnabled) {
            log.debug("Cierre automático desactivado");
            return;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        int closed = 0;
        int failed = 0;
        for (Long shiftId : shiftLifecycleCoordinator.activeShiftIds()) {
            try {
                if (shiftLifecycleCoordinator.autoClose(shiftId, now).isPresent()) {
                    closed++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("❌ Error en cierre automático del turno {}: {}", shiftId, e.getMessage(), e);
            }
        }
        if (closed > 0 || failed > 0) {
            log.info("⏰ Cierre automático: {} turnos cerrados, {} errores", closed, failed);
        }
    }

    @Scheduled(cron = "${scheduler.adjustments.cron:0 0 3 * * *}")
    public void dailyAdjustments() {
        if (!adjustmentsEnabled) {
            log.info("Job de ajustes desactivado");
            return;
        }
        AdjustmentResult result = adjustmentEngine.processWindow(businessClock.today());
        if (!result.getErrors().isEmpty()) {
            log.error("❌ Job de ajustes terminó con {} errores: {}", result.getErrors().size(), result.getErrors());
        }
    }

    @Scheduled(cron = "${scheduler.payroll.cron:0 0 4 * * *}")
    public void dailyPayroll() {
        if (!payrollEnabled) {
            log.info("Job de nómina desactivado");
            return;
        }
        PayrollRunResult result = periodBuilder.run(businessClock.today());
        if (!result.getErrors().isEmpty()) {
            log.error("❌ Job de nómina terminó con {} errores: {}", result.getErrors().size(), result.getErrors());
        }
    }
}
