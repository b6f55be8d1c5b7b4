package sp.sistemaspalacios.api_nomina.service.notification;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import sp.sistemaspalacios.api_nomina.event.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Escucha los eventos de dominio y los reenvía una vez confirmada la transacción,
 * de modo que nunca se notifica un cambio que terminó en rollback.
 */
@Component
@RequiredArgsConstructor
public class DomainEventForwarder {

    private final NotificationService notificationService;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onShiftOpened(ShiftOpenedEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("shiftId", event.getShiftId());
        data.put("objectId", event.getObjectId());
        data.put("scheduleEntryId", event.getScheduleEntryId());
        data.put("startTime", String.valueOf(event.getStartTime()));
        notificationService.dispatch("SHIFT_OPENED", event.getEmployeeId(), data);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onShiftClosed(ShiftClosedEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("shiftId", event.getShiftId());
        data.put("objectId", event.getObjectId());
        data.put("endTime", String.valueOf(event.getEndTime()));
        data.put("totalHours", event.getTotalHours());
        data.put("totalPayment", event.getTotalPayment());
        data.put("autoClosed", event.isAutoClosed());
        notificationService.dispatch("SHIFT_CLOSED", event.getEmployeeId(), data);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onShiftCancelled(ShiftCancelledEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("shiftId", event.getShiftId());
        data.put("scheduleEntryId", event.getScheduleEntryId());
        notificationService.dispatch("SHIFT_CANCELLED", event.getEmployeeId(), data);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onPayrollEntry(PayrollEntryCreatedEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("entryId", event.getEntryId());
        data.put("periodStart", String.valueOf(event.getPeriodStart()));
        data.put("periodEnd", String.valueOf(event.getPeriodEnd()));
        data.put("netAmount", event.getNetAmount());
        data.put("created", event.isCreated());
        notificationService.dispatch("PAYROLL_ENTRY_CREATED", event.getEmployeeId(), data);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onAdjustmentApplied(AdjustmentAppliedEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("adjustmentId", event.getAdjustmentId());
        data.put("shiftId", event.getShiftId());
        data.put("kind", event.getKind().name());
        data.put("amount", event.getAmount());
        data.put("automatic", event.isAutomatic());
        notificationService.dispatch("ADJUSTMENT_APPLIED", event.getEmployeeId(), data);
    }
}
