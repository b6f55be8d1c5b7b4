package sp.sistemaspalacios.api_nomina.service.payroll;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_nomina.dto.payroll.PaymentPeriod;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentFrequency;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentSchedule;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentScheduleInstance;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Calcula el periodo que se paga en una fecha según el calendario.
 * Función pura: no modifica el calendario ni sus instancias.
 */
@Slf4j
@Component
public class PeriodCalculator {

    static final int DEFAULT_WEEKLY_START_OFFSET = -22;
    static final int DEFAULT_WEEKLY_END_OFFSET = -16;
    static final int DEFAULT_MONTHLY_START_OFFSET = -60;
    static final int DEFAULT_MONTHLY_END_OFFSET = -30;

    public Optional<PaymentPeriod> periodForDate(PaymentSchedule schedule, LocalDate targetDate) {
        if (schedule == null || targetDate == null || schedule.getFrequency() == null) {
            return Optional.empty();
        }
        if (schedule.getFrequency() == PaymentFrequency.WEEKLY) {
            return weeklyPeriod(schedule, targetDate);
        }
        return monthlyPeriod(schedule, targetDate);
    }

    // ==========================================
    // SEMANAL
    // ==========================================

    private Optional<PaymentPeriod> weeklyPeriod(PaymentSchedule schedule, LocalDate targetDate) {
        Integer paymentWeekday = schedule.getPaymentDay();
        if (paymentWeekday == null || targetDate.getDayOfWeek().getValue() != paymentWeekday) {
            return Optional.empty();
        }
        int start = orDefault(schedule.getStartOffset(), DEFAULT_WEEKLY_START_OFFSET);
        int end = orDefault(schedule.getEndOffset(), DEFAULT_WEEKLY_END_OFFSET);
        return Optional.of(PaymentPeriod.of(targetDate.plusDays(start), targetDate.plusDays(end)));
    }

    // ==========================================
    // MENSUAL
    // ==========================================

    private Optional<PaymentPeriod> monthlyPeriod(PaymentSchedule schedule, LocalDate targetDate) {
        if (!schedule.hasInstances()) {
            return legacyMonthlyPeriod(schedule, targetDate);
        }

        List<PaymentScheduleInstance> matches = new ArrayList<>();
        for (PaymentScheduleInstance instance : schedule.getPayments()) {
            if (targetDate.equals(instance.getNextPaymentDate()) || targetDate.equals(instance.getLastPaymentDate())) {
                matches.add(instance);
            }
        }

        if (matches.isEmpty()) {
            return Optional.empty();
        }
        if (matches.size() > 1) {
            log.warn("⚠️ Calendario {} tiene {} instancias para {}; se usa la primera (instancia {})",
                    schedule.getId(), matches.size(), targetDate, matches.get(0).getId());
        }
        if (legacyDayMatches(schedule, targetDate)) {
            log.warn("⚠️ Calendario {} coincide en {} por instancia y por formato antiguo; se usa la instancia",
                    schedule.getId(), targetDate);
        }

        PaymentScheduleInstance chosen = matches.get(0);
        return Optional.of(new PaymentPeriod(
                targetDate.plusDays(chosen.getStartOffset()),
                targetDate.plusDays(chosen.getEndOffset()),
                chosen));
    }

    private Optional<PaymentPeriod> legacyMonthlyPeriod(PaymentSchedule schedule, LocalDate targetDate) {
        if (!legacyDayMatches(schedule, targetDate)) {
            return Optional.empty();
        }
        if (Boolean.TRUE.equals(schedule.getPreviousMonth())) {
            LocalDate firstOfCurrent = targetDate.withDayOfMonth(1);
            return Optional.of(PaymentPeriod.of(firstOfCurrent.minusMonths(1), firstOfCurrent.minusDays(1)));
        }
        int start = orDefault(schedule.getStartOffset(), DEFAULT_MONTHLY_START_OFFSET);
        int end = orDefault(schedule.getEndOffset(), DEFAULT_MONTHLY_END_OFFSET);
        return Optional.of(PaymentPeriod.of(targetDate.plusDays(start), targetDate.plusDays(end)));
    }

    // Un día de pago 31 cae en el último día de los meses más cortos
    private boolean legacyDayMatches(PaymentSchedule schedule, LocalDate targetDate) {
        Integer paymentDay = schedule.getPaymentDay();
        if (paymentDay == null) {
            return false;
        }
        int effectiveDay = Math.min(paymentDay, targetDate.lengthOfMonth());
        return targetDate.getDayOfMonth() == effectiveDay;
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}
