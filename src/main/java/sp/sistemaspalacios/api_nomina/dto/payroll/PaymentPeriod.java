package sp.sistemaspalacios.api_nomina.dto.payroll;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentScheduleInstance;

import java.time.LocalDate;

/**
 * Periodo pagado en una fecha de pago, ambos extremos incluidos.
 */
@Value
public class PaymentPeriod {

    LocalDate periodStart;
    LocalDate periodEnd;

    // Instancia mensual que produjo el periodo; null en semanal y formato antiguo
    @JsonIgnore
    PaymentScheduleInstance instance;

    public static PaymentPeriod of(LocalDate start, LocalDate end) {
        return new PaymentPeriod(start, end, null);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(periodStart) && !date.isAfter(periodEnd);
    }
}
