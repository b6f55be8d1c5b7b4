package sp.sistemaspalacios.api_nomina.dto.settings;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentSchedule;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentSystem;

import java.math.BigDecimal;

/**
 * Configuración efectiva tras aplicar la cadena contrato → franja → objeto → unidades → defecto.
 */
@Value
@Builder
public class EffectiveSettings {

    BigDecimal hourlyRate;
    SettingsSource rateSource;

    @JsonIgnore
    PaymentSystem paymentSystem;
    SettingsSource paymentSystemSource;

    @JsonIgnore
    PaymentSchedule paymentSchedule;
    SettingsSource paymentScheduleSource;

    int lateThresholdMinutes;
    BigDecimal latePenaltyPerMinute;
    SettingsSource lateSettingsSource;
    String lateSettingsInheritedFrom;

    public String getPaymentSystemCode() {
        return paymentSystem != null ? paymentSystem.getCode() : null;
    }

    public Long getPaymentScheduleId() {
        return paymentSchedule != null ? paymentSchedule.getId() : null;
    }
}
