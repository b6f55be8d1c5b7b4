package sp.sistemaspalacios.api_nomina.event;

import lombok.Value;
import sp.sistemaspalacios.api_nomina.entity.payroll.AdjustmentKind;

import java.math.BigDecimal;

@Value
public class AdjustmentAppliedEvent {

    Long adjustmentId;
    Long shiftId;
    Long employeeId;
    AdjustmentKind kind;
    BigDecimal amount;
    boolean automatic;
}
