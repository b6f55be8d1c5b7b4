package sp.sistemaspalacios.api_nomina.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Value
public class ShiftClosedEvent {

    Long shiftId;
    Long employeeId;
    Long objectId;
    LocalDateTime endTime;
    BigDecimal totalHours;
    BigDecimal totalPayment;
    boolean autoClosed;
}
