package sp.sistemaspalacios.api_nomina.dto.shift;

import lombok.Builder;
import lombok.Value;
import sp.sistemaspalacios.api_nomina.entity.shift.ShiftStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Value
@Builder
public class ShiftCloseResult {

    Long shiftId;
    ShiftStatus status;
    LocalDateTime endTime;
    BigDecimal totalHours;
    BigDecimal hourlyRate;
    BigDecimal totalPayment;
    boolean autoClosed;

    /** true cuando el turno ya estaba cerrado y no se escribió nada. */
    boolean alreadyClosed;
    String message;
}
