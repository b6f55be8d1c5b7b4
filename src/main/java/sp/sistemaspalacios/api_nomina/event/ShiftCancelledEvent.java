package sp.sistemaspalacios.api_nomina.event;

import lombok.Value;

@Value
public class ShiftCancelledEvent {

    Long shiftId;
    Long employeeId;
    Long scheduleEntryId;
}
