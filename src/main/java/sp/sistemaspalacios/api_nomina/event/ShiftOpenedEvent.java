package sp.sistemaspalacios.api_nomina.event;

import lombok.Value;

import java.time.LocalDateTime;

@Value
public class ShiftOpenedEvent {

    Long shiftId;
    Long employeeId;
    Long objectId;
    Long scheduleEntryId;
    LocalDateTime startTime;
}
