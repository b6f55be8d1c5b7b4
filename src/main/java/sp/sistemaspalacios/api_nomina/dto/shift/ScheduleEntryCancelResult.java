package sp.sistemaspalacios.api_nomina.dto.shift;

import lombok.Value;

import java.util.List;

@Value
public class ScheduleEntryCancelResult {

    Long scheduleEntryId;
    boolean alreadyCancelled;
    List<Long> cancelledShiftIds;
}
