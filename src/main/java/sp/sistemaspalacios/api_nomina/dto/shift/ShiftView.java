package sp.sistemaspalacios.api_nomina.dto.shift;

import lombok.Builder;
import lombok.Value;
import sp.sistemaspalacios.api_nomina.entity.shift.Shift;
import sp.sistemaspalacios.api_nomina.entity.shift.ShiftStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Value
@Builder
public class ShiftView {

    Long id;
    Long employeeId;
    Long contractId;
    Long objectId;
    Long scheduleEntryId;
    ShiftStatus status;
    LocalDateTime startTime;
    LocalDateTime endTime;
    LocalDateTime plannedStart;
    BigDecimal totalHours;
    BigDecimal hourlyRate;
    BigDecimal totalPayment;
    boolean autoClosed;

    public static ShiftView from(Shift shift) {
        return ShiftView.builder()
                .id(shift.getId())
                .employeeId(shift.getEmployeeId())
                .contractId(shift.getContract() != null ? shift.getContract().getId() : null)
                .objectId(shift.getWorkObject() != null ? shift.getWorkObject().getId() : null)
                .scheduleEntryId(shift.getScheduleEntry() != null ? shift.getScheduleEntry().getId() : null)
                .status(shift.getStatus())
                .startTime(shift.getStartTime())
                .endTime(shift.getEndTime())
                .plannedStart(shift.getPlannedStart())
                .totalHours(shift.getTotalHours())
                .hourlyRate(shift.getHourlyRate())
                .totalPayment(shift.getTotalPayment())
                .autoClosed(Boolean.TRUE.equals(shift.getAutoClosed()))
                .build();
    }
}
