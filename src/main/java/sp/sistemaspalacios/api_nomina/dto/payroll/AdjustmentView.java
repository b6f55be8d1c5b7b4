package sp.sistemaspalacios.api_nomina.dto.payroll;

import lombok.Builder;
import lombok.Value;
import sp.sistemaspalacios.api_nomina.entity.payroll.AdjustmentKind;
import sp.sistemaspalacios.api_nomina.entity.payroll.PayrollAdjustment;

import java.math.BigDecimal;

@Value
@Builder
public class AdjustmentView {

    Long id;
    Long shiftId;
    Long employeeId;
    Long objectId;
    AdjustmentKind kind;
    BigDecimal amount;
    String description;
    boolean automatic;
    Long payrollEntryId;

    public static AdjustmentView from(PayrollAdjustment adjustment) {
        return AdjustmentView.builder()
                .id(adjustment.getId())
                .shiftId(adjustment.getShift() != null ? adjustment.getShift().getId() : null)
                .employeeId(adjustment.getEmployeeId())
                .objectId(adjustment.getObjectId())
                .kind(adjustment.getKind())
                .amount(adjustment.getAmount())
                .description(adjustment.getDescription())
                .automatic(Boolean.TRUE.equals(adjustment.getAutomatic()))
                .payrollEntryId(adjustment.getPayrollEntry() != null ? adjustment.getPayrollEntry().getId() : null)
                .build();
    }
}
