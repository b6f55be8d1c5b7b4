package sp.sistemaspalacios.api_nomina.dto.payroll;

import lombok.Value;

@Value
public class RunSkip {

    String unitType;
    Long unitId;
    String reason;
}
