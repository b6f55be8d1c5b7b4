package sp.sistemaspalacios.api_nomina.dto.payroll;

import lombok.Value;

/**
 * Fallo de una unidad de trabajo (turno, calendario, empleado) dentro de una ejecución por lotes.
 */
@Value
public class RunError {

    String unitType;
    Long unitId;
    String errorType;
    String message;
}
