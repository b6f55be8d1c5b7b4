package sp.sistemaspalacios.api_nomina.dto.payroll;

import lombok.Value;

/**
 * Conteo de filas afectadas al procesar un solo turno.
 */
@Value
public class ShiftAdjustmentOutcome {

    int created;
    int updated;
    int unchanged;
    int removed;
}
