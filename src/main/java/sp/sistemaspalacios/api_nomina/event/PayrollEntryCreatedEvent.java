package sp.sistemaspalacios.api_nomina.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Se publica cuando una ejecución crea o recalcula una entrada de nómina.
 * {@code created} distingue la primera creación de las actualizaciones.
 */
@Value
public class PayrollEntryCreatedEvent {

    Long entryId;
    Long employeeId;
    LocalDate periodStart;
    LocalDate periodEnd;
    BigDecimal netAmount;
    boolean created;
}
