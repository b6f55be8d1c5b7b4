package sp.sistemaspalacios.api_nomina.dto.payroll;

public enum EntryOutcome {
    CREATED,
    UPDATED,
    /** La entrada ya estaba aprobada o pagada y no se tocó. */
    FROZEN
}
