package sp.sistemaspalacios.api_nomina.entity.payroll;

public enum PayrollEntryStatus {
    DRAFT,
    APPROVED,
    PAID
}
