package sp.sistemaspalacios.api_nomina.entity.payroll;

public enum AdjustmentKind {
    BASE_PAY,
    LATE_PENALTY,
    TASK_BONUS,
    TASK_PENALTY,
    MANUAL
}
