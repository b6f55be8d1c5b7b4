package sp.sistemaspalacios.api_nomina.entity.shift;

public enum ShiftStatus {
    ACTIVE,
    COMPLETED,
    CANCELLED
}
