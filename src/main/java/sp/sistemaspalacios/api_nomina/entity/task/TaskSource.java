package sp.sistemaspalacios.api_nomina.entity.task;

public enum TaskSource {
    OBJECT,
    TIME_SLOT
}
