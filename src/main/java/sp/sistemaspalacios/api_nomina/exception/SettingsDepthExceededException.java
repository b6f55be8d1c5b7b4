package sp.sistemaspalacios.api_nomina.exception;

public class SettingsDepthExceededException extends PayrollDomainException {

    public SettingsDepthExceededException(Long startUnitId, int maxDepth) {
        super("Se superó la profundidad máxima (" + maxDepth + ") recorriendo la estructura desde la unidad "
                + startUnitId + "; posible ciclo en los datos");
    }
}
