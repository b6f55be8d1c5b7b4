package sp.sistemaspalacios.api_nomina.exception;

import lombok.Getter;

/**
 * Dos calendarios de pago reclaman el mismo objeto (o la misma fecha) en una ejecución.
 */
@Getter
public class AmbiguousScheduleException extends PayrollDomainException {

    private final Long objectId;
    private final Long firstScheduleId;
    private final Long secondScheduleId;

    public AmbiguousScheduleException(Long objectId, Long firstScheduleId, Long secondScheduleId) {
        super("El objeto " + objectId + " ya fue reclamado por el calendario " + firstScheduleId
                + "; se omite el calendario " + secondScheduleId);
        this.objectId = objectId;
        this.firstScheduleId = firstScheduleId;
        this.secondScheduleId = secondScheduleId;
    }
}
