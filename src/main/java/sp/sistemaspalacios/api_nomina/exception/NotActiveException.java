package sp.sistemaspalacios.api_nomina.exception;

import lombok.Getter;

@Getter
public class NotActiveException extends PayrollDomainException {

    private final Long shiftId;

    public NotActiveException(Long shiftId, String currentStatus) {
        super("El turno " + shiftId + " no está activo (estado actual: " + currentStatus + ")");
        this.shiftId = shiftId;
    }

    public NotActiveException(String message) {
        super(message);
        this.shiftId = null;
    }
}
