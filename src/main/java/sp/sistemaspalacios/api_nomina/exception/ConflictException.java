package sp.sistemaspalacios.api_nomina.exception;

import lombok.Getter;

/**
 * El empleado ya tiene un turno activo (o la entrada de horario ya está en uso).
 */
@Getter
public class ConflictException extends PayrollDomainException {

    private final Long employeeId;
    private final Long activeShiftId;

    public ConflictException(Long employeeId, Long activeShiftId) {
        super("El empleado " + employeeId + " ya tiene un turno activo (turno " + activeShiftId + ")");
        this.employeeId = employeeId;
        this.activeShiftId = activeShiftId;
    }

    public ConflictException(String message) {
        super(message);
        this.employeeId = null;
        this.activeShiftId = null;
    }
}
