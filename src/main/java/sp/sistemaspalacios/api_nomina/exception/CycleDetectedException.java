package sp.sistemaspalacios.api_nomina.exception;

import lombok.Getter;

@Getter
public class CycleDetectedException extends PayrollDomainException {

    private final Long unitId;
    private final Long newParentId;

    public CycleDetectedException(Long unitId, Long newParentId) {
        super("Mover la unidad " + unitId + " bajo " + newParentId + " crearía un ciclo en la estructura");
        this.unitId = unitId;
        this.newParentId = newParentId;
    }
}
