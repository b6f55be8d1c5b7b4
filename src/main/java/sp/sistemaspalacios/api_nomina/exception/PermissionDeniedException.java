package sp.sistemaspalacios.api_nomina.exception;

import lombok.Getter;
import sp.sistemaspalacios.api_nomina.entity.contract.ManagerPermission;

@Getter
public class PermissionDeniedException extends PayrollDomainException {

    private final Long contractId;
    private final ManagerPermission permission;

    public PermissionDeniedException(Long contractId, ManagerPermission permission) {
        super("El contrato " + contractId + " no tiene el permiso " + permission);
        this.contractId = contractId;
        this.permission = permission;
    }

    public PermissionDeniedException(Long contractId, ManagerPermission permission, String message) {
        super(message);
        this.contractId = contractId;
        this.permission = permission;
    }
}
