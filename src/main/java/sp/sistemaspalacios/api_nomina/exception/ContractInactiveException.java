package sp.sistemaspalacios.api_nomina.exception;

import lombok.Getter;

@Getter
public class ContractInactiveException extends PayrollDomainException {

    private final Long contractId;

    public ContractInactiveException(Long contractId, String status) {
        super("El contrato " + contractId + " no está activo (estado: " + status + ")");
        this.contractId = contractId;
    }
}
