package sp.sistemaspalacios.api_nomina.entity.contract;

public enum ContractStatus {
    DRAFT,
    ACTIVE,
    TERMINATED
}
