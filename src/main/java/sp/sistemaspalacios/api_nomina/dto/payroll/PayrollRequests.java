package sp.sistemaspalacios.api_nomina.dto.payroll;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

/** Peticiones de la API de nómina */
public final class PayrollRequests {

    private PayrollRequests() {
    }

    @Data
    public static class ManualAdjustmentRequest {
        private Long shiftId;

        private Long employeeId;

        private Long objectId;

        @NotNull(message = "El importe es requerido")
        private BigDecimal amount;

        @NotBlank(message = "La descripción es requerida")
        private String description;

        private Long createdBy;
    }

    @Data
    public static class EntryActionRequest {
        /** Contrato del gestor que aprueba o paga. */
        @NotNull(message = "El contrato del gestor es requerido")
        private Long actorContractId;
    }
}
