package sp.sistemaspalacios.api_nomina.dto.orgStructure;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

/** Peticiones sobre la estructura organizativa */
public final class OrgUnitRequests {

    private OrgUnitRequests() {
    }

    @Data
    public static class CreateRequest {
        @NotNull(message = "El propietario es requerido")
        private Long ownerId;

        private Long parentId;

        @NotBlank(message = "El nombre es requerido")
        private String name;

        private Long paymentSystemId;

        private Long paymentScheduleId;

        private Boolean inheritLateSettings = true;

        @Min(value = 0, message = "El umbral de retraso no puede ser negativo")
        private Integer lateThresholdMinutes;

        private BigDecimal latePenaltyPerMinute;
    }

    @Data
    public static class MoveRequest {
        /** null mueve la unidad a la raíz. */
        private Long newParentId;
    }
}
