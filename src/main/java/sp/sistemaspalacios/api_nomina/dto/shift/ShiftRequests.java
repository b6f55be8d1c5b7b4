package sp.sistemaspalacios.api_nomina.dto.shift;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDateTime;

/** Peticiones del ciclo de vida de turnos. Fechas en UTC. */
public final class ShiftRequests {

    private ShiftRequests() {
    }

    @Data
    public static class OpenShiftRequest {
        @NotNull(message = "Employee ID es requerido")
        private Long employeeId;

        @NotNull(message = "Object ID es requerido")
        private Long objectId;

        private Long scheduleEntryId;

        private LocalDateTime at;

        private String coordinates;
    }

    @Data
    public static class CloseShiftRequest {
        private LocalDateTime at;

        private String coordinates;
    }

    @Data
    public static class ObjectActionRequest {
        @NotNull(message = "Employee ID es requerido")
        private Long employeeId;

        private Long scheduleEntryId;

        private LocalDateTime at;

        private String coordinates;
    }
}
