package sp.sistemaspalacios.api_nomina.dto.shift;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * Resultado de abrir o cerrar un objeto junto con el turno de quien lo hace.
 */
@Value
public class ObjectSessionResult {

    Long objectId;
    Long openingId;
    Long shiftId;
    LocalDateTime openedAt;
    LocalDateTime closedAt;
    ShiftCloseResult shiftClose;
}
