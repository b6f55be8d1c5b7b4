package sp.sistemaspalacios.api_nomina.dto.task;

import lombok.Builder;
import lombok.Value;
import sp.sistemaspalacios.api_nomina.entity.task.TaskSource;

import java.math.BigDecimal;

/**
 * Definición de tarea normalizada, independiente del formato en que se configuró.
 */
@Value
@Builder
public class TaskDefinition {

    String text;
    boolean mandatory;
    BigDecimal amount;
    boolean requiresMedia;
    TaskSource source;
    Long sourceId;
}
