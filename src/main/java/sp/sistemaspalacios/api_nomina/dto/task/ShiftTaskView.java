package sp.sistemaspalacios.api_nomina.dto.task;

import lombok.Builder;
import lombok.Value;
import sp.sistemaspalacios.api_nomina.entity.task.ShiftTask;
import sp.sistemaspalacios.api_nomina.entity.task.TaskSource;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Value
@Builder
public class ShiftTaskView {

    Long id;
    Long shiftId;
    String text;
    boolean mandatory;
    BigDecimal amount;
    boolean requiresMedia;
    TaskSource source;
    boolean completed;
    LocalDateTime completedAt;
    String evidenceRef;

    public static ShiftTaskView from(ShiftTask task) {
        return ShiftTaskView.builder()
                .id(task.getId())
                .shiftId(task.getShift().getId())
                .text(task.getTaskText())
                .mandatory(task.mandatory())
                .amount(task.getAmount())
                .requiresMedia(Boolean.TRUE.equals(task.getRequiresMedia()))
                .source(task.getSource())
                .completed(task.completed())
                .completedAt(task.getCompletedAt())
                .evidenceRef(task.getEvidenceRef())
                .build();
    }
}
