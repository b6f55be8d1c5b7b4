package sp.sistemaspalacios.api_nomina.exception;

import lombok.Getter;

@Getter
public class EvidenceRequiredException extends PayrollDomainException {

    private final Long taskId;

    public EvidenceRequiredException(Long taskId) {
        super("La tarea " + taskId + " requiere evidencia multimedia para completarse");
        this.taskId = taskId;
    }
}
