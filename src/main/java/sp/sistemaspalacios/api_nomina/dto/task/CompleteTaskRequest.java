package sp.sistemaspalacios.api_nomina.dto.task;

import lombok.Data;

@Data
public class CompleteTaskRequest {

    /** Referencia opaca al fichero en el almacén de evidencias. */
    private String evidenceRef;
}
