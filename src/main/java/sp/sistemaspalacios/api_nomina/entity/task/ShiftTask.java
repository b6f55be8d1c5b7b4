package sp.sistemaspalacios.api_nomina.entity.task;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import sp.sistemaspalacios.api_nomina.entity.shift.Shift;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Tarea asignada a un turno (copia de la configuración vigente al abrirlo).
 */
@Entity
@Table(name = "shift_tasks")
@Getter
@Setter
@NoArgsConstructor
public class ShiftTask {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "shift_id", nullable = false)
    private Shift shift;

    @Column(name = "task_text", nullable = false)
    private String taskText;

    @Column(name = "is_mandatory", nullable = false)
    private Boolean isMandatory = true;

    // El signo distingue multa (negativo) de bono (positivo)
    @Column(precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(name = "requires_media", nullable = false)
    private Boolean requiresMedia = false;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskSource source;

    @Column(name = "source_id")
    private Long sourceId;

    @Column(name = "is_completed", nullable = false)
    private Boolean isCompleted = false;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    // Referencia opaca al almacén de medios
    @Column(name = "evidence_ref")
    private String evidenceRef;

    public boolean mandatory() {
        return Boolean.TRUE.equals(isMandatory);
    }

    public boolean completed() {
        return Boolean.TRUE.equals(isCompleted);
    }
}
