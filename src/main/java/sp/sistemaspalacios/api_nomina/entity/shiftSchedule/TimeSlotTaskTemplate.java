package sp.sistemaspalacios.api_nomina.entity.shiftSchedule;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

@Entity
@Table(name = "timeslot_task_templates")
@Getter
@Setter
@NoArgsConstructor
public class TimeSlotTaskTemplate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "timeslot_id", nullable = false)
    private TimeSlot timeSlot;

    @Column(name = "task_text", nullable = false)
    private String taskText;

    @Column(name = "is_mandatory", nullable = false)
    private Boolean isMandatory = true;

    // Negativo = multa, positivo = bono
    @Column(precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(name = "requires_media", nullable = false)
    private Boolean requiresMedia = false;

    @Column(name = "display_order")
    private Integer displayOrder;
}
