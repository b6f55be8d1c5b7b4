package sp.sistemaspalacios.api_nomina.entity.payroll;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import sp.sistemaspalacios.api_nomina.entity.shift.Shift;
import sp.sistemaspalacios.api_nomina.entity.task.ShiftTask;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Línea monetaria con signo asociada a un turno, o solo al empleado en los ajustes manuales.
 * <p>
 * Las automáticas llevan naturalKey = "shiftId:KIND" (única), lo que limita a una fila
 * por turno y tipo. Las manuales no tienen clave natural.
 */
@Entity
@Table(name = "payroll_adjustments")
@Getter
@Setter
@NoArgsConstructor
public class PayrollAdjustment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "shift_id")
    private Shift shift;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Column(name = "object_id")
    private Long objectId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AdjustmentKind kind;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(nullable = false)
    private Boolean automatic = true;

    @Column(name = "natural_key", unique = true)
    private String naturalKey;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "shift_task_id")
    private ShiftTask shiftTask;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "payroll_entry_id")
    private PayrollEntry payrollEntry;

    @Column(name = "created_by")
    private Long createdBy;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static String naturalKey(Long shiftId, AdjustmentKind kind) {
        return shiftId + ":" + kind.name();
    }

    @PrePersist
    public void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
        this.updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    public void preUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
