package sp.sistemaspalacios.api_nomina.entity.workObject;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import sp.sistemaspalacios.api_nomina.entity.orgStructure.OrgUnit;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentSchedule;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentSystem;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Punto físico de trabajo. Lo que no define lo hereda de su unidad organizativa.
 */
@Entity
@Table(name = "work_objects")
@Getter
@Setter
@NoArgsConstructor
public class WorkObject {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(nullable = false)
    private String name;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "org_unit_id")
    private OrgUnit orgUnit;

    @Column(name = "hourly_rate", precision = 10, scale = 2)
    private BigDecimal hourlyRate;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "payment_system_id")
    private PaymentSystem paymentSystem;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "payment_schedule_id")
    private PaymentSchedule paymentSchedule;

    @Column(name = "inherit_late_settings", nullable = false)
    private Boolean inheritLateSettings = true;

    @Column(name = "late_threshold_minutes")
    private Integer lateThresholdMinutes;

    @Column(name = "late_penalty_per_minute", precision = 10, scale = 2)
    private BigDecimal latePenaltyPerMinute;

    // Zona horaria IANA, p.ej. "Europe/Moscow"
    private String timezone;

    @Column(name = "opening_time")
    private LocalTime openingTime;

    @Column(name = "closing_time")
    private LocalTime closingTime;

    /**
     * Tareas por defecto en JSON. Admite el formato antiguo (lista de textos)
     * y el nuevo (objetos con text/is_mandatory/amount/requires_media).
     */
    @Column(name = "shift_tasks", columnDefinition = "TEXT")
    private String shiftTasks;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean ownsLateSettings() {
        return !Boolean.TRUE.equals(inheritLateSettings)
                && lateThresholdMinutes != null
                && latePenaltyPerMinute != null;
    }

    @PrePersist
    public void prePersist() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    public void preUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
