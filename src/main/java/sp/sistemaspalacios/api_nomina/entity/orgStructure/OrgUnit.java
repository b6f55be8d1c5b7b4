package sp.sistemaspalacios.api_nomina.entity.orgStructure;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentSchedule;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentSystem;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Nodo del árbol organizativo. Un padre nulo indica la raíz.
 */
@Entity
@Table(name = "org_structure_units")
@Getter
@Setter
@NoArgsConstructor
public class OrgUnit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_id")
    private OrgUnit parent;

    @Column(nullable = false)
    private String name;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "payment_system_id")
    private PaymentSystem paymentSystem;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "payment_schedule_id")
    private PaymentSchedule paymentSchedule;

    // Multas por retraso: solo aplican si no hereda y ambos valores están definidos
    @Column(name = "inherit_late_settings", nullable = false)
    private Boolean inheritLateSettings = true;

    @Column(name = "late_threshold_minutes")
    private Integer lateThresholdMinutes;

    @Column(name = "late_penalty_per_minute", precision = 10, scale = 2)
    private BigDecimal latePenaltyPerMinute;

    @Column(nullable = false)
    private Integer level = 0;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean isRoot() {
        return parent == null;
    }

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
