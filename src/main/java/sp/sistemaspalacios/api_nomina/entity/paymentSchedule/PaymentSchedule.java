package sp.sistemaspalacios.api_nomina.entity.paymentSchedule;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Calendario de pagos.
 * <ul>
 *   <li>WEEKLY: paymentDay es el día ISO de la semana (1=lunes ... 7=domingo).</li>
 *   <li>MONTHLY con {@link #payments}: cada instancia lleva su próxima fecha de pago.</li>
 *   <li>MONTHLY sin instancias (formato antiguo): paymentDay es el día del mes.</li>
 * </ul>
 * Los desplazamientos son días relativos a la fecha de pago (normalmente negativos).
 */
@Entity
@Table(name = "payment_schedules")
@Getter
@Setter
@NoArgsConstructor
public class PaymentSchedule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentFrequency frequency;

    @Column(name = "payment_day")
    private Integer paymentDay;

    @Column(name = "start_offset")
    private Integer startOffset;

    @Column(name = "end_offset")
    private Integer endOffset;

    // Formato mensual antiguo: pagar el mes calendario anterior completo
    @Column(name = "previous_month", nullable = false)
    private Boolean previousMonth = false;

    @OneToMany(mappedBy = "schedule", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @OrderBy("displayOrder ASC, id ASC")
    private List<PaymentScheduleInstance> payments = new ArrayList<>();

    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean hasInstances() {
        return payments != null && !payments.isEmpty();
    }

    public void addPayment(PaymentScheduleInstance instance) {
        instance.setSchedule(this);
        payments.add(instance);
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
