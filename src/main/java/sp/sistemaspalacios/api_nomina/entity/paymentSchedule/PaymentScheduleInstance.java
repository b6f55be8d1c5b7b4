package sp.sistemaspalacios.api_nomina.entity.paymentSchedule;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

/**
 * Instancia de pago de un calendario mensual.
 * lastPaymentDate guarda la última fecha consumida para poder repetir esa ejecución.
 */
@Entity
@Table(name = "payment_schedule_instances")
@Getter
@Setter
@NoArgsConstructor
public class PaymentScheduleInstance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "schedule_id", nullable = false)
    private PaymentSchedule schedule;

    @Column(name = "next_payment_date", nullable = false)
    private LocalDate nextPaymentDate;

    @Column(name = "last_payment_date")
    private LocalDate lastPaymentDate;

    @Column(name = "start_offset", nullable = false)
    private Integer startOffset;

    @Column(name = "end_offset", nullable = false)
    private Integer endOffset;

    @Column(name = "display_order")
    private Integer displayOrder;

    public PaymentScheduleInstance(LocalDate nextPaymentDate, int startOffset, int endOffset) {
        this.nextPaymentDate = nextPaymentDate;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
    }
}
