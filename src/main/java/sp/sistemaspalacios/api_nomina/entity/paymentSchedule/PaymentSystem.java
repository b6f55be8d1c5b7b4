package sp.sistemaspalacios.api_nomina.entity.paymentSchedule;

import jakarta.persistence.*;
import lombok.*;

/**
 * Sistema de pago (simple_hourly, salary, hourly_bonus...).
 */
@Entity
@Table(name = "payment_systems")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentSystem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String code;

    @Column(nullable = false)
    private String name;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;

    @Column(name = "display_order")
    private Integer displayOrder;
}
