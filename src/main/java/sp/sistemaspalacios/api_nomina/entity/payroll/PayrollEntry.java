package sp.sistemaspalacios.api_nomina.entity.payroll;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "payroll_entries",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_payroll_entry_employee_period",
                columnNames = {"employee_id", "period_start", "period_end"}))
@Getter
@Setter
@NoArgsConstructor
public class PayrollEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Column(name = "owner_id")
    private Long ownerId;

    // Calendario que creó la entrada; no cambia en recálculos posteriores
    @Column(name = "payment_schedule_id")
    private Long paymentScheduleId;

    @Column(name = "period_start", nullable = false)
    private LocalDate periodStart;

    @Column(name = "period_end", nullable = false)
    private LocalDate periodEnd;

    @Column(name = "gross_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal grossAmount = BigDecimal.ZERO;

    @Column(name = "total_bonuses", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalBonuses = BigDecimal.ZERO;

    @Column(name = "total_deductions", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalDeductions = BigDecimal.ZERO;

    @Column(name = "net_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal netAmount = BigDecimal.ZERO;

    @Column(name = "shifts_count", nullable = false)
    private Integer shiftsCount = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PayrollEntryStatus status = PayrollEntryStatus.DRAFT;

    private LocalDateTime approvedAt;
    private LocalDateTime paidAt;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

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
