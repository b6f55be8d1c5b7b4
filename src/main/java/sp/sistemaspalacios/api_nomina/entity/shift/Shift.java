package sp.sistemaspalacios.api_nomina.entity.shift;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import sp.sistemaspalacios.api_nomina.entity.contract.Contract;
import sp.sistemaspalacios.api_nomina.entity.shiftSchedule.ScheduleEntry;
import sp.sistemaspalacios.api_nomina.entity.workObject.WorkObject;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Ejecución real de un turno. Fechas en UTC.
 * <p>
 * activeEmployeeId y activeScheduleEntryId solo tienen valor mientras el turno está ACTIVE;
 * sus restricciones únicas garantizan en base de datos un único turno activo por empleado
 * y por entrada de horario.
 */
@Entity
@Table(name = "shifts")
@Getter
@Setter
@NoArgsConstructor
public class Shift {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "contract_id", nullable = false)
    private Contract contract;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "object_id", nullable = false)
    private WorkObject workObject;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "schedule_id")
    private ScheduleEntry scheduleEntry;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time")
    private LocalDateTime endTime;

    @Column(name = "planned_start")
    private LocalDateTime plannedStart;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ShiftStatus status = ShiftStatus.ACTIVE;

    @Column(name = "active_employee_id", unique = true)
    private Long activeEmployeeId;

    @Column(name = "active_schedule_id", unique = true)
    private Long activeScheduleEntryId;

    @Column(name = "start_coordinates")
    private String startCoordinates;

    @Column(name = "end_coordinates")
    private String endCoordinates;

    @Column(name = "total_hours", precision = 6, scale = 2)
    private BigDecimal totalHours;

    @Column(name = "hourly_rate", precision = 10, scale = 2)
    private BigDecimal hourlyRate;

    @Column(name = "total_payment", precision = 12, scale = 2)
    private BigDecimal totalPayment;

    @Column(name = "auto_closed", nullable = false)
    private Boolean autoClosed = false;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean isActive() {
        return status == ShiftStatus.ACTIVE;
    }

    public boolean isPlanned() {
        return scheduleEntry != null;
    }

    /**
     * Horas trabajadas redondeadas a 2 decimales; null mientras el turno no tenga fin.
     */
    public BigDecimal durationHours() {
        if (startTime == null || endTime == null) {
            return null;
        }
        long seconds = Math.max(0, Duration.between(startTime, endTime).getSeconds());
        return BigDecimal.valueOf(seconds)
                .divide(BigDecimal.valueOf(3600), 2, RoundingMode.HALF_UP);
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
