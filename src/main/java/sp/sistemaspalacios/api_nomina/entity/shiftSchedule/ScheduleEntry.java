package sp.sistemaspalacios.api_nomina.entity.shiftSchedule;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import sp.sistemaspalacios.api_nomina.entity.workObject.WorkObject;

import java.time.LocalDateTime;

/**
 * Turno planificado. Las fechas se guardan en UTC.
 * El estado solo lo modifica ShiftLifecycleCoordinator.
 */
@Entity
@Table(name = "shift_schedules")
@Getter
@Setter
@NoArgsConstructor
public class ScheduleEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "object_id", nullable = false)
    private WorkObject workObject;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "time_slot_id")
    private TimeSlot timeSlot;

    @Column(name = "planned_start", nullable = false)
    private LocalDateTime plannedStart;

    @Column(name = "planned_end", nullable = false)
    private LocalDateTime plannedEnd;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ScheduleEntryStatus status = ScheduleEntryStatus.PLANNED;

    @Column(name = "auto_closed", nullable = false)
    private Boolean autoClosed = false;

    @Column(columnDefinition = "TEXT")
    private String notes;

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
