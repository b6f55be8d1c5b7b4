package sp.sistemaspalacios.api_nomina.entity.shiftSchedule;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import sp.sistemaspalacios.api_nomina.entity.workObject.WorkObject;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Franja de planificación de un objeto. Horas en hora local del objeto.
 */
@Entity
@Table(name = "time_slots")
@Getter
@Setter
@NoArgsConstructor
public class TimeSlot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "object_id", nullable = false)
    private WorkObject workObject;

    @Column(name = "slot_date", nullable = false)
    private LocalDate slotDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "hourly_rate", precision = 10, scale = 2)
    private BigDecimal hourlyRate;

    /**
     * La franja declara su propia lista de tareas (aunque esté vacía).
     * En ese caso las tareas del objeto no se usan, salvo que mergeObjectTasks sea true.
     */
    @Column(name = "custom_tasks", nullable = false)
    private Boolean customTasks = false;

    @Column(name = "merge_object_tasks", nullable = false)
    private Boolean mergeObjectTasks = false;

    @OneToMany(mappedBy = "timeSlot", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("displayOrder ASC, id ASC")
    private List<TimeSlotTaskTemplate> tasks = new ArrayList<>();

    public void addTask(TimeSlotTaskTemplate task) {
        task.setTimeSlot(this);
        tasks.add(task);
    }
}
