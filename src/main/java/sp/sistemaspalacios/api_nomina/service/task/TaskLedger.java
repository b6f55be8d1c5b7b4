package sp.sistemaspalacios.api_nomina.service.task;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_nomina.dto.task.TaskDefinition;
import sp.sistemaspalacios.api_nomina.entity.shift.Shift;
import sp.sistemaspalacios.api_nomina.entity.shiftSchedule.TimeSlot;
import sp.sistemaspalacios.api_nomina.entity.task.ShiftTask;
import sp.sistemaspalacios.api_nomina.entity.workObject.WorkObject;
import sp.sistemaspalacios.api_nomina.exception.EvidenceRequiredException;
import sp.sistemaspalacios.api_nomina.exception.NotActiveException;
import sp.sistemaspalacios.api_nomina.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_nomina.repository.task.ShiftTaskRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Registro de tareas por turno.
 * <p>
 * Una sola fuente aporta la lista de un turno: si la franja declara sus propias tareas
 * (aunque sea una lista vacía) se usan esas y las del objeto se ignoran, salvo que la
 * franja pida combinarlas. Sin franja propia se usan las tareas por defecto del objeto.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskLedger {

    private final ShiftTaskRepository shiftTaskRepository;
    private final TaskDefinitionAdapter taskDefinitionAdapter;
    private final Clock clock;

    public List<TaskDefinition> resolveDefinitions(TimeSlot slot, WorkObject object) {
        if (slot != null && Boolean.TRUE.equals(slot.getCustomTasks())) {
            List<TaskDefinition> definitions = new ArrayList<>(taskDefinitionAdapter.fromTimeSlot(slot));
            if (Boolean.TRUE.equals(slot.getMergeObjectTasks())) {
                definitions.addAll(taskDefinitionAdapter.fromObject(object));
            }
            return definitions;
        }
        return taskDefinitionAdapter.fromObject(object);
    }

    /**
     * Crea las tareas del turno. Si el turno ya tiene tareas las devuelve sin duplicarlas.
     */
    @Transactional
    public List<ShiftTask> materializeTasks(Shift shift, TimeSlot slot, WorkObject object) {
        List<ShiftTask> existing = shiftTaskRepository.findByShiftIdOrderByIdAsc(shift.getId());
        if (!existing.isEmpty()) {
            return existing;
        }

        List<ShiftTask> tasks = new ArrayList<>();
        for (TaskDefinition definition : resolveDefinitions(slot, object)) {
            ShiftTask task = new ShiftTask();
            task.setShift(shift);
            task.setTaskText(definition.getText());
            task.setIsMandatory(definition.isMandatory());
            task.setAmount(definition.getAmount());
            task.setRequiresMedia(definition.isRequiresMedia());
            task.setSource(definition.getSource());
            task.setSourceId(definition.getSourceId());
            tasks.add(task);
        }

        if (tasks.isEmpty()) {
            return tasks;
        }
        List<ShiftTask> saved = shiftTaskRepository.saveAll(tasks);
        log.info("📋 {} tareas asignadas al turno {} (fuente: {})",
                saved.size(), shift.getId(), saved.get(0).getSource());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ShiftTask> tasksOf(Long shiftId) {
        return shiftTaskRepository.findByShiftIdOrderByIdAsc(shiftId);
    }

    /**
     * Marca la tarea como completada. Solo mientras el turno está activo:
     * al cerrarse, el estado de las tareas queda fijado para la nómina.
     */
    @Transactional
    public ShiftTask complete(Long taskId, String evidenceRef) {
        ShiftTask task = shiftTaskRepository.findById(taskId)
                .orElseThrow(() -> new ResourceNotFoundException("Tarea con ID " + taskId + " no encontrada"));

        Shift shift = task.getShift();
        if (!shift.isActive()) {
            throw new NotActiveException(shift.getId(), shift.getStatus().name());
        }
        if (Boolean.TRUE.equals(task.getRequiresMedia()) && (evidenceRef == null || evidenceRef.isBlank())) {
            throw new EvidenceRequiredException(taskId);
        }
        if (task.completed()) {
            return task;
        }

        task.setIsCompleted(true);
        task.setCompletedAt(LocalDateTime.now(clock));
        task.setEvidenceRef(evidenceRef);
        ShiftTask saved = shiftTaskRepository.save(task);
        log.info("✅ Tarea {} completada en turno {}", taskId, shift.getId());
        return saved;
    }
}
