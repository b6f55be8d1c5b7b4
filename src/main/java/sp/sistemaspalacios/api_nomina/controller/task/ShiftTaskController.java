package sp.sistemaspalacios.api_nomina.controller.task;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_nomina.dto.task.CompleteTaskRequest;
import sp.sistemaspalacios.api_nomina.dto.task.ShiftTaskView;
import sp.sistemaspalacios.api_nomina.service.task.TaskLedger;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api")
public class ShiftTaskController {

    private final TaskLedger taskLedger;

    public ShiftTaskController(TaskLedger taskLedger) {
        this.taskLedger = taskLedger;
    }

    @GetMapping("/shifts/{id}/tasks")
    public ResponseEntity<List<ShiftTaskView>> tasksOfShift(@PathVariable Long id) {
        List<ShiftTaskView> tasks = taskLedger.tasksOf(id).stream()
                .map(ShiftTaskView::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(tasks);
    }

    @PostMapping("/tasks/{id}/complete")
    public ResponseEntity<ShiftTaskView> completeTask(@PathVariable Long id,
                                                      @RequestBody(required = false) CompleteTaskRequest request) {
        String evidenceRef = request != null ? request.getEvidenceRef() : null;
        return ResponseEntity.ok(ShiftTaskView.from(taskLedger.complete(id, evidenceRef)));
    }
}
