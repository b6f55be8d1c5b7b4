package sp.sistemaspalacios.api_nomina.controller.shift;

import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_nomina.dto.shift.ObjectSessionResult;
import sp.sistemaspalacios.api_nomina.dto.shift.ScheduleEntryCancelResult;
import sp.sistemaspalacios.api_nomina.dto.shift.ShiftCloseResult;
import sp.sistemaspalacios.api_nomina.dto.shift.ShiftRequests.CloseShiftRequest;
import sp.sistemaspalacios.api_nomina.dto.shift.ShiftRequests.ObjectActionRequest;
import sp.sistemaspalacios.api_nomina.dto.shift.ShiftRequests.OpenShiftRequest;
import sp.sistemaspalacios.api_nomina.dto.shift.ShiftView;
import sp.sistemaspalacios.api_nomina.entity.shift.Shift;
import sp.sistemaspalacios.api_nomina.service.shift.ShiftLifecycleCoordinator;

@RestController
@RequestMapping("/api")
public class ShiftLifecycleController {

    private final ShiftLifecycleCoordinator coordinator;

    public ShiftLifecycleController(ShiftLifecycleCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    // ==========================================
    // TURNOS
    // ==========================================

    @PostMapping("/shifts/open")
    public ResponseEntity<ShiftView> openShift(@Valid @RequestBody OpenShiftRequest request) {
        Shift shift = coordinator.open(request.getScheduleEntryId(), request.getEmployeeId(),
                request.getObjectId(), request.getAt(), request.getCoordinates());
        return ResponseEntity.status(HttpStatus.CREATED).body(ShiftView.from(shift));
    }

    /**
     * POST /api/shifts/{id}/close
     * Si el turno ya estaba cerrado responde 200 con alreadyClosed=true.
     */
    @PostMapping("/shifts/{id}/close")
    public ResponseEntity<ShiftCloseResult> closeShift(@PathVariable Long id,
                                                       @RequestBody(required = false) CloseShiftRequest request) {
        CloseShiftRequest body = request != null ? request : new CloseShiftRequest();
        return ResponseEntity.ok(coordinator.close(id, body.getAt(), body.getCoordinates()));
    }

    @PostMapping("/schedule-entries/{id}/cancel")
    public ResponseEntity<ScheduleEntryCancelResult> cancelEntry(@PathVariable Long id) {
        return ResponseEntity.ok(coordinator.cancel(id));
    }

    // ==========================================
    // OBJETOS
    // ==========================================

    @PostMapping("/objects/{id}/open")
    public ResponseEntity<ObjectSessionResult> openObject(@PathVariable Long id,
                                                          @Valid @RequestBody ObjectActionRequest request) {
        ObjectSessionResult result = coordinator.openObject(id, request.getEmployeeId(),
                request.getScheduleEntryId(), request.getAt(), request.getCoordinates());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @PostMapping("/objects/{id}/close")
    public ResponseEntity<ObjectSessionResult> closeObject(@PathVariable Long id,
                                                           @Valid @RequestBody ObjectActionRequest request) {
        return ResponseEntity.ok(coordinator.closeObject(id, request.getEmployeeId(), request.getAt(), request.getCoordinates()));
    }
}
