package sp.sistemaspalacios.api_nomina.controller.payroll;

import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_nomina.config.BusinessClock;
import sp.sistemaspalacios.api_nomina.dto.payroll.AdjustmentResult;
import sp.sistemaspalacios.api_nomina.dto.payroll.AdjustmentView;
import sp.sistemaspalacios.api_nomina.dto.payroll.PayrollRequests.EntryActionRequest;
import sp.sistemaspalacios.api_nomina.dto.payroll.PayrollRequests.ManualAdjustmentRequest;
import sp.sistemaspalacios.api_nomina.dto.payroll.PayrollRunResult;
import sp.sistemaspalacios.api_nomina.entity.payroll.PayrollEntry;
import sp.sistemaspalacios.api_nomina.service.payroll.PayrollAdjustmentEngine;
import sp.sistemaspalacios.api_nomina.service.payroll.PayrollAdjustmentService;
import sp.sistemaspalacios.api_nomina.service.payroll.PayrollEntryService;
import sp.sistemaspalacios.api_nomina.service.payroll.PayrollPeriodBuilder;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/payroll")
public class PayrollController {

    private final PayrollAdjustmentEngine adjustmentEngine;
    private final PayrollAdjustmentService adjustmentService;
    private final PayrollPeriodBuilder periodBuilder;
    private final PayrollEntryService entryService;
    private final BusinessClock businessClock;

    public PayrollController(PayrollAdjustmentEngine adjustmentEngine,
                             PayrollAdjustmentService adjustmentService,
                             PayrollPeriodBuilder periodBuilder,
                             PayrollEntryService entryService,
                             BusinessClock businessClock) {
        this.adjustmentEngine = adjustmentEngine;
        this.adjustmentService = adjustmentService;
        this.periodBuilder = periodBuilder;
        this.entryService = entryService;
        this.businessClock = businessClock;
    }

    // ==========================================
    // EJECUCIONES (REPROCESO MANUAL)
    // ==========================================

    @PostMapping("/adjustments/run")
    public ResponseEntity<AdjustmentResult> runAdjustments(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate targetDate) {
        return ResponseEntity.ok(adjustmentEngine.processWindow(targetDate != null ? targetDate : businessClock.today()));
    }

    @PostMapping("/entries/run")
    public ResponseEntity<PayrollRunResult> runEntries(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate targetDate) {
        return ResponseEntity.ok(periodBuilder.run(targetDate != null ? targetDate : businessClock.today()));
    }

    // ==========================================
    // AJUSTES MANUALES
    // ==========================================

    @PostMapping("/adjustments/manual")
    public ResponseEntity<AdjustmentView> createManual(@Valid @RequestBody ManualAdjustmentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(AdjustmentView.from(adjustmentService.createManual(request)));
    }

    @DeleteMapping("/adjustments/{id}")
    public ResponseEntity<Void> deleteManual(@PathVariable Long id) {
        adjustmentService.deleteManual(id);
        return ResponseEntity.noContent().build();
    }

    // ==========================================
    // ENTRADAS
    // ==========================================

    @GetMapping("/entries")
    public ResponseEntity<List<PayrollEntry>> entries(@RequestParam Long employeeId) {
        return ResponseEntity.ok(entryService.entriesOf(employeeId));
    }

    @PostMapping("/entries/{id}/approve")
    public ResponseEntity<PayrollEntry> approve(@PathVariable Long id,
                                                @Valid @RequestBody EntryActionRequest request) {
        return ResponseEntity.ok(entryService.approve(id, request.getActorContractId()));
    }

    @PostMapping("/entries/{id}/paid")
    public ResponseEntity<PayrollEntry> markPaid(@PathVariable Long id,
                                                 @Valid @RequestBody EntryActionRequest request) {
        return ResponseEntity.ok(entryService.markPaid(id, request.getActorContractId()));
    }
}
