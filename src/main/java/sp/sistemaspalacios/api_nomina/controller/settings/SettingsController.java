package sp.sistemaspalacios.api_nomina.controller.settings;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_nomina.dto.payroll.PaymentPeriod;
import sp.sistemaspalacios.api_nomina.dto.settings.EffectiveSettings;
import sp.sistemaspalacios.api_nomina.service.payroll.PaymentScheduleService;
import sp.sistemaspalacios.api_nomina.service.settings.EffectiveSettingsService;

import java.time.LocalDate;

/**
 * Consultas de solo lectura para la web.
 */
@RestController
@RequestMapping("/api")
public class SettingsController {

    private final EffectiveSettingsService effectiveSettingsService;
    private final PaymentScheduleService paymentScheduleService;

    public SettingsController(EffectiveSettingsService effectiveSettingsService,
                              PaymentScheduleService paymentScheduleService) {
        this.effectiveSettingsService = effectiveSettingsService;
        this.paymentScheduleService = paymentScheduleService;
    }

    @GetMapping("/settings/effective")
    public ResponseEntity<EffectiveSettings> effectiveSettings(@RequestParam(required = false) Long contractId,
                                                               @RequestParam Long objectId) {
        return ResponseEntity.ok(effectiveSettingsService.effectiveFor(contractId, objectId));
    }

    /**
     * GET /api/payment-schedules/{id}/period?date=2025-11-18
     * 204 si la fecha no es día de pago del calendario.
     */
    @GetMapping("/payment-schedules/{id}/period")
    public ResponseEntity<PaymentPeriod> period(@PathVariable Long id,
                                                @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return paymentScheduleService.previewPeriod(id, date)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
