package sp.sistemaspalacios.api_nomina.service.payroll;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_nomina.dto.payroll.PaymentPeriod;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentSchedule;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentScheduleInstance;
import sp.sistemaspalacios.api_nomina.entity.workObject.WorkObject;
import sp.sistemaspalacios.api_nomina.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_nomina.repository.paymentSchedule.PaymentScheduleRepository;
import sp.sistemaspalacios.api_nomina.repository.workObject.WorkObjectRepository;
import sp.sistemaspalacios.api_nomina.service.settings.SettingsResolver;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentScheduleService {

    private final PaymentScheduleRepository scheduleRepository;
    private final WorkObjectRepository workObjectRepository;
    private final PeriodCalculator periodCalculator;
    private final SettingsResolver settingsResolver;

    @Transactional(readOnly = true)
    public Optional<PaymentPeriod> previewPeriod(Long scheduleId, LocalDate date) {
        PaymentSchedule schedule = scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new ResourceNotFoundException("Calendario con ID " + scheduleId + " no encontrado"));
        return periodCalculator.periodForDate(schedule, date);
    }

    /**
     * Objetos activos cuyo calendario efectivo es el indicado: el propio del objeto o el de
     * la primera unidad ascendente que lo defina. Una unidad hija con calendario propio
     * queda así fuera del calendario de su padre.
     */
    @Transactional(readOnly = true)
    public List<Long> governedObjectIds(PaymentSchedule schedule) {
        List<Long> governed = new ArrayList<>();
        for (WorkObject object : workObjectRepository.findByOwnerIdAndIsActiveTrueOrderByIdAsc(schedule.getOwnerId())) {
            PaymentSchedule effective = settingsResolver.resolvePaymentSchedule(object);
            if (effective != null && schedule.getId().equals(effective.getId())) {
                governed.add(object.getId());
            }
        }
        return governed;
    }

    /**
     * Marca la instancia como pagada en {@code paidOn} y la mueve al mes siguiente.
     * Repetir la llamada con la misma fecha no la vuelve a mover.
     */
    @Transactional
    public void advanceInstance(Long scheduleId, Long instanceId, LocalDate paidOn) {
        PaymentSchedule schedule = scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new ResourceNotFoundException("Calendario con ID " + scheduleId + " no encontrado"));

        for (PaymentScheduleInstance instance : schedule.getPayments()) {
            if (!instance.getId().equals(instanceId)) {
                continue;
            }
            instance.setLastPaymentDate(paidOn);
            if (paidOn.equals(instance.getNextPaymentDate())) {
                instance.setNextPaymentDate(paidOn.plusMonths(1));
                log.info("📅 Instancia {} del calendario {}: próximo pago {}", instanceId, scheduleId, instance.getNextPaymentDate());
            }
            scheduleRepository.save(schedule);
            return;
        }
        throw new ResourceNotFoundException("Instancia " + instanceId + " no pertenece al calendario " + scheduleId);
    }
}
