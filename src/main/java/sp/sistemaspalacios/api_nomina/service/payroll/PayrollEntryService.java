package sp.sistemaspalacios.api_nomina.service.payroll;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_nomina.dto.payroll.EntryOutcome;
import sp.sistemaspalacios.api_nomina.dto.payroll.PaymentPeriod;
import sp.sistemaspalacios.api_nomina.entity.contract.Contract;
import sp.sistemaspalacios.api_nomina.entity.contract.ManagerPermission;
import sp.sistemaspalacios.api_nomina.entity.payroll.AdjustmentKind;
import sp.sistemaspalacios.api_nomina.entity.payroll.PayrollAdjustment;
import sp.sistemaspalacios.api_nomina.entity.payroll.PayrollEntry;
import sp.sistemaspalacios.api_nomina.entity.payroll.PayrollEntryStatus;
import sp.sistemaspalacios.api_nomina.event.PayrollEntryCreatedEvent;
import sp.sistemaspalacios.api_nomina.exception.ConflictException;
import sp.sistemaspalacios.api_nomina.exception.ContractInactiveException;
import sp.sistemaspalacios.api_nomina.exception.PermissionDeniedException;
import sp.sistemaspalacios.api_nomina.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_nomina.repository.contract.ContractRepository;
import sp.sistemaspalacios.api_nomina.repository.payroll.PayrollAdjustmentRepository;
import sp.sistemaspalacios.api_nomina.repository.payroll.PayrollEntryRepository;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Entradas de nómina: una por (empleado, periodo).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PayrollEntryService {

    private final PayrollEntryRepository entryRepository;
    private final PayrollAdjustmentRepository adjustmentRepository;
    private final ContractRepository contractRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Crea o recalcula la entrada del empleado para el periodo. Suma los ajustes de los
     * turnos indicados y los ajustes sin turno creados dentro del periodo.
     * El llamador pasa todos los turnos del empleado en el periodo, de cualquier calendario.
     * Una entrada aprobada o pagada no se modifica.
     */
    @Transactional
    public EntryOutcome upsertEntry(Long employeeId, Long ownerId, Long paymentScheduleId, PaymentPeriod period,
                                    Collection<Long> shiftIds) {
        PayrollEntry entry = entryRepository
                .findByEmployeeIdAndPeriodStartAndPeriodEnd(employeeId, period.getPeriodStart(), period.getPeriodEnd())
                .orElse(null);

        if (entry != null && entry.getStatus() != PayrollEntryStatus.DRAFT) {
            log.info("ℹ️ Entrada {} del empleado {} ya está en estado {}; no se recalcula",
                    entry.getId(), employeeId, entry.getStatus());
            return EntryOutcome.FROZEN;
        }

        boolean created = entry == null;
        if (created) {
            entry = new PayrollEntry();
            entry.setEmployeeId(employeeId);
            entry.setPeriodStart(period.getPeriodStart());
            entry.setPeriodEnd(period.getPeriodEnd());
        }
        if (entry.getOwnerId() == null) {
            entry.setOwnerId(ownerId);
        }
        if (entry.getPaymentScheduleId() == null) {
            entry.setPaymentScheduleId(paymentScheduleId);
        }

        List<PayrollAdjustment> adjustments = new ArrayList<>();
        if (!shiftIds.isEmpty()) {
            adjustments.addAll(adjustmentRepository.findByEmployeeIdAndShiftIdInOrderByIdAsc(employeeId, shiftIds));
        }
        adjustments.addAll(adjustmentRepository.findShiftlessForPeriod(employeeId,
                period.getPeriodStart().atStartOfDay(), period.getPeriodEnd().plusDays(1).atStartOfDay(),
                period.getPeriodStart(), period.getPeriodEnd()));

        BigDecimal gross = BigDecimal.ZERO;
        BigDecimal bonuses = BigDecimal.ZERO;
        BigDecimal deductions = BigDecimal.ZERO;
        Set<Long> included = new HashSet<>();

        for (PayrollAdjustment adjustment : adjustments) {
            PayrollEntry linked = adjustment.getPayrollEntry();
            if (linked != null && linked != entry && linked.getStatus() != PayrollEntryStatus.DRAFT) {
                // ya pagado en otra nómina
                continue;
            }
            if (!included.add(adjustment.getId())) {
                continue;
            }
            BigDecimal amount = adjustment.getAmount();
            if (adjustment.getKind() == AdjustmentKind.BASE_PAY) {
                gross = gross.add(amount);
            } else if (amount.signum() > 0) {
                bonuses = bonuses.add(amount);
            } else {
                deductions = deductions.add(amount.abs());
            }
        }

        entry.setGrossAmount(gross);
        entry.setTotalBonuses(bonuses);
        entry.setTotalDeductions(deductions);
        entry.setNetAmount(gross.add(bonuses).subtract(deductions));
        entry.setShiftsCount(shiftIds.size());
        PayrollEntry saved = entryRepository.save(entry);

        if (!created) {
            for (PayrollAdjustment previous : adjustmentRepository.findByPayrollEntryIdOrderByIdAsc(saved.getId())) {
                if (!included.contains(previous.getId())) {
                    previous.setPayrollEntry(null);
                }
            }
        }
        for (PayrollAdjustment adjustment : adjustments) {
            if (included.contains(adjustment.getId())) {
                adjustment.setPayrollEntry(saved);
            }
        }

        eventPublisher.publishEvent(new PayrollEntryCreatedEvent(saved.getId(), employeeId,
                saved.getPeriodStart(), saved.getPeriodEnd(), saved.getNetAmount(), created));
        log.info("✅ Entrada {} {} para empleado {} [{} - {}]: neto {}",
                saved.getId(), created ? "creada" : "actualizada", employeeId,
                saved.getPeriodStart(), saved.getPeriodEnd(), saved.getNetAmount());
        return created ? EntryOutcome.CREATED : EntryOutcome.UPDATED;
    }

    @Transactional
    public PayrollEntry approve(Long entryId, Long actorContractId) {
        Contract actor = checkPermission(actorContractId, ManagerPermission.APPROVE_PAYROLL);
        PayrollEntry entry = load(entryId);
        checkSameOwner(actor, entry);
        if (entry.getStatus() != PayrollEntryStatus.DRAFT) {
            throw new ConflictException("La entrada " + entryId + " no está en borrador (estado: " + entry.getStatus() + ")");
        }
        entry.setStatus(PayrollEntryStatus.APPROVED);
        entry.setApprovedAt(LocalDateTime.now(clock));
        log.info("✅ Entrada {} aprobada por contrato {}", entryId, actorContractId);
        return entryRepository.save(entry);
    }

    @Transactional
    public PayrollEntry markPaid(Long entryId, Long actorContractId) {
        Contract actor = checkPermission(actorContractId, ManagerPermission.APPROVE_PAYROLL);
        PayrollEntry entry = load(entryId);
        checkSameOwner(actor, entry);
        if (entry.getStatus() != PayrollEntryStatus.APPROVED) {
            throw new ConflictException("Solo se pueden pagar entradas aprobadas (entrada " + entryId
                    + " en estado " + entry.getStatus() + ")");
        }
        entry.setStatus(PayrollEntryStatus.PAID);
        entry.setPaidAt(LocalDateTime.now(clock));
        log.info("✅ Entrada {} pagada por contrato {}", entryId, actorContractId);
        return entryRepository.save(entry);
    }

    @Transactional(readOnly = true)
    public List<PayrollEntry> entriesOf(Long employeeId) {
        return entryRepository.findByEmployeeIdOrderByPeriodStartDesc(employeeId);
    }

    private PayrollEntry load(Long entryId) {
        return entryRepository.findById(entryId)
                .orElseThrow(() -> new ResourceNotFoundException("Entrada de nómina con ID " + entryId + " no encontrada"));
    }

    private Contract checkPermission(Long contractId, ManagerPermission permission) {
        if (contractId == null) {
            throw new PermissionDeniedException(null, permission,
                    "Se requiere el contrato del gestor para " + permission);
        }
        Contract contract = contractRepository.findById(contractId)
                .orElseThrow(() -> new ResourceNotFoundException("Contrato con ID " + contractId + " no encontrado"));
        if (!contract.isActive()) {
            throw new ContractInactiveException(contractId, contract.getStatus().name());
        }
        if (!contract.hasPermission(permission)) {
            throw new PermissionDeniedException(contractId, permission);
        }
        return contract;
    }

    private void checkSameOwner(Contract actor, PayrollEntry entry) {
        if (entry.getOwnerId() == null || !entry.getOwnerId().equals(actor.getOwnerId())) {
            log.warn("⚠️ Contrato {} intenta operar la entrada {} de otro propietario", actor.getId(), entry.getId());
            throw new PermissionDeniedException(actor.getId(), ManagerPermission.APPROVE_PAYROLL,
                    "El contrato " + actor.getId() + " no pertenece al propietario de la entrada " + entry.getId());
        }
    }
}
