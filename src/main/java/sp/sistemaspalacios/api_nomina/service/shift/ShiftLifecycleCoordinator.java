package sp.sistemaspalacios.api_nomina.service.shift;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_nomina.dto.settings.EffectiveSettings;
import sp.sistemaspalacios.api_nomina.dto.shift.ObjectSessionResult;
import sp.sistemaspalacios.api_nomina.dto.shift.ScheduleEntryCancelResult;
import sp.sistemaspalacios.api_nomina.dto.shift.ShiftCloseResult;
import sp.sistemaspalacios.api_nomina.entity.contract.Contract;
import sp.sistemaspalacios.api_nomina.entity.shift.Shift;
import sp.sistemaspalacios.api_nomina.entity.shift.ShiftStatus;
import sp.sistemaspalacios.api_nomina.entity.shiftSchedule.ScheduleEntry;
import sp.sistemaspalacios.api_nomina.entity.shiftSchedule.ScheduleEntryStatus;
import sp.sistemaspalacios.api_nomina.entity.shiftSchedule.TimeSlot;
import sp.sistemaspalacios.api_nomina.entity.workObject.ObjectOpening;
import sp.sistemaspalacios.api_nomina.entity.workObject.WorkObject;
import sp.sistemaspalacios.api_nomina.event.ShiftCancelledEvent;
import sp.sistemaspalacios.api_nomina.event.ShiftClosedEvent;
import sp.sistemaspalacios.api_nomina.event.ShiftOpenedEvent;
import sp.sistemaspalacios.api_nomina.exception.ConflictException;
import sp.sistemaspalacios.api_nomina.exception.ContractInactiveException;
import sp.sistemaspalacios.api_nomina.exception.NotActiveException;
import sp.sistemaspalacios.api_nomina.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_nomina.repository.contract.ContractRepository;
import sp.sistemaspalacios.api_nomina.repository.shift.ShiftRepository;
import sp.sistemaspalacios.api_nomina.repository.shiftSchedule.ScheduleEntryRepository;
import sp.sistemaspalacios.api_nomina.repository.workObject.ObjectOpeningRepository;
import sp.sistemaspalacios.api_nomina.repository.workObject.WorkObjectRepository;
import sp.sistemaspalacios.api_nomina.service.settings.SettingsResolver;
import sp.sistemaspalacios.api_nomina.service.task.TaskLedger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.*;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Único punto que cambia el estado de turnos y entradas de horario.
 * <p>
 * Todas las transiciones se hacen con UPDATE condicionales sobre el estado actual,
 * así dos peticiones concurrentes (o un job repetido) convergen al mismo resultado.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShiftLifecycleCoordinator {

    static final Set<ScheduleEntryStatus> OPEN_ENTRY_STATUSES =
            EnumSet.of(ScheduleEntryStatus.PLANNED, ScheduleEntryStatus.CONFIRMED);

    private final ShiftRepository shiftRepository;
    private final ScheduleEntryRepository scheduleEntryRepository;
    private final ContractRepository contractRepository;
    private final WorkObjectRepository workObjectRepository;
    private final ObjectOpeningRepository objectOpeningRepository;
    private final SettingsResolver settingsResolver;
    private final TaskLedger taskLedger;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Value("${payroll.default-timezone:Europe/Moscow}")
    private String defaultTimezone;

    // ==========================================
    // APERTURA
    // ==========================================

    /**
     * Abre un turno. Si se indica una entrada de horario, esta permanece en PLANNED.
     */
    @Transactional
    public Shift open(Long scheduleEntryId, Long employeeId, Long objectId, LocalDateTime at, String coordinates) {
        log.info("🔍 Abriendo turno: empleado={}, objeto={}, entrada={}", employeeId, objectId, scheduleEntryId);

        WorkObject object = workObjectRepository.findById(objectId)
                .orElseThrow(() -> new ResourceNotFoundException("Objeto con ID " + objectId + " no encontrado"));
        if (!Boolean.TRUE.equals(object.getIsActive())) {
            throw new IllegalArgumentException("El objeto " + objectId + " no está activo");
        }

        Contract contract = findActiveContract(employeeId, object);
        if (!contract.allowsObject(objectId)) {
            throw new IllegalArgumentException(
                    "El contrato " + contract.getId() + " no permite trabajar en el objeto " + objectId);
        }

        shiftRepository.findFirstByEmployeeIdAndStatus(employeeId, ShiftStatus.ACTIVE).ifPresent(active -> {
            log.warn("⚠️ Empleado {} ya tiene el turno {} activo", employeeId, active.getId());
            throw new ConflictException(employeeId, active.getId());
        });

        ScheduleEntry entry = scheduleEntryId != null ? loadOpenEntry(scheduleEntryId, employeeId, objectId) : null;

        Shift shift = new Shift();
        shift.setEmployeeId(employeeId);
        shift.setContract(contract);
        shift.setWorkObject(object);
        shift.setScheduleEntry(entry);
        shift.setStartTime(at != null ? at : LocalDateTime.now(clock));
        shift.setPlannedStart(entry != null ? entry.getPlannedStart() : null);
        shift.setStartCoordinates(coordinates);
        shift.setStatus(ShiftStatus.ACTIVE);
        shift.setActiveEmployeeId(employeeId);
        shift.setActiveScheduleEntryId(entry != null ? entry.getId() : null);

        Shift saved;
        try {
            saved = shiftRepository.saveAndFlush(shift);
        } catch (DataIntegrityViolationException e) {
            // otra petición abrió turno para el mismo empleado o la misma entrada
            log.warn("⚠️ Conflicto de unicidad al abrir turno para empleado {}", employeeId);
            throw new ConflictException("El empleado " + employeeId + " ya tiene un turno activo");
        }

        TimeSlot slot = entry != null ? entry.getTimeSlot() : null;
        taskLedger.materializeTasks(saved, slot, object);

        eventPublisher.publishEvent(new ShiftOpenedEvent(
                saved.getId(), employeeId, objectId, entry != null ? entry.getId() : null, saved.getStartTime()));
        log.info("✅ Turno {} abierto para empleado {} en objeto {}", saved.getId(), employeeId, objectId);
        return saved;
    }

    // ==========================================
    // CIERRE
    // ==========================================

    /**
     * Cierra un turno activo. Si ya estaba cerrado devuelve el estado actual sin escribir.
     */
    @Transactional
    public ShiftCloseResult close(Long shiftId, LocalDateTime at, String coordinates) {
        Shift shift = shiftRepository.findById(shiftId)
                .orElseThrow(() -> new ResourceNotFoundException("Turno con ID " + shiftId + " no encontrado"));
        return closeShift(shift, at != null ? at : LocalDateTime.now(clock), coordinates, false);
    }

    /**
     * Cierre automático de un turno cuyo fin implícito ya pasó. El turno se cierra
     * en la hora de corte, no en la hora de ejecución del job.
     */
    @Transactional
    public Optional<ShiftCloseResult> autoClose(Long shiftId, LocalDateTime nowUtc) {
        Shift shift = shiftRepository.findById(shiftId).orElse(null);
        if (shift == null || !shift.isActive()) {
            return Optional.empty();
        }
        LocalDateTime cutoff = cutoffFor(shift);
        if (cutoff.isAfter(nowUtc)) {
            return Optional.empty();
        }
        LocalDateTime endTime = cutoff.isBefore(shift.getStartTime()) ? shift.getStartTime() : cutoff;
        log.info("⏰ Cierre automático del turno {} (corte {} UTC)", shiftId, cutoff);
        return Optional.of(closeShift(shift, endTime, null, true));
    }

    @Transactional(readOnly = true)
    public List<Long> activeShiftIds() {
        List<Long> ids = new ArrayList<>();
        for (Shift shift : shiftRepository.findByStatusOrderByIdAsc(ShiftStatus.ACTIVE)) {
            ids.add(shift.getId());
        }
        return ids;
    }

    /**
     * Hora de corte en UTC: fin de la franja, si no fin planificado de la entrada,
     * si no hora de cierre del objeto, si no medianoche local.
     */
    public LocalDateTime cutoffFor(Shift shift) {
        WorkObject object = shift.getWorkObject();
        ZoneId zone = zoneOf(object);
        LocalDateTime localStart = toLocal(shift.getStartTime(), zone);
        ScheduleEntry entry = shift.getScheduleEntry();

        if (entry != null && entry.getTimeSlot() != null && entry.getTimeSlot().getEndTime() != null) {
            TimeSlot slot = entry.getTimeSlot();
            LocalDate slotDate = slot.getSlotDate() != null ? slot.getSlotDate() : localStart.toLocalDate();
            LocalDateTime localEnd = slotDate.atTime(slot.getEndTime());
            if (slot.getStartTime() != null && !slot.getEndTime().isAfter(slot.getStartTime())) {
                localEnd = localEnd.plusDays(1);
            }
            return toUtc(localEnd, zone);
        }
        if (entry != null && entry.getPlannedEnd() != null) {
            return entry.getPlannedEnd();
        }
        if (object.getClosingTime() != null) {
            LocalDateTime localEnd = localStart.toLocalDate().atTime(object.getClosingTime());
            if (!localEnd.isAfter(localStart)) {
                localEnd = localEnd.plusDays(1);
            }
            return toUtc(localEnd, zone);
        }
        return toUtc(localStart.toLocalDate().plusDays(1).atStartOfDay(), zone);
    }

    // ==========================================
    // CANCELACIÓN
    // ==========================================

    /**
     * Cancela una entrada de horario y los turnos activos enlazados a ella.
     * Un turno completado nunca se cancela.
     */
    @Transactional
    public ScheduleEntryCancelResult cancel(Long scheduleEntryId) {
        ScheduleEntry entry = scheduleEntryRepository.findByIdForUpdate(scheduleEntryId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Entrada de horario con ID " + scheduleEntryId + " no encontrada"));

        if (entry.getStatus() == ScheduleEntryStatus.CANCELLED) {
            return new ScheduleEntryCancelResult(scheduleEntryId, true, List.of());
        }
        if (entry.getStatus() == ScheduleEntryStatus.COMPLETED) {
            throw new ConflictException("La entrada de horario " + scheduleEntryId + " ya está completada");
        }

        List<Shift> linked = shiftRepository.findByScheduleEntryIdAndStatus(scheduleEntryId, ShiftStatus.ACTIVE);
        LocalDateTime now = LocalDateTime.now(clock);

        List<Long> cancelledShiftIds = new ArrayList<>();
        List<ShiftCancelledEvent> events = new ArrayList<>();
        for (Shift shift : linked) {
            Long shiftId = shift.getId();
            Long employeeId = shift.getEmployeeId();
            if (shiftRepository.cancelIfActive(shiftId, now) == 1) {
                cancelledShiftIds.add(shiftId);
                events.add(new ShiftCancelledEvent(shiftId, employeeId, scheduleEntryId));
            }
        }

        int updated = scheduleEntryRepository.transitionIfOpen(
                scheduleEntryId, ScheduleEntryStatus.CANCELLED, false, OPEN_ENTRY_STATUSES);
        if (updated == 0) {
            ScheduleEntryStatus current = scheduleEntryRepository.findById(scheduleEntryId)
                    .map(ScheduleEntry::getStatus).orElse(null);
            if (current != ScheduleEntryStatus.CANCELLED) {
                throw new ConflictException(
                        "La entrada de horario " + scheduleEntryId + " cambió de estado a " + current);
            }
        }

        events.forEach(eventPublisher::publishEvent);
        log.info("✅ Entrada {} cancelada; turnos cancelados: {}", scheduleEntryId, cancelledShiftIds);
        return new ScheduleEntryCancelResult(scheduleEntryId, updated == 0, cancelledShiftIds);
    }

    // ==========================================
    // APERTURA Y CIERRE DE OBJETO
    // ==========================================

    @Transactional
    public ObjectSessionResult openObject(Long objectId, Long employeeId, Long scheduleEntryId,
                                          LocalDateTime at, String coordinates) {
        WorkObject object = workObjectRepository.findById(objectId)
                .orElseThrow(() -> new ResourceNotFoundException("Objeto con ID " + objectId + " no encontrado"));

        if (objectOpeningRepository.findByOpenObjectId(objectId).isPresent()) {
            throw new ConflictException("El objeto " + objectId + " ya está abierto");
        }

        LocalDateTime openedAt = at != null ? at : LocalDateTime.now(clock);
        Shift shift = open(scheduleEntryId, employeeId, objectId, openedAt, coordinates);

        ObjectOpening opening = new ObjectOpening();
        opening.setWorkObject(object);
        opening.setOpenObjectId(objectId);
        opening.setOpenedBy(employeeId);
        opening.setOpenedAt(openedAt);
        opening.setOpenCoordinates(coordinates);
        try {
            opening = objectOpeningRepository.saveAndFlush(opening);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("El objeto " + objectId + " ya está abierto");
        }

        log.info("🏢 Objeto {} abierto por empleado {}", objectId, employeeId);
        return new ObjectSessionResult(objectId, opening.getId(), shift.getId(), openedAt, null, null);
    }

    /**
     * Cierra el objeto. Primero se completa el turno del empleado y solo después
     * se registra el cierre del objeto.
     */
    @Transactional
    public ObjectSessionResult closeObject(Long objectId, Long employeeId, LocalDateTime at, String coordinates) {
        Shift shift = shiftRepository.findFirstByWorkObjectIdAndEmployeeIdAndStatus(objectId, employeeId, ShiftStatus.ACTIVE)
                .orElseThrow(() -> new NotActiveException(
                        "El empleado " + employeeId + " no tiene turno activo en el objeto " + objectId));

        long activeOnObject = shiftRepository.countByWorkObjectIdAndStatus(objectId, ShiftStatus.ACTIVE);
        if (activeOnObject > 1) {
            throw new ConflictException("En el objeto " + objectId + " trabajan otros empleados; solo el último puede cerrarlo");
        }

        LocalDateTime closedAt = at != null ? at : LocalDateTime.now(clock);
        ShiftCloseResult shiftClose = closeShift(shift, closedAt, coordinates, false);

        ObjectOpening opening = objectOpeningRepository.findByOpenObjectId(objectId)
                .orElseThrow(() -> new ConflictException("El objeto " + objectId + " no está abierto"));
        opening.setOpenObjectId(null);
        opening.setClosedBy(employeeId);
        opening.setClosedAt(closedAt);
        opening.setCloseCoordinates(coordinates);
        objectOpeningRepository.save(opening);

        log.info("🏢 Objeto {} cerrado por empleado {} tras cerrar el turno {}", objectId, employeeId, shiftClose.getShiftId());
        return new ObjectSessionResult(objectId, opening.getId(), shiftClose.getShiftId(),
                opening.getOpenedAt(), closedAt, shiftClose);
    }

    // ==========================================
    // MÉTODOS PRIVADOS
    // ==========================================

    private ShiftCloseResult closeShift(Shift shift, LocalDateTime endTime, String coordinates, boolean autoClosed) {
        Long shiftId = shift.getId();

        if (shift.getStatus() == ShiftStatus.COMPLETED) {
            log.info("ℹ️ El turno {} ya estaba cerrado", shiftId);
            return alreadyClosed(shift);
        }
        if (shift.getStatus() != ShiftStatus.ACTIVE) {
            throw new NotActiveException(shiftId, shift.getStatus().name());
        }
        if (endTime.isBefore(shift.getStartTime())) {
            throw new IllegalArgumentException("La hora de cierre no puede ser anterior al inicio del turno");
        }

        ScheduleEntry entry = shift.getScheduleEntry();
        Long entryId = entry != null ? entry.getId() : null;
        TimeSlot slot = entry != null ? entry.getTimeSlot() : null;
        WorkObject object = shift.getWorkObject();
        Long objectId = object.getId();
        Long employeeId = shift.getEmployeeId();

        EffectiveSettings settings = settingsResolver.resolve(shift.getContract(), object, object.getOrgUnit(), slot);
        BigDecimal hours = hoursBetween(shift.getStartTime(), endTime);
        BigDecimal rate = settings.getHourlyRate();
        BigDecimal payment = hours.multiply(rate).setScale(2, RoundingMode.HALF_UP);

        int updated = shiftRepository.completeIfActive(shiftId, endTime, coordinates, hours, rate, payment, autoClosed);
        if (updated == 0) {
            Shift current = shiftRepository.findById(shiftId).orElseThrow(
                    () -> new ResourceNotFoundException("Turno con ID " + shiftId + " no encontrado"));
            if (current.getStatus() == ShiftStatus.COMPLETED) {
                return alreadyClosed(current);
            }
            throw new NotActiveException(shiftId, current.getStatus().name());
        }

        if (entryId != null) {
            int entryUpdated = scheduleEntryRepository.transitionIfOpen(
                    entryId, ScheduleEntryStatus.COMPLETED, autoClosed, OPEN_ENTRY_STATUSES);
            if (entryUpdated == 0) {
                log.warn("⚠️ Turno {} cerrado pero la entrada {} ya no estaba abierta; se deja como está",
                        shiftId, entryId);
            }
        }

        eventPublisher.publishEvent(new ShiftClosedEvent(shiftId, employeeId, objectId, endTime, hours, payment, autoClosed));
        log.info("✅ Turno {} cerrado: {} h × {} = {}", shiftId, hours, rate, payment);

        return ShiftCloseResult.builder()
                .shiftId(shiftId)
                .status(ShiftStatus.COMPLETED)
                .endTime(endTime)
                .totalHours(hours)
                .hourlyRate(rate)
                .totalPayment(payment)
                .autoClosed(autoClosed)
                .alreadyClosed(false)
                .message("Turno cerrado")
                .build();
    }

    private ShiftCloseResult alreadyClosed(Shift shift) {
        return ShiftCloseResult.builder()
                .shiftId(shift.getId())
                .status(shift.getStatus())
                .endTime(shift.getEndTime())
                .totalHours(shift.getTotalHours())
                .hourlyRate(shift.getHourlyRate())
                .totalPayment(shift.getTotalPayment())
                .autoClosed(Boolean.TRUE.equals(shift.getAutoClosed()))
                .alreadyClosed(true)
                .message("El turno " + shift.getId() + " ya estaba cerrado")
                .build();
    }

    private Contract findActiveContract(Long employeeId, WorkObject object) {
        List<Contract> contracts = contractRepository.findByEmployeeIdAndOwnerIdOrderByIdDesc(employeeId, object.getOwnerId());
        if (contracts.isEmpty()) {
            throw new ResourceNotFoundException(
                    "No existe contrato del empleado " + employeeId + " con el propietario " + object.getOwnerId());
        }
        return contracts.stream()
                .filter(Contract::isActive)
                .findFirst()
                .orElseThrow(() -> new ContractInactiveException(contracts.get(0).getId(), contracts.get(0).getStatus().name()));
    }

    private ScheduleEntry loadOpenEntry(Long scheduleEntryId, Long employeeId, Long objectId) {
        ScheduleEntry entry = scheduleEntryRepository.findByIdForUpdate(scheduleEntryId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Entrada de horario con ID " + scheduleEntryId + " no encontrada"));

        if (!employeeId.equals(entry.getEmployeeId())) {
            throw new IllegalArgumentException("La entrada de horario " + scheduleEntryId + " pertenece a otro empleado");
        }
        if (!objectId.equals(entry.getWorkObject().getId())) {
            throw new IllegalArgumentException("La entrada de horario " + scheduleEntryId + " es de otro objeto");
        }
        if (!entry.getStatus().isOpen()) {
            throw new ConflictException(
                    "La entrada de horario " + scheduleEntryId + " está en estado " + entry.getStatus());
        }
        if (!shiftRepository.findByScheduleEntryIdAndStatus(scheduleEntryId, ShiftStatus.ACTIVE).isEmpty()) {
            throw new ConflictException("La entrada de horario " + scheduleEntryId + " ya tiene un turno activo");
        }
        return entry;
    }

    private ZoneId zoneOf(WorkObject object) {
        String zone = object.getTimezone() != null && !object.getTimezone().isBlank()
                ? object.getTimezone() : defaultTimezone;
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            log.warn("⚠️ Zona horaria inválida '{}' en objeto {}; se usa {}", zone, object.getId(), defaultTimezone);
            return ZoneId.of(defaultTimezone);
        }
    }

    private static LocalDateTime toLocal(LocalDateTime utc, ZoneId zone) {
        return utc.atZone(ZoneOffset.UTC).withZoneSameInstant(zone).toLocalDateTime();
    }

    private static LocalDateTime toUtc(LocalDateTime local, ZoneId zone) {
        return local.atZone(zone).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
    }

    static BigDecimal hoursBetween(LocalDateTime start, LocalDateTime end) {
        long seconds = Math.max(0, Duration.between(start, end).getSeconds());
        return BigDecimal.valueOf(seconds).divide(BigDecimal.valueOf(3600), 2, RoundingMode.HALF_UP);
    }
}
