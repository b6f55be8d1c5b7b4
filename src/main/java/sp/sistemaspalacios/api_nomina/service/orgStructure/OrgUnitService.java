package sp.sistemaspalacios.api_nomina.service.orgStructure;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_nomina.dto.orgStructure.OrgUnitRequests.CreateRequest;
import sp.sistemaspalacios.api_nomina.entity.orgStructure.OrgUnit;
import sp.sistemaspalacios.api_nomina.exception.ConflictException;
import sp.sistemaspalacios.api_nomina.exception.CycleDetectedException;
import sp.sistemaspalacios.api_nomina.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_nomina.exception.SettingsDepthExceededException;
import sp.sistemaspalacios.api_nomina.repository.orgStructure.OrgUnitRepository;
import sp.sistemaspalacios.api_nomina.repository.paymentSchedule.PaymentScheduleRepository;
import sp.sistemaspalacios.api_nomina.repository.paymentSchedule.PaymentSystemRepository;
import sp.sistemaspalacios.api_nomina.repository.workObject.WorkObjectRepository;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Escritura del árbol de unidades organizativas.
 * <p>
 * Los movimientos bloquean la unidad y su nuevo padre (en orden de id) y comprueban
 * ciclos antes de confirmar, de modo que el árbol nunca queda con un ciclo.
 */
@Slf4j
@Service
public class OrgUnitService {

    private final OrgUnitRepository orgUnitRepository;
    private final WorkObjectRepository workObjectRepository;
    private final PaymentSystemRepository paymentSystemRepository;
    private final PaymentScheduleRepository paymentScheduleRepository;
    private final int maxDepth;

    public OrgUnitService(OrgUnitRepository orgUnitRepository,
                          WorkObjectRepository workObjectRepository,
                          PaymentSystemRepository paymentSystemRepository,
                          PaymentScheduleRepository paymentScheduleRepository,
                          @Value("${payroll.settings.max-depth:64}") int maxDepth) {
        this.orgUnitRepository = orgUnitRepository;
        this.workObjectRepository = workObjectRepository;
        this.paymentSystemRepository = paymentSystemRepository;
        this.paymentScheduleRepository = paymentScheduleRepository;
        this.maxDepth = maxDepth;
    }

    @Transactional
    public OrgUnit create(CreateRequest request) {
        OrgUnit unit = new OrgUnit();
        unit.setOwnerId(request.getOwnerId());
        unit.setName(request.getName().trim());

        if (request.getParentId() != null) {
            OrgUnit parent = findUnit(request.getParentId());
            if (!parent.getOwnerId().equals(request.getOwnerId())) {
                throw new IllegalArgumentException("La unidad padre pertenece a otro propietario");
            }
            if (!Boolean.TRUE.equals(parent.getIsActive())) {
                throw new IllegalArgumentException("La unidad padre " + parent.getId() + " no está activa");
            }
            unit.setParent(parent);
            unit.setLevel(parent.getLevel() + 1);
            if (unit.getLevel() >= maxDepth) {
                throw new SettingsDepthExceededException(parent.getId(), maxDepth);
            }
        }

        if (request.getPaymentSystemId() != null) {
            unit.setPaymentSystem(paymentSystemRepository.findById(request.getPaymentSystemId())
                    .orElseThrow(() -> new ResourceNotFoundException(
                            "Sistema de pago con ID " + request.getPaymentSystemId() + " no encontrado")));
        }
        if (request.getPaymentScheduleId() != null) {
            unit.setPaymentSchedule(paymentScheduleRepository.findById(request.getPaymentScheduleId())
                    .orElseThrow(() -> new ResourceNotFoundException(
                            "Calendario con ID " + request.getPaymentScheduleId() + " no encontrado")));
        }

        unit.setInheritLateSettings(!Boolean.FALSE.equals(request.getInheritLateSettings()));
        unit.setLateThresholdMinutes(request.getLateThresholdMinutes());
        unit.setLatePenaltyPerMinute(request.getLatePenaltyPerMinute());

        OrgUnit saved = orgUnitRepository.save(unit);
        log.info("✅ Unidad {} '{}' creada (nivel {})", saved.getId(), saved.getName(), saved.getLevel());
        return saved;
    }

    /**
     * Cambia el padre de una unidad y recalcula el nivel de todo su subárbol.
     */
    @Transactional
    public OrgUnit move(Long unitId, Long newParentId) {
        if (unitId.equals(newParentId)) {
            throw new CycleDetectedException(unitId, newParentId);
        }

        OrgUnit unit;
        OrgUnit newParent = null;
        if (newParentId == null) {
            unit = lockUnit(unitId);
        } else if (unitId < newParentId) {
            unit = lockUnit(unitId);
            newParent = lockUnit(newParentId);
        } else {
            newParent = lockUnit(newParentId);
            unit = lockUnit(unitId);
        }

        if (newParent != null) {
            if (!newParent.getOwnerId().equals(unit.getOwnerId())) {
                throw new IllegalArgumentException("No se puede mover una unidad bajo otro propietario");
            }
            if (!Boolean.TRUE.equals(newParent.getIsActive())) {
                throw new IllegalArgumentException("La unidad destino " + newParentId + " no está activa");
            }
            checkNoCycle(unit, newParent);
        }

        unit.setParent(newParent);
        unit.setLevel(newParent != null ? newParent.getLevel() + 1 : 0);
        OrgUnit saved = orgUnitRepository.save(unit);
        int updated = recomputeSubtreeLevels(saved);

        log.info("✅ Unidad {} movida bajo {} ({} descendientes actualizados)", unitId, newParentId, updated);
        return saved;
    }

    /**
     * Desactiva una unidad sin objetos activos ni subunidades activas.
     */
    @Transactional
    public OrgUnit deactivate(Long unitId) {
        OrgUnit unit = lockUnit(unitId);
        if (!Boolean.TRUE.equals(unit.getIsActive())) {
            return unit;
        }
        long activeObjects = workObjectRepository.countByOrgUnitIdAndIsActiveTrue(unitId);
        if (activeObjects > 0) {
            throw new ConflictException("La unidad " + unitId + " tiene " + activeObjects + " objetos activos");
        }
        long activeChildren = orgUnitRepository.countByParentIdAndIsActiveTrue(unitId);
        if (activeChildren > 0) {
            throw new ConflictException("La unidad " + unitId + " tiene " + activeChildren + " subunidades activas");
        }
        unit.setIsActive(false);
        log.info("✅ Unidad {} desactivada", unitId);
        return orgUnitRepository.save(unit);
    }

    @Transactional(readOnly = true)
    public List<OrgUnit> tree(Long ownerId) {
        return orgUnitRepository.findByOwnerIdAndIsActiveTrueOrderByLevelAscIdAsc(ownerId);
    }

    // ==========================================
    // MÉTODOS PRIVADOS
    // ==========================================

    private void checkNoCycle(OrgUnit unit, OrgUnit newParent) {
        OrgUnit current = newParent;
        int depth = 0;
        while (current != null) {
            if (current.getId().equals(unit.getId())) {
                log.warn("⚠️ Ciclo detectado moviendo {} bajo {}", unit.getId(), newParent.getId());
                throw new CycleDetectedException(unit.getId(), newParent.getId());
            }
            if (++depth > maxDepth) {
                throw new SettingsDepthExceededException(newParent.getId(), maxDepth);
            }
            current = current.getParent();
        }
    }

    private int recomputeSubtreeLevels(OrgUnit root) {
        int updated = 0;
        Deque<OrgUnit> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            OrgUnit parent = pending.pop();
            for (OrgUnit child : orgUnitRepository.findByParentId(parent.getId())) {
                int level = parent.getLevel() + 1;
                if (level >= maxDepth) {
                    throw new SettingsDepthExceededException(root.getId(), maxDepth);
                }
                child.setLevel(level);
                orgUnitRepository.save(child);
                pending.push(child);
                updated++;
            }
        }
        return updated;
    }

    private OrgUnit lockUnit(Long unitId) {
        return orgUnitRepository.findByIdForUpdate(unitId)
                .orElseThrow(() -> new ResourceNotFoundException("Unidad con ID " + unitId + " no encontrada"));
    }

    private OrgUnit findUnit(Long unitId) {
        return orgUnitRepository.findById(unitId)
                .orElseThrow(() -> new ResourceNotFoundException("Unidad con ID " + unitId + " no encontrada"));
    }
}
