package sp.sistemaspalacios.api_nomina.service.settings;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_nomina.dto.settings.EffectiveSettings;
import sp.sistemaspalacios.api_nomina.dto.settings.SettingsSource;
import sp.sistemaspalacios.api_nomina.entity.contract.Contract;
import sp.sistemaspalacios.api_nomina.entity.orgStructure.OrgUnit;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentSchedule;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentSystem;
import sp.sistemaspalacios.api_nomina.entity.shiftSchedule.TimeSlot;
import sp.sistemaspalacios.api_nomina.entity.workObject.WorkObject;
import sp.sistemaspalacios.api_nomina.exception.SettingsDepthExceededException;

import java.math.BigDecimal;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Resuelve la configuración efectiva de pago para (contrato, objeto, unidad).
 * <p>
 * Cada campo se resuelve por separado, de mayor a menor prioridad:
 * <ol>
 *   <li>contrato, solo si su bandera de prioridad está activa y el campo no es nulo;</li>
 *   <li>franja horaria (solo la tarifa);</li>
 *   <li>el propio objeto;</li>
 *   <li>la primera unidad ascendente que defina el campo;</li>
 *   <li>valor por defecto.</li>
 * </ol>
 * No tiene efectos secundarios. El recorrido de unidades está limitado a {@code maxDepth}
 * niveles y falla con {@link SettingsDepthExceededException} si se supera.
 */
@Slf4j
@Service
public class SettingsResolver {

    private final int maxDepth;

    public SettingsResolver(@Value("${payroll.settings.max-depth:64}") int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public EffectiveSettings resolve(Contract contract, WorkObject object, OrgUnit unit) {
        return resolve(contract, object, unit, null);
    }

    public EffectiveSettings resolve(Contract contract, WorkObject object, OrgUnit unit, TimeSlot slot) {
        if (object == null) {
            throw new IllegalArgumentException("El objeto es obligatorio para resolver la configuración");
        }
        OrgUnit startUnit = unit != null ? unit : object.getOrgUnit();

        EffectiveSettings.EffectiveSettingsBuilder builder = EffectiveSettings.builder();
        resolveRate(builder, contract, object, slot);
        resolvePaymentSystem(builder, contract, object, startUnit);
        resolvePaymentSchedule(builder, object, startUnit);
        resolveLateSettings(builder, object, startUnit);
        return builder.build();
    }

    /**
     * Calendario de pago efectivo de un objeto: el suyo propio o el de su cadena de unidades.
     * Es la única función que decide qué calendario gobierna un objeto.
     */
    public PaymentSchedule resolvePaymentSchedule(WorkObject object) {
        if (object.getPaymentSchedule() != null) {
            return object.getPaymentSchedule();
        }
        return resolvePaymentSchedule(object.getOrgUnit());
    }

    public PaymentSchedule resolvePaymentSchedule(OrgUnit unit) {
        return firstInAncestors(unit, OrgUnit::getPaymentSchedule);
    }

    // ==========================================
    // MÉTODOS PRIVADOS - CAMPOS
    // ==========================================

    private void resolveRate(EffectiveSettings.EffectiveSettingsBuilder builder,
                             Contract contract, WorkObject object, TimeSlot slot) {
        if (contract != null && Boolean.TRUE.equals(contract.getUseContractRate()) && contract.getHourlyRate() != null) {
            builder.hourlyRate(contract.getHourlyRate()).rateSource(SettingsSource.CONTRACT);
        } else if (slot != null && slot.getHourlyRate() != null) {
            builder.hourlyRate(slot.getHourlyRate()).rateSource(SettingsSource.TIME_SLOT);
        } else if (object.getHourlyRate() != null) {
            builder.hourlyRate(object.getHourlyRate()).rateSource(SettingsSource.OBJECT);
        } else {
            log.warn("⚠️ Objeto {} sin tarifa horaria; se usa 0", object.getId());
            builder.hourlyRate(BigDecimal.ZERO).rateSource(SettingsSource.DEFAULT);
        }
    }

    private void resolvePaymentSystem(EffectiveSettings.EffectiveSettingsBuilder builder,
                                      Contract contract, WorkObject object, OrgUnit unit) {
        if (contract != null && Boolean.TRUE.equals(contract.getUseContractPaymentSystem())
                && contract.getPaymentSystem() != null) {
            builder.paymentSystem(contract.getPaymentSystem()).paymentSystemSource(SettingsSource.CONTRACT);
            return;
        }
        if (object.getPaymentSystem() != null) {
            builder.paymentSystem(object.getPaymentSystem()).paymentSystemSource(SettingsSource.OBJECT);
            return;
        }
        PaymentSystem inherited = firstInAncestors(unit, OrgUnit::getPaymentSystem);
        builder.paymentSystem(inherited)
                .paymentSystemSource(inherited != null ? SettingsSource.ORG_UNIT : SettingsSource.DEFAULT);
    }

    private void resolvePaymentSchedule(EffectiveSettings.EffectiveSettingsBuilder builder,
                                        WorkObject object, OrgUnit unit) {
        if (object.getPaymentSchedule() != null) {
            builder.paymentSchedule(object.getPaymentSchedule()).paymentScheduleSource(SettingsSource.OBJECT);
            return;
        }
        PaymentSchedule inherited = firstInAncestors(unit, OrgUnit::getPaymentSchedule);
        builder.paymentSchedule(inherited)
                .paymentScheduleSource(inherited != null ? SettingsSource.ORG_UNIT : SettingsSource.DEFAULT);
    }

    // Umbral y multa se resuelven como pareja, nunca mezclando niveles
    private void resolveLateSettings(EffectiveSettings.EffectiveSettingsBuilder builder,
                                     WorkObject object, OrgUnit unit) {
        if (object.ownsLateSettings()) {
            builder.lateThresholdMinutes(object.getLateThresholdMinutes())
                    .latePenaltyPerMinute(object.getLatePenaltyPerMinute())
                    .lateSettingsSource(SettingsSource.OBJECT);
            return;
        }
        OrgUnit owner = firstAncestorMatching(unit, OrgUnit::ownsLateSettings);
        if (owner != null) {
            builder.lateThresholdMinutes(owner.getLateThresholdMinutes())
                    .latePenaltyPerMinute(owner.getLatePenaltyPerMinute())
                    .lateSettingsSource(SettingsSource.ORG_UNIT)
                    .lateSettingsInheritedFrom(owner.getName());
            return;
        }
        builder.lateThresholdMinutes(0)
                .latePenaltyPerMinute(BigDecimal.ZERO)
                .lateSettingsSource(SettingsSource.DEFAULT);
    }

    // ==========================================
    // MÉTODOS PRIVADOS - RECORRIDO DEL ÁRBOL
    // ==========================================

    private <T> T firstInAncestors(OrgUnit start, Function<OrgUnit, T> field) {
        OrgUnit owner = firstAncestorMatching(start, u -> field.apply(u) != null);
        return owner != null ? field.apply(owner) : null;
    }

    private OrgUnit firstAncestorMatching(OrgUnit start, Predicate<OrgUnit> condition) {
        OrgUnit current = start;
        int depth = 0;
        while (current != null) {
            if (depth >= maxDepth) {
                log.error("❌ Profundidad máxima {} superada desde la unidad {}", maxDepth, start.getId());
                throw new SettingsDepthExceededException(start.getId(), maxDepth);
            }
            if (condition.test(current)) {
                return current;
            }
            current = current.getParent();
            depth++;
        }
        return null;
    }
}
