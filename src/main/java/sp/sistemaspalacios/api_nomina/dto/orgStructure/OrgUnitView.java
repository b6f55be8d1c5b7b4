package sp.sistemaspalacios.api_nomina.dto.orgStructure;

import lombok.Builder;
import lombok.Value;
import sp.sistemaspalacios.api_nomina.entity.orgStructure.OrgUnit;

@Value
@Builder
public class OrgUnitView {

    Long id;
    Long ownerId;
    Long parentId;
    String name;
    int level;
    boolean active;
    Long paymentScheduleId;
    String paymentSystemCode;

    public static OrgUnitView from(OrgUnit unit) {
        return OrgUnitView.builder()
                .id(unit.getId())
                .ownerId(unit.getOwnerId())
                .parentId(unit.getParent() != null ? unit.getParent().getId() : null)
                .name(unit.getName())
                .level(unit.getLevel())
                .active(Boolean.TRUE.equals(unit.getIsActive()))
                .paymentScheduleId(unit.getPaymentSchedule() != null ? unit.getPaymentSchedule().getId() : null)
                .paymentSystemCode(unit.getPaymentSystem() != null ? unit.getPaymentSystem().getCode() : null)
                .build();
    }
}
