package sp.sistemaspalacios.api_nomina.service.orgStructure;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import sp.sistemaspalacios.api_nomina.dto.orgStructure.OrgUnitRequests.CreateRequest;
import sp.sistemaspalacios.api_nomina.entity.orgStructure.OrgUnit;
import sp.sistemaspalacios.api_nomina.exception.ConflictException;
import sp.sistemaspalacios.api_nomina.exception.CycleDetectedException;
import sp.sistemaspalacios.api_nomina.exception.SettingsDepthExceededException;
import sp.sistemaspalacios.api_nomina.repository.orgStructure.OrgUnitRepository;
import sp.sistemaspalacios.api_nomina.repository.paymentSchedule.PaymentScheduleRepository;
import sp.sistemaspalacios.api_nomina.repository.paymentSchedule.PaymentSystemRepository;
import sp.sistemaspalacios.api_nomina.repository.workObject.WorkObjectRepository;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static sp.sistemaspalacios.api_nomina.TestFixtures.OWNER_ID;
import static sp.sistemaspalacios.api_nomina.TestFixtures.unit;

@ExtendWith(MockitoExtension.class)
class OrgUnitServiceTest {

    @Mock
    private OrgUnitRepository orgUnitRepository;
    @Mock
    private WorkObjectRepository workObjectRepository;
    @Mock
    private PaymentSystemRepository paymentSystemRepository;
    @Mock
    private PaymentScheduleRepository paymentScheduleRepository;

    private OrgUnitService service;

    // raíz(1) -> región(2) -> tienda(3); otra(4) cuelga de la raíz
    private OrgUnit root;
    private OrgUnit region;
    private OrgUnit store;
    private OrgUnit other;

    @BeforeEach
    void setUp() {
        service = new OrgUnitService(orgUnitRepository, workObjectRepository,
                paymentSystemRepository, paymentScheduleRepository, 4);
        root = unit(1L, "Raíz", null);
        region = unit(2L, "Región", root);
        store = unit(3L, "Tienda", region);
        other = unit(4L, "Otra", root);
    }

    @Test
    void createUnderParentSetsLevel() {
        when(orgUnitRepository.findById(2L)).thenReturn(Optional.of(region));
        when(orgUnitRepository.save(any(OrgUnit.class))).thenAnswer(inv -> inv.getArgument(0));

        OrgUnit created = service.create(request("Tienda sur", 2L));

        assertThat(created.getParent()).isSameAs(region);
        assertThat(created.getLevel()).isEqualTo(2);
        assertThat(created.getInheritLateSettings()).isTrue();
    }

    @Test
    void createBeyondMaxDepthIsRejected() {
        OrgUnit deep = unit(9L, "Profunda", store);
        when(orgUnitRepository.findById(9L)).thenReturn(Optional.of(deep));

        assertThatThrownBy(() -> service.create(request("Demasiado", 9L)))
                .isInstanceOf(SettingsDepthExceededException.class);
        verify(orgUnitRepository, never()).save(any());
    }

    @Test
    void movingUnitUnderItsDescendantIsACycle() {
        when(orgUnitRepository.findByIdForUpdate(2L)).thenReturn(Optional.of(region));
        when(orgUnitRepository.findByIdForUpdate(3L)).thenReturn(Optional.of(store));

        assertThatThrownBy(() -> service.move(2L, 3L)).isInstanceOf(CycleDetectedException.class);
        assertThat(region.getParent()).isSameAs(root);
        verify(orgUnitRepository, never()).save(any());
    }

    @Test
    void movingUnitUnderItselfIsACycle() {
        assertThatThrownBy(() -> service.move(2L, 2L)).isInstanceOf(CycleDetectedException.class);
    }

    @Test
    void moveRecomputesSubtreeLevels() {
        when(orgUnitRepository.findByIdForUpdate(2L)).thenReturn(Optional.of(region));
        when(orgUnitRepository.findByIdForUpdate(4L)).thenReturn(Optional.of(other));
        when(orgUnitRepository.save(any(OrgUnit.class))).thenAnswer(inv -> inv.getArgument(0));
        when(orgUnitRepository.findByParentId(2L)).thenReturn(List.of(store));
        when(orgUnitRepository.findByParentId(3L)).thenReturn(List.of());

        OrgUnit moved = service.move(2L, 4L);

        assertThat(moved.getParent()).isSameAs(other);
        assertThat(moved.getLevel()).isEqualTo(2);
        assertThat(store.getLevel()).isEqualTo(3);
    }

    @Test
    void unitWithActiveObjectsCannotBeDeactivated() {
        when(orgUnitRepository.findByIdForUpdate(3L)).thenReturn(Optional.of(store));
        when(workObjectRepository.countByOrgUnitIdAndIsActiveTrue(3L)).thenReturn(2L);

        assertThatThrownBy(() -> service.deactivate(3L)).isInstanceOf(ConflictException.class);
        assertThat(store.getIsActive()).isTrue();
    }

    @Test
    void unitWithActiveChildrenCannotBeDeactivated() {
        when(orgUnitRepository.findByIdForUpdate(2L)).thenReturn(Optional.of(region));
        when(workObjectRepository.countByOrgUnitIdAndIsActiveTrue(2L)).thenReturn(0L);
        when(orgUnitRepository.countByParentIdAndIsActiveTrue(2L)).thenReturn(1L);

        assertThatThrownBy(() -> service.deactivate(2L)).isInstanceOf(ConflictException.class);
    }

    @Test
    void emptyLeafIsDeactivated() {
        when(orgUnitRepository.findByIdForUpdate(3L)).thenReturn(Optional.of(store));
        when(workObjectRepository.countByOrgUnitIdAndIsActiveTrue(3L)).thenReturn(0L);
        when(orgUnitRepository.countByParentIdAndIsActiveTrue(3L)).thenReturn(0L);
        when(orgUnitRepository.save(store)).thenReturn(store);

        assertThat(service.deactivate(3L).getIsActive()).isFalse();
    }

    private static CreateRequest request(String name, Long parentId) {
        CreateRequest request = new CreateRequest();
        request.setOwnerId(OWNER_ID);
        request.setName(name);
        request.setParentId(parentId);
        return request;
    }
}
