package sp.sistemaspalacios.api_nomina.repository.workObject;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_nomina.entity.workObject.WorkObject;

import java.util.List;

@Repository
public interface WorkObjectRepository extends JpaRepository<WorkObject, Long> {

    List<WorkObject> findByOwnerIdAndIsActiveTrueOrderByIdAsc(Long ownerId);

    long countByOrgUnitIdAndIsActiveTrue(Long orgUnitId);
}
