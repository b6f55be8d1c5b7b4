package sp.sistemaspalacios.api_nomina.repository.orgStructure;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_nomina.entity.orgStructure.OrgUnit;

import java.util.List;
import java.util.Optional;

@Repository
public interface OrgUnitRepository extends JpaRepository<OrgUnit, Long> {

    List<OrgUnit> findByOwnerIdAndIsActiveTrueOrderByLevelAscIdAsc(Long ownerId);

    List<OrgUnit> findByParentId(Long parentId);

    long countByParentIdAndIsActiveTrue(Long parentId);

    /**
     * Bloquea la fila para serializar movimientos dentro del árbol.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM OrgUnit u WHERE u.id = :id")
    Optional<OrgUnit> findByIdForUpdate(@Param("id") Long id);
}
