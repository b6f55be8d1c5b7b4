package sp.sistemaspalacios.api_nomina.repository.workObject;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_nomina.entity.workObject.ObjectOpening;

import java.util.Optional;

@Repository
public interface ObjectOpeningRepository extends JpaRepository<ObjectOpening, Long> {

    Optional<ObjectOpening> findByOpenObjectId(Long objectId);
}
