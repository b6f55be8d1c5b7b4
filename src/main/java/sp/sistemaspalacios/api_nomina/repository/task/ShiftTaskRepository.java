package sp.sistemaspalacios.api_nomina.repository.task;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_nomina.entity.task.ShiftTask;

import java.util.List;

@Repository
public interface ShiftTaskRepository extends JpaRepository<ShiftTask, Long> {

    List<ShiftTask> findByShiftIdOrderByIdAsc(Long shiftId);
}
