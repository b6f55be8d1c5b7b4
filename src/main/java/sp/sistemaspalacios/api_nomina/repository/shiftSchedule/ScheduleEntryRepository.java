package sp.sistemaspalacios.api_nomina.repository.shiftSchedule;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_nomina.entity.shiftSchedule.ScheduleEntry;
import sp.sistemaspalacios.api_nomina.entity.shiftSchedule.ScheduleEntryStatus;

import java.util.Collection;
import java.util.Optional;

@Repository
public interface ScheduleEntryRepository extends JpaRepository<ScheduleEntry, Long> {

    /**
     * Bloquea la fila de la entrada hasta el fin de la transacción.
     * Apertura y cancelación la leen así para no cruzarse.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM ScheduleEntry e WHERE e.id = :id")
    Optional<ScheduleEntry> findByIdForUpdate(@Param("id") Long id);

    /**
     * Transición condicional: solo cambia el estado si la entrada sigue abierta.
     * Devuelve el número de filas afectadas (0 o 1).
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ScheduleEntry e SET e.status = :target, e.autoClosed = :autoClosed, e.updatedAt = CURRENT_TIMESTAMP " +
            "WHERE e.id = :id AND e.status IN :openStatuses")
    int transitionIfOpen(@Param("id") Long id,
                         @Param("target") ScheduleEntryStatus target,
                         @Param("autoClosed") Boolean autoClosed,
                         @Param("openStatuses") Collection<ScheduleEntryStatus> openStatuses);
}
