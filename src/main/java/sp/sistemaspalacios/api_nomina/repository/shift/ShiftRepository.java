package sp.sistemaspalacios.api_nomina.repository.shift;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_nomina.entity.shift.Shift;
import sp.sistemaspalacios.api_nomina.entity.shift.ShiftStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ShiftRepository extends JpaRepository<Shift, Long> {

    Optional<Shift> findFirstByEmployeeIdAndStatus(Long employeeId, ShiftStatus status);

    List<Shift> findByScheduleEntryIdAndStatus(Long scheduleEntryId, ShiftStatus status);

    Optional<Shift> findFirstByWorkObjectIdAndEmployeeIdAndStatus(Long objectId, Long employeeId, ShiftStatus status);

    List<Shift> findByStatusOrderByIdAsc(ShiftStatus status);

    long countByWorkObjectIdAndStatus(Long objectId, ShiftStatus status);

    List<Shift> findByEmployeeIdOrderByStartTimeDesc(Long employeeId);

    List<Shift> findByStatusAndEndTimeBetweenOrderByIdAsc(ShiftStatus status, LocalDateTime from, LocalDateTime to);

    @Query("SELECT s FROM Shift s WHERE s.status = :status AND s.workObject.id IN :objectIds " +
            "AND s.startTime >= :from AND s.startTime < :to ORDER BY s.employeeId ASC, s.id ASC")
    List<Shift> findByObjectsAndStartBetween(@Param("status") ShiftStatus status,
                                             @Param("objectIds") Collection<Long> objectIds,
                                             @Param("from") LocalDateTime from,
                                             @Param("to") LocalDateTime to);

    /**
     * Cierra el turno solo si sigue ACTIVE y libera los marcadores de unicidad.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Shift s SET s.status = sp.sistemaspalacios.api_nomina.entity.shift.ShiftStatus.COMPLETED, " +
            "s.endTime = :endTime, s.endCoordinates = :coordinates, s.totalHours = :hours, " +
            "s.hourlyRate = :rate, s.totalPayment = :payment, s.autoClosed = :autoClosed, " +
            "s.activeEmployeeId = NULL, s.activeScheduleEntryId = NULL, s.updatedAt = CURRENT_TIMESTAMP " +
            "WHERE s.id = :id AND s.status = sp.sistemaspalacios.api_nomina.entity.shift.ShiftStatus.ACTIVE")
    int completeIfActive(@Param("id") Long id,
                         @Param("endTime") LocalDateTime endTime,
                         @Param("coordinates") String coordinates,
                         @Param("hours") BigDecimal hours,
                         @Param("rate") BigDecimal rate,
                         @Param("payment") BigDecimal payment,
                         @Param("autoClosed") Boolean autoClosed);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Shift s SET s.status = sp.sistemaspalacios.api_nomina.entity.shift.ShiftStatus.CANCELLED, " +
            "s.endTime = :endTime, s.activeEmployeeId = NULL, s.activeScheduleEntryId = NULL, " +
            "s.updatedAt = CURRENT_TIMESTAMP " +
            "WHERE s.id = :id AND s.status = sp.sistemaspalacios.api_nomina.entity.shift.ShiftStatus.ACTIVE")
    int cancelIfActive(@Param("id") Long id, @Param("endTime") LocalDateTime endTime);
}
