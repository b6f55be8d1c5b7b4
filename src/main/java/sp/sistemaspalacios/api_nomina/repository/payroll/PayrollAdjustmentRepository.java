package sp.sistemaspalacios.api_nomina.repository.payroll;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_nomina.entity.payroll.PayrollAdjustment;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PayrollAdjustmentRepository extends JpaRepository<PayrollAdjustment, Long> {

    Optional<PayrollAdjustment> findByNaturalKey(String naturalKey);

    List<PayrollAdjustment> findByShiftIdOrderByIdAsc(Long shiftId);

    List<PayrollAdjustment> findByPayrollEntryIdOrderByIdAsc(Long payrollEntryId);

    List<PayrollAdjustment> findByEmployeeIdAndShiftIdInOrderByIdAsc(Long employeeId, Collection<Long> shiftIds);

    /**
     * Ajustes sin turno del empleado creados dentro del periodo, libres o ya enlazados
     * a la entrada de ese mismo periodo.
     */
    @Query("SELECT a FROM PayrollAdjustment a LEFT JOIN a.payrollEntry e " +
            "WHERE a.employeeId = :employeeId AND a.shift IS NULL " +
            "AND a.createdAt >= :from AND a.createdAt < :to " +
            "AND (e IS NULL OR (e.periodStart = :periodStart AND e.periodEnd = :periodEnd)) " +
            "ORDER BY a.id ASC")
    List<PayrollAdjustment> findShiftlessForPeriod(@Param("employeeId") Long employeeId,
                                                   @Param("from") LocalDateTime from,
                                                   @Param("to") LocalDateTime to,
                                                   @Param("periodStart") LocalDate periodStart,
                                                   @Param("periodEnd") LocalDate periodEnd);

    /**
     * Empleados con contrato del propietario que tienen ajustes sin turno pendientes de nómina.
     */
    @Query("SELECT DISTINCT a.employeeId FROM PayrollAdjustment a " +
            "WHERE a.shift IS NULL AND a.payrollEntry IS NULL " +
            "AND a.createdAt >= :from AND a.createdAt < :to " +
            "AND EXISTS (SELECT c.id FROM Contract c WHERE c.employeeId = a.employeeId AND c.ownerId = :ownerId)")
    List<Long> findEmployeesWithPendingShiftless(@Param("ownerId") Long ownerId,
                                                 @Param("from") LocalDateTime from,
                                                 @Param("to") LocalDateTime to);
}
