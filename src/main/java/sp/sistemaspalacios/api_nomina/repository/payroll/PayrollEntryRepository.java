package sp.sistemaspalacios.api_nomina.repository.payroll;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_nomina.entity.payroll.PayrollEntry;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface PayrollEntryRepository extends JpaRepository<PayrollEntry, Long> {

    Optional<PayrollEntry> findByEmployeeIdAndPeriodStartAndPeriodEnd(Long employeeId, LocalDate periodStart, LocalDate periodEnd);

    List<PayrollEntry> findByEmployeeIdOrderByPeriodStartDesc(Long employeeId);
}
