package sp.sistemaspalacios.api_nomina.repository.paymentSchedule;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentSchedule;

import java.util.List;

@Repository
public interface PaymentScheduleRepository extends JpaRepository<PaymentSchedule, Long> {

    List<PaymentSchedule> findByIsActiveTrueOrderByIdAsc();
}
