package sp.sistemaspalacios.api_nomina.repository.paymentSchedule;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentSystem;

import java.util.Optional;

@Repository
public interface PaymentSystemRepository extends JpaRepository<PaymentSystem, Long> {

    Optional<PaymentSystem> findByCode(String code);
}
