package sp.sistemaspalacios.api_nomina.repository.contract;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_nomina.entity.contract.Contract;

import java.util.List;

@Repository
public interface ContractRepository extends JpaRepository<Contract, Long> {

    List<Contract> findByEmployeeIdAndOwnerIdOrderByIdDesc(Long employeeId, Long ownerId);
}
