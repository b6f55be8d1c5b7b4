package sp.sistemaspalacios.api_nomina.entity.contract;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import sp.sistemaspalacios.api_nomina.entity.paymentSchedule.PaymentSystem;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

@Entity
@Table(name = "contracts")
@Getter
@Setter
@NoArgsConstructor
public class Contract {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "contract_number", unique = true)
    private String contractNumber;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Column(name = "hourly_rate", precision = 10, scale = 2)
    private BigDecimal hourlyRate;

    @Column(name = "use_contract_rate", nullable = false)
    private Boolean useContractRate = false;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "payment_system_id")
    private PaymentSystem paymentSystem;

    @Column(name = "use_contract_payment_system", nullable = false)
    private Boolean useContractPaymentSystem = false;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ContractStatus status = ContractStatus.DRAFT;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "contract_allowed_objects", joinColumns = @JoinColumn(name = "contract_id"))
    @Column(name = "object_id")
    private Set<Long> allowedObjectIds = new HashSet<>();

    @Column(name = "is_manager", nullable = false)
    private Boolean isManager = false;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "contract_manager_permissions", joinColumns = @JoinColumn(name = "contract_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "permission")
    private Set<ManagerPermission> managerPermissions = new HashSet<>();

    private LocalDate startDate;
    private LocalDate endDate;
    private LocalDateTime terminatedAt;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean isActive() {
        return status == ContractStatus.ACTIVE;
    }

    public boolean allowsObject(Long objectId) {
        return allowedObjectIds != null && allowedObjectIds.contains(objectId);
    }

    public boolean hasPermission(ManagerPermission permission) {
        return Boolean.TRUE.equals(isManager)
                && managerPermissions != null
                && managerPermissions.contains(permission);
    }

    @PrePersist
    public void prePersist() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    public void preUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
