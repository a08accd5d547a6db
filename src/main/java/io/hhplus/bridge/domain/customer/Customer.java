package io.hhplus.bridge.domain.customer;

import io.hhplus.bridge.common.exception.BusinessException;
import io.hhplus.bridge.common.exception.ErrorCode;
import io.hhplus.bridge.domain.common.BaseTimeEntity;
import io.hhplus.bridge.domain.lifetime.DerivedValueOwner;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(
    name = "customers",
    indexes = {
        @Index(name = "idx_customer_email", columnList = "email")
    }
)
@Getter
@NoArgsConstructor
public class Customer extends BaseTimeEntity implements DerivedValueOwner {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 100)
    private String email;

    @Column(nullable = false)
    private Long lifetime;  // 생애 가치 (완납 주문 소계 합계, 커밋 이후 재계산)

    public static Customer create(String name, String email) {
        validateName(name);

        Customer customer = new Customer();
        customer.name = name;
        customer.email = email;
        customer.lifetime = 0L;

        return customer;
    }

    /**
     * 테스트용 고객 생성 (ID 직접 지정 가능)
     * <p>
     * InMemory Repository 기반 단위 테스트에서 사용합니다.
     * 프로덕션 코드에서는 사용하지 마세요.
     */
    public static Customer createForTest(Long id, String name, Long lifetime) {
        validateName(name);

        Customer customer = new Customer();
        customer.id = id;
        customer.name = name;
        customer.email = null;
        customer.lifetime = lifetime;

        return customer;
    }

    @Override
    public Long getDerivedValue() {
        return lifetime;
    }

    @Override
    public void changeDerivedValue(Long value) {
        validateLifetime(value);

        this.lifetime = value;
    }

    private static void validateName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "고객명은 필수입니다"
            );
        }
    }

    private void validateLifetime(Long value) {
        if (value == null) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                String.format("생애 가치는 null일 수 없습니다. customerId: %d", this.id)
            );
        }
    }
}
