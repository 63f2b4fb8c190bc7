package io.b2mash.payables.paymenttype;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PaymentTypeRepository extends JpaRepository<PaymentType, UUID> {

  List<PaymentType> findByActiveTrueOrderByDisplayOrderAscNameAsc();
}
