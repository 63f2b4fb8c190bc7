package io.b2mash.payables.profile;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BillingProfileRepository extends JpaRepository<BillingProfile, UUID> {

  List<BillingProfile> findByActiveTrueOrderByNameAsc();
}
