package io.b2mash.hms.hmsadmin.plan;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PlanRepository extends JpaRepository<Plan, UUID> {

  Optional<Plan> findByNameIgnoreCase(String name);

  boolean existsByNameIgnoreCase(String name);

  List<Plan> findAllByOrderByPriceCentsAsc();
}
