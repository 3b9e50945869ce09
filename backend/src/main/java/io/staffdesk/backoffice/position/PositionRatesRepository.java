package io.staffdesk.backoffice.position;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PositionRatesRepository extends JpaRepository<PositionRates, UUID> {}
