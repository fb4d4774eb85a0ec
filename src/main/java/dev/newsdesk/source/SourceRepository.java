package dev.newsdesk.source;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link Source} entities. */
public interface SourceRepository extends JpaRepository<Source, UUID> {

  Optional<Source> findByName(String name);

  boolean existsByName(String name);

  List<Source> findAllByActiveTrueOrderByNameAsc();

  List<Source> findAllByOrderByNameAsc();
}
