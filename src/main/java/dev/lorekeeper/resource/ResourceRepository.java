package dev.lorekeeper.resource;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link Resource} entities. */
public interface ResourceRepository extends JpaRepository<Resource, UUID> {

  List<Resource> findByCollectionIdOrderByUploadedAtAsc(UUID collectionId);

  long countByStatus(ResourceStatus status);
}
