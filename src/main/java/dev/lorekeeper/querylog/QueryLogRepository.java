package dev.lorekeeper.querylog;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link QueryLog} entities. */
public interface QueryLogRepository extends JpaRepository<QueryLog, UUID> {

  List<QueryLog> findByConversationIdOrderByCreatedAtAsc(UUID conversationId);
}
