package dev.lorekeeper;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.lorekeeper.embedding.EmbeddingProvider;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Shared base class for all integration tests.
 *
 * <p>Provides a Testcontainers-managed PostgreSQL instance with pgvector, migrated by Flyway, and
 * empties every table before each test. The embedding and completion providers are replaced with
 * mocks so no test reaches the network.
 */
@SpringBootTest
public abstract class BaseIntegrationTest {

  /** Width of the {@code vector} column in the schema. */
  protected static final int DIMENSIONS = 1536;

  @ServiceConnection
  static PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>(
          DockerImageName.parse("pgvector/pgvector:pg16").asCompatibleSubstituteFor("postgres"));

  static {
    postgres.start();
  }

  @MockitoBean protected EmbeddingProvider embeddingProvider;

  @MockitoBean protected ChatModel chatModel;

  @MockitoBean protected StreamingChatModel streamingChatModel;

  @Autowired protected JdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanDatabase() {
    jdbcTemplate.execute("TRUNCATE query_logs, resource_chunks, resources");
  }

  /** A unit vector along one axis; distinct axes are orthogonal under cosine distance. */
  protected static float[] axis(int index) {
    float[] vector = new float[DIMENSIONS];
    vector[index] = 1.0f;
    return vector;
  }

  /** A unit vector between two axes, closer to {@code primary}. */
  protected static float[] blend(int primary, int secondary) {
    float[] vector = new float[DIMENSIONS];
    vector[primary] = 0.8f;
    vector[secondary] = 0.6f;
    return vector;
  }
}
