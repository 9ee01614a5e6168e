package dev.lorekeeper.fixture;

import dev.lorekeeper.resource.Resource;
import dev.lorekeeper.resource.ResourceStatus;
import java.lang.reflect.Field;
import java.util.Map;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Lightweight test builder for the {@link Resource} JPA entity. Provides sensible defaults so tests
 * only override what they care about.
 *
 * <pre>{@code
 * Resource resource = new ResourceBuilder().filename("rules.pdf").build();
 * }</pre>
 */
public final class ResourceBuilder {

  private @Nullable UUID id = UUID.randomUUID();
  private UUID collectionId = UUID.randomUUID();
  private String filename = "players-handbook.pdf";
  private String fileUrl = "collection/players-handbook.pdf";
  private ResourceStatus status = ResourceStatus.PENDING;
  private @Nullable Integer totalChunks;
  private @Nullable String title;
  private Map<String, ?> metadata = Map.of();

  public ResourceBuilder id(@Nullable UUID id) {
    this.id = id;
    return this;
  }

  public ResourceBuilder collectionId(UUID collectionId) {
    this.collectionId = collectionId;
    return this;
  }

  public ResourceBuilder filename(String filename) {
    this.filename = filename;
    this.fileUrl = "collection/" + filename;
    return this;
  }

  public ResourceBuilder fileUrl(String fileUrl) {
    this.fileUrl = fileUrl;
    return this;
  }

  public ResourceBuilder status(ResourceStatus status) {
    this.status = status;
    return this;
  }

  public ResourceBuilder totalChunks(Integer totalChunks) {
    this.totalChunks = totalChunks;
    return this;
  }

  public ResourceBuilder title(String title) {
    this.title = title;
    return this;
  }

  public ResourceBuilder metadata(Map<String, ?> metadata) {
    this.metadata = metadata;
    return this;
  }

  public Resource build() {
    Resource resource = new Resource(collectionId, filename, fileUrl);
    if (id != null) {
      setField(resource, "id", id);
    }
    resource.setStatus(status);
    resource.setTotalChunks(totalChunks);
    resource.setTitle(title);
    resource.putMetadata(metadata);
    return resource;
  }

  private static void setField(Resource resource, String fieldName, Object value) {
    try {
      Field field = Resource.class.getDeclaredField(fieldName);
      field.setAccessible(true);
      field.set(resource, value);
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to set field " + fieldName, e);
    }
  }
}
