package dev.lorekeeper.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.lorekeeper.document.PendingChunk;
import dev.lorekeeper.embedding.EmbeddingProviderExhaustedException;
import dev.lorekeeper.embedding.EmbeddingService;
import dev.lorekeeper.embedding.EmbeddingUsage;
import dev.lorekeeper.fixture.ResourceBuilder;
import dev.lorekeeper.ingestion.chunking.ChunkData;
import dev.lorekeeper.ingestion.chunking.DocumentChunker;
import dev.lorekeeper.ingestion.extraction.DocumentExtractor;
import dev.lorekeeper.ingestion.extraction.DocumentMetadata;
import dev.lorekeeper.ingestion.extraction.ExtractedPage;
import dev.lorekeeper.ingestion.extraction.ExtractionException;
import dev.lorekeeper.ingestion.extraction.ExtractionResult;
import dev.lorekeeper.resource.Resource;
import dev.lorekeeper.resource.ResourceFileStore;
import dev.lorekeeper.resource.ResourceNotFoundException;
import dev.lorekeeper.resource.ResourceRepository;
import dev.lorekeeper.resource.ResourceStatus;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
  private static final Path PDF = Path.of("/uploads/collection/players-handbook.pdf");

  @Mock ResourceRepository resourceRepository;

  @Mock ResourceFileStore fileStore;

  @Mock DocumentExtractor extractor;

  @Mock DocumentChunker chunker;

  @Mock ResourceChunkWriter chunkWriter;

  @Mock EmbeddingService embeddingService;

  IngestionService ingestionService;

  Resource resource;

  ResourceIngestionJob job;

  @BeforeEach
  void setUp() {
    ingestionService =
        new IngestionService(
            resourceRepository,
            fileStore,
            extractor,
            chunker,
            chunkWriter,
            embeddingService,
            new IngestionProperties(),
            Clock.fixed(NOW, ZoneOffset.UTC));
    resource = new ResourceBuilder().build();
    job = jobFor(resource);
  }

  private static ResourceIngestionJob jobFor(Resource resource) {
    return new ResourceIngestionJob(
        resource.getId(), resource.getCollectionId(), resource.getFileUrl());
  }

  private void stubResourceLookupAndSave() {
    when(resourceRepository.findById(resource.getId())).thenReturn(Optional.of(resource));
    when(resourceRepository.save(any(Resource.class))).thenAnswer(inv -> inv.getArgument(0));
  }

  private List<PendingChunk> stubExtractionAndChunking() {
    List<ExtractedPage> pages =
        List.of(
            new ExtractedPage(1, "COMBAT\nRoll initiative.", true, false),
            new ExtractedPage(2, "MAGIC\nSpells need slots.", false, false));
    when(fileStore.resolve(resource.getFileUrl())).thenReturn(PDF);
    when(extractor.extract(PDF))
        .thenReturn(
            new ExtractionResult(
                pages, 2, new DocumentMetadata("Handbook", "Ann Vale", null, "Writer", null)));
    List<ChunkData> chunks =
        List.of(
            new ChunkData("COMBAT\nRoll initiative.", 4, 1, "COMBAT", 0, 23),
            new ChunkData("MAGIC\nSpells need slots.", 5, 2, "MAGIC", 25, 49));
    when(chunker.chunk(pages)).thenReturn(chunks);
    List<PendingChunk> stored =
        List.of(
            new PendingChunk(UUID.randomUUID(), 0, chunks.get(0).content()),
            new PendingChunk(UUID.randomUUID(), 1, chunks.get(1).content()));
    when(chunkWriter.replaceChunks(resource.getId(), chunks)).thenReturn(stored);
    return stored;
  }

  // --- Happy path ---

  @Test
  void processRunsEveryStageAndCompletes() {
    stubResourceLookupAndSave();
    List<PendingChunk> stored = stubExtractionAndChunking();
    EmbeddingUsage usage = new EmbeddingUsage(2, 12, 10, 0.00024);
    when(embeddingService.embedChunks(resource.getId(), stored)).thenReturn(usage);
    when(embeddingService.modelName()).thenReturn("text-embedding-3-small");

    IngestionService.IngestResult result = ingestionService.process(job);

    assertThat(result.status()).isEqualTo(ResourceStatus.COMPLETED);
    assertThat(result.chunkCount()).isEqualTo(2);
    assertThat(result.usage()).isEqualTo(usage);
    assertThat(resource.getStatus()).isEqualTo(ResourceStatus.COMPLETED);
    assertThat(resource.getTotalChunks()).isEqualTo(2);
    assertThat(resource.getTotalPages()).isEqualTo(2);
    assertThat(resource.getTitle()).isEqualTo("Handbook");
    assertThat(resource.getAuthor()).isEqualTo("Ann Vale");
    assertThat(resource.getProcessingAttempts()).isEqualTo(1);
    assertThat(resource.getProcessingCompletedAt()).isEqualTo(NOW);
    assertThat(resource.getMetadata())
        .containsEntry("embeddingTokens", 12L)
        .containsEntry("embeddingProviderTokens", 10L)
        .containsEntry("embeddingModel", "text-embedding-3-small")
        .containsEntry("embeddingsGenerated", true)
        .containsEntry("hasImages", true)
        .containsEntry("hasTables", false)
        .containsEntry("creator", "Writer");
  }

  @Test
  void titleSetAtUploadIsNotReplacedByDocumentTitle() {
    resource = new ResourceBuilder().title("My Handbook").build();
    job = jobFor(resource);
    stubResourceLookupAndSave();
    List<PendingChunk> stored = stubExtractionAndChunking();
    when(embeddingService.embedChunks(resource.getId(), stored))
        .thenReturn(new EmbeddingUsage(2, 12, 10, 0.0));
    when(embeddingService.modelName()).thenReturn("text-embedding-3-small");

    ingestionService.process(job);

    assertThat(resource.getTitle()).isEqualTo("My Handbook");
  }

  // --- Embedding failure ---

  @Test
  void embeddingFailureKeepsChunksAndCompletesWithoutEmbeddings() {
    stubResourceLookupAndSave();
    List<PendingChunk> stored = stubExtractionAndChunking();
    when(embeddingService.embedChunks(resource.getId(), stored))
        .thenThrow(new EmbeddingProviderExhaustedException(6, null));

    IngestionService.IngestResult result = ingestionService.process(job);

    assertThat(result.status()).isEqualTo(ResourceStatus.COMPLETED_NO_EMBEDDINGS);
    assertThat(result.chunkCount()).isEqualTo(2);
    assertThat(result.usage()).isEqualTo(EmbeddingUsage.NONE);
    assertThat(resource.getStatus()).isEqualTo(ResourceStatus.COMPLETED_NO_EMBEDDINGS);
    assertThat(resource.getTotalChunks()).isEqualTo(2);
    assertThat(resource.getIngestionError()).startsWith("[EMBEDDING] ");
    assertThat(resource.getMetadata())
        .containsEntry("embeddingsGenerated", false)
        .containsEntry("failedStage", "EMBEDDING")
        .containsKey("embeddingError");
  }

  // --- Fatal failures ---

  @Test
  void extractionFailureMarksResourceFailed() {
    stubResourceLookupAndSave();
    when(fileStore.resolve(resource.getFileUrl())).thenReturn(PDF);
    when(extractor.extract(PDF)).thenThrow(new ExtractionException("Failed to read PDF"));

    assertThatThrownBy(() -> ingestionService.process(job))
        .isInstanceOfSatisfying(
            IngestionFailedException.class,
            e -> {
              assertThat(e.getStage()).isEqualTo(IngestionStage.EXTRACTION);
              assertThat(e.getResourceId()).isEqualTo(resource.getId());
            });

    assertThat(resource.getStatus()).isEqualTo(ResourceStatus.FAILED);
    assertThat(resource.getIngestionError()).isEqualTo("[EXTRACTION] Failed to read PDF");
    assertThat(resource.getMetadata()).containsEntry("failedStage", "EXTRACTION");
    verifyNoInteractions(chunker, chunkWriter, embeddingService);
  }

  @Test
  void unsupportedExtensionFailsBeforeExtraction() {
    stubResourceLookupAndSave();
    when(fileStore.resolve(resource.getFileUrl())).thenReturn(Path.of("/uploads/sheet.xlsx"));

    assertThatThrownBy(() -> ingestionService.process(job))
        .isInstanceOf(IngestionFailedException.class)
        .hasMessageStartingWith("[EXTRACTION] Unsupported file type: .xlsx");

    assertThat(resource.getStatus()).isEqualTo(ResourceStatus.FAILED);
    verifyNoInteractions(extractor);
  }

  @Test
  void chunkingFailureIsRecordedWithItsStage() {
    stubResourceLookupAndSave();
    when(fileStore.resolve(resource.getFileUrl())).thenReturn(PDF);
    when(extractor.extract(PDF))
        .thenReturn(
            new ExtractionResult(
                List.of(new ExtractedPage(1, "text", false, false)),
                1,
                new DocumentMetadata(null, null, null, null, null)));
    when(chunker.chunk(anyList())).thenThrow(new IllegalStateException("boom"));

    assertThatThrownBy(() -> ingestionService.process(job))
        .isInstanceOfSatisfying(
            IngestionFailedException.class,
            e -> assertThat(e.getStage()).isEqualTo(IngestionStage.CHUNKING));

    assertThat(resource.getIngestionError()).isEqualTo("[CHUNKING] boom");
    verify(chunkWriter, never()).replaceChunks(any(), anyList());
  }

  // --- Redelivery ---

  @Test
  void redeliveredJobForCompletedResourceIsIgnored() {
    resource = new ResourceBuilder().status(ResourceStatus.COMPLETED).totalChunks(7).build();
    job = jobFor(resource);
    when(resourceRepository.findById(resource.getId())).thenReturn(Optional.of(resource));

    IngestionService.IngestResult result = ingestionService.process(job);

    assertThat(result.status()).isEqualTo(ResourceStatus.COMPLETED);
    assertThat(result.chunkCount()).isEqualTo(7);
    verify(resourceRepository, never()).save(any());
    verifyNoInteractions(fileStore, extractor, chunker, chunkWriter, embeddingService);
  }

  @Test
  void redeliveredJobForFailedResourceRunsAgain() {
    resource = new ResourceBuilder().status(ResourceStatus.FAILED).build();
    job = jobFor(resource);
    stubResourceLookupAndSave();
    List<PendingChunk> stored = stubExtractionAndChunking();
    when(embeddingService.embedChunks(eq(resource.getId()), eq(stored)))
        .thenReturn(new EmbeddingUsage(2, 12, 10, 0.0));
    when(embeddingService.modelName()).thenReturn("text-embedding-3-small");

    IngestionService.IngestResult result = ingestionService.process(job);

    assertThat(result.status()).isEqualTo(ResourceStatus.COMPLETED);
    assertThat(resource.getIngestionError()).isNull();
  }

  @Test
  void unknownResourceIsNotFound() {
    when(resourceRepository.findById(resource.getId())).thenReturn(Optional.empty());

    assertThatThrownBy(() -> ingestionService.process(job))
        .isInstanceOf(ResourceNotFoundException.class)
        .hasMessage("Resource not found: " + resource.getId());
  }
}
