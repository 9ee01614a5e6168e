package dev.lorekeeper.ingestion;

import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * One-shot embedding backfill, active under the {@code backfill} profile.
 *
 * <p>Options: {@code --resource-id=<uuid>}, {@code --collection-id=<uuid>}, {@code --dry-run}. The
 * exit code is non-zero when any resource failed.
 */
@Component
@Profile("backfill")
public class BackfillCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger log = LoggerFactory.getLogger(BackfillCommandLineRunner.class);

  private final EmbeddingBackfillService backfillService;
  private int exitCode;

  public BackfillCommandLineRunner(EmbeddingBackfillService backfillService) {
    this.backfillService = backfillService;
  }

  @Override
  public void run(ApplicationArguments args) {
    UUID resourceId = uuidOption(args, "resource-id");
    UUID collectionId = uuidOption(args, "collection-id");
    boolean dryRun = args.containsOption("dry-run");
    log.info(
        "Embedding backfill: mode={}, resource={}, collection={}",
        dryRun ? "DRY RUN" : "LIVE",
        resourceId != null ? resourceId : "all",
        collectionId != null ? collectionId : "all");

    BackfillReport report = backfillService.backfill(resourceId, collectionId, dryRun);
    exitCode = report.errors() > 0 ? 1 : 0;
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  private static @Nullable UUID uuidOption(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    if (values == null || values.isEmpty()) {
      return null;
    }
    try {
      return UUID.fromString(values.get(0));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("--" + name + " must be a UUID, got: " + values.get(0), e);
    }
  }
}
