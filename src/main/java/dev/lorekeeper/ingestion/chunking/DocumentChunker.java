package dev.lorekeeper.ingestion.chunking;

import dev.lorekeeper.ingestion.extraction.ExtractedPage;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns extracted pages into token-bounded chunks.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Assemble the pages into one immutable text and detect sections in it
 *   <li>A section that fits within {@code maxTokens} becomes a single chunk
 *   <li>A larger section is packed sentence by sentence; when the next sentence would overflow,
 *       the chunk is emitted and the next one is seeded with trailing sentences worth up to {@code
 *       overlapTokens}
 *   <li>Text before the first heading, or the whole document when no heading is found, is chunked
 *       the same way with a null heading
 *   <li>Chunks below {@code minTokens} are folded into their successor while the result stays
 *       within {@code maxTokens}
 * </ol>
 *
 * <p>A sentence that alone exceeds {@code maxTokens} is cut at whitespace into pieces of at most
 * {@code targetTokens}. Every size decision counts the exact slice that would be stored, so a
 * chunk's {@code tokenCount} is the tokenizer's count of its content and never exceeds {@code
 * maxTokens}. Chunk content is always a slice of the assembled text and offsets are positions in
 * it.
 */
@Component
public class DocumentChunker {

  private static final Logger log = LoggerFactory.getLogger(DocumentChunker.class);

  private final TokenCounter tokenCounter;
  private final ChunkingProperties properties;

  public DocumentChunker(TokenCounter tokenCounter, ChunkingProperties properties) {
    this.tokenCounter = tokenCounter;
    this.properties = properties;
  }

  /**
   * Chunks the given pages.
   *
   * @param pages extracted pages in reading order
   * @return chunks in document order
   */
  public List<ChunkData> chunk(List<ExtractedPage> pages) {
    SourceText source = SourceText.of(pages);
    List<Section> sections = SectionDetector.detectSections(source.lines());
    List<ChunkData> chunks = new ArrayList<>();

    if (sections.isEmpty()) {
      log.warn("No sections detected across {} pages, chunking entire document", pages.size());
      chunks.addAll(chunkRegion(source, 0, source.length(), null));
    } else {
      int firstHeading = source.lineStart(sections.get(0).startLine());
      chunks.addAll(chunkRegion(source, 0, firstHeading, null));
      for (Section section : sections) {
        chunks.addAll(
            chunkRegion(
                source,
                source.lineStart(section.startLine()),
                source.lineEnd(section.endLine()),
                section.heading()));
      }
    }

    List<ChunkData> merged = mergeSmallChunks(chunks, source);
    log.debug(
        "Chunked {} pages into {} sections, {} chunks ({} before merge)",
        pages.size(),
        sections.size(),
        merged.size(),
        chunks.size());
    return merged;
  }

  private List<ChunkData> chunkRegion(
      SourceText source, int from, int to, @Nullable String heading) {
    TextSpan region = source.trim(from, to);
    if (region.length() == 0) {
      return List.of();
    }
    int tokens = tokenCounter.count(region.of(source.text()));
    if (tokens <= properties.getMaxTokens()) {
      return List.of(toChunk(source, region.start(), region.end(), tokens, heading));
    }
    return splitLargeRegion(source, region, heading);
  }

  private List<ChunkData> splitLargeRegion(
      SourceText source, TextSpan region, @Nullable String heading) {
    List<Unit> units = sentenceUnits(source, region);
    List<ChunkData> chunks = new ArrayList<>();
    List<Unit> current = new ArrayList<>();
    int currentTokens = 0;

    for (Unit unit : units) {
      if (!current.isEmpty()) {
        int extended = countSlice(source, current.get(0).start(), unit.end());
        if (extended <= properties.getMaxTokens()) {
          current.add(unit);
          currentTokens = extended;
          continue;
        }
        chunks.add(toChunk(source, current, currentTokens, heading));
        current = trailingOverlap(source, current);
        if (!current.isEmpty()) {
          int seeded = countSlice(source, current.get(0).start(), unit.end());
          if (seeded <= properties.getMaxTokens()) {
            current.add(unit);
            currentTokens = seeded;
            continue;
          }
          current.clear();
        }
      }
      current.add(unit);
      currentTokens = unit.tokens();
    }
    if (!current.isEmpty()) {
      chunks.add(toChunk(source, current, currentTokens, heading));
    }
    return chunks;
  }

  /** Trailing units worth at most {@code overlapTokens}, never the whole emitted chunk. */
  private List<Unit> trailingOverlap(SourceText source, List<Unit> emitted) {
    int end = emitted.get(emitted.size() - 1).end();
    int first = emitted.size();
    for (int j = emitted.size() - 1; j >= 1; j--) {
      if (countSlice(source, emitted.get(j).start(), end) > properties.getOverlapTokens()) {
        break;
      }
      first = j;
    }
    return new ArrayList<>(emitted.subList(first, emitted.size()));
  }

  // Counted over the slice itself: separators between units carry tokens of their own.
  private int countSlice(SourceText source, int start, int end) {
    return tokenCounter.count(source.slice(start, end));
  }

  private List<Unit> sentenceUnits(SourceText source, TextSpan region) {
    String regionText = region.of(source.text());
    List<Unit> units = new ArrayList<>();
    for (TextSpan sentence : SentenceSplitter.sentenceSpans(regionText)) {
      int start = region.start() + sentence.start();
      int end = region.start() + sentence.end();
      int tokens = tokenCounter.count(source.slice(start, end));
      if (tokens > properties.getMaxTokens()) {
        cutOversized(source, start, end, units);
      } else {
        units.add(new Unit(start, end, tokens));
      }
    }
    return units;
  }

  /** Halves a range at the whitespace nearest its middle until every piece fits the target. */
  private void cutOversized(SourceText source, int start, int end, List<Unit> out) {
    int tokens = tokenCounter.count(source.slice(start, end));
    if (tokens <= properties.getTargetTokens() || end - start <= 1) {
      out.add(new Unit(start, end, tokens));
      return;
    }
    int cut = nearestWhitespace(source.text(), start, end);
    TextSpan left = source.trim(start, cut);
    TextSpan right = source.trim(cut, end);
    if (left.length() > 0) {
      cutOversized(source, left.start(), left.end(), out);
    }
    if (right.length() > 0) {
      cutOversized(source, right.start(), right.end(), out);
    }
  }

  private static int nearestWhitespace(String text, int start, int end) {
    int middle = start + (end - start) / 2;
    for (int distance = 0; middle - distance > start || middle + distance < end; distance++) {
      int before = middle - distance;
      if (before > start && Character.isWhitespace(text.charAt(before))) {
        return before;
      }
      int after = middle + distance;
      if (after < end && after > start && Character.isWhitespace(text.charAt(after))) {
        return after;
      }
    }
    return middle;
  }

  /**
   * Folds every chunk below {@code minTokens} into its successor, repeatedly, as long as the
   * merged slice counts within {@code maxTokens}. The merged chunk keeps the first chunk's
   * page and the first non-null heading. Applying the pass to its own output changes nothing.
   */
  List<ChunkData> mergeSmallChunks(List<ChunkData> chunks, SourceText source) {
    List<ChunkData> merged = new ArrayList<>(chunks.size());
    int i = 0;
    while (i < chunks.size()) {
      ChunkData current = chunks.get(i);
      while (current.tokenCount() < properties.getMinTokens() && i + 1 < chunks.size()) {
        ChunkData next = chunks.get(i + 1);
        int combined = countSlice(source, current.startOffset(), next.endOffset());
        if (combined > properties.getMaxTokens()) {
          break;
        }
        current =
            new ChunkData(
                source.slice(current.startOffset(), next.endOffset()),
                combined,
                current.pageNumber(),
                current.sectionHeading() != null ? current.sectionHeading() : next.sectionHeading(),
                current.startOffset(),
                next.endOffset());
        i++;
      }
      merged.add(current);
      i++;
    }
    return merged;
  }

  private ChunkData toChunk(
      SourceText source, List<Unit> units, int tokens, @Nullable String heading) {
    int end = units.get(units.size() - 1).end();
    return toChunk(source, units.get(0).start(), end, tokens, heading);
  }

  private static ChunkData toChunk(
      SourceText source, int start, int end, int tokens, @Nullable String heading) {
    return new ChunkData(
        source.slice(start, end), tokens, source.pageAt(start), heading, start, end);
  }

  /** A sentence, or a piece of an over-long sentence, with its token count. */
  private record Unit(int start, int end, int tokens) {}
}
