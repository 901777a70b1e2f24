package com.flamingo.ai.graphrag.service.retrieval;

import com.flamingo.ai.graphrag.config.RetrievalConfig;
import com.flamingo.ai.graphrag.domain.model.Candidate;
import com.flamingo.ai.graphrag.domain.model.ChunkRecord;
import java.text.Normalizer;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Selects seed candidates by counting how many distinct query words occur as substrings of each
 * node's text.
 *
 * <p>Matching is case-insensitive and Unicode-normalized (NFC), so a query typed with combining
 * diacritics still matches precomposed Vietnamese text.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LexicalSeedSelector {

  // includes no-break and ideographic spaces
  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  private static final Comparator<Candidate> SEED_ORDER =
      Comparator.comparingDouble(Candidate::getLexicalScore)
          .reversed()
          .thenComparing(Candidate::getChunkId);

  private final RetrievalConfig retrievalConfig;

  public List<Candidate> select(String query, Collection<ChunkRecord> nodes) {
    return select(query, nodes, retrievalConfig.getLexical().getSeedCandidates());
  }

  /**
   * Scores every node with text and returns at most {@code limit} seeds, ordered by match count
   * descending then chunk id ascending. Nodes matching no word are dropped.
   */
  public List<Candidate> select(String query, Collection<ChunkRecord> nodes, int limit) {
    Set<String> words = tokenize(query);
    if (words.isEmpty()) {
      return List.of();
    }

    List<Candidate> seeds =
        nodes.stream()
            .filter(ChunkRecord::hasText)
            .map(node -> Candidate.seedOf(node, matchCount(words, normalize(node.text()))))
            .filter(candidate -> candidate.getLexicalScore() > 0)
            .sorted(SEED_ORDER)
            .limit(limit)
            .toList();

    log.debug(
        "Lexical selection: {} distinct words, {} nodes scanned, {} seeds kept",
        words.size(),
        nodes.size(),
        seeds.size());
    return seeds;
  }

  /** Distinct, normalized, non-empty whitespace-separated words of the query. */
  static Set<String> tokenize(String query) {
    if (query == null) {
      return Set.of();
    }
    return Arrays.stream(WHITESPACE.split(normalize(query)))
        .filter(word -> !word.isEmpty())
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  static String normalize(String text) {
    return Normalizer.normalize(text, Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
  }

  private static int matchCount(Set<String> words, String normalizedText) {
    int count = 0;
    for (String word : words) {
      if (normalizedText.contains(word)) {
        count++;
      }
    }
    return count;
  }
}
