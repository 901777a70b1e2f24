package com.flamingo.ai.graphrag.graph;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.graphrag.domain.enums.ChunkType;
import com.flamingo.ai.graphrag.domain.model.ChunkRecord;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

@DisplayName("GraphFixtureLoader Tests")
class GraphFixtureLoaderTest {

  private final GraphFixtureLoader loader = new GraphFixtureLoader(new ObjectMapper());

  @Test
  @DisplayName("Should load nodes, types, embeddings and edges from the sample fixture")
  void shouldLoadSampleFixture() {
    InMemoryGraphStore store = loader.load(new ClassPathResource("graph/sample-graph.json"), false);

    List<ChunkRecord> nodes = store.scanByLabel("Test_rel_2");
    assertThat(nodes)
        .extracting(ChunkRecord::id)
        .containsExactly("law_1_c1", "law_1_a5", "law_1_a6", "law_1_a7");

    ChunkRecord article = nodes.get(1);
    assertThat(article.type()).isEqualTo(ChunkType.ARTICLE);
    assertThat(article.parentId()).isEqualTo("law_1_c1");
    assertThat(article.embedding()).containsExactly(1.0f, 0.0f, 0.0f);

    assertThat(store.neighbors("Test_rel_2", List.of("law_1_a5"), 1))
        .extracting(hit -> hit.node().id() + ":" + hit.edge().relationType())
        .containsExactlyInAnyOrder("law_1_c1:HAS_ARTICLE", "law_1_a6:CITES");
  }

  @Test
  @DisplayName("Should map unknown chunk types to OTHER and tolerate missing sections")
  void shouldToleratePartialFixture() throws Exception {
    String json =
        """
        {"namespaces": {"Ns": {"nodes": [{"id": "n1", "text": "x", "type": "annex"}]}}}
        """;

    InMemoryGraphStore store =
        loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), false);

    assertThat(store.scanByLabel("Ns"))
        .singleElement()
        .satisfies(node -> assertThat(node.type()).isEqualTo(ChunkType.OTHER));
  }
}
