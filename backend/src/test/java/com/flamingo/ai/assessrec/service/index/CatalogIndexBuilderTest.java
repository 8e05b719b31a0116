package com.flamingo.ai.assessrec.service.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.assessrec.config.RecommenderConfig;
import com.flamingo.ai.assessrec.exception.EmbeddingUnavailableException;
import com.flamingo.ai.assessrec.exception.IndexNotReadyException;
import com.flamingo.ai.assessrec.exception.InternalInconsistencyException;
import com.flamingo.ai.assessrec.service.catalog.CatalogLoader;
import com.flamingo.ai.assessrec.service.embedding.EmbeddingProvider;
import com.flamingo.ai.assessrec.testsupport.TestRecords;
import com.flamingo.ai.assessrec.testsupport.VocabularyEmbeddingProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("CatalogIndexBuilder Tests")
class CatalogIndexBuilderTest {

  @Mock private CatalogLoader catalogLoader;
  @Mock private EmbeddingProvider failingProvider;

  private RecommenderConfig config;
  private SimpleMeterRegistry meterRegistry;
  private VocabularyEmbeddingProvider provider;

  @BeforeEach
  void setUp() {
    config = new RecommenderConfig();
    meterRegistry = new SimpleMeterRegistry();
    provider = new VocabularyEmbeddingProvider("java", "python", "teamwork");
    config.getEmbedding().setDimension(provider.dimension());
  }

  @Test
  @DisplayName("Should build a vector snapshot with term sets aligned to records")
  void shouldBuildVectorSnapshot() {
    CatalogIndexBuilder builder =
        new CatalogIndexBuilder(catalogLoader, provider, config, meterRegistry);

    CatalogIndex index = builder.build(TestRecords.javaTeamworkPython());

    assertThat(index.size()).isEqualTo(3);
    assertThat(index.hasVectors()).isTrue();
    assertThat(index.vectorIndex().dimension()).isEqualTo(4);
    assertThat(index.termSets().get(0)).contains("java", "programming", "knowledge", "skills");
    assertThat(index.builtAt()).isNotNull();
    assertThat(meterRegistry.counter("catalog.index.builds", "mode", "vector").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should load records from the catalog source when none are given")
  void shouldLoadFromCatalogSource() {
    when(catalogLoader.load()).thenReturn(TestRecords.javaTeamworkPython());
    CatalogIndexBuilder builder =
        new CatalogIndexBuilder(catalogLoader, provider, config, meterRegistry);

    assertThat(builder.build().size()).isEqualTo(3);
  }

  @Test
  @DisplayName("Should fail the build when embeddings have the wrong dimension")
  void shouldFailOnDimensionMismatch() {
    config.getEmbedding().setDimension(384);
    CatalogIndexBuilder builder =
        new CatalogIndexBuilder(catalogLoader, provider, config, meterRegistry);

    assertThatThrownBy(() -> builder.build(TestRecords.javaTeamworkPython()))
        .isInstanceOf(InternalInconsistencyException.class)
        .hasMessageContaining("expected 384");
  }

  @Test
  @DisplayName("Should build a lexical-only snapshot when embedding is unavailable")
  void shouldBuildLexicalOnlySnapshot() {
    when(failingProvider.embedPassage(anyString()))
        .thenThrow(new EmbeddingUnavailableException("down"));
    CatalogIndexBuilder builder =
        new CatalogIndexBuilder(catalogLoader, failingProvider, config, meterRegistry);

    CatalogIndex index = builder.build(TestRecords.javaTeamworkPython());

    assertThat(index.hasVectors()).isFalse();
    assertThat(index.size()).isEqualTo(3);
    verify(failingProvider).embedPassage(anyString());
  }

  @Test
  @DisplayName("Should build an empty snapshot without calling the embedding model")
  void shouldBuildEmptySnapshot() {
    CatalogIndexBuilder builder =
        new CatalogIndexBuilder(catalogLoader, failingProvider, config, meterRegistry);

    CatalogIndex index = builder.build(List.of());

    assertThat(index.isEmpty()).isTrue();
    verify(failingProvider, never()).embedPassage(anyString());
  }

  @Test
  @DisplayName("Holder should report not-ready until the first swap, then serve the latest")
  void holderShouldSwapAtomically() {
    CatalogIndexBuilder builder =
        new CatalogIndexBuilder(catalogLoader, provider, config, meterRegistry);
    CatalogIndexHolder holder = new CatalogIndexHolder();

    assertThatThrownBy(holder::current).isInstanceOf(IndexNotReadyException.class);
    assertThat(holder.peek()).isEmpty();

    CatalogIndex first = builder.build(TestRecords.javaTeamworkPython());
    assertThat(holder.swap(first)).isEmpty();
    CatalogIndex reader = holder.current();

    CatalogIndex second = builder.build(TestRecords.javaTeamworkPython().subList(0, 1));
    assertThat(holder.swap(second)).contains(first);

    assertThat(holder.current()).isSameAs(second);
    // a reader holding the old snapshot keeps seeing it unchanged
    assertThat(reader.size()).isEqualTo(3);
  }
}
