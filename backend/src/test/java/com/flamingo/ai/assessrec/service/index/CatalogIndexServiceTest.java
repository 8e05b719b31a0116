package com.flamingo.ai.assessrec.service.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.flamingo.ai.assessrec.config.RecommenderConfig;
import com.flamingo.ai.assessrec.exception.EmbeddingUnavailableException;
import com.flamingo.ai.assessrec.service.catalog.CatalogLoader;
import com.flamingo.ai.assessrec.service.embedding.EmbeddingProvider;
import com.flamingo.ai.assessrec.testsupport.TestRecords;
import com.flamingo.ai.assessrec.testsupport.VocabularyEmbeddingProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CatalogIndexService Tests")
class CatalogIndexServiceTest {

  private final VocabularyEmbeddingProvider vocabularyProvider =
      new VocabularyEmbeddingProvider("java", "python", "teamwork");

  private CatalogLoader catalogLoader;
  private EmbeddingProvider embeddingProvider;
  private CatalogIndexHolder holder;
  private CatalogIndexService service;

  @BeforeEach
  void setUp() {
    RecommenderConfig config = new RecommenderConfig();
    config.getEmbedding().setDimension(vocabularyProvider.dimension());
    catalogLoader = mock(CatalogLoader.class);
    embeddingProvider = mock(EmbeddingProvider.class);
    when(catalogLoader.load()).thenReturn(TestRecords.javaTeamworkPython());
    holder = new CatalogIndexHolder();
    service =
        new CatalogIndexService(
            new CatalogIndexBuilder(
                catalogLoader, embeddingProvider, config, new SimpleMeterRegistry()),
            holder);
  }

  private void embeddingWorks() {
    doAnswer(invocation -> vocabularyProvider.embedPassage(invocation.getArgument(0)))
        .when(embeddingProvider)
        .embedPassage(anyString());
  }

  private void embeddingFails() {
    doThrow(new EmbeddingUnavailableException("blip"))
        .when(embeddingProvider)
        .embedPassage(anyString());
  }

  @Test
  @DisplayName("Should publish a lexical-only snapshot when it is the first one")
  void shouldPublishLexicalFirstSnapshot() {
    embeddingFails();

    CatalogIndex index = service.refresh();

    assertThat(index.hasVectors()).isFalse();
    assertThat(holder.current()).isSameAs(index);
  }

  @Test
  @DisplayName("Should keep the vector snapshot when a rebuild cannot embed the catalog")
  void shouldKeepVectorSnapshotOnEmbeddingFailure() {
    embeddingWorks();
    CatalogIndex vectorIndex = service.refresh();
    embeddingFails();

    assertThatThrownBy(service::refresh).isInstanceOf(EmbeddingUnavailableException.class);

    assertThat(holder.current()).isSameAs(vectorIndex);
    assertThat(holder.current().hasVectors()).isTrue();
  }

  @Test
  @DisplayName("Should upgrade a lexical-only snapshot once embedding recovers")
  void shouldUpgradeLexicalSnapshot() {
    embeddingFails();
    service.refresh();
    embeddingWorks();

    CatalogIndex index = service.refresh();

    assertThat(index.hasVectors()).isTrue();
    assertThat(holder.current()).isSameAs(index);
  }

  @Test
  @DisplayName("Should publish an empty catalog over a vector snapshot")
  void shouldPublishEmptyCatalog() {
    embeddingWorks();
    service.refresh();
    when(catalogLoader.load()).thenReturn(List.of());

    CatalogIndex index = service.refresh();

    assertThat(holder.current()).isSameAs(index);
    assertThat(index.isEmpty()).isTrue();
  }
}
