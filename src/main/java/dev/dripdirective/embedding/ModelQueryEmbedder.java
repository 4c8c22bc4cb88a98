package dev.dripdirective.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * {@link QueryEmbedder} backed by the in-process LangChain4j {@link EmbeddingModel}
 * (bge-small-en-v1.5 quantized, 384 dimensions).
 *
 * <p>Queries get the BGE retrieval instruction prepended; documents are embedded verbatim, matching
 * how the model was trained for asymmetric search.
 */
@Service
public class ModelQueryEmbedder implements QueryEmbedder {

  private static final Logger log = LoggerFactory.getLogger(ModelQueryEmbedder.class);

  /** Query prefix recommended by the bge-small-en-v1.5 model card. Never applied to documents. */
  static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  private final EmbeddingModel embeddingModel;

  public ModelQueryEmbedder(EmbeddingModel embeddingModel) {
    this.embeddingModel = embeddingModel;
  }

  @Override
  public Optional<Embedding> embedQuery(String text) {
    return embed(BGE_QUERY_PREFIX + text);
  }

  @Override
  public Optional<Embedding> embedDocument(String text) {
    return embed(text);
  }

  private Optional<Embedding> embed(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    try {
      Embedding embedding = embeddingModel.embed(text).content();
      if (embedding == null || embedding.vector().length == 0) {
        log.warn("Embedding model returned an empty vector for {} chars of text", text.length());
        return Optional.empty();
      }
      return Optional.of(embedding);
    } catch (RuntimeException e) {
      log.warn("Embedding model failed for {} chars of text: {}", text.length(), e.getMessage());
      return Optional.empty();
    }
  }
}
