package dev.dripdirective.embedding;

import dev.langchain4j.data.embedding.Embedding;
import java.util.Optional;

/**
 * Turns text into an embedding vector. Implementations never throw for model failures; they return
 * empty so the pipeline can degrade instead of aborting.
 */
public interface QueryEmbedder {

  /** Embeds a retrieval query (a user request, possibly enriched with profile context). */
  Optional<Embedding> embedQuery(String text);

  /** Embeds a stored document (a wardrobe item, a profile summary, a recommendation digest). */
  Optional<Embedding> embedDocument(String text);
}
