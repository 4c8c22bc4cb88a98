package dev.dripdirective.recommend;

import dev.dripdirective.diversify.Candidate;
import dev.dripdirective.ranking.ComposedGroup;
import java.util.List;
import java.util.Optional;

/**
 * External generative step that turns diverse candidates into named outfits with a confidence
 * score. Its output is non-deterministic and its confidence is treated as an opaque number.
 */
@FunctionalInterface
public interface OutfitComposer {

  /**
   * Composes outfits from the given candidates.
   *
   * @param query the user's request text
   * @param candidates the diverse candidates, most preferred first
   * @return composed groups in the composer's own order, or empty if it produced nothing
   */
  Optional<List<ComposedGroup>> compose(String query, List<Candidate> candidates);
}
