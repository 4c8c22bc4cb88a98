package dev.dripdirective.recommend;

import org.jspecify.annotations.Nullable;

/** Builds the text that gets embedded for a recommendation query. */
public final class QueryContext {

  static final int MAX_PROFILE_CHARS = 500;
  static final String GENERAL_STYLE = "General style";

  private QueryContext() {}

  /**
   * Appends the user's style profile to the request: {@code "<query>. User style: <profile>"}. The
   * profile is cut at 500 characters; a missing or blank profile reads {@code General style}.
   */
  public static String of(String query, @Nullable String profileSummary) {
    String style =
        profileSummary == null || profileSummary.isBlank()
            ? GENERAL_STYLE
            : profileSummary.substring(0, Math.min(MAX_PROFILE_CHARS, profileSummary.length()));
    return query + ". User style: " + style;
  }
}
