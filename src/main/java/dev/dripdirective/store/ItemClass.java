package dev.dripdirective.store;

/** The kind of object a partition holds. Each tenant gets one partition per class. */
public enum ItemClass {
  PROFILE("user_profiles"),
  ITEM("wardrobe_items"),
  RECOMMENDATION("recommendations");

  private final String collectionName;

  ItemClass(String collectionName) {
    this.collectionName = collectionName;
  }

  /** Human-readable collection name, used in log lines. */
  public String collectionName() {
    return collectionName;
  }
}
