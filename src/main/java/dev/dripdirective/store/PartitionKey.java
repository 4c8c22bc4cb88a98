package dev.dripdirective.store;

/**
 * Scope of every store operation: one tenant, one item class. Identical item ids under different
 * keys are different entities.
 *
 * @param tenantId opaque tenant identifier (must not be blank)
 * @param itemClass the item class
 */
public record PartitionKey(String tenantId, ItemClass itemClass) {

  public PartitionKey {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("tenantId must not be blank");
    }
    if (itemClass == null) {
      throw new IllegalArgumentException("itemClass must not be null");
    }
  }

  public static PartitionKey items(String tenantId) {
    return new PartitionKey(tenantId, ItemClass.ITEM);
  }

  public static PartitionKey profiles(String tenantId) {
    return new PartitionKey(tenantId, ItemClass.PROFILE);
  }

  public static PartitionKey recommendations(String tenantId) {
    return new PartitionKey(tenantId, ItemClass.RECOMMENDATION);
  }

  @Override
  public String toString() {
    return tenantId + "/" + itemClass.collectionName();
  }
}
