package dev.dripdirective.store;

/**
 * The vector backend could not be reached or failed while serving a request. Callers are expected
 * to degrade (treat the result as empty) and log, not abort the whole recommendation.
 */
public class SimilarityStoreUnavailableException extends RuntimeException {

  private final transient PartitionKey partition;

  public SimilarityStoreUnavailableException(
      PartitionKey partition, String message, Throwable cause) {
    super(message + " [" + partition + "]", cause);
    this.partition = partition;
  }

  public PartitionKey getPartition() {
    return partition;
  }
}
