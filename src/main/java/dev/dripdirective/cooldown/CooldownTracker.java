package dev.dripdirective.cooldown;

import dev.dripdirective.history.OutputHistoryService;
import dev.dripdirective.history.RecentOutput;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Works out which wardrobe items were handed out recently so the next search can exclude them.
 *
 * <p>Ids are collected newest record first, group by group, in stored order, and the result is cut
 * at {@code maxIds}. The same history therefore always yields the same set in the same iteration
 * order.
 */
@Service
public class CooldownTracker {

  private static final Logger log = LoggerFactory.getLogger(CooldownTracker.class);

  private final OutputHistoryService historyService;

  public CooldownTracker(OutputHistoryService historyService) {
    this.historyService = historyService;
  }

  /**
   * Item ids used in the tenant's last {@code lookback} recommendations.
   *
   * @param tenantId the tenant
   * @param lookback how many recent records to scan
   * @param maxIds upper bound on the returned set
   * @return at most {@code maxIds} ids, in first-seen order
   */
  public Set<String> recentlyUsedIds(String tenantId, int lookback, int maxIds) {
    if (lookback <= 0 || maxIds <= 0) {
      return Set.of();
    }
    Set<String> used = collect(historyService.latest(tenantId, lookback), maxIds);
    log.debug("Cooldown for tenant {}: {} item(s) excluded", tenantId, used.size());
    return used;
  }

  /** Union of all member ids across all groups, truncated to {@code maxIds}. */
  static Set<String> collect(List<RecentOutput> outputs, int maxIds) {
    Set<String> used = new LinkedHashSet<>();
    for (RecentOutput output : outputs) {
      for (List<String> group : output.itemGroups()) {
        for (String id : group) {
          used.add(id);
          if (used.size() == maxIds) {
            return used;
          }
        }
      }
    }
    return used;
  }
}
