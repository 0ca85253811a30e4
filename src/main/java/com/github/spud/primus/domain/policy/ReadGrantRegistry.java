package com.github.spud.primus.domain.policy;

import com.github.spud.primus.domain.memory.PartitionId;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Explicit cross-partition read grants issued by partition owners. Mutated only by the interaction
 * guard after a GRANT_READ or REVOKE_READ action was allowed, so every grant is audited.
 */
@Component
public class ReadGrantRegistry {

  private final Map<PartitionId, Set<String>> grants = new ConcurrentHashMap<>();

  public void grant(PartitionId partition, String granteeId) {
    grants.computeIfAbsent(partition, p -> ConcurrentHashMap.newKeySet()).add(granteeId);
  }

  public void revoke(PartitionId partition, String granteeId) {
    grants.computeIfPresent(partition, (p, grantees) -> {
      grantees.remove(granteeId);
      return grantees.isEmpty() ? null : grantees;
    });
  }

  public boolean isGranted(PartitionId partition, String granteeId) {
    Set<String> grantees = grants.get(partition);
    return grantees != null && grantees.contains(granteeId);
  }

  /**
   * Drops every grant held by or issued by an actor.
   */
  public void dropActor(String actorId) {
    grants.keySet().removeIf(partition -> partition.getOwnerId().equals(actorId));
    grants.values().forEach(grantees -> grantees.remove(actorId));
    grants.values().removeIf(Set::isEmpty);
  }
}
