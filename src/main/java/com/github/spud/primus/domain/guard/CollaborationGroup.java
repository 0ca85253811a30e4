package com.github.spud.primus.domain.guard;

import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.Getter;

/**
 * Two agents working together, and the keys of their private partitions each one chose to share
 * with the other.
 */
public class CollaborationGroup {

  public static final int MAX_MEMBERS = 2;

  @Getter
  private final String id;

  @Getter
  private final Instant openedAt;

  private final Set<String> members = new LinkedHashSet<>();

  private final Map<String, Set<String>> sharedKeys = new LinkedHashMap<>();

  CollaborationGroup(String id, String first, String second, Instant openedAt) {
    this.id = id;
    this.openedAt = openedAt;
    members.add(first);
    members.add(second);
  }

  public Set<String> getMembers() {
    return Collections.unmodifiableSet(members);
  }

  public boolean contains(String actorId) {
    return members.contains(actorId);
  }

  public Map<String, Set<String>> getSharedKeys() {
    Map<String, Set<String>> copy = new LinkedHashMap<>();
    sharedKeys.forEach((owner, keys) -> copy.put(owner, Set.copyOf(keys)));
    return copy;
  }

  void share(String ownerId, Set<String> keys) {
    sharedKeys.computeIfAbsent(ownerId, o -> new HashSet<>()).addAll(keys);
  }

  boolean isShared(String ownerId, String key) {
    Set<String> keys = sharedKeys.get(ownerId);
    return keys != null && keys.contains(key);
  }
}
