package com.github.spud.primus.domain.guard;

import com.github.spud.primus.domain.actor.Actor;
import com.github.spud.primus.domain.actor.ActorDirectory;
import com.github.spud.primus.domain.capability.CapabilityGrant;
import com.github.spud.primus.domain.policy.ReadGrantRegistry;
import com.github.spud.primus.domain.state.ModeController;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Creates and closes actors. Closing an actor removes its subchats too, and cleans up everything
 * that referenced any of them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActorLifecycleService {

  private final ActorDirectory actorDirectory;

  private final ModeController modeController;

  private final AgentCommunicationGuard communicationGuard;

  private final ReadGrantRegistry readGrants;

  public Actor createAgent(String name) {
    return actorDirectory.createAgent(name);
  }

  public Actor createSubChat(String parentId, String name) {
    return actorDirectory.createSubChat(parentId, name);
  }

  public CapabilityGrant narrow(String actorId, CapabilityGrant grant) {
    return actorDirectory.narrow(actorId, grant);
  }

  /**
   * @return ids of every closed actor
   */
  public List<String> close(String actorId) {
    List<String> removed = actorDirectory.remove(actorId);
    int discarded = 0;
    for (String id : removed) {
      discarded += modeController.cancelFor(id);
      communicationGuard.dissolveFor(id);
      readGrants.dropActor(id);
    }
    log.info("Closed actors: ids={}, discardedApprovals={}", removed, discarded);
    return removed;
  }
}
