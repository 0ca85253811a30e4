package com.github.spud.primus.support;

import com.github.spud.primus.application.config.AuditProperties;
import com.github.spud.primus.application.config.PolicyProperties;
import com.github.spud.primus.domain.actor.Actor;
import com.github.spud.primus.domain.actor.ActorDirectory;
import com.github.spud.primus.domain.audit.AuditLog;
import com.github.spud.primus.domain.capability.CapabilityRegistry;
import com.github.spud.primus.domain.guard.ActorLifecycleService;
import com.github.spud.primus.domain.guard.AgentCommunicationGuard;
import com.github.spud.primus.domain.guard.InteractionGuard;
import com.github.spud.primus.domain.memory.MemoryPartitionStore;
import com.github.spud.primus.domain.policy.PermissionEnforcer;
import com.github.spud.primus.domain.policy.ReadGrantRegistry;
import com.github.spud.primus.domain.sandbox.AesGcmCipher;
import com.github.spud.primus.domain.state.ModeController;
import javax.crypto.spec.SecretKeySpec;

/**
 * The policy core wired by hand, the way the application context wires it.
 */
public class PolicyFixture {

  public static final byte[] KEY = new byte[32];

  static {
    for (int i = 0; i < KEY.length; i++) {
      KEY[i] = (byte) i;
    }
  }

  public final PolicyProperties properties = new PolicyProperties();

  public final AuditProperties auditProperties = new AuditProperties();

  public final AesGcmCipher cipher = new AesGcmCipher(new SecretKeySpec(KEY, "AES"));

  public final CapabilityRegistry capabilityRegistry = new CapabilityRegistry();

  public final ReadGrantRegistry readGrants = new ReadGrantRegistry();

  public final ActorDirectory directory;

  public final AgentCommunicationGuard communicationGuard;

  public final ModeController modeController;

  public final AuditLog auditLog;

  public final MemoryPartitionStore store;

  public final PermissionEnforcer enforcer;

  public final InteractionGuard guard;

  public final ActorLifecycleService lifecycle;

  public PolicyFixture() {
    directory = new ActorDirectory(properties);
    communicationGuard = new AgentCommunicationGuard(properties);
    modeController = ModeMachines.controller();
    auditLog = new AuditLog(modeController, auditProperties);
    store = new MemoryPartitionStore(cipher, properties);
    enforcer = new PermissionEnforcer(capabilityRegistry, directory, readGrants,
      communicationGuard);
    guard = new InteractionGuard(directory, enforcer, modeController, communicationGuard,
      readGrants, store, auditLog, properties);
    lifecycle = new ActorLifecycleService(directory, modeController, communicationGuard,
      readGrants);
  }

  public Actor primus() {
    return directory.primus();
  }

  public Actor sandbox() {
    return directory.sandbox();
  }
}
