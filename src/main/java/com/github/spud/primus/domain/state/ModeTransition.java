package com.github.spud.primus.domain.state;

import java.time.Instant;
import lombok.Value;

@Value
public class ModeTransition {

  Mode from;

  Mode to;

  ModeEvent event;

  Instant at;
}
