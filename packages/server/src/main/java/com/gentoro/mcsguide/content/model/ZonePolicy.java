package com.gentoro.mcsguide.content.model;

import java.util.List;

/** Availability of a feature inside one governance zone. */
public record ZonePolicy(boolean available, String reason, List<String> requirements) {

  public ZonePolicy {
    requirements = Lists.frozen(requirements);
  }
}
