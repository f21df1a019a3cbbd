package com.occasionbell.reminder.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Required trigger set produced by one compiler run.
 *
 * @param epoch reconciliation epoch, strictly increasing per compiler run
 * @param scopes namespaces this schedule is authoritative for; armed jobs of other scopes are left
 *     alone during reconciliation
 */
public record CompiledSchedule(long epoch, Set<Trigger> triggers, Set<TriggerScope> scopes) {

  public CompiledSchedule {
    triggers = Collections.unmodifiableSet(new LinkedHashSet<>(triggers));
    scopes =
        Collections.unmodifiableSet(
            scopes.isEmpty() ? EnumSet.noneOf(TriggerScope.class) : EnumSet.copyOf(scopes));
  }

  public static CompiledSchedule full(long epoch, Set<Trigger> triggers) {
    return new CompiledSchedule(epoch, triggers, EnumSet.allOf(TriggerScope.class));
  }
}
