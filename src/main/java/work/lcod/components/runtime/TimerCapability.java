package work.lcod.components.runtime;

import work.lcod.components.trigger.TimerConfig;

/**
 * Runtime view of a timer interface prop: the schedule in effect for this deployment.
 */
public record TimerCapability(String propName, TimerConfig config) {}
