package org.arenasync.node.processes.http.api.health;

import java.util.Map;

/**
 * Node health summary.
 *
 * @param status     "UP" when every component is healthy, otherwise "DEGRADED"
 * @param region     Arena region identifier
 * @param tick       Current world tick
 * @param sessions   Open sessions
 * @param components Per-component health, keyed by component name
 */
public record HealthDto(
    String status,
    String region,
    long tick,
    int sessions,
    Map<String, ComponentHealthDto> components
) {}
