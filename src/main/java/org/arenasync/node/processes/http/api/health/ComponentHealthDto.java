package org.arenasync.node.processes.http.api.health;

import org.arenasync.arena.api.IMonitorable;
import org.arenasync.arena.api.OperationalError;

import java.util.List;
import java.util.Map;

/**
 * Health, metrics and recent errors of one arena component.
 */
public record ComponentHealthDto(
    boolean healthy,
    Map<String, Number> metrics,
    List<ErrorDto> errors
) {

    /**
     * A recorded operational error.
     */
    public record ErrorDto(String timestamp, String errorType, String message, String details) {

        static ErrorDto from(final OperationalError error) {
            return new ErrorDto(error.timestamp().toString(), error.errorType(), error.message(), error.details());
        }
    }

    /**
     * @param component  The component.
     * @param errorLimit Most recent errors to include.
     */
    public static ComponentHealthDto from(final IMonitorable component, final int errorLimit) {
        final List<OperationalError> errors = component.getErrors();
        final List<ErrorDto> recent = errors.subList(Math.max(0, errors.size() - errorLimit), errors.size())
            .stream()
            .map(ErrorDto::from)
            .toList();
        return new ComponentHealthDto(component.isHealthy(), component.getMetrics(), recent);
    }
}
