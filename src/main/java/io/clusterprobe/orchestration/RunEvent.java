package io.clusterprobe.orchestration;

import lombok.Value;

/**
 * Something the orchestrator's event loop reacts to. Each type is acted on at most once per run.
 */
@Value
public class RunEvent {

    public enum Type {
        GRACE_DEADLINE,
        HARD_DEADLINE,
        TRANSPORT_TERMINATED,
        COMPLETED
    }

    Type type;

    /**
     * Why the transport terminated; null for every other event and for a clean close.
     */
    Throwable cause;

    public static RunEvent of(Type type) {
        return new RunEvent(type, null);
    }

    public static RunEvent transportTerminated(Throwable cause) {
        return new RunEvent(Type.TRANSPORT_TERMINATED, cause);
    }
}
