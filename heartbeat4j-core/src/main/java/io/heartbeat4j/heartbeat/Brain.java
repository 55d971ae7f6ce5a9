package io.heartbeat4j.heartbeat;

/**
 * Decision-making collaborator driven by the {@link HeartbeatController}.
 *
 * <p>Implementations should honour {@link CycleContext#remaining()}; calls that outlive the cycle
 * deadline are interrupted.
 */
public interface Brain {

    /**
     * Sense: produce a snapshot of the environment. Null or blank means nothing to evaluate.
     */
    String collectEnv(CycleContext ctx) throws Exception;

    /**
     * Think: decide what to do about the snapshot.
     */
    Decision think(CycleContext ctx, String snapshot) throws Exception;

    /**
     * Act on a decision other than {@link Decision.Kind#NO_OP}.
     */
    void executeDecision(CycleContext ctx, Decision decision) throws Exception;

    /**
     * Best-effort idle action run when the decision is {@link Decision.Kind#NO_OP}.
     */
    void runPatrol(CycleContext ctx) throws Exception;

    void generateMorningBriefing(CycleContext ctx) throws Exception;
}
