package io.heartbeat4j.worker;

/**
 * One-shot unit of background work. Executed exactly once by one worker, never persisted.
 */
public interface BackgroundJob {
    String name();

    void execute() throws Exception;

    static BackgroundJob of(String name, Runnable body) {
        return new BackgroundJob() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void execute() {
                body.run();
            }
        };
    }
}
