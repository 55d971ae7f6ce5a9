package io.heartbeat4j.notify;

/**
 * A delivery channel (chat bot, mail, log...). Implementations are called from the dispatcher's send
 * executor and may block; the dispatcher bounds each call with its send timeout.
 */
public interface Notifier {

    /**
     * Channel name, used in dispatch logs.
     */
    String name();

    void send(String message) throws Exception;
}
