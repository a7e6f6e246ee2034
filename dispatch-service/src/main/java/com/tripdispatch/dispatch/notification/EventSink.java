package com.tripdispatch.dispatch.notification;

import java.io.IOException;

/**
 * Transport behind one live connection. The WebSocket handler supplies the
 * production implementation; tests supply in-memory ones.
 */
public interface EventSink {

    void send(String payload) throws IOException;

    void close();
}
