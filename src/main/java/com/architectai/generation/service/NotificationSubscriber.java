package com.architectai.generation.service;

import com.architectai.generation.model.NotificationEvent;

import java.io.IOException;

/**
 * A live connection that can receive pushed events.
 */
public interface NotificationSubscriber {

    /**
     * Stable identifier of the connection, used for logging and bookkeeping.
     */
    String getId();

    boolean isOpen();

    void send(NotificationEvent event) throws IOException;
}
