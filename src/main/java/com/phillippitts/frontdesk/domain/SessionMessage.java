package com.phillippitts.frontdesk.domain;

/**
 * A pipeline message addressed to one call session. The session id is the ordering key
 * on every queue: messages for one session are delivered in order, sessions run independently.
 */
public interface SessionMessage {

    String sessionId();
}
