package com.phillippitts.frontdesk.service.session;

import com.phillippitts.frontdesk.config.properties.ReplyProperties;
import com.phillippitts.frontdesk.exception.UnknownSessionException;
import com.phillippitts.frontdesk.service.carrier.CarrierChannel;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Indexed registry of active call sessions, by session id and by carrier call id.
 *
 * <p>Sessions are created on call start and explicitly destroyed on call end. Destroying a session
 * twice is harmless: only the first removal runs the teardown.
 */
@Component
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final Map<String, CallSession> byId = new ConcurrentHashMap<>();
    private final Map<String, String> idByCallSid = new ConcurrentHashMap<>();
    private final ReplyProperties replyProperties;

    public SessionRegistry(ReplyProperties replyProperties) {
        this.replyProperties = replyProperties;
    }

    /**
     * Creates and registers a session for a newly started call.
     *
     * @param callSid   carrier call id
     * @param streamSid carrier media stream id (may be null for non-carrier channels)
     * @param channel   outbound media channel of the call
     */
    public CallSession create(String callSid, String streamSid, CarrierChannel channel) {
        String id = UUID.randomUUID().toString();
        ConversationHistory history = new ConversationHistory(
                replyProperties.getSystemPrompt(), replyProperties.getHistoryTurns());
        CallSession session = new CallSession(id, callSid, streamSid, channel, history);
        byId.put(id, session);
        String previous = idByCallSid.put(callSid, id);
        if (previous != null) {
            LOG.warn("Call {} restarted its media stream; replacing session {}", callSid, previous);
            destroy(previous);
        }
        LOG.info("Session created: sessionId={}, callSid={}, active={}", id, callSid, byId.size());
        return session;
    }

    public Optional<CallSession> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(byId.get(sessionId));
    }

    public CallSession require(String sessionId) {
        return find(sessionId).orElseThrow(() -> new UnknownSessionException(sessionId));
    }

    public Optional<CallSession> findByCallSid(String callSid) {
        String id = callSid == null ? null : idByCallSid.get(callSid);
        return find(id);
    }

    /**
     * Removes the session and tears it down.
     *
     * @return true if this call performed the teardown
     */
    public boolean destroy(String sessionId) {
        CallSession session = sessionId == null ? null : byId.remove(sessionId);
        if (session == null) {
            return false;
        }
        idByCallSid.remove(session.callSid(), sessionId);
        boolean tornDown = session.close();
        if (tornDown) {
            LOG.info("Session destroyed: sessionId={}, callSid={}, active={}",
                    sessionId, session.callSid(), byId.size());
        }
        return tornDown;
    }

    public Collection<CallSession> active() {
        return List.copyOf(byId.values());
    }

    public int activeCount() {
        return byId.size();
    }

    @PreDestroy
    void destroyAll() {
        for (String id : new ArrayList<>(byId.keySet())) {
            destroy(id);
        }
    }
}
