package com.phillippitts.frontdesk.service.carrier;

import com.phillippitts.frontdesk.config.properties.ReplyProperties;
import com.phillippitts.frontdesk.service.orchestration.SessionOrchestrator;
import com.phillippitts.frontdesk.service.session.CallSession;
import com.phillippitts.frontdesk.service.session.SessionRegistry;
import com.phillippitts.frontdesk.testutil.RecordingCarrierChannel;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BrowserVoiceHandlerTest {

    private SessionOrchestrator orchestrator;
    private WebSocketSession socket;
    private BrowserVoiceHandler handler;
    private CallSession session;

    @BeforeEach
    void setUp() throws Exception {
        orchestrator = mock(SessionOrchestrator.class);
        socket = mock(WebSocketSession.class);
        Map<String, Object> attributes = new HashMap<>();
        when(socket.getAttributes()).thenReturn(attributes);
        when(socket.getId()).thenReturn("ws-7");
        when(socket.isOpen()).thenReturn(true);
        session = new SessionRegistry(new ReplyProperties())
                .create("browser-ws-7", null, new RecordingCarrierChannel());
        when(orchestrator.startSession(anyString(), isNull(), any(CarrierChannel.class))).thenReturn(session);
        handler = new BrowserVoiceHandler(orchestrator);
        handler.afterConnectionEstablished(socket);
    }

    @Test
    void connectStartsASessionAndAnnouncesIt() throws Exception {
        ArgumentCaptor<CarrierChannel> channel = ArgumentCaptor.forClass(CarrierChannel.class);
        verify(orchestrator).startSession(eq("browser-ws-7"), isNull(), channel.capture());
        assertThat(channel.getValue()).isInstanceOf(BrowserChannel.class);

        ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
        verify(socket).sendMessage(sent.capture());
        JSONObject announcement = new JSONObject(sent.getValue().getPayload());
        assertThat(announcement.getString("type")).isEqualTo("session_started");
        assertThat(announcement.getString("sessionId")).isEqualTo(session.id());
    }

    @Test
    void binaryFramesArePcmAudio() throws Exception {
        byte[] pcm = new byte[640];
        pcm[1] = 0x10;

        handler.handleMessage(socket, new BinaryMessage(pcm));

        verify(orchestrator).onPcmAudio(session.id(), pcm);
    }

    @Test
    void typedTextBecomesAQuery() throws Exception {
        handler.handleMessage(socket, new TextMessage("{\"type\":\"text_message\",\"text\":\"Where do I park?\"}"));

        verify(orchestrator).onTypedQuery(session.id(), "Where do I park?");
    }

    @Test
    void controlAndMalformedMessagesAreIgnored() throws Exception {
        handler.handleMessage(socket, new TextMessage("{\"type\":\"start_recording\"}"));
        handler.handleMessage(socket, new TextMessage("{\"type\":\"ping\"}"));
        handler.handleMessage(socket, new TextMessage("{broken"));

        verify(orchestrator, never()).onTypedQuery(anyString(), anyString());
    }

    @Test
    void closeEndsTheSession() throws Exception {
        handler.afterConnectionClosed(socket, CloseStatus.NORMAL);
        handler.afterConnectionClosed(socket, CloseStatus.NORMAL);

        verify(orchestrator).endSession(session.id());
    }
}
