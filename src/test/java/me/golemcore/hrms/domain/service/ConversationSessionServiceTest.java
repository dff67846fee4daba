package me.golemcore.hrms.domain.service;

import me.golemcore.hrms.domain.model.Message;
import me.golemcore.hrms.infrastructure.config.HrmsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationSessionServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-14T10:00:00Z");

    private ConversationSessionService service;

    @BeforeEach
    void setUp() {
        HrmsProperties properties = new HrmsProperties();
        properties.getAgent().setMaxHistory(4);
        service = new ConversationSessionService(properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldCreateSessionOnFirstUse() {
        assertTrue(service.find("s-1").isEmpty());

        service.getOrCreate("s-1");

        assertTrue(service.find("s-1").isPresent());
        assertEquals(NOW, service.find("s-1").get().getCreatedAt());
        assertTrue(service.history("s-1").isEmpty());
    }

    @Test
    void shouldKeepOnlyMostRecentMessages() {
        for (int i = 1; i <= 6; i++) {
            service.append("s-1", Message.user("m" + i, NOW));
        }

        List<Message> history = service.history("s-1");

        assertEquals(4, history.size());
        assertEquals("m3", history.get(0).getContent());
        assertEquals("m6", history.get(3).getContent());
    }

    @Test
    void shouldIsolateSessions() {
        service.append("s-1", Message.user("hello", NOW));
        service.append("s-2", Message.user("bonjour", NOW));

        assertEquals("hello", service.history("s-1").get(0).getContent());
        assertEquals("bonjour", service.history("s-2").get(0).getContent());
    }

    @Test
    void shouldReturnImmutableSnapshot() {
        service.append("s-1", Message.user("hello", NOW));
        List<Message> snapshot = service.history("s-1");

        service.append("s-1", Message.assistant("hi", NOW));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(Message.user("x", NOW)));
    }
}
