package czm.staff_application_be.notification;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MessageLedgerTest {
    private static final Set<MessageRole> SINGLETONS = EnumSet.of(MessageRole.SUMMARY, MessageRole.RESULT);
    private static final MessageContent CONTENT = MessageContent.builder("Application Result").build();

    @Mock
    private MessageRefDao dao;
    @Mock
    private NotificationDispatcher dispatcher;

    private MessageLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new MessageLedger(dao, dispatcher, Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void resultReplacesPreviousSummary() {
        MessageRef summary = new MessageRef("dm:u1", "m-1", MessageRole.SUMMARY, "app-1");
        MessageRef result = new MessageRef("dm:u1", "m-2", MessageRole.RESULT, "app-1");
        when(dao.findByConversation("dm:u1", SINGLETONS)).thenReturn(List.of(summary), List.of(result));
        when(dispatcher.send("dm:u1", MessageRole.RESULT, "app-1", CONTENT)).thenReturn(Optional.of(result));

        Optional<MessageRef> sent = ledger.sendTracked("dm:u1", MessageRole.RESULT, "app-1", CONTENT);

        assertEquals(Optional.of(result), sent);
        InOrder order = inOrder(dispatcher, dao);
        order.verify(dispatcher).deleteMany(List.of(summary));
        order.verify(dao).delete(summary);
        order.verify(dispatcher).send("dm:u1", MessageRole.RESULT, "app-1", CONTENT);
        order.verify(dao).insert(eq(result), any());
    }

    @Test
    void refIsForgottenEvenWhenTransportCannotDelete() {
        MessageRef prompt = new MessageRef("dm:u1", "m-1", MessageRole.QUESTION_PROMPT, "app-1");
        when(dao.findByConversation("dm:u1", EnumSet.of(MessageRole.QUESTION_PROMPT))).thenReturn(List.of(prompt));
        when(dispatcher.deleteMany(List.of(prompt))).thenReturn(0);

        int removed = ledger.removeAll("dm:u1", EnumSet.of(MessageRole.QUESTION_PROMPT));

        assertEquals(1, removed);
        verify(dao).delete(prompt);
    }

    @Test
    void failedSendRecordsNothing() {
        when(dao.findByConversation("dm:u1", SINGLETONS)).thenReturn(List.of(), List.of());
        when(dispatcher.send("dm:u1", MessageRole.SUMMARY, "app-1", CONTENT)).thenReturn(Optional.empty());

        assertTrue(ledger.sendTracked("dm:u1", MessageRole.SUMMARY, "app-1", CONTENT).isEmpty());
        verify(dao, never()).insert(any(), any());
    }

    @Test
    void removeAllExceptKeepsResult() {
        Set<MessageRole> expected = EnumSet.of(MessageRole.QUESTION_PROMPT, MessageRole.SUMMARY, MessageRole.STAFF_REVIEW_CARD);
        when(dao.findByConversation("dm:u1", expected)).thenReturn(List.of());

        assertEquals(0, ledger.removeAllExcept("dm:u1", MessageRole.RESULT));
    }

    @Test
    void transcriptsAreNotTracked() {
        assertThrows(IllegalArgumentException.class,
                () -> ledger.sendTracked("dm:u1", MessageRole.TRANSCRIPT, "app-1", CONTENT));
    }

    @Test
    void racingInstallKeepsOnlyNewestSummary() {
        MessageRef older = new MessageRef("dm:u1", "m-1", MessageRole.SUMMARY, "app-1");
        MessageRef newer = new MessageRef("dm:u1", "m-2", MessageRole.RESULT, "app-1");
        when(dao.findByConversation("dm:u1", SINGLETONS)).thenReturn(List.of(), List.of(older, newer));
        when(dispatcher.send("dm:u1", MessageRole.RESULT, "app-1", CONTENT)).thenReturn(Optional.of(newer));

        Optional<MessageRef> sent = ledger.sendTracked("dm:u1", MessageRole.RESULT, "app-1", CONTENT);

        assertEquals(Optional.of(newer), sent);
        verify(dispatcher).deleteMany(List.of(older));
        verify(dao).delete(older);
        verify(dao, never()).delete(newer);
    }

    @Test
    void singleSummaryNeedsNoCleanup() {
        when(dao.findByConversation("dm:u1", SINGLETONS)).thenReturn(List.of(
                new MessageRef("dm:u1", "m-1", MessageRole.SUMMARY, "app-1")));

        assertEquals(0, ledger.enforceSingleLiveSummary("dm:u1"));
        verify(dispatcher, never()).deleteMany(any());
    }
}
