package com.maestro.runtime.worker;

import com.maestro.plugin.ControlMessage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MailboxTest {

    private record Pause() implements ControlMessage {
    }

    @Test
    void controlAwareMailboxTakesControlMessagesFirst() {
        Mailbox mailbox = new Mailbox(true);
        Pause pause = new Pause();
        mailbox.offer("a");
        mailbox.offer(pause);
        mailbox.offer("b");

        assertSame(pause, mailbox.poll());
        assertEquals("a", mailbox.poll());
        assertEquals("b", mailbox.poll());
        assertNull(mailbox.poll());
    }

    @Test
    void plainMailboxKeepsArrivalOrder() {
        Mailbox mailbox = new Mailbox(false);
        Pause pause = new Pause();
        mailbox.offer("a");
        mailbox.offer(pause);

        assertEquals("a", mailbox.poll());
        assertSame(pause, mailbox.poll());
    }

    @Test
    void systemSignalsJumpAheadAndAreNotCounted() {
        Mailbox mailbox = new Mailbox(false);
        mailbox.offer("a");
        mailbox.offerSystem(SystemSignal.STOP);

        assertEquals(1, mailbox.size());
        assertSame(SystemSignal.STOP, mailbox.poll());
        assertEquals("a", mailbox.poll());
        assertEquals(0, mailbox.size());
    }

    @Test
    void drainSignalGoesLastAndClosesMailbox() {
        Mailbox mailbox = new Mailbox(false);
        mailbox.offer("a");

        assertTrue(mailbox.offerLastAndClose(SystemSignal.DRAIN_STOP));
        assertFalse(mailbox.offer("late"));
        assertFalse(mailbox.offerLastAndClose(SystemSignal.DRAIN_STOP));
        assertEquals("a", mailbox.poll());
        assertSame(SystemSignal.DRAIN_STOP, mailbox.poll());
    }

    @Test
    void drainMessagesReturnsOnlyPerformerMessages() {
        Mailbox mailbox = new Mailbox(true);
        mailbox.offer("a");
        mailbox.offer(new Pause());
        mailbox.offerSystem(SystemSignal.PRINT_PATH);

        List<Object> dropped = mailbox.drainMessages();

        assertEquals(2, dropped.size());
        assertTrue(mailbox.isEmpty());
        assertEquals(0, mailbox.size());
    }
}
