package com.maestro.runtime.worker;

import com.maestro.plugin.ControlMessage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Unbounded worker mailbox. System entries are taken first; a control-aware mailbox then takes
 * {@link ControlMessage}s ahead of ordinary traffic. A closed mailbox rejects new messages but still
 * yields what it holds.
 */
public final class Mailbox {

    private final boolean controlAware;
    private final ArrayDeque<Object> system = new ArrayDeque<>();
    private final ArrayDeque<Object> control = new ArrayDeque<>();
    private final ArrayDeque<Object> normal = new ArrayDeque<>();
    private boolean closed;
    private int messages;

    public Mailbox(boolean controlAware) {
        this.controlAware = controlAware;
    }

    /**
     * Appends a message.
     *
     * @return false if the mailbox is closed
     */
    public synchronized boolean offer(Object message) {
        if (closed) {
            return false;
        }
        if (controlAware && message instanceof ControlMessage) {
            control.addLast(message);
        } else {
            normal.addLast(message);
        }
        if (!(message instanceof SystemSignal)) messages++;
        return true;
    }

    /** Queues a system signal ahead of every message, even when closed. */
    synchronized void offerSystem(SystemSignal signal) {
        system.addLast(signal);
    }

    /**
     * Appends the signal behind every pending message and closes the mailbox.
     *
     * @return false if already closed
     */
    synchronized boolean offerLastAndClose(SystemSignal signal) {
        if (closed) {
            return false;
        }
        normal.addLast(signal);
        closed = true;
        return true;
    }

    /** Next entry, or null when empty. */
    public synchronized Object poll() {
        Object next = system.pollFirst();
        if (next == null) next = control.pollFirst();
        if (next == null) next = normal.pollFirst();
        if (next != null && !(next instanceof SystemSignal)) messages--;
        return next;
    }

    public synchronized void close() {
        closed = true;
    }

    public synchronized boolean isEmpty() {
        return system.isEmpty() && control.isEmpty() && normal.isEmpty();
    }

    /** Pending performer messages; system signals are not counted. */
    public synchronized int size() {
        return messages;
    }

    public boolean isControlAware() {
        return controlAware;
    }

    /** Removes and returns every pending performer message. */
    public synchronized List<Object> drainMessages() {
        List<Object> out = new ArrayList<>(control.size() + normal.size());
        out.addAll(control);
        for (Object o : normal) {
            if (!(o instanceof SystemSignal)) out.add(o);
        }
        control.clear();
        normal.clear();
        system.clear();
        messages = 0;
        return out;
    }
}
