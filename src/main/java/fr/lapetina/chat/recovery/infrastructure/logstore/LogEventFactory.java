package fr.lapetina.chat.recovery.infrastructure.logstore;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates {@link LogEvent} slots for the log store ring buffer.
 */
public final class LogEventFactory implements EventFactory<LogEvent> {

    @Override
    public LogEvent newInstance() {
        return new LogEvent();
    }
}
