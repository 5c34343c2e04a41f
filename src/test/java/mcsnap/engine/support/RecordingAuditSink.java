package mcsnap.engine.support;

import mcsnap.engine.model.AuditAction;
import mcsnap.engine.model.AuditEvent;
import mcsnap.engine.repository.AuditSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingAuditSink implements AuditSink {

    private final List<AuditEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void record(AuditEvent event) {
        events.add(event);
    }

    public List<AuditEvent> events() {
        return List.copyOf(events);
    }

    public List<AuditEvent> events(AuditAction action) {
        return events.stream().filter(e -> e.action() == action).toList();
    }
}
