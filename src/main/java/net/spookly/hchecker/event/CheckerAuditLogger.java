package net.spookly.hchecker.event;

/**
 * Default audit logger that emits one line per event.
 */
public final class CheckerAuditLogger implements CheckerEventListener {
    public static final CheckerAuditLogger INSTANCE = new CheckerAuditLogger();

    private CheckerAuditLogger() {
    }

    @Override
    public void onEvent(CheckerEvent event) {
        System.out.println(format(event));
    }

    static String format(CheckerEvent event) {
        StringBuilder builder = new StringBuilder("checker_event");
        append(builder, "type", event.type());
        append(builder, "checkerId", event.checkerId());
        append(builder, "backend", event.backendUrl());
        append(builder, "frontend", event.frontendKey());
        append(builder, "position", event.position());
        append(builder, "detail", event.detail());
        append(builder, "timestamp", event.timestamp());
        return builder.toString();
    }

    private static void append(StringBuilder builder, String key, Object value) {
        if (value == null) {
            return;
        }
        builder.append(' ').append(key).append('=').append(value);
    }
}
