package dev.relaygate.steering.action;

import dev.relaygate.steering.EvaluationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public record LogAction(Level level, String message) implements Action {

    private static final Logger log = LoggerFactory.getLogger("dev.relaygate.steering.rules");

    public LogAction {
        if (level == null) level = Level.INFO;
        if (message == null || message.isBlank()) message = "Steering rule matched";
    }

    public static Level parseLevel(String value) {
        if (value == null || value.isBlank()) return Level.INFO;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "trace" -> Level.TRACE;
            case "debug" -> Level.DEBUG;
            case "warn", "warning" -> Level.WARN;
            case "error" -> Level.ERROR;
            default -> Level.INFO;
        };
    }

    @Override
    public String typeName() {
        return ActionType.LOG.wireName();
    }

    @Override
    public boolean applyTo(EvaluationContext context) {
        log.atLevel(level).log("Rule action: {}", message);
        context.log(level + " " + message);
        return true;
    }

    @Override
    public Map<String, Object> params() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("level", level.name().toLowerCase(Locale.ROOT));
        params.put("message", message);
        return params;
    }
}
