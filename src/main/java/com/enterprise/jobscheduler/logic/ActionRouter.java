package com.enterprise.jobscheduler.logic;

import com.enterprise.jobscheduler.core.Job;
import com.enterprise.jobscheduler.exception.JobExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link JobLogic} that routes each invocation to the handler registered for the payload's
 * {@code action} field, falling back to a default handler for absent or unknown actions.
 */
public class ActionRouter implements JobLogic {

    private static final Logger logger = LoggerFactory.getLogger(ActionRouter.class);

    public static final String ACTION_FIELD = "action";

    private final Map<String, ActionHandler> handlers = new ConcurrentHashMap<>();
    private final ActionHandler fallbackHandler;

    public ActionRouter(ActionHandler fallbackHandler) {
        this.fallbackHandler = fallbackHandler;
    }

    /**
     * Router with every built-in handler registered
     *
     * @param clock         source of output timestamps
     * @param workDelay     simulated work time of the report, api-call and default handlers
     * @param reportBaseUrl base URL of generated report links
     */
    public static ActionRouter withBuiltInHandlers(Clock clock, Duration workDelay, String reportBaseUrl) {
        ActionRouter router = new ActionRouter(new DefaultJobHandler(clock, workDelay));
        router.registerHandler(new DataProcessingHandler(clock));
        router.registerHandler(new NotificationHandler(clock));
        router.registerHandler(new CleanupHandler(clock));
        router.registerHandler(new ReportGenerationHandler(clock, workDelay, reportBaseUrl));
        router.registerHandler(new ApiCallHandler(clock, workDelay));
        return router;
    }

    public void registerHandler(ActionHandler handler) {
        ActionHandler previous = handlers.put(handler.getSupportedAction(), handler);
        if (previous != null) {
            logger.warn("Handler for action '{}' replaced", handler.getSupportedAction());
        } else {
            logger.info("Registered handler for action: {}", handler.getSupportedAction());
        }
    }

    public Set<String> getRegisteredActions() {
        return Set.copyOf(handlers.keySet());
    }

    @Override
    public Map<String, Object> execute(Job job, Map<String, Object> input) throws JobExecutionException {
        Map<String, Object> payload = input != null ? input : Map.of();
        ActionHandler handler = resolve(payload.get(ACTION_FIELD));

        logger.debug("Job {} ({}) routed to handler '{}'", job.getId(), job.getName(), handler.getSupportedAction());
        return handler.handle(job, payload);
    }

    ActionHandler resolve(Object action) {
        if (action instanceof String) {
            ActionHandler handler = handlers.get(action);
            if (handler != null) {
                return handler;
            }
            logger.debug("No handler for action '{}', using fallback", action);
        }
        return fallbackHandler;
    }
}
