package com.libragraph.keeper.core.logging;

import com.libragraph.keeper.core.config.SupervisorOptions;
import com.libragraph.keeper.types.ServiceIdentity;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;

/**
 * Default {@link LoggerProvider}: one jboss-logging category per service,
 * {@code com.libragraph.keeper.service.<namespace>.<name>}, bound with the service
 * identity attributes.
 *
 * <p>With {@code logDebug} the category is opened to debug records. jboss-logging writes
 * through {@code java.util.logging} both on its JDK backend and on jboss-logmanager, whose
 * loggers extend it, so the level is set there. Records below INFO get a console handler
 * of their own; INFO and above keep flowing to the parent handlers.
 */
public class JBossLoggerProvider implements LoggerProvider {

    static final String CATEGORY_PREFIX = "com.libragraph.keeper.service";

    // JUL holds loggers weakly; keeping them here keeps the level
    private static final Map<String, java.util.logging.Logger> DEBUG_CATEGORIES = new ConcurrentHashMap<>();

    @Override
    public ServiceLogger create(ServiceIdentity identity, SupervisorOptions options) {
        String category = category(identity);
        if (options.logDebug()) {
            enableDebug(category);
        }
        Logger delegate = Logger.getLogger(category);
        ServiceLogger logger = new ServiceLogger(delegate, options.logDebug(), options.logJson());

        // empty components are not bound
        if (!identity.name().isEmpty()) {
            logger = logger.with("service", identity.name());
        }
        if (!identity.version().isEmpty()) {
            logger = logger.with("version", identity.version());
        }
        if (!identity.namespace().isEmpty()) {
            logger = logger.with("namespace", identity.namespace());
        }
        return logger;
    }

    static String category(ServiceIdentity identity) {
        StringBuilder sb = new StringBuilder(CATEGORY_PREFIX);
        if (!identity.namespace().isEmpty()) {
            sb.append('.').append(identity.namespace());
        }
        if (!identity.name().isEmpty()) {
            sb.append('.').append(identity.name());
        }
        return sb.toString();
    }

    static java.util.logging.Logger enableDebug(String category) {
        return DEBUG_CATEGORIES.computeIfAbsent(category, name -> {
            java.util.logging.Logger jul = java.util.logging.Logger.getLogger(name);
            jul.setLevel(Level.FINEST);

            ConsoleHandler handler = new ConsoleHandler();
            handler.setLevel(Level.FINEST);
            handler.setFilter(record -> record.getLevel().intValue() < Level.INFO.intValue());
            jul.addHandler(handler);
            return jul;
        });
    }
}
