package com.libragraph.keeper.core.logging;

import com.libragraph.keeper.core.config.SupervisorOptions;
import com.libragraph.keeper.types.ServiceIdentity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.assertj.core.api.Assertions.assertThat;

class JBossLoggerProviderTest {

    private final JBossLoggerProvider provider = new JBossLoggerProvider();

    @Test
    void bindsIdentityAttributes() {
        ServiceLogger logger = provider.create(ServiceIdentity.of("example", "service", "1.0.0"),
                SupervisorOptions.builder().logDebug(true).logJson(true).build());

        assertThat(logger.boundAttributes())
                .containsEntry("service", "example")
                .containsEntry("version", "1.0.0")
                .containsEntry("namespace", "service");
        assertThat(logger.isDebugEnabled()).isTrue();
        assertThat(logger.isJson()).isTrue();
    }

    @Test
    void emptyVersionIsNotBound() {
        ServiceLogger logger = provider.create(ServiceIdentity.of("example", "service", ""), SupervisorOptions.defaults());

        assertThat(logger.boundAttributes()).doesNotContainKey("version");
    }

    @Test
    void categoryFollowsNamespaceAndName() {
        assertThat(JBossLoggerProvider.category(ServiceIdentity.of("example", "service", "")))
                .isEqualTo("com.libragraph.keeper.service.service.example");
    }

    @Test
    void debugFlagOpensTheCategoryToDebugRecords() {
        ServiceIdentity identity = ServiceIdentity.of("debug-on", "service", "");
        java.util.logging.Logger jul = java.util.logging.Logger.getLogger(JBossLoggerProvider.category(identity));
        CapturingHandler captured = attach(jul);
        try {
            provider.create(identity, SupervisorOptions.builder().logDebug(true).build())
                    .debug("initializing service");

            assertThat(captured.records)
                    .anySatisfy(record -> {
                        assertThat(record.getLevel().intValue()).isLessThan(Level.INFO.intValue());
                        assertThat(record.getMessage()).contains("initializing service");
                    });
        } finally {
            jul.removeHandler(captured);
        }
    }

    @Test
    void debugRecordsAreDroppedWithoutTheFlag() {
        ServiceIdentity identity = ServiceIdentity.of("debug-off", "service", "");
        java.util.logging.Logger jul = java.util.logging.Logger.getLogger(JBossLoggerProvider.category(identity));
        CapturingHandler captured = attach(jul);
        try {
            ServiceLogger logger = provider.create(identity, SupervisorOptions.defaults());
            logger.debug("initializing service");
            logger.info("service started");

            assertThat(captured.records)
                    .extracting(LogRecord::getMessage)
                    .noneMatch(message -> message.contains("initializing service"))
                    .anyMatch(message -> message.contains("service started"));
        } finally {
            jul.removeHandler(captured);
        }
    }

    private static CapturingHandler attach(java.util.logging.Logger jul) {
        CapturingHandler handler = new CapturingHandler();
        handler.setLevel(Level.ALL);
        jul.addHandler(handler);
        return handler;
    }

    private static final class CapturingHandler extends Handler {
        final List<LogRecord> records = new CopyOnWriteArrayList<>();

        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    }
}
