package com.libragraph.keeper.core.logging;

import com.libragraph.keeper.core.config.SupervisorOptions;
import com.libragraph.keeper.types.ServiceIdentity;

/**
 * Creates the logger a supervised service sees through its context.
 */
@FunctionalInterface
public interface LoggerProvider {

    ServiceLogger create(ServiceIdentity identity, SupervisorOptions options);
}
