/**
 * Shared utilities for all Keeper modules.
 *
 * <p>Contains {@link com.libragraph.keeper.util.EnvKeys} (environment key normalisation),
 * {@link com.libragraph.keeper.util.Durations} and {@link com.libragraph.keeper.util.BuildInfo}.
 * Plain Java, no framework dependencies.
 */
package com.libragraph.keeper.util;
