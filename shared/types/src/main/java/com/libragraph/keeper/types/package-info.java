/**
 * Pure Java value types shared across all Keeper modules.
 *
 * <p>Holds {@link com.libragraph.keeper.types.ServiceIdentity}. No framework dependencies.
 */
package com.libragraph.keeper.types;
