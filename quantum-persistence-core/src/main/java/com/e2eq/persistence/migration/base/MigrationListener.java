package com.e2eq.persistence.migration.base;

import org.jetbrains.annotations.Nullable;

/**
 Receives every state transition of the units handled by a {@link MigrationRunner}.
 */
@FunctionalInterface
public interface MigrationListener {
   MigrationListener NO_OP = (migration, state, failure) -> { };

   /**
    @param failure the cause when {@code state} is {@link MigrationState#FAILED}, otherwise null
    */
   void onStateChange(MigrationDescriptor migration, MigrationState state, @Nullable Throwable failure);
}
