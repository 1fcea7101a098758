package com.e2eq.persistence.migration.base;

public enum MigrationState {
   PENDING,
   VALIDATING,
   APPLYING,
   COMMITTED,
   REVERTING,
   REVERTED,
   FAILED
}
