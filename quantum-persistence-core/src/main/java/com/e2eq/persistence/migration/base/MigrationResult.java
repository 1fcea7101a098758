package com.e2eq.persistence.migration.base;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 Outcome of a migration or rollback batch.
 */
@Value
@Builder
public class MigrationResult {
   long fromVersion;
   long toVersion;
   /** Versions applied or reverted, in the order they were processed. */
   @Singular
   List<Long> versions;
   long elapsedMillis;

   public boolean isEmpty() {
      return versions.isEmpty();
   }

   public int count() {
      return versions.size();
   }
}
