package com.e2eq.persistence.migration.base;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class IntegrityReport {

   @Value
   public static class Mismatch {
      long version;
      String name;
      String recordedHash;
      String currentHash;
   }

   int checked;
   @Singular
   List<Mismatch> mismatches;
   @Singular
   List<String> warnings;

   public boolean isValid() {
      return mismatches.isEmpty();
   }
}
