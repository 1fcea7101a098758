package com.e2eq.persistence.migration.base;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RollbackSafety {
   long version;
   String name;
   boolean safe;
   /** Null when it could not be determined. */
   Boolean dataDestructive;
   String warning;
}
