package com.e2eq.persistence.migration.base;

import com.e2eq.persistence.backend.StorageBackend;

import java.util.Map;

/**
 A single versioned change to the stored state. Implementations are annotated with
 {@link com.e2eq.persistence.migration.annotations.Migration} and need a public no argument
 constructor. Both methods run inside a backend transaction.
 */
public interface MigrationUnit {

   void apply(StorageBackend backend, Map<String, Object> config) throws Exception;

   /**
    Undoes {@link #apply}. Units that do not override this method are not reversible.
    */
   default void revert(StorageBackend backend, Map<String, Object> config) throws Exception {
      throw new UnsupportedOperationException(getClass().getName() + " can not be reverted");
   }
}
