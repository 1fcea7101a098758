package com.e2eq.persistence.migration.base;

import java.util.List;

/**
 Supplies the migration units known to the application. Units are described, not created.
 */
@FunctionalInterface
public interface MigrationSource {
   List<MigrationDescriptor> discover();
}
