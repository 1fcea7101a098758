package com.e2eq.persistence.migration.base;

import java.util.ArrayList;
import java.util.List;

/**
 Explicit registration table of migration units.
 */
public class StaticMigrationSource implements MigrationSource {
   private final List<MigrationDescriptor> descriptors = new ArrayList<>();

   @SafeVarargs
   public static StaticMigrationSource of(Class<? extends MigrationUnit>... unitClasses) {
      StaticMigrationSource source = new StaticMigrationSource();
      for (Class<? extends MigrationUnit> unitClass : unitClasses) {
         source.register(unitClass);
      }
      return source;
   }

   public StaticMigrationSource register(Class<? extends MigrationUnit> unitClass) {
      descriptors.add(MigrationDescriptor.of(unitClass));
      return this;
   }

   public StaticMigrationSource register(MigrationDescriptor descriptor) {
      descriptors.add(descriptor);
      return this;
   }

   @Override
   public List<MigrationDescriptor> discover() {
      return List.copyOf(descriptors);
   }
}
