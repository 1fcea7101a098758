package com.e2eq.persistence.migration.base;

import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 Discovers units listed in {@code META-INF/services/com.e2eq.persistence.migration.base.MigrationUnit}.
 Only the provider types are inspected, units are created when they run.
 */
public class ServiceLoaderMigrationSource implements MigrationSource {
   private static final Logger LOG = Logger.getLogger(ServiceLoaderMigrationSource.class);

   private final String location;
   private final ClassLoader classLoader;

   /**
    @param location package the units must live in (sub packages included), all units when null or empty
    */
   public ServiceLoaderMigrationSource(String location) {
      this(location, Thread.currentThread().getContextClassLoader());
   }

   public ServiceLoaderMigrationSource(String location, ClassLoader classLoader) {
      this.location = location == null ? "" : location.trim();
      this.classLoader = classLoader;
   }

   @Override
   public List<MigrationDescriptor> discover() {
      List<MigrationDescriptor> descriptors = new ArrayList<>();
      ServiceLoader.load(MigrationUnit.class, classLoader).stream()
         .map(ServiceLoader.Provider::type)
         .filter(this::inLocation)
         .forEach(type -> descriptors.add(MigrationDescriptor.of(type)));
      LOG.debugf("Discovered %d migration units in %s", descriptors.size(),
         location.isEmpty() ? "all packages" : location);
      return descriptors;
   }

   private boolean inLocation(Class<? extends MigrationUnit> type) {
      if (location.isEmpty()) {
         return true;
      }
      String packageName = type.getPackageName();
      return packageName.equals(location) || packageName.startsWith(location + ".");
   }
}
