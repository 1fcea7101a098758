package com.e2eq.persistence.migration.base;

import com.e2eq.persistence.backend.StorageBackend;
import com.e2eq.persistence.exceptions.MigrationException;
import com.e2eq.persistence.migration.annotations.Migration;
import com.e2eq.persistence.util.CommonUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.InvocationTargetException;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 Metadata of a migration unit plus the means to create it and to read the content its hash is
 computed from.
 */
@Value
@Builder
public class MigrationDescriptor {
   private static final Logger LOG = Logger.getLogger(MigrationDescriptor.class);

   /**
    Opens the content a unit's hash is computed from, null when it is not available.
    */
   @FunctionalInterface
   public interface ContentProvider {
      InputStream open() throws IOException;
   }

   long version;
   @NonNull
   String name;
   String description;
   String author;
   @Builder.Default
   Set<Long> dependencies = Set.of();
   boolean risky;
   boolean dataDestructive;
   boolean reversible;
   @NonNull
   Supplier<MigrationUnit> unitFactory;
   ContentProvider content;

   /**
    Reads the metadata of an annotated unit class. The class is not instantiated.
    */
   public static MigrationDescriptor of(Class<? extends MigrationUnit> unitClass) {
      Migration migration = unitClass.getAnnotation(Migration.class);
      if (migration == null) {
         throw new MigrationException(String.format("%s is not annotated with @%s", unitClass.getName(),
            Migration.class.getSimpleName()));
      }
      Set<Long> dependencies = new TreeSet<>();
      for (long dependency : migration.dependsOn()) {
         dependencies.add(dependency);
      }
      String name = migration.name().isEmpty() ? unitClass.getSimpleName() : migration.name();
      String resource = unitClass.getName().substring(unitClass.getName().lastIndexOf('.') + 1) + ".class";

      return MigrationDescriptor.builder()
                .version(migration.version())
                .name(name)
                .description(migration.description())
                .author(migration.author())
                .dependencies(Set.copyOf(dependencies))
                .risky(migration.risky())
                .dataDestructive(migration.dataDestructive())
                .reversible(overridesRevert(unitClass))
                .unitFactory(() -> instantiate(unitClass, migration.version(), name))
                .content(() -> unitClass.getResourceAsStream(resource))
                .build();
   }

   static boolean overridesRevert(Class<? extends MigrationUnit> unitClass) {
      try {
         return unitClass.getMethod("revert", StorageBackend.class, Map.class).getDeclaringClass() != MigrationUnit.class;
      } catch (NoSuchMethodException e) {
         return false;
      }
   }

   private static MigrationUnit instantiate(Class<? extends MigrationUnit> unitClass, long version, String name) {
      try {
         return unitClass.getDeclaredConstructor().newInstance();
      } catch (InvocationTargetException e) {
         throw new MigrationException(version, name, "could not be created", e.getCause());
      } catch (ReflectiveOperationException e) {
         throw new MigrationException(version, name, "needs a public no argument constructor", e);
      }
   }

   public MigrationUnit newUnit() {
      return unitFactory.get();
   }

   /**
    SHA-256 of the unit's content, empty when the content can not be read.
    */
   public Optional<String> checksum() {
      if (content == null) {
         return Optional.empty();
      }
      InputStream in = null;
      try {
         in = content.open();
         if (in == null) {
            return Optional.empty();
         }
         return Optional.of(CommonUtils.calculateSHA256(in));
      } catch (IOException e) {
         LOG.debugf("Unable to read content of migration %s (version %d): %s", name, version, e.getMessage());
         return Optional.empty();
      } finally {
         CommonUtils.closeStreams(in);
      }
   }

   @Override
   public String toString() {
      return String.format("%s (version %d)", name, version);
   }
}
