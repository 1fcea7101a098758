package com.e2eq.persistence.migration.base;

import com.e2eq.persistence.exceptions.MigrationException;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 The validated, version ordered set of migration units.
 */
public class MigrationRegistry {
   private static final Logger LOG = Logger.getLogger(MigrationRegistry.class);

   private final List<MigrationDescriptor> migrations;
   private final Map<Long, MigrationDescriptor> byVersion;

   /**
    @throws MigrationException on a non-positive or duplicate version, or a dependency that is
    not lower than the unit's own version
    */
   public MigrationRegistry(Collection<MigrationDescriptor> descriptors) {
      List<MigrationDescriptor> sorted = new ArrayList<>(descriptors);
      sorted.sort(Comparator.comparingLong(MigrationDescriptor::getVersion));

      Map<Long, MigrationDescriptor> index = new LinkedHashMap<>();
      for (MigrationDescriptor descriptor : sorted) {
         if (descriptor.getVersion() <= 0) {
            throw new MigrationException(descriptor.getVersion(), descriptor.getName(), "has a non-positive version");
         }
         MigrationDescriptor existing = index.putIfAbsent(descriptor.getVersion(), descriptor);
         if (existing != null) {
            throw new MigrationException(descriptor.getVersion(), descriptor.getName(),
               String.format("uses the same version as %s", existing.getName()));
         }
         for (Long dependency : descriptor.getDependencies()) {
            if (dependency >= descriptor.getVersion()) {
               throw new MigrationException(descriptor.getVersion(), descriptor.getName(),
                  String.format("depends on version %d which is not lower than its own", dependency));
            }
         }
      }
      this.migrations = Collections.unmodifiableList(sorted);
      this.byVersion = Collections.unmodifiableMap(index);
      LOG.debugf("Registered migrations: %s", migrations.stream().map(MigrationDescriptor::toString)
         .collect(Collectors.joining(", ")));
   }

   public static MigrationRegistry load(MigrationSource source) {
      return new MigrationRegistry(source.discover());
   }

   /** All units, ascending by version. */
   public List<MigrationDescriptor> all() {
      return migrations;
   }

   public Optional<MigrationDescriptor> find(long version) {
      return Optional.ofNullable(byVersion.get(version));
   }

   /** Units with a version greater than the given one, ascending. */
   public List<MigrationDescriptor> after(long version) {
      return migrations.stream().filter(m -> m.getVersion() > version).collect(Collectors.toList());
   }

   public long latestVersion() {
      return migrations.isEmpty() ? 0L : migrations.get(migrations.size() - 1).getVersion();
   }

   public int size() {
      return migrations.size();
   }
}
