package com.e2eq.persistence.migration.base;

import com.e2eq.persistence.backend.StorageBackend;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 Compares the hash recorded for every applied migration with the hash of the unit as it is
 registered now. Differences are reported, never corrected.
 */
public class IntegrityVerifier {
   private static final Logger LOG = Logger.getLogger(IntegrityVerifier.class);

   private final StorageBackend backend;
   private final MigrationRegistry registry;

   public IntegrityVerifier(StorageBackend backend, MigrationRegistry registry) {
      this.backend = backend;
      this.registry = registry;
   }

   public IntegrityReport verify() {
      IntegrityReport.IntegrityReportBuilder report = IntegrityReport.builder();
      int checked = 0;
      for (MigrationRecord record : new HistoryStore(backend).migrations()) {
         checked++;
         Optional<MigrationDescriptor> migration = registry.find(record.getVersion());
         if (migration.isEmpty()) {
            report.warning(String.format("Migration %s (version %d) is in the history but its unit is not registered",
               record.getName(), record.getVersion()));
            continue;
         }
         Optional<String> current = migration.get().checksum();
         if (current.isEmpty()) {
            report.warning(String.format("Content of migration %s (version %d) is not readable",
               record.getName(), record.getVersion()));
            continue;
         }
         if (!current.get().equals(record.getHash())) {
            LOG.warnf("Migration %s (version %d) was modified after it was applied", record.getName(), record.getVersion());
            report.mismatch(new IntegrityReport.Mismatch(record.getVersion(), record.getName(), record.getHash(),
               current.get()));
         }
      }
      IntegrityReport result = report.checked(checked).build();
      LOG.infof("Verified %d applied migration(s): %d mismatch(es), %d warning(s)", checked,
         result.getMismatches().size(), result.getWarnings().size());
      return result;
   }
}
