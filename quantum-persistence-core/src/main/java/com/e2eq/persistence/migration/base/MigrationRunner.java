package com.e2eq.persistence.migration.base;

import com.e2eq.persistence.backend.StorageBackend;
import com.e2eq.persistence.backup.BackupService;
import com.e2eq.persistence.exceptions.MigrationException;
import com.e2eq.persistence.exceptions.MigrationInProgressException;
import com.e2eq.persistence.util.ExceptionLoggingUtils;
import org.jboss.logging.Logger;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 Applies pending migration units in ascending version order and reverts applied ones. Each unit
 is applied in its own backend transaction together with the schema version and its history
 record, so a failure leaves the store at the last committed unit.
 */
public class MigrationRunner {
   private static final Logger LOG = Logger.getLogger(MigrationRunner.class);

   private final StorageBackend backend;
   private final MigrationRegistry registry;
   private final Map<String, Object> config;
   private final BackupService backupService;
   private final AtomicBoolean inProgress = new AtomicBoolean(false);
   private volatile MigrationListener listener = MigrationListener.NO_OP;

   /**
    @param backupService used before risky units and rollbacks, may be null to skip those backups
    */
   public MigrationRunner(StorageBackend backend, MigrationRegistry registry, Map<String, Object> config,
                          BackupService backupService) {
      this.backend = backend;
      this.registry = registry;
      this.config = config == null ? Map.of() : Map.copyOf(config);
      this.backupService = backupService;
   }

   public void setListener(MigrationListener listener) {
      this.listener = listener == null ? MigrationListener.NO_OP : listener;
   }

   public boolean isInProgress() {
      return inProgress.get();
   }

   public MigrationRegistry getRegistry() {
      return registry;
   }

   /** Units with a version above the current schema version, ascending. */
   public List<MigrationDescriptor> pending() {
      return registry.after(new HistoryStore(backend).schemaVersion());
   }

   public List<MigrationRecord> history() {
      return new HistoryStore(backend).migrations();
   }

   public List<RollbackRecord> rollbackHistory() {
      return new HistoryStore(backend).rollbacks();
   }

   /**
    Applies every pending unit. Dependencies of the whole batch are checked before anything is
    applied; the first failing unit is rolled back and stops the batch.

    @throws MigrationInProgressException when another run or rollback is active on this runner
    @throws MigrationException when a dependency is missing or a unit fails
    */
   public MigrationResult run() {
      acquire("migrate");
      try {
         return runPending();
      } finally {
         inProgress.set(false);
      }
   }

   private MigrationResult runPending() {
      long started = System.currentTimeMillis();
      HistoryStore history = new HistoryStore(backend);
      long current = history.schemaVersion();
      List<MigrationDescriptor> pending = registry.after(current);

      if (pending.isEmpty()) {
         LOG.infof("Schema is up to date at version %d", current);
         return MigrationResult.builder().fromVersion(current).toVersion(current).build();
      }

      LOG.infof("Current schema version: %d, %d migration(s) pending", current, pending.size());
      pending.forEach(migration -> listener.onStateChange(migration, MigrationState.PENDING, null));
      validateBatch(pending, history.appliedVersions());

      MigrationResult.MigrationResultBuilder result = MigrationResult.builder().fromVersion(current);
      for (MigrationDescriptor migration : pending) {
         apply(migration);
         result.version(migration.getVersion());
      }

      long reached = history.schemaVersion();
      LOG.infof("-- Applied %d migration(s), schema version is now %d --", pending.size(), reached);
      return result.toVersion(reached).elapsedMillis(System.currentTimeMillis() - started).build();
   }

   private void validateBatch(List<MigrationDescriptor> pending, Set<Long> applied) {
      Set<Long> available = new TreeSet<>(applied);
      for (MigrationDescriptor migration : pending) {
         Set<Long> missing = missingDependencies(migration, available);
         if (!missing.isEmpty()) {
            MigrationException failure = new MigrationException(migration.getVersion(), migration.getName(),
               String.format("has unsatisfied dependencies %s, nothing was applied", missing));
            listener.onStateChange(migration, MigrationState.FAILED, failure);
            throw failure;
         }
         available.add(migration.getVersion());
      }
   }

   private void apply(MigrationDescriptor migration) {
      listener.onStateChange(migration, MigrationState.VALIDATING, null);
      Set<Long> missing = missingDependencies(migration, new HistoryStore(backend).appliedVersions());
      if (!missing.isEmpty()) {
         MigrationException failure = new MigrationException(migration.getVersion(), migration.getName(),
            String.format("has unsatisfied dependencies %s", missing));
         listener.onStateChange(migration, MigrationState.FAILED, failure);
         throw failure;
      }

      if (migration.isRisky() && backupService != null) {
         LOG.infof("Creating backup before risky migration %s", migration);
         backupService.backup();
      }

      listener.onStateChange(migration, MigrationState.APPLYING, null);
      LOG.infof("Applying migration %s", migration);
      try {
         backend.transaction(tx -> {
            migration.newUnit().apply(tx, config);
            HistoryStore history = new HistoryStore(tx);
            history.setSchemaVersion(migration.getVersion());
            history.append(newRecord(migration));
            return null;
         });
      } catch (Exception e) {
         MigrationException failure = new MigrationException(migration.getVersion(), migration.getName(),
            "failed: " + ExceptionLoggingUtils.describe(e), e);
         listener.onStateChange(migration, MigrationState.FAILED, failure);
         ExceptionLoggingUtils.logError(LOG, e, "Migration %s failed and was rolled back", migration);
         throw failure;
      }
      listener.onStateChange(migration, MigrationState.COMMITTED, null);
      LOG.infof("Committed migration %s", migration);
   }

   private static Set<Long> missingDependencies(MigrationDescriptor migration, Set<Long> available) {
      return migration.getDependencies().stream()
                .filter(dependency -> !available.contains(dependency))
                .collect(Collectors.toCollection(TreeSet::new));
   }

   private MigrationRecord newRecord(MigrationDescriptor migration) {
      String hash = migration.checksum().orElseGet(() -> {
         LOG.warnf("Content of migration %s is not readable, recording an empty hash", migration);
         return "";
      });
      return MigrationRecord.builder()
                .version(migration.getVersion())
                .name(migration.getName())
                .description(migration.getDescription())
                .dependencies(new TreeSet<>(migration.getDependencies()))
                .hash(hash)
                .appliedAt(now())
                .build();
   }

   /**
    Reverts the last {@code steps} applied units, newest first.
    */
   public MigrationResult rollback(int steps) {
      acquire("rollback");
      try {
         if (steps <= 0) {
            throw new MigrationException(String.format("Rollback steps must be positive, was %d", steps));
         }
         List<MigrationRecord> applied = new HistoryStore(backend).migrations();
         if (applied.isEmpty()) {
            throw new MigrationException("No migrations to roll back");
         }
         if (steps > applied.size()) {
            throw new MigrationException(String.format("Cannot roll back %d migrations, only %d applied",
               steps, applied.size()));
         }
         List<MigrationRecord> targets = new ArrayList<>(applied.subList(applied.size() - steps, applied.size()));
         Collections.reverse(targets);
         return revert(targets);
      } finally {
         inProgress.set(false);
      }
   }

   /**
    Reverts every applied unit above {@code targetVersion}. The target must be 0 or an applied
    version.
    */
   public MigrationResult rollbackTo(long targetVersion) {
      acquire("rollback");
      try {
         HistoryStore history = new HistoryStore(backend);
         long current = history.schemaVersion();
         if (targetVersion == current) {
            LOG.infof("Already at version %d", targetVersion);
            return MigrationResult.builder().fromVersion(current).toVersion(current).build();
         }
         if (targetVersion < 0 || targetVersion > current) {
            throw new MigrationException(String.format("Invalid target version %d, current version is %d",
               targetVersion, current));
         }
         List<MigrationRecord> applied = history.migrations();
         if (targetVersion != 0 && applied.stream().noneMatch(record -> record.getVersion() == targetVersion)) {
            throw new MigrationException(String.format("Version %d is not in the migration history", targetVersion));
         }
         List<MigrationRecord> targets = applied.stream()
                                          .filter(record -> record.getVersion() > targetVersion)
                                          .collect(Collectors.toList());
         Collections.reverse(targets);
         return revert(targets);
      } finally {
         inProgress.set(false);
      }
   }

   private MigrationResult revert(List<MigrationRecord> targets) {
      long started = System.currentTimeMillis();
      long current = new HistoryStore(backend).schemaVersion();

      // every unit must be present and reversible before anything changes
      List<MigrationDescriptor> units = new ArrayList<>();
      for (MigrationRecord record : targets) {
         MigrationDescriptor migration = registry.find(record.getVersion())
            .orElseThrow(() -> new MigrationException(record.getVersion(), record.getName(),
               "can not be rolled back, its unit is not registered"));
         if (!migration.isReversible()) {
            throw new MigrationException(record.getVersion(), record.getName(), "is not reversible");
         }
         units.add(migration);
      }

      LOG.infof("Rolling back %d migration(s) from version %d", targets.size(), current);
      if (backupService != null) {
         LOG.info("Creating backup before rollback");
         backupService.backup();
      }

      MigrationResult.MigrationResultBuilder result = MigrationResult.builder().fromVersion(current);
      for (int i = 0; i < targets.size(); i++) {
         revert(targets.get(i), units.get(i));
         result.version(targets.get(i).getVersion());
      }
      long reached = new HistoryStore(backend).schemaVersion();
      LOG.infof("-- Rolled back %d migration(s), schema version is now %d --", targets.size(), reached);
      return result.toVersion(reached).elapsedMillis(System.currentTimeMillis() - started).build();
   }

   private void revert(MigrationRecord record, MigrationDescriptor migration) {
      listener.onStateChange(migration, MigrationState.REVERTING, null);
      migration.checksum()
         .filter(hash -> !hash.equals(record.getHash()))
         .ifPresent(hash -> LOG.warnf("Migration %s changed since it was applied (recorded %s, current %s)",
            migration, record.getHash(), hash));

      LOG.infof("Rolling back migration %s", migration);
      try {
         backend.transaction(tx -> {
            migration.newUnit().revert(tx, config);
            HistoryStore history = new HistoryStore(tx);
            history.setSchemaVersion(history.remove(record.getVersion()));
            history.appendRollback(RollbackRecord.builder()
                                      .version(record.getVersion())
                                      .name(record.getName())
                                      .rolledBackAt(now())
                                      .build());
            return null;
         });
      } catch (Exception e) {
         MigrationException failure = new MigrationException(migration.getVersion(), migration.getName(),
            "rollback failed: " + ExceptionLoggingUtils.describe(e), e);
         listener.onStateChange(migration, MigrationState.FAILED, failure);
         ExceptionLoggingUtils.logError(LOG, e, "Rollback of migration %s failed", migration);
         throw failure;
      }
      listener.onStateChange(migration, MigrationState.REVERTED, null);
   }

   /**
    Whether reverting the given version is possible and whether it loses data.
    */
   public RollbackSafety checkRollbackSafety(long version) {
      return registry.find(version)
                .map(migration -> {
                   RollbackSafety.RollbackSafetyBuilder safety = RollbackSafety.builder()
                      .version(version)
                      .name(migration.getName())
                      .dataDestructive(migration.isDataDestructive());
                   if (!migration.isReversible()) {
                      return safety.safe(false)
                                .warning(String.format("Migration %s does not implement revert", migration.getName()))
                                .build();
                   }
                   if (migration.isDataDestructive()) {
                      return safety.safe(false)
                                .warning(String.format("Rolling back migration %s may result in data loss. "
                                   + "Ensure you have a recent backup before proceeding.", migration.getName()))
                                .build();
                   }
                   return safety.safe(true).build();
                })
                .orElseGet(() -> RollbackSafety.builder()
                                    .version(version)
                                    .safe(false)
                                    .warning(String.format("Migration unit not found for version %d", version))
                                    .build());
   }

   private void acquire(String operation) {
      if (!inProgress.compareAndSet(false, true)) {
         throw new MigrationInProgressException(
            String.format("Cannot %s, a migration operation is already in progress", operation));
      }
   }

   private static String now() {
      return LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
   }
}
