package com.e2eq.persistence.migration.base;

import com.e2eq.persistence.exceptions.MigrationException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/**
 Writes the source skeleton of a new migration unit, versioned with the current timestamp.
 */
public class MigrationTemplateWriter {
   private static final Logger LOG = Logger.getLogger(MigrationTemplateWriter.class);
   private static final DateTimeFormatter VERSION_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
   private static final Pattern NON_IDENTIFIER = Pattern.compile("[^A-Za-z0-9]+");

   private final Path sourceRoot;
   private final String packageName;

   /**
    @param sourceRoot root of the java sources, e.g. {@code src/main/java}
    @param packageName package of the new unit, normally the configured migrations location
    */
   public MigrationTemplateWriter(Path sourceRoot, String packageName) {
      this.sourceRoot = sourceRoot;
      this.packageName = packageName;
   }

   public Path create(String description) {
      return create(description, LocalDateTime.now());
   }

   public Path create(String description, LocalDateTime timestamp) {
      if (description == null || description.isBlank()) {
         throw new IllegalArgumentException("description cannot be empty");
      }
      long version = Long.parseLong(timestamp.format(VERSION_FORMAT));
      String className = "V" + version + "_" + toClassSuffix(description);

      Path directory = sourceRoot.resolve(packageName.replace('.', '/'));
      Path file = directory.resolve(className + ".java");
      if (Files.exists(file)) {
         throw new MigrationException(version, className, "already exists at " + file);
      }
      try {
         Files.createDirectories(directory);
         Files.writeString(file, render(className, version, description), StandardCharsets.UTF_8);
      } catch (IOException e) {
         throw new MigrationException(version, className, "template could not be written", e);
      }
      LOG.infof("Created migration %s at %s", className, file);
      return file;
   }

   static String toClassSuffix(String description) {
      StringBuilder suffix = new StringBuilder();
      for (String word : NON_IDENTIFIER.split(description.trim())) {
         if (!word.isEmpty()) {
            suffix.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
         }
      }
      return suffix.length() == 0 ? "Migration" : suffix.toString();
   }

   private String render(String className, long version, String description) {
      String escaped = description.replace("\\", "\\\\").replace("\"", "\\\"");
      StringBuilder source = new StringBuilder();
      if (!packageName.isEmpty()) {
         source.append("package ").append(packageName).append(";\n\n");
      }
      source.append("import com.e2eq.persistence.backend.StorageBackend;\n")
            .append("import com.e2eq.persistence.migration.annotations.Migration;\n")
            .append("import com.e2eq.persistence.migration.base.MigrationUnit;\n\n")
            .append("import java.util.Map;\n\n")
            .append("@Migration(version = ").append(version).append("L, description = \"").append(escaped).append("\")\n")
            .append("public class ").append(className).append(" implements MigrationUnit {\n\n")
            .append("   @Override\n")
            .append("   public void apply(StorageBackend backend, Map<String, Object> config) throws Exception {\n")
            .append("      // TODO: implement the change\n")
            .append("   }\n\n")
            .append("   @Override\n")
            .append("   public void revert(StorageBackend backend, Map<String, Object> config) throws Exception {\n")
            .append("      // TODO: undo the change\n")
            .append("   }\n")
            .append("}\n");
      return source.toString();
   }
}
