package com.e2eq.persistence.migration.base;

import com.e2eq.persistence.exceptions.MigrationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class MigrationTemplateWriterTest {

   @TempDir
   Path sourceRoot;

   @Test
   void testWritesVersionedUnit() throws Exception {
      MigrationTemplateWriter writer = new MigrationTemplateWriter(sourceRoot, "com.example.migrations");
      LocalDateTime timestamp = LocalDateTime.of(2025, 1, 2, 3, 4, 5);

      Path file = writer.create("Add tags to notes", timestamp);

      assertEquals(sourceRoot.resolve("com/example/migrations/V20250102030405_AddTagsToNotes.java"), file);
      String source = Files.readString(file, StandardCharsets.UTF_8);
      assertTrue(source.startsWith("package com.example.migrations;"));
      assertTrue(source.contains("@Migration(version = 20250102030405L, description = \"Add tags to notes\")"));
      assertTrue(source.contains("public class V20250102030405_AddTagsToNotes implements MigrationUnit"));
      assertTrue(source.contains("public void revert(StorageBackend backend"));

      assertThrows(MigrationException.class, () -> writer.create("Add tags to notes", timestamp));
   }

   @Test
   void testRejectsEmptyDescription() {
      MigrationTemplateWriter writer = new MigrationTemplateWriter(sourceRoot, "com.example");
      assertThrows(IllegalArgumentException.class, () -> writer.create("  "));
   }

   @Test
   void testClassSuffix() {
      assertEquals("DropOldNotes", MigrationTemplateWriter.toClassSuffix("  drop-old   notes!"));
      assertEquals("Migration", MigrationTemplateWriter.toClassSuffix("!!!"));
   }
}
