package com.e2eq.persistence.migration.fixtures;

import com.e2eq.persistence.backend.StorageBackend;
import com.e2eq.persistence.migration.annotations.Migration;
import com.e2eq.persistence.migration.base.MigrationUnit;
import com.e2eq.persistence.util.JSONUtils;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

@Migration(version = 202501020000L, description = "Add the notes index", dependsOn = 202501010000L,
   dataDestructive = true)
public class V202501020000_AddNotesIndex implements MigrationUnit {

   @Override
   public void apply(StorageBackend backend, Map<String, Object> config) {
      ObjectNode settings = (ObjectNode) backend.get("settings")
                                          .orElseThrow(() -> new IllegalStateException("settings missing"));
      settings.put("indexed", true);
      backend.set("settings", settings);

      ObjectNode index = JSONUtils.instance().newObject();
      index.putArray("entries");
      backend.set("notes_index", index);
   }

   @Override
   public void revert(StorageBackend backend, Map<String, Object> config) {
      backend.delete("notes_index");
      backend.get("settings").ifPresent(settings -> {
         ((ObjectNode) settings).remove("indexed");
         backend.set("settings", settings);
      });
   }
}
