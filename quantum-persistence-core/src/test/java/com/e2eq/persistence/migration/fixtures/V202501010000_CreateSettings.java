package com.e2eq.persistence.migration.fixtures;

import com.e2eq.persistence.backend.StorageBackend;
import com.e2eq.persistence.migration.annotations.Migration;
import com.e2eq.persistence.migration.base.MigrationUnit;
import com.e2eq.persistence.util.JSONUtils;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

@Migration(version = 202501010000L, description = "Create the settings document", author = "quantum")
public class V202501010000_CreateSettings implements MigrationUnit {

   @Override
   public void apply(StorageBackend backend, Map<String, Object> config) {
      ObjectNode settings = JSONUtils.instance().newObject();
      settings.put("theme", "dark");
      settings.put("backend", String.valueOf(config.get("backend")));
      backend.set("settings", settings);
   }

   @Override
   public void revert(StorageBackend backend, Map<String, Object> config) {
      backend.delete("settings");
   }
}
