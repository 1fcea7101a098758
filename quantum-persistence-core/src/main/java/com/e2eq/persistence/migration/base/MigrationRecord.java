package com.e2eq.persistence.migration.base;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;
import java.util.TreeSet;

/**
 One committed migration as stored in the migration history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"version", "name", "description", "dependencies", "hash", "applied_at"})
public class MigrationRecord {
   protected long version;
   protected String name;
   protected String description;
   @Builder.Default
   protected Set<Long> dependencies = new TreeSet<>();
   protected String hash;

   /** ISO-8601 local date time. */
   @JsonProperty("applied_at")
   protected String appliedAt;
}
