package com.e2eq.persistence.migration.base;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"version", "name", "rolled_back_at"})
public class RollbackRecord {
   protected long version;
   protected String name;

   @JsonProperty("rolled_back_at")
   protected String rolledBackAt;
}
