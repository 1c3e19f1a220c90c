package com.flamingo.ai.wikishred.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a batch ingestion. No IDs means the whole archive. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchIngestRequest {

  @Size(max = 10000, message = "At most 10000 article IDs per batch")
  private List<@NotBlank(message = "Article IDs must not be blank") String> articleIds;
}
