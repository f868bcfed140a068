package com.flamingo.ai.formfill.api.dto.request;

import com.flamingo.ai.formfill.domain.profile.Profile;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for filling a static HTML form. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HtmlFillRequest {

  @NotNull(message = "Profile is required")
  private Profile profile;

  @NotBlank(message = "HTML is required")
  private String html;

  /** Return the plan without applying it. */
  private boolean dryRun;

  private Map<String, List<String>> extraAliases;
}
