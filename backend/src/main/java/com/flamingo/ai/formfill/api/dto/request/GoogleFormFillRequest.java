package com.flamingo.ai.formfill.api.dto.request;

import com.flamingo.ai.formfill.domain.profile.Profile;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for filling a Google Form. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GoogleFormFillRequest {

  @NotNull(message = "Profile is required")
  private Profile profile;

  @NotBlank(message = "Form URL is required")
  @Pattern(
      regexp = "^https://docs\\.google\\.com/forms/.+",
      message = "Form URL must be a docs.google.com/forms link")
  private String formUrl;

  /** Post the answers once the form is filled. */
  private boolean submit;

  /** Return the plan without applying it. */
  private boolean dryRun;

  private Map<String, List<String>> extraAliases;
}
