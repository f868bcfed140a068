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

/** Request DTO for filling a form in a live browser session. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BrowserFillRequest {

  @NotNull(message = "Profile is required")
  private Profile profile;

  @NotBlank(message = "URL is required")
  @Pattern(regexp = "^https?://.+", message = "URL must start with http:// or https://")
  private String url;

  private Map<String, List<String>> extraAliases;
}
