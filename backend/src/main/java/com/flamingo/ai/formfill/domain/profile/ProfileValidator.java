package com.flamingo.ai.formfill.domain.profile;

import com.flamingo.ai.formfill.exception.InvalidProfileException;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Checks the identity fields a profile must carry before any page is touched. */
@Component
public class ProfileValidator {

  private static final Pattern EMAIL =
      Pattern.compile("^[A-Za-z0-9._%+'-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");

  /**
   * Validates the profile.
   *
   * @param profile the profile to check
   * @throws InvalidProfileException if full name or email is missing, or email is malformed
   */
  public void validate(Profile profile) {
    if (profile == null) {
      throw new InvalidProfileException("profile", "Profile is required");
    }
    if (isBlank(profile.fullName())) {
      throw new InvalidProfileException("fullName", "Full name is required");
    }
    if (isBlank(profile.email())) {
      throw new InvalidProfileException("email", "Email is required");
    }
    if (!EMAIL.matcher(profile.email().trim()).matches()) {
      throw new InvalidProfileException("email", "Email is not a valid address");
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
