package com.flamingo.ai.formfill.config;

import com.flamingo.ai.formfill.domain.form.FieldKind;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for field matching, coercion and execution. */
@Configuration
@ConfigurationProperties(prefix = "formfill")
@Getter
@Setter
public class FormFillConfig {

  private Matching matching = new Matching();
  private Aliases aliases = new Aliases();
  private Execution execution = new Execution();
  private Browser browser = new Browser();
  private GoogleForms googleForms = new GoogleForms();

  @Getter
  @Setter
  public static class Matching {
    /** Minimum label similarity for the label strategy to express an opinion. */
    private double labelFloor = 0.5;

    /** Upper bound of any placeholder-derived score. */
    private double placeholderCeiling = 0.6;

    /** Minimum option similarity for a choice value to be selected. */
    private double optionFloor = 0.6;

    /** Floor a candidate must reach to be assigned, per field kind. */
    private Map<FieldKind, Double> kindFloors = defaultKindFloors();

    /**
     * Returns the acceptance floor for a field kind.
     *
     * @param kind the field kind
     * @return the configured floor, or the label floor when the kind has none
     */
    public double floorFor(FieldKind kind) {
      Double floor = kindFloors.get(kind);
      return floor != null ? floor : labelFloor;
    }

    private static Map<FieldKind, Double> defaultKindFloors() {
      Map<FieldKind, Double> floors = new EnumMap<>(FieldKind.class);
      floors.put(FieldKind.SINGLE_SELECT, 0.6);
      floors.put(FieldKind.MULTI_SELECT, 0.6);
      floors.put(FieldKind.RADIO_GROUP, 0.6);
      floors.put(FieldKind.CHECKBOX, 0.8);
      return floors;
    }
  }

  /**
   * Caller extensions of the built-in alias table. Keys are attribute keys such as {@code
   * fullName} or {@code education.degree} (use {@code "[education.degree]"} in YAML).
   */
  @Getter
  @Setter
  public static class Aliases {
    private Map<String, List<String>> extra = new LinkedHashMap<>();
    private Map<String, List<String>> domainTokens = new LinkedHashMap<>();
  }

  @Getter
  @Setter
  public static class Execution {
    /** Bounded wait for one field to become interactable. */
    private Duration fieldTimeout = Duration.ofSeconds(5);

    /** Bounded wait for the document to be ready before extraction. */
    private Duration extractionTimeout = Duration.ofSeconds(15);

    /** Re-applies after a verification mismatch before the field is reported as failed. */
    private int verificationRetries = 1;

    private int corePoolSize = 2;
    private int maxPoolSize = 4;
    private int queueCapacity = 50;
  }

  @Getter
  @Setter
  public static class Browser {
    private boolean headless = true;
    private String windowSize = "1366,900";
    private Duration pageLoadTimeout = Duration.ofSeconds(30);
  }

  @Getter
  @Setter
  public static class GoogleForms {
    private Duration fetchTimeout = Duration.ofSeconds(10);
    private Duration submitTimeout = Duration.ofSeconds(5);
    private int maxInMemorySize = 4 * 1024 * 1024;
  }
}
