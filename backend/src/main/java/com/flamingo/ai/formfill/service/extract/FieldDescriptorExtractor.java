package com.flamingo.ai.formfill.service.extract;

import com.flamingo.ai.formfill.config.FormFillConfig;
import com.flamingo.ai.formfill.domain.form.FieldDescriptor;
import com.flamingo.ai.formfill.domain.form.FieldKind;
import com.flamingo.ai.formfill.domain.form.FieldOption;
import com.flamingo.ai.formfill.domain.form.LabelSource;
import com.flamingo.ai.formfill.domain.form.RawFormControl;
import com.flamingo.ai.formfill.page.FormPage;
import com.flamingo.ai.formfill.service.match.TextSimilarity;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns the raw controls of a page into typed field descriptors.
 *
 * <p>Kind comes from the element type first and from name/id/placeholder tokens when the type is
 * generic. Labels resolve in order: associated caption, aria label, placeholder, preceding text.
 * Hidden, disabled and already-populated controls are left out. Radios and multi-member checkbox
 * groups sharing a name collapse into one descriptor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FieldDescriptorExtractor {

  private static final Set<String> IGNORED_INPUT_TYPES =
      Set.of("hidden", "submit", "button", "reset", "image", "file", "password", "range", "color");

  private static final Set<String> GENERIC_INPUT_TYPES = Set.of("", "text", "search");

  private static final Set<String> DATE_INPUT_TYPES = Set.of("date", "month", "datetime-local");

  private static final Set<String> EMAIL_TOKENS = Set.of("email", "mail");
  private static final Set<String> TEL_TOKENS =
      Set.of("phone", "tel", "mobile", "cell", "telephone");
  private static final Set<String> DATE_TOKENS = Set.of("date", "dob", "birthday", "birthdate");

  private static final Pattern DATE_MASK =
      Pattern.compile("(?i)^(yyyy|yy|mm|m|dd|d)([-/. ](yyyy|yy|mm|m|dd|d)){1,2}$");

  private static final Pattern PLACEHOLDER_OPTION =
      Pattern.compile("(?i)^[-\\s]*((please )?(select|choose)\\b.*)?$");

  private final FormFillConfig config;

  /**
   * Extracts fillable field descriptors in document order.
   *
   * @param page the loaded form page
   * @return descriptors, possibly empty
   * @throws com.flamingo.ai.formfill.exception.StaleDocumentException if the page is gone
   */
  public List<FieldDescriptor> extract(FormPage page) {
    List<RawFormControl> controls =
        page.inspectControls(config.getExecution().getExtractionTimeout());

    // Slots keep document order; grouped controls sit at their first member's position.
    Map<String, List<RawFormControl>> slots = new LinkedHashMap<>();
    for (RawFormControl control : controls) {
      String slotKey = slotKey(control);
      if (slotKey == null) {
        continue;
      }
      slots.computeIfAbsent(slotKey, k -> new ArrayList<>()).add(control);
    }

    List<FieldDescriptor> descriptors = new ArrayList<>();
    for (Map.Entry<String, List<RawFormControl>> slot : slots.entrySet()) {
      List<RawFormControl> members = slot.getValue();
      FieldDescriptor descriptor =
          slot.getKey().startsWith("radio:")
              ? radioGroup(members, descriptors.size())
              : slot.getKey().startsWith("checkbox:")
                  ? checkboxes(members, descriptors.size())
                  : single(members.get(0), descriptors.size());
      if (descriptor != null) {
        descriptors.add(descriptor);
      }
    }

    log.info(
        "Extracted {} fillable fields from {} controls on page {}",
        descriptors.size(),
        controls.size(),
        page.pageId());
    return descriptors;
  }

  private String slotKey(RawFormControl control) {
    String tag = lower(control.tagName());
    if ("input".equals(tag)) {
      String type = inputType(control);
      if (IGNORED_INPUT_TYPES.contains(type)) {
        return null;
      }
      String name = control.attribute("name");
      String group = isBlank(name) ? "#" + control.handle() : name;
      if ("radio".equals(type)) {
        return "radio:" + group;
      }
      if ("checkbox".equals(type)) {
        return "checkbox:" + group;
      }
      return "single:" + control.handle();
    }
    if ("select".equals(tag) || "textarea".equals(tag)) {
      return "single:" + control.handle();
    }
    return null;
  }

  private FieldDescriptor single(RawFormControl control, int order) {
    if (!isFillable(control)) {
      return null;
    }
    FieldKind kind = classify(control);
    if (kind == FieldKind.CHECKBOX ? control.checked() : !isBlank(control.currentValue())) {
      log.debug("Skipping pre-populated control {}", control.handle());
      return null;
    }

    List<FieldOption> options =
        kind.isChoice()
            ? control.options().stream().filter(o -> !isPlaceholderOption(o)).toList()
            : List.of();

    Label label = resolveLabel(control);
    return FieldDescriptor.builder()
        .id(control.handle())
        .kind(kind)
        .label(label.text())
        .labelSource(label.source())
        .placeholder(nullToEmpty(control.attribute("placeholder")))
        .name(nullToEmpty(control.attribute("name")))
        .domId(nullToEmpty(control.attribute("id")))
        .required(isRequired(control))
        .options(options)
        .maxLength(maxLength(control))
        .dateFormatHint(
            kind == FieldKind.DATE || kind == FieldKind.TEXT ? dateHint(control) : null)
        .documentOrder(order)
        .build();
  }

  private FieldDescriptor radioGroup(List<RawFormControl> members, int order) {
    List<RawFormControl> usable = members.stream().filter(this::isFillable).toList();
    if (usable.isEmpty() || usable.stream().anyMatch(RawFormControl::checked)) {
      return null;
    }
    return group(usable, FieldKind.RADIO_GROUP, order);
  }

  private FieldDescriptor checkboxes(List<RawFormControl> members, int order) {
    List<RawFormControl> usable = members.stream().filter(this::isFillable).toList();
    if (usable.isEmpty() || usable.stream().anyMatch(RawFormControl::checked)) {
      return null;
    }
    if (usable.size() == 1) {
      return single(usable.get(0), order);
    }
    return group(usable, FieldKind.MULTI_SELECT, order);
  }

  private FieldDescriptor group(List<RawFormControl> members, FieldKind kind, int order) {
    RawFormControl first = members.get(0);
    List<FieldOption> options = new ArrayList<>();
    for (RawFormControl member : members) {
      String value = member.attribute("value");
      String text = firstNonBlank(member.captionText(), member.attribute("aria-label"), value);
      options.add(
          new FieldOption(isBlank(value) ? "on" : value, nullToEmpty(text), member.handle()));
    }

    Label label;
    if (!isBlank(first.groupCaption())) {
      label = new Label(first.groupCaption().trim(), LabelSource.CAPTION);
    } else if (!isBlank(first.labelledByText())) {
      label = new Label(first.labelledByText().trim(), LabelSource.ARIA);
    } else if (!isBlank(first.precedingText())) {
      label = new Label(first.precedingText().trim(), LabelSource.PRECEDING_TEXT);
    } else if (!isBlank(first.attribute("name"))) {
      label = new Label(first.attribute("name").trim(), LabelSource.NAME);
    } else {
      label = new Label("", LabelSource.NONE);
    }

    return FieldDescriptor.builder()
        .id(first.handle())
        .kind(kind)
        .label(label.text())
        .labelSource(label.source())
        .placeholder("")
        .name(nullToEmpty(first.attribute("name")))
        .domId(nullToEmpty(first.attribute("id")))
        .required(members.stream().anyMatch(this::isRequired))
        .options(options)
        .documentOrder(order)
        .build();
  }

  FieldKind classify(RawFormControl control) {
    String tag = lower(control.tagName());
    if ("textarea".equals(tag)) {
      return FieldKind.TEXTAREA;
    }
    if ("select".equals(tag)) {
      return control.hasAttribute("multiple") ? FieldKind.MULTI_SELECT : FieldKind.SINGLE_SELECT;
    }

    String type = inputType(control);
    FieldKind declared =
        switch (type) {
          case "email" -> FieldKind.EMAIL;
          case "tel" -> FieldKind.TEL;
          case "checkbox" -> FieldKind.CHECKBOX;
          case "radio" -> FieldKind.RADIO_GROUP;
          default -> null;
        };
    if (declared != null) {
      return declared;
    }
    if (DATE_INPUT_TYPES.contains(type)) {
      return FieldKind.DATE;
    }
    if (!GENERIC_INPUT_TYPES.contains(type)) {
      return FieldKind.TEXT;
    }

    List<String> tokens = new ArrayList<>();
    tokens.addAll(TextSimilarity.tokens(control.attribute("name")));
    tokens.addAll(TextSimilarity.tokens(control.attribute("id")));
    tokens.addAll(TextSimilarity.tokens(control.attribute("placeholder")));
    if (tokens.stream().anyMatch(EMAIL_TOKENS::contains)) {
      return FieldKind.EMAIL;
    }
    if (tokens.stream().anyMatch(TEL_TOKENS::contains)) {
      return FieldKind.TEL;
    }
    if (tokens.stream().anyMatch(DATE_TOKENS::contains)) {
      return FieldKind.DATE;
    }
    return FieldKind.TEXT;
  }

  private Label resolveLabel(RawFormControl control) {
    if (!isBlank(control.captionText())) {
      return new Label(control.captionText().trim(), LabelSource.CAPTION);
    }
    String aria = firstNonBlank(control.attribute("aria-label"), control.labelledByText());
    if (!isBlank(aria)) {
      return new Label(aria.trim(), LabelSource.ARIA);
    }
    String placeholder = control.attribute("placeholder");
    if (!isBlank(placeholder)) {
      return new Label(placeholder.trim(), LabelSource.PLACEHOLDER);
    }
    if (!isBlank(control.precedingText())) {
      return new Label(control.precedingText().trim(), LabelSource.PRECEDING_TEXT);
    }
    return new Label("", LabelSource.NONE);
  }

  private String dateHint(RawFormControl control) {
    String explicit =
        firstNonBlank(control.attribute("data-date-format"), control.attribute("data-format"));
    if (!isBlank(explicit)) {
      return explicit.trim();
    }
    String type = inputType(control);
    if (DATE_INPUT_TYPES.contains(type)) {
      return type;
    }
    String placeholder = control.attribute("placeholder");
    if (!isBlank(placeholder) && DATE_MASK.matcher(placeholder.trim()).matches()) {
      return placeholder.trim();
    }
    return null;
  }

  private boolean isFillable(RawFormControl control) {
    if (!control.visible()) {
      log.debug("Skipping hidden control {}", control.handle());
      return false;
    }
    if (control.hasAttribute("disabled") || control.hasAttribute("readonly")) {
      log.debug("Skipping disabled control {}", control.handle());
      return false;
    }
    return true;
  }

  private boolean isRequired(RawFormControl control) {
    return control.hasAttribute("required")
        || "true".equalsIgnoreCase(control.attribute("aria-required"));
  }

  private Integer maxLength(RawFormControl control) {
    String raw = control.attribute("maxlength");
    if (isBlank(raw)) {
      return null;
    }
    try {
      int value = Integer.parseInt(raw.trim());
      return value > 0 ? value : null;
    } catch (NumberFormatException e) {
      log.debug("Ignoring malformed maxlength '{}' on {}", raw, control.handle());
      return null;
    }
  }

  private boolean isPlaceholderOption(FieldOption option) {
    return isBlank(option.value())
        && PLACEHOLDER_OPTION.matcher(nullToEmpty(option.displayText())).matches();
  }

  private static String inputType(RawFormControl control) {
    return lower(control.attribute("type"));
  }

  private static String firstNonBlank(String... values) {
    for (String value : values) {
      if (!isBlank(value)) {
        return value;
      }
    }
    return null;
  }

  private static String lower(String value) {
    return value == null ? "" : value.trim().toLowerCase();
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private record Label(String text, LabelSource source) {}
}
