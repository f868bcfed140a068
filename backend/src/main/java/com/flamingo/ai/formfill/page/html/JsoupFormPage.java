package com.flamingo.ai.formfill.page.html;

import com.flamingo.ai.formfill.domain.form.CoercedValue;
import com.flamingo.ai.formfill.domain.form.FieldDescriptor;
import com.flamingo.ai.formfill.domain.form.FieldOption;
import com.flamingo.ai.formfill.domain.form.RawFormControl;
import com.flamingo.ai.formfill.exception.FieldInteractionException;
import com.flamingo.ai.formfill.page.FormPage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Form page backed by a parsed static HTML document. Values are written into the markup, so the
 * filled form can be rendered again with {@link #html()}. There are no scripts, so change events
 * are not fired. A parsed document cannot detach, so inspection never reports a stale page; markup
 * without controls simply has none.
 */
@Slf4j
public class JsoupFormPage implements FormPage {

  static final String HANDLE_ATTRIBUTE = "data-formfill-id";

  private static final String CONTROLS = "input, select, textarea";

  private static final Pattern HIDDEN_STYLE =
      Pattern.compile("(?i)(display\\s*:\\s*none|visibility\\s*:\\s*hidden)");

  private static final int PRECEDING_TEXT_DEPTH = 3;

  private final String pageId;
  private final Document document;
  private int nextHandle;

  public JsoupFormPage(String pageId, Document document) {
    this.pageId = Objects.requireNonNull(pageId, "pageId");
    this.document = Objects.requireNonNull(document, "document");
  }

  /**
   * Parses an HTML string into a page.
   *
   * @param pageId identifier of the page
   * @param html the form markup
   * @return the page
   */
  public static JsoupFormPage parse(String pageId, String html) {
    return new JsoupFormPage(pageId, Jsoup.parse(html == null ? "" : html));
  }

  @Override
  public String pageId() {
    return pageId;
  }

  @Override
  public List<RawFormControl> inspectControls(Duration timeout) {
    List<RawFormControl> controls = new ArrayList<>();
    for (Element element : document.select(CONTROLS)) {
      controls.add(describe(element));
    }
    return controls;
  }

  @Override
  public void awaitInteractable(FieldDescriptor field, Duration timeout) {
    Element element = element(field.id());
    if (element.hasAttr("disabled")) {
      throw new FieldInteractionException(field.id(), "Field " + field.id() + " is disabled");
    }
  }

  @Override
  public void apply(FieldDescriptor field, CoercedValue value) {
    switch (field.kind()) {
      case TEXT, EMAIL, TEL, DATE -> element(field.id()).attr("value", value.asText());
      case TEXTAREA -> element(field.id()).text(value.asText());
      case SINGLE_SELECT -> selectOptions(field, value.values().subList(0, 1));
      case MULTI_SELECT -> {
        if (isGrouped(field)) {
          checkMembers(field, value.values());
        } else {
          selectOptions(field, value.values());
        }
      }
      case RADIO_GROUP -> checkMembers(field, value.values());
      case CHECKBOX -> setChecked(element(field.id()), value.asToggle());
    }
  }

  @Override
  public void dispatchChangeEvents(FieldDescriptor field) {
    log.trace("Static page {} has no scripts to notify for {}", pageId, field.id());
  }

  @Override
  public List<String> read(FieldDescriptor field) {
    return switch (field.kind()) {
      case TEXT, EMAIL, TEL, DATE -> List.of(element(field.id()).attr("value"));
      case TEXTAREA -> List.of(element(field.id()).wholeText());
      case SINGLE_SELECT -> selectedValues(element(field.id()));
      case MULTI_SELECT ->
          isGrouped(field) ? checkedMembers(field) : selectedValues(element(field.id()));
      case RADIO_GROUP -> checkedMembers(field);
      case CHECKBOX -> List.of(Boolean.toString(element(field.id()).hasAttr("checked")));
    };
  }

  /** Returns the current markup without element handles. */
  public String html() {
    Document copy = document.clone();
    copy.select("[" + HANDLE_ATTRIBUTE + "]").removeAttr(HANDLE_ATTRIBUTE);
    return copy.outerHtml();
  }

  private RawFormControl describe(Element element) {
    Map<String, String> attributes = new LinkedHashMap<>();
    for (Attribute attribute : element.attributes()) {
      attributes.put(attribute.getKey().toLowerCase(Locale.ROOT), attribute.getValue());
    }
    String tag = element.normalName();
    return RawFormControl.builder()
        .handle(stamp(element))
        .tagName(tag)
        .attributes(attributes)
        .captionText(captionText(element))
        .labelledByText(labelledByText(element))
        .groupCaption(groupCaption(element))
        .precedingText(precedingText(element))
        .visible(isVisible(element))
        .currentValue(currentValue(element, tag))
        .checked(element.hasAttr("checked"))
        .options("select".equals(tag) ? options(element) : List.of())
        .build();
  }

  private String stamp(Element element) {
    if (element.hasAttr(HANDLE_ATTRIBUTE)) {
      return element.attr(HANDLE_ATTRIBUTE);
    }
    String handle;
    do {
      handle = "ff-" + nextHandle++;
    } while (document.selectFirst(handleSelector(handle)) != null);
    element.attr(HANDLE_ATTRIBUTE, handle);
    return handle;
  }

  private String captionText(Element element) {
    String id = element.id();
    if (!id.isEmpty()) {
      for (Element label : document.getElementsByTag("label")) {
        if (id.equals(label.attr("for"))) {
          return controlFreeText(label);
        }
      }
    }
    Element wrapping = element.closest("label");
    return wrapping == null ? null : controlFreeText(wrapping);
  }

  private String labelledByText(Element element) {
    String ids = element.attr("aria-labelledby");
    if (ids.isBlank()) {
      return null;
    }
    String text =
        Arrays.stream(ids.trim().split("\\s+"))
            .map(document::getElementById)
            .filter(Objects::nonNull)
            .map(Element::text)
            .filter(t -> !t.isBlank())
            .collect(Collectors.joining(" "));
    return text.isEmpty() ? null : text;
  }

  private String groupCaption(Element element) {
    Element group = element.closest("fieldset, [role=radiogroup], [role=group]");
    if (group == null) {
      return null;
    }
    Element legend = group.selectFirst("legend");
    if (legend != null && !legend.text().isBlank()) {
      return legend.text();
    }
    String aria = group.attr("aria-label");
    return aria.isBlank() ? null : aria;
  }

  /** Nearest text before the element, looking at siblings of the element and a few ancestors. */
  private String precedingText(Element element) {
    Node current = element;
    for (int depth = 0; depth <= PRECEDING_TEXT_DEPTH && current != null; depth++) {
      for (Node sibling = current.previousSibling();
          sibling != null;
          sibling = sibling.previousSibling()) {
        if (sibling instanceof TextNode textNode) {
          if (!textNode.isBlank()) {
            return textNode.text().trim();
          }
        } else if (sibling instanceof Element siblingElement) {
          if (siblingElement.is(CONTROLS) || !siblingElement.select(CONTROLS).isEmpty()) {
            return null;
          }
          if (!siblingElement.text().isBlank()) {
            return siblingElement.text();
          }
        }
      }
      current = current.parent();
      if (current instanceof Element parent && parent.is("form, body")) {
        return null;
      }
    }
    return null;
  }

  private boolean isVisible(Element element) {
    for (Element e = element; e != null; e = e.parent()) {
      if (e.hasAttr("hidden") || HIDDEN_STYLE.matcher(e.attr("style")).find()) {
        return false;
      }
    }
    return true;
  }

  private String currentValue(Element element, String tag) {
    return switch (tag) {
      case "textarea" -> element.wholeText();
      case "select" -> String.join(",", selectedValues(element));
      default -> {
        String type = element.attr("type").toLowerCase(Locale.ROOT);
        yield "checkbox".equals(type) || "radio".equals(type) ? "" : element.attr("value");
      }
    };
  }

  private List<FieldOption> options(Element select) {
    List<FieldOption> options = new ArrayList<>();
    for (Element option : select.select("option")) {
      options.add(FieldOption.of(optionValue(option), option.text()));
    }
    return options;
  }

  private void selectOptions(FieldDescriptor field, List<String> values) {
    Element select = element(field.id());
    List<Element> options = select.select("option");
    for (String value : values) {
      if (options.stream().noneMatch(o -> optionValue(o).equals(value))) {
        throw new FieldInteractionException(
            field.id(), "Field " + field.id() + " has no option '" + value + "'");
      }
    }
    for (Element option : options) {
      if (values.contains(optionValue(option))) {
        option.attr("selected", true);
      } else {
        option.removeAttr("selected");
      }
    }
  }

  private List<String> selectedValues(Element select) {
    return select.select("option[selected]").stream().map(this::optionValue).toList();
  }

  private void checkMembers(FieldDescriptor field, List<String> values) {
    for (FieldOption option : field.options()) {
      setChecked(element(option.handle()), values.contains(option.value()));
    }
  }

  private List<String> checkedMembers(FieldDescriptor field) {
    return field.options().stream()
        .filter(option -> element(option.handle()).hasAttr("checked"))
        .map(FieldOption::value)
        .toList();
  }

  private static boolean isGrouped(FieldDescriptor field) {
    return !field.options().isEmpty() && field.options().get(0).handle() != null;
  }

  private static void setChecked(Element element, boolean checked) {
    if (checked) {
      element.attr("checked", true);
    } else {
      element.removeAttr("checked");
    }
  }

  private String optionValue(Element option) {
    return option.hasAttr("value") ? option.attr("value") : option.text();
  }

  /** Text of a label without the text of controls nested in it. */
  private static String controlFreeText(Element label) {
    Element copy = label.clone();
    copy.select(CONTROLS).remove();
    String text = copy.text();
    return text.isBlank() ? null : text;
  }

  private static String handleSelector(String handle) {
    return "[" + HANDLE_ATTRIBUTE + "='" + handle + "']";
  }

  private Element element(String handle) {
    Element element = document.selectFirst(handleSelector(handle));
    if (element == null) {
      throw new FieldInteractionException(handle, "No element with handle " + handle);
    }
    return element;
  }
}
