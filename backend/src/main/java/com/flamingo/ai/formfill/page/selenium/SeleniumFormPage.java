package com.flamingo.ai.formfill.page.selenium;

import com.flamingo.ai.formfill.domain.form.CoercedValue;
import com.flamingo.ai.formfill.domain.form.FieldDescriptor;
import com.flamingo.ai.formfill.domain.form.FieldOption;
import com.flamingo.ai.formfill.domain.form.RawFormControl;
import com.flamingo.ai.formfill.exception.FieldInteractionException;
import com.flamingo.ai.formfill.exception.FieldTimeoutException;
import com.flamingo.ai.formfill.exception.StaleDocumentException;
import com.flamingo.ai.formfill.page.FormPage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.Select;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.springframework.core.io.ClassPathResource;

/**
 * Form page in a live browser driven through Selenium WebDriver.
 *
 * <p>Controls are collected by one injected script that also stamps every control with a {@code
 * data-formfill-id} handle; field ids and option handles are those stamps.
 */
@Slf4j
public class SeleniumFormPage implements FormPage {

  static final String INSPECT_SCRIPT_LOCATION = "formfill/inspect-controls.js";

  private static final String DISPATCH_EVENTS_SCRIPT =
      "var el = arguments[0];"
          + "['input', 'change', 'blur'].forEach(function (type) {"
          + "  el.dispatchEvent(new Event(type, { bubbles: true }));"
          + "});";

  private static final String SET_VALUE_SCRIPT = "arguments[0].value = arguments[1];";

  private static final String READY_STATE_SCRIPT = "return document.readyState";

  private final WebDriver driver;
  private final String pageId;
  private final String inspectScript;

  public SeleniumFormPage(WebDriver driver, String pageId) {
    this.driver = driver;
    this.pageId = pageId;
    this.inspectScript = loadScript(INSPECT_SCRIPT_LOCATION);
  }

  @Override
  public String pageId() {
    return pageId;
  }

  @Override
  public List<RawFormControl> inspectControls(Duration timeout) {
    try {
      new WebDriverWait(driver, timeout)
          .until(d -> "complete".equals(javascript().executeScript(READY_STATE_SCRIPT)));
      Object result = javascript().executeScript(inspectScript);
      if (!(result instanceof List<?> rows)) {
        throw new StaleDocumentException(pageId, "Control inspection returned " + result);
      }
      List<RawFormControl> controls = new ArrayList<>();
      for (Object row : rows) {
        controls.add(toControl((Map<?, ?>) row));
      }
      return controls;
    } catch (WebDriverException e) {
      throw new StaleDocumentException(pageId, "Page " + pageId + " is no longer available", e);
    }
  }

  @Override
  public void awaitInteractable(FieldDescriptor field, Duration timeout) {
    try {
      new WebDriverWait(driver, timeout)
          .until(ExpectedConditions.elementToBeClickable(locator(field.id())));
    } catch (TimeoutException e) {
      throw new FieldTimeoutException(field.id(), timeout, e);
    } catch (WebDriverException e) {
      throw new FieldInteractionException(field.id(), "Cannot reach field " + field.id(), e);
    }
  }

  @Override
  public void apply(FieldDescriptor field, CoercedValue value) {
    try {
      switch (field.kind()) {
        case TEXT, EMAIL, TEL, TEXTAREA -> {
          WebElement element = element(field.id());
          element.clear();
          element.sendKeys(value.asText());
        }
        case DATE ->
            javascript().executeScript(SET_VALUE_SCRIPT, element(field.id()), value.asText());
        case SINGLE_SELECT -> new Select(element(field.id())).selectByValue(value.asText());
        case MULTI_SELECT -> {
          if (isGrouped(field)) {
            setMembers(field, value.values());
          } else {
            Select select = new Select(element(field.id()));
            select.deselectAll();
            value.values().forEach(select::selectByValue);
          }
        }
        case RADIO_GROUP -> setMembers(field, value.values());
        case CHECKBOX -> setSelected(element(field.id()), value.asToggle());
      }
    } catch (WebDriverException e) {
      throw new FieldInteractionException(field.id(), "Cannot set field " + field.id(), e);
    }
  }

  @Override
  public void dispatchChangeEvents(FieldDescriptor field) {
    try {
      if (isGrouped(field)) {
        for (FieldOption option : field.options()) {
          javascript().executeScript(DISPATCH_EVENTS_SCRIPT, element(option.handle()));
        }
      } else {
        javascript().executeScript(DISPATCH_EVENTS_SCRIPT, element(field.id()));
      }
    } catch (WebDriverException e) {
      throw new FieldInteractionException(field.id(), "Cannot notify field " + field.id(), e);
    }
  }

  @Override
  public List<String> read(FieldDescriptor field) {
    try {
      return switch (field.kind()) {
        case TEXT, EMAIL, TEL, TEXTAREA, DATE ->
            List.of(nullToEmpty(element(field.id()).getDomProperty("value")));
        case SINGLE_SELECT -> selectedValues(field);
        case MULTI_SELECT -> isGrouped(field) ? selectedMembers(field) : selectedValues(field);
        case RADIO_GROUP -> selectedMembers(field);
        case CHECKBOX -> List.of(Boolean.toString(element(field.id()).isSelected()));
      };
    } catch (WebDriverException e) {
      throw new FieldInteractionException(field.id(), "Cannot read field " + field.id(), e);
    }
  }

  private RawFormControl toControl(Map<?, ?> row) {
    Map<String, String> attributes = new LinkedHashMap<>();
    if (row.get("attributes") instanceof Map<?, ?> raw) {
      raw.forEach((key, value) -> attributes.put(String.valueOf(key), String.valueOf(value)));
    }
    List<FieldOption> options = new ArrayList<>();
    if (row.get("options") instanceof List<?> raw) {
      for (Object item : raw) {
        Map<?, ?> option = (Map<?, ?>) item;
        options.add(FieldOption.of(string(option.get("value")), string(option.get("text"))));
      }
    }
    return RawFormControl.builder()
        .handle(string(row.get("handle")))
        .tagName(string(row.get("tagName")))
        .attributes(attributes)
        .captionText(string(row.get("captionText")))
        .labelledByText(string(row.get("labelledByText")))
        .groupCaption(string(row.get("groupCaption")))
        .precedingText(string(row.get("precedingText")))
        .visible(Boolean.TRUE.equals(row.get("visible")))
        .currentValue(string(row.get("currentValue")))
        .checked(Boolean.TRUE.equals(row.get("checked")))
        .options(options)
        .build();
  }

  private void setMembers(FieldDescriptor field, List<String> values) {
    for (FieldOption option : field.options()) {
      setSelected(element(option.handle()), values.contains(option.value()));
    }
  }

  private List<String> selectedMembers(FieldDescriptor field) {
    List<String> selected = new ArrayList<>();
    for (FieldOption option : field.options()) {
      if (element(option.handle()).isSelected()) {
        selected.add(option.value());
      }
    }
    return selected;
  }

  private List<String> selectedValues(FieldDescriptor field) {
    return new Select(element(field.id())).getAllSelectedOptions().stream()
        .map(option -> nullToEmpty(option.getDomProperty("value")))
        .filter(value -> !value.isEmpty())
        .toList();
  }

  private static void setSelected(WebElement element, boolean selected) {
    if (element.isSelected() != selected) {
      element.click();
    }
  }

  private static boolean isGrouped(FieldDescriptor field) {
    return !field.options().isEmpty() && field.options().get(0).handle() != null;
  }

  private WebElement element(String handle) {
    return driver.findElement(locator(handle));
  }

  private static By locator(String handle) {
    return By.cssSelector("[data-formfill-id='" + handle + "']");
  }

  private JavascriptExecutor javascript() {
    return (JavascriptExecutor) driver;
  }

  private static String string(Object value) {
    return value == null ? null : value.toString();
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  private static String loadScript(String location) {
    try {
      return new ClassPathResource(location).getContentAsString(StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot load " + location, e);
    }
  }
}
