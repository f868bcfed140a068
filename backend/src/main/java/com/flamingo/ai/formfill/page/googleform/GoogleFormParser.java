package com.flamingo.ai.formfill.page.googleform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.formfill.exception.FormSourceException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads the form structure from the {@code FB_PUBLIC_LOAD_DATA_} script variable of a Google Form
 * page.
 *
 * <p>Questions live at {@code data[1][1]}; each is {@code [id, title, description, typeId,
 * [[entryId, options, required, rowNames], ...]]}. Type 8 is a page break.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GoogleFormParser {

  private static final Pattern LOAD_DATA =
      Pattern.compile("var\\s+FB_PUBLIC_LOAD_DATA_\\s*=\\s*(.*?);\\s*</script>", Pattern.DOTALL);

  private static final int PAGE_BREAK_TYPE_ID = 8;

  private final ObjectMapper objectMapper;

  /**
   * Parses a form page.
   *
   * @param formUrl the URL the page was fetched from
   * @param html the page markup
   * @return the form definition
   * @throws FormSourceException if the page carries no readable form data
   */
  public GoogleFormDefinition parse(String formUrl, String html) {
    JsonNode data = loadData(formUrl, html);
    JsonNode items = data.path(1).path(1);
    if (!items.isArray()) {
      throw new FormSourceException(
          "No questions in form " + formUrl + "; the form may require sign-in");
    }

    List<GoogleFormQuestion> questions = new ArrayList<>();
    int pageCount = 0;
    for (JsonNode item : items) {
      int typeId = item.path(3).asInt(-1);
      if (typeId == PAGE_BREAK_TYPE_ID) {
        pageCount++;
        continue;
      }
      GoogleFormQuestion.QuestionType type = GoogleFormQuestion.QuestionType.fromTypeId(typeId);
      if (type == null) {
        log.debug("Skipping question '{}' of unsupported type {}", item.path(1).asText(), typeId);
        continue;
      }
      for (JsonNode entry : item.path(4)) {
        questions.add(question(item, entry, type));
      }
    }

    boolean collectsEmail = data.path(1).path(10).path(6).asInt(0) > 1;
    log.info(
        "Parsed Google Form {}: questions={}, pages={}, collectsEmail={}",
        formUrl,
        questions.size(),
        pageCount,
        collectsEmail);
    return new GoogleFormDefinition(
        formUrl, responseUrl(formUrl), questions, pageCount, collectsEmail);
  }

  /**
   * Derives the submission URL from a view URL.
   *
   * @param formUrl the form view URL
   * @return the {@code /formResponse} URL
   */
  static String responseUrl(String formUrl) {
    String url = formUrl;
    int query = url.indexOf('?');
    if (query >= 0) {
      url = url.substring(0, query);
    }
    url = url.replace("/viewform", "/formResponse");
    if (!url.endsWith("/formResponse")) {
      url = (url.endsWith("/") ? url : url + "/") + "formResponse";
    }
    return url;
  }

  private GoogleFormQuestion question(
      JsonNode item, JsonNode entry, GoogleFormQuestion.QuestionType type) {
    List<String> options = new ArrayList<>();
    for (JsonNode option : entry.path(1)) {
      String text = option.path(0).asText("");
      // An empty option is the free-text "Other" choice, which needs a second parameter.
      if (!text.isBlank()) {
        options.add(text);
      }
    }
    List<String> rowNames = new ArrayList<>();
    for (JsonNode rowName : entry.path(3)) {
      rowNames.add(rowName.asText());
    }
    return new GoogleFormQuestion(
        entry.path(0).asText(),
        item.path(1).asText(""),
        rowNames.isEmpty() ? null : String.join(" - ", rowNames),
        type,
        entry.path(2).asInt(0) == 1,
        options);
  }

  private JsonNode loadData(String formUrl, String html) {
    Matcher matcher = LOAD_DATA.matcher(html == null ? "" : html);
    if (!matcher.find()) {
      throw new FormSourceException("No form data found at " + formUrl);
    }
    try {
      return objectMapper.readTree(matcher.group(1));
    } catch (JsonProcessingException e) {
      throw new FormSourceException("Malformed form data at " + formUrl, e);
    }
  }
}
