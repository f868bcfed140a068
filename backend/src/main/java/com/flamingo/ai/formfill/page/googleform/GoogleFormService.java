package com.flamingo.ai.formfill.page.googleform;

import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Loads Google Forms as fillable pages and submits their answers. */
@Service
@RequiredArgsConstructor
@Slf4j
public class GoogleFormService {

  private final GoogleFormClient client;
  private final GoogleFormParser parser;

  /**
   * Fetches and parses a form.
   *
   * @param formUrl the form view URL
   * @return a page holding no answers yet
   * @throws com.flamingo.ai.formfill.exception.FormSourceException if the form cannot be loaded
   */
  public GoogleFormPage load(String formUrl) {
    GoogleFormDefinition definition = parser.parse(formUrl, client.fetch(formUrl));
    String pageId = "gform-" + UUID.randomUUID().toString().substring(0, 8);
    return new GoogleFormPage(pageId, definition);
  }

  /**
   * Posts the answers applied to the page.
   *
   * @param page a filled form page
   * @return true if the response was accepted
   */
  public boolean submit(GoogleFormPage page) {
    log.info("Submitting page {} to {}", page.pageId(), page.definition().responseUrl());
    return client.submit(page.definition().responseUrl(), page.formData());
  }
}
