package com.flamingo.ai.formfill.page.googleform;

import com.flamingo.ai.formfill.config.FormFillConfig;
import com.flamingo.ai.formfill.exception.FormSourceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

/** HTTP client for fetching Google Form pages and posting responses. */
@Component
@Slf4j
public class GoogleFormClient {

  private final WebClient webClient;
  private final FormFillConfig.GoogleForms settings;
  private final MeterRegistry meterRegistry;

  @Autowired
  public GoogleFormClient(FormFillConfig config, MeterRegistry meterRegistry) {
    this(
        config,
        meterRegistry,
        WebClient.builder()
            .codecs(
                configurer ->
                    configurer
                        .defaultCodecs()
                        .maxInMemorySize(config.getGoogleForms().getMaxInMemorySize()))
            .build());
  }

  GoogleFormClient(FormFillConfig config, MeterRegistry meterRegistry, WebClient webClient) {
    this.settings = config.getGoogleForms();
    this.meterRegistry = meterRegistry;
    this.webClient = webClient;
    log.info(
        "Google Forms client initialized: fetchTimeout={}, submitTimeout={}",
        settings.getFetchTimeout(),
        settings.getSubmitTimeout());
  }

  /**
   * Fetches the form page markup.
   *
   * @param formUrl the form view URL
   * @return the page HTML
   */
  @CircuitBreaker(name = "googleForms", fallbackMethod = "fetchFallback")
  @Retry(name = "googleForms")
  public String fetch(String formUrl) {
    log.debug("Fetching Google Form {}", formUrl);
    String html =
        webClient
            .get()
            .uri(formUrl)
            .accept(MediaType.TEXT_HTML)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(settings.getFetchTimeout())
            .block();
    if (html == null || html.isBlank()) {
      throw new FormSourceException("Empty response from " + formUrl);
    }
    return html;
  }

  /**
   * Posts answers to the form's response URL.
   *
   * @param responseUrl the {@code formResponse} URL
   * @param formData the answer parameters
   * @return true if Google Forms accepted the response
   */
  @CircuitBreaker(name = "googleForms", fallbackMethod = "submitFallback")
  @Retry(name = "googleForms")
  public boolean submit(String responseUrl, MultiValueMap<String, String> formData) {
    ResponseEntity<Void> response =
        webClient
            .post()
            .uri(responseUrl)
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .body(BodyInserters.fromFormData(formData))
            .retrieve()
            .toBodilessEntity()
            .timeout(settings.getSubmitTimeout())
            .block();
    boolean accepted = response != null && response.getStatusCode().is2xxSuccessful();
    meterRegistry
        .counter("formfill.google.submissions", "accepted", Boolean.toString(accepted))
        .increment();
    log.info("Submitted response to {}: accepted={}", responseUrl, accepted);
    return accepted;
  }

  String fetchFallback(String formUrl, Throwable t) {
    log.error("Fetching Google Form {} failed: {}", formUrl, t.getMessage());
    meterRegistry.counter("formfill.google.failures", "operation", "fetch").increment();
    if (t instanceof FormSourceException formSourceException) {
      throw formSourceException;
    }
    throw new FormSourceException("Cannot fetch form " + formUrl, t);
  }

  boolean submitFallback(
      String responseUrl, MultiValueMap<String, String> formData, Throwable t) {
    log.error("Submitting to {} failed: {}", responseUrl, t.getMessage());
    meterRegistry.counter("formfill.google.failures", "operation", "submit").increment();
    throw new FormSourceException("Cannot submit form response to " + responseUrl, t);
  }
}
