package com.flamingo.ai.formfill.page.googleform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

import com.flamingo.ai.formfill.config.FormFillConfig;
import com.flamingo.ai.formfill.exception.FormSourceException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@DisplayName("GoogleFormClient Tests")
class GoogleFormClientTest {

  private static final String FORM_URL = "https://docs.google.com/forms/d/e/abc/viewform";

  private FormFillConfig config;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    config = new FormFillConfig();
    config.getGoogleForms().setFetchTimeout(Duration.ofMillis(50));
    meterRegistry = new SimpleMeterRegistry();
  }

  @Test
  @DisplayName("Should return the page markup")
  void shouldReturnPageMarkup() {
    GoogleFormClient client = client(request -> Mono.just(html("<html>form</html>")));

    assertThat(client.fetch(FORM_URL)).isEqualTo("<html>form</html>");
  }

  @Test
  @DisplayName("Should reject an empty page")
  void shouldRejectEmptyPage() {
    GoogleFormClient client = client(request -> Mono.just(html("")));

    assertThatThrownBy(() -> client.fetch(FORM_URL))
        .isInstanceOf(FormSourceException.class)
        .hasMessageContaining("Empty response");
  }

  @Test
  @DisplayName("Should give up on a page that never answers")
  void shouldTimeOutOnSilentServer() {
    GoogleFormClient client = client(request -> Mono.never());

    Throwable thrown = catchThrowable(() -> client.fetch(FORM_URL));

    assertThat(thrown).hasCauseInstanceOf(TimeoutException.class);
  }

  @Test
  @DisplayName("Fetch fallback should wrap the failure and count it")
  void fetchFallbackShouldWrapFailure() {
    GoogleFormClient client = client(request -> Mono.never());
    Throwable timeout = catchThrowable(() -> client.fetch(FORM_URL));

    assertThatThrownBy(() -> client.fetchFallback(FORM_URL, timeout))
        .isInstanceOf(FormSourceException.class)
        .hasMessage("Cannot fetch form " + FORM_URL)
        .hasCause(timeout);
    assertThat(
            meterRegistry
                .get("formfill.google.failures")
                .tag("operation", "fetch")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Fetch fallback should pass a form source failure through unchanged")
  void fetchFallbackShouldKeepFormSourceFailure() {
    GoogleFormClient client = client(request -> Mono.never());
    FormSourceException empty = new FormSourceException("Empty response from " + FORM_URL);

    assertThatThrownBy(() -> client.fetchFallback(FORM_URL, empty)).isSameAs(empty);
  }

  @Test
  @DisplayName("Should count an accepted submission")
  void shouldCountAcceptedSubmission() {
    GoogleFormClient client =
        client(request -> Mono.just(ClientResponse.create(HttpStatus.OK).build()));

    boolean accepted = client.submit(FORM_URL.replace("viewform", "formResponse"), answers());

    assertThat(accepted).isTrue();
    assertThat(
            meterRegistry
                .get("formfill.google.submissions")
                .tag("accepted", "true")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Submit fallback should wrap the failure and count it")
  void submitFallbackShouldWrapFailure() {
    GoogleFormClient client = client(request -> Mono.never());
    RuntimeException unavailable = new RuntimeException("Google Forms unavailable");

    assertThatThrownBy(() -> client.submitFallback(FORM_URL, answers(), unavailable))
        .isInstanceOf(FormSourceException.class)
        .hasCause(unavailable);
    assertThat(
            meterRegistry
                .get("formfill.google.failures")
                .tag("operation", "submit")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  private GoogleFormClient client(ExchangeFunction exchange) {
    return new GoogleFormClient(
        config, meterRegistry, WebClient.builder().exchangeFunction(exchange).build());
  }

  private static ClientResponse html(String body) {
    return ClientResponse.create(HttpStatus.OK)
        .header(HttpHeaders.CONTENT_TYPE, "text/html")
        .body(body)
        .build();
  }

  private static MultiValueMap<String, String> answers() {
    MultiValueMap<String, String> answers = new LinkedMultiValueMap<>();
    answers.add("entry.1", "Jane Doe");
    return answers;
  }
}
