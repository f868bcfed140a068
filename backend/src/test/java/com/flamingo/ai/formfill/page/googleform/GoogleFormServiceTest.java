package com.flamingo.ai.formfill.page.googleform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.formfill.domain.form.CoercedValue;
import com.flamingo.ai.formfill.domain.form.FieldDescriptor;
import com.flamingo.ai.formfill.domain.form.FieldKind;
import com.flamingo.ai.formfill.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.util.MultiValueMap;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class GoogleFormServiceTest {

  private static final String FORM_URL = "https://docs.google.com/forms/d/e/X/viewform";

  @Mock private GoogleFormClient client;

  private GoogleFormService service;

  @BeforeEach
  void setUp() {
    service = new GoogleFormService(client, new GoogleFormParser(new ObjectMapper()));
    when(client.fetch(FORM_URL)).thenReturn(Fixtures.resource("forms/google-form.html"));
  }

  @Test
  void shouldLoadFormAsFreshPage() {
    GoogleFormPage page = service.load(FORM_URL);

    assertThat(page.pageId()).startsWith("gform-");
    assertThat(page.definition().questions()).hasSize(6);
    assertThat(service.load(FORM_URL).pageId()).isNotEqualTo(page.pageId());
  }

  @Test
  @SuppressWarnings("unchecked")
  void shouldPostAnswersToResponseUrl() {
    // Given
    GoogleFormPage page = service.load(FORM_URL);
    FieldDescriptor name =
        FieldDescriptor.builder().id("entry.1001").name("entry.1001").kind(FieldKind.TEXT).build();
    page.apply(name, CoercedValue.text(FieldKind.TEXT, "Jane Doe"));
    when(client.submit(any(), any())).thenReturn(true);

    // When
    boolean accepted = service.submit(page);

    // Then
    ArgumentCaptor<MultiValueMap<String, String>> data =
        ArgumentCaptor.forClass(MultiValueMap.class);
    verify(client).submit(eq("https://docs.google.com/forms/d/e/X/formResponse"), data.capture());
    assertThat(accepted).isTrue();
    assertThat(data.getValue().getFirst("entry.1001")).isEqualTo("Jane Doe");
    assertThat(data.getValue().getFirst("pageHistory")).isEqualTo("0,1");
  }
}
