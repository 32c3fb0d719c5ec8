package com.bluequee.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SpanHelper}.
 *
 * <p>Uses {@link InMemorySpanExporter} directly for reliable span collection.
 */
@DisplayName("SpanHelper")
class SpanHelperTest {

    private InMemorySpanExporter spanExporter;
    private SpanHelper spanHelper;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider =
                SdkTracerProvider.builder()
                        .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                        .build();
        OpenTelemetrySdk sdk = OpenTelemetrySdk.builder().setTracerProvider(tracerProvider).build();
        spanHelper = new SpanHelper(sdk.getTracer("test-tracer"));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
        spanExporter.reset();
    }

    @Test
    @DisplayName("rejects null tracer")
    void rejectsNullTracer() {
        assertThatThrownBy(() -> new SpanHelper(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tracer");
    }

    @Test
    @DisplayName("returns the work's result and ends the span with OK")
    void returnsResult() {
        String result = spanHelper.inSpan("tabconfig.resolve", () -> "tabs");

        assertThat(result).isEqualTo("tabs");
        List<SpanData> spans = spanExporter.getFinishedSpanItems();
        assertThat(spans).hasSize(1);
        assertThat(spans.get(0).getName()).isEqualTo("tabconfig.resolve");
        assertThat(spans.get(0).getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
    }

    @Test
    @DisplayName("attaches correlation, organization and user attributes")
    void attachesCorrelation() {
        CorrelationContextHolder.set(new CorrelationContext("corr-9", 3L, 8L, null));

        spanHelper.inSpan("tabconfig.reorder", Map.of("tab.count", "2"), () -> 2);

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getAttributes().get(AttributeKey.stringKey(SpanHelper.ATTR_CORRELATION_ID)))
                .isEqualTo("corr-9");
        assertThat(span.getAttributes().get(AttributeKey.longKey(SpanHelper.ATTR_ORGANIZATION_ID)))
                .isEqualTo(3L);
        assertThat(span.getAttributes().get(AttributeKey.longKey(SpanHelper.ATTR_USER_ID)))
                .isEqualTo(8L);
        assertThat(span.getAttributes().get(AttributeKey.stringKey("tab.count"))).isEqualTo("2");
    }

    @Test
    @DisplayName("records and rethrows runtime exceptions")
    void recordsExceptions() {
        assertThatThrownBy(
                        () ->
                                spanHelper.runInSpan(
                                        "tabconfig.delete",
                                        () -> {
                                            throw new IllegalStateException("boom");
                                        }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(span.getEvents()).anyMatch(event -> event.getName().equals("exception"));
    }
}
