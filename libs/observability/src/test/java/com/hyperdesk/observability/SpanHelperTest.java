package com.hyperdesk.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanKind;
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
 * Tests for {@link SpanHelper} using an {@link InMemorySpanExporter}.
 */
@DisplayName("SpanHelper")
class SpanHelperTest {

    private InMemorySpanExporter spanExporter;
    private SpanHelper spanHelper;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        spanHelper = new SpanHelper(OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .build()
                .getTracer("test-tracer"));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
        spanExporter.reset();
    }

    @Test
    @DisplayName("rejects a null tracer")
    void rejectsNullTracer() {
        assertThatThrownBy(() -> new SpanHelper(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tracer");
    }

    @Test
    @DisplayName("records a successful span with correlation attributes")
    void recordsCorrelatedSpan() {
        CorrelationContextHolder.set(new CorrelationContext("corr-abc", "tenant-xyz", "user-42", "req-7"));

        String result = spanHelper.inSpan("vm.provision", SpanKind.INTERNAL, Map.of("vm.size", "M"), () -> "ok");

        assertThat(result).isEqualTo("ok");
        List<SpanData> spans = spanExporter.getFinishedSpanItems();
        assertThat(spans).hasSize(1);
        var attributes = spans.get(0).getAttributes();
        assertThat(spans.get(0).getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
        assertThat(attributes.get(AttributeKey.stringKey("correlation.id"))).isEqualTo("corr-abc");
        assertThat(attributes.get(AttributeKey.stringKey("tenant.id"))).isEqualTo("tenant-xyz");
        assertThat(attributes.get(AttributeKey.stringKey("vm_request.id"))).isEqualTo("req-7");
        assertThat(attributes.get(AttributeKey.stringKey("vm.size"))).isEqualTo("M");
    }

    @Test
    @DisplayName("marks the span failed when the result is a failure value")
    void marksFailureValue() {
        String result = spanHelper.inSpan("vm.provision", SpanKind.CLIENT, Map.of(), () -> "ResourceExhausted",
                value -> value.startsWith("Resource"));

        assertThat(result).isEqualTo("ResourceExhausted");
        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(span.getKind()).isEqualTo(SpanKind.CLIENT);
    }

    @Test
    @DisplayName("records the exception and rethrows it")
    void recordsException() {
        assertThatThrownBy(() -> spanHelper.inSpan("vm.provision", () -> {
            throw new IllegalStateException("backend down");
        })).isInstanceOf(IllegalStateException.class).hasMessage("backend down");

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(span.getStatus().getDescription()).contains("backend down");
        assertThat(span.getEvents()).isNotEmpty();
    }
}
