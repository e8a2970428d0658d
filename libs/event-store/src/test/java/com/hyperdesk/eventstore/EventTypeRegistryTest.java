package com.hyperdesk.eventstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.hyperdesk.eventstore.WidgetEvents.WidgetCreated;
import com.hyperdesk.eventstore.WidgetEvents.WidgetRenamed;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EventTypeRegistry")
class EventTypeRegistryTest {

    @Test
    @DisplayName("resolves names and classes in both directions")
    void resolvesBothDirections() {
        var registry = WidgetEvents.REGISTRY;

        assertThat(registry.typeNameOf(WidgetEvents.created(UUID.randomUUID(), "a"))).isEqualTo("WidgetCreated");
        assertThat(registry.classFor("WidgetRenamed")).contains(WidgetRenamed.class);
        assertThat(registry.isKnown("WidgetCreated")).isTrue();
        assertThat(registry.isKnown("WidgetDeleted")).isFalse();
        assertThat(registry.classFor("WidgetDeleted")).isEmpty();
        assertThat(registry.typeNames()).containsExactly("WidgetCreated", "WidgetRenamed");
    }

    @Test
    @DisplayName("rejects an event whose class was never registered")
    void rejectsUnregisteredClass() {
        var registry = EventTypeRegistry.builder().register("WidgetCreated", WidgetCreated.class).build();

        assertThatThrownBy(() -> registry.typeNameOf(WidgetEvents.renamed(UUID.randomUUID(), "b")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("WidgetRenamed");
    }

    @Test
    @DisplayName("rejects duplicate names and duplicate classes")
    void rejectsDuplicates() {
        assertThatThrownBy(() -> EventTypeRegistry.builder()
                        .register("WidgetCreated", WidgetCreated.class)
                        .register("WidgetCreated", WidgetRenamed.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");

        assertThatThrownBy(() -> EventTypeRegistry.builder()
                        .register("WidgetCreated", WidgetCreated.class)
                        .register("WidgetCreatedV2", WidgetCreated.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("twice");
    }
}
