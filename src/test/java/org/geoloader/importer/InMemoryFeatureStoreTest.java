package org.geoloader.importer;

import org.geoloader.dto.geojson.Bounds;
import org.geoloader.dto.geojson.GeoJsonFeature;
import org.geoloader.dto.geojson.PointGeometry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryFeatureStoreTest {

    private static ImportResult result(int featureCount) {
        List<GeoJsonFeature> features = new ArrayList<>();
        for (int i = 0; i < featureCount; i++) {
            features.add(new GeoJsonFeature(PointGeometry.of(i, i), Map.of("id", String.valueOf(i))));
        }
        return new ImportResult(features, Bounds.of(features), "EPSG:2056", "EPSG:2056", "EPSG:4326",
                featureCount + 1, featureCount, 1, 0, Map.of("0", featureCount), List.of(), 0);
    }

    @Test
    void store_returnsMetadata() {
        InMemoryFeatureStore store = new InMemoryFeatureStore(Duration.ofMinutes(5), 10);

        FeatureStore.StoredImport meta = store.store("root:a.dxf", result(3));

        assertThat(meta.token()).isNotBlank();
        assertThat(meta.source()).isEqualTo("root:a.dxf");
        assertThat(meta.imported()).isEqualTo(3);
        assertThat(meta.failed()).isEqualTo(1);
        assertThat(meta.detectedCrs()).isEqualTo("EPSG:2056");
        assertThat(meta.crs()).isEqualTo("EPSG:4326");
        assertThat(meta.expiresAt()).isAfter(meta.createdAt());
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void page_walksThroughFeatures() {
        InMemoryFeatureStore store = new InMemoryFeatureStore(Duration.ofMinutes(5), 10);
        String token = store.store("a", result(5)).token();

        FeatureStore.FeaturePage first = store.page(token, 0, 2);
        FeatureStore.FeaturePage last = store.page(token, 4, 2);
        FeatureStore.FeaturePage beyond = store.page(token, 10, 2);

        assertThat(first.features()).extracting(f -> f.property("id")).containsExactly("0", "1");
        assertThat(first.hasMore()).isTrue();
        assertThat(first.total()).isEqualTo(5);
        assertThat(last.features()).hasSize(1);
        assertThat(last.hasMore()).isFalse();
        assertThat(beyond.features()).isEmpty();
        assertThat(beyond.hasMore()).isFalse();
    }

    @Test
    void page_rejectsInvalidArguments() {
        InMemoryFeatureStore store = new InMemoryFeatureStore(Duration.ofMinutes(5), 10);
        String token = store.store("a", result(1)).token();

        assertThatThrownBy(() -> store.page(token, -1, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.page(token, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void page_unknownTokenIsNull() {
        InMemoryFeatureStore store = new InMemoryFeatureStore(Duration.ofMinutes(5), 10);

        assertThat(store.page("missing", 0, 10)).isNull();
        assertThat(store.page(null, 0, 10)).isNull();
        assertThat(store.page(" ", 0, 10)).isNull();
    }

    @Test
    void expiredImportsDisappear() throws InterruptedException {
        InMemoryFeatureStore store = new InMemoryFeatureStore(Duration.ofMillis(20), 10);
        String token = store.store("a", result(1)).token();

        Thread.sleep(100);

        assertThat(store.page(token, 0, 10)).isNull();
        assertThat(store.size()).isZero();
    }

    @Test
    void oldestImportIsEvictedAtCapacity() throws InterruptedException {
        InMemoryFeatureStore store = new InMemoryFeatureStore(Duration.ofMinutes(5), 2);
        String first = store.store("a", result(1)).token();
        Thread.sleep(5);
        String second = store.store("b", result(1)).token();
        Thread.sleep(5);
        String third = store.store("c", result(1)).token();

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.page(first, 0, 1)).isNull();
        assertThat(store.page(second, 0, 1)).isNotNull();
        assertThat(store.page(third, 0, 1)).isNotNull();
    }

    @Test
    void remove_dropsImport() {
        InMemoryFeatureStore store = new InMemoryFeatureStore(Duration.ofMinutes(5), 10);
        String token = store.store("a", result(1)).token();

        assertThat(store.remove(token)).isTrue();
        assertThat(store.remove(token)).isFalse();
        assertThat(store.remove(null)).isFalse();
        assertThat(store.page(token, 0, 1)).isNull();
    }
}
