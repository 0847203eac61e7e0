package org.geoloader.crs;

import org.geoloader.dto.geojson.Bounds;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CoordinateSystemManagerTest {

    private static final CoordinatePoint BERN_LV95 = new CoordinatePoint(2_600_000, 1_200_000);

    private CoordinateSystemManager manager;

    @BeforeEach
    void setUp() {
        manager = new CoordinateSystemManager();
        manager.initialize();
    }

    @AfterEach
    void tearDown() {
        manager.reset();
    }

    @Test
    void initialize_registersBuiltInSystemsSortedByCode() {
        assertThat(manager.isInitialized()).isTrue();
        assertThat(manager.getSupportedSystems())
                .extracting(CoordinateSystemDefinition::code)
                .containsExactly("EPSG:2056", "EPSG:21781", "EPSG:4150", "EPSG:4326");
        assertThat(manager.getSystemUnits(CoordinateSystems.LV95)).isEqualTo("meters");
        assertThat(manager.getSystemUnits(CoordinateSystems.WGS84)).isEqualTo("degrees");
        assertThat(manager.getSystemDefinition("EPSG:9999")).isNull();
    }

    @Test
    void initialize_isIdempotent() {
        manager.initialize();
        manager.initialize();

        assertThat(manager.getSupportedSystems()).hasSize(4);
    }

    @Test
    void transform_sameSystemReturnsCopyWithoutCaching() {
        CoordinatePoint result = manager.transform(BERN_LV95, CoordinateSystems.LV95, CoordinateSystems.LV95);

        assertThat(result).isEqualTo(BERN_LV95).isNotSameAs(BERN_LV95);
        assertThat(manager.cacheSize()).isZero();
    }

    @Test
    void transform_lv95OriginToSwissGeographicIsProjectionCenter() {
        CoordinatePoint result = manager.transform(BERN_LV95, CoordinateSystems.LV95,
                CoordinateSystems.CH1903_PLUS_GEOGRAPHIC);

        assertThat(result.x()).isCloseTo(7.4396, within(1e-4));
        assertThat(result.y()).isCloseTo(46.9524, within(1e-4));
    }

    @Test
    void transform_lv95OriginToWgs84AppliesDatumShift() {
        CoordinatePoint result = manager.transform(BERN_LV95, CoordinateSystems.LV95, CoordinateSystems.WGS84);

        assertThat(result.x()).isCloseTo(7.43863, within(1e-3));
        assertThat(result.y()).isCloseTo(46.95108, within(1e-3));
    }

    @Test
    void transform_lv95AndLv03DifferByFalseOrigin() {
        CoordinatePoint lv03 = manager.transform(new CoordinatePoint(2_645_021, 1_249_991),
                CoordinateSystems.LV95, CoordinateSystems.LV03);

        assertThat(lv03.x()).isCloseTo(645_021, within(1e-3));
        assertThat(lv03.y()).isCloseTo(249_991, within(1e-3));
    }

    @Test
    void transform_repeatedCallsAreCachedAndDeterministic() {
        CoordinatePoint first = manager.transform(BERN_LV95, CoordinateSystems.LV95, CoordinateSystems.WGS84);
        CoordinatePoint second = manager.transform(BERN_LV95, CoordinateSystems.LV95, CoordinateSystems.WGS84);

        assertThat(second).isEqualTo(first);
        assertThat(manager.cacheSize()).isEqualTo(1);

        manager.transform(new CoordinatePoint(2_600_001, 1_200_000), CoordinateSystems.LV95, CoordinateSystems.WGS84);
        assertThat(manager.cacheSize()).isEqualTo(2);
    }

    @Test
    void transform_rejectsNonFiniteInput() {
        assertThatThrownBy(() -> manager.transform(new CoordinatePoint(Double.NaN, 1), CoordinateSystems.LV95,
                CoordinateSystems.WGS84))
                .isInstanceOf(CoordinateTransformationException.class);
    }

    @Test
    void transform_rejectsUnknownSystems() {
        assertThatThrownBy(() -> manager.transform(BERN_LV95, "EPSG:9999", CoordinateSystems.WGS84))
                .isInstanceOf(CoordinateTransformationException.class)
                .satisfies(e -> assertThat(((CoordinateTransformationException) e).getFromSystem()).isEqualTo("EPSG:9999"));
        assertThatThrownBy(() -> manager.transform(BERN_LV95, CoordinateSystems.LV95, null))
                .isInstanceOf(CoordinateTransformationException.class);
    }

    @Test
    void validateBounds_usesDeclaredValidityArea() {
        assertThat(manager.validateBounds(BERN_LV95, CoordinateSystems.LV95)).isTrue();
        assertThat(manager.validateBounds(new CoordinatePoint(0, 0), CoordinateSystems.LV95)).isFalse();
        assertThat(manager.validateBounds(new CoordinatePoint(600_000, 200_000), CoordinateSystems.LV03)).isTrue();
        assertThat(manager.validateBounds(new CoordinatePoint(7.4, 46.9), "EPSG:9999")).isFalse();
        assertThat(manager.validateBounds(new CoordinatePoint(Double.NaN, 0), CoordinateSystems.WGS84)).isFalse();
    }

    @Test
    void validateBounds_systemWithoutBoundsAcceptsEverything() {
        manager.registerSystem(new CoordinateSystemDefinition("LOCAL:1", "+proj=longlat +datum=WGS84 +no_defs",
                null, "degrees", null));

        assertThat(manager.validateBounds(new CoordinatePoint(1_000, -1_000), "LOCAL:1")).isTrue();
    }

    @Test
    void registerSystem_makesSystemTransformableAndClearsCache() {
        manager.transform(BERN_LV95, CoordinateSystems.LV95, CoordinateSystems.WGS84);
        assertThat(manager.cacheSize()).isEqualTo(1);

        manager.registerSystem(new CoordinateSystemDefinition("LOCAL:WGS", "+proj=longlat +datum=WGS84 +no_defs",
                new Bounds(-180, -90, 180, 90), "degrees", "copy of WGS 84"));

        assertThat(manager.cacheSize()).isZero();
        CoordinatePoint result = manager.transform(new CoordinatePoint(8.5, 47.3), "LOCAL:WGS", CoordinateSystems.WGS84);
        assertThat(result.x()).isCloseTo(8.5, within(1e-9));
        assertThat(result.y()).isCloseTo(47.3, within(1e-9));
    }

    @Test
    void registerSystem_rejectsUnparsableDefinition() {
        assertThatThrownBy(() -> manager.registerSystem(
                new CoordinateSystemDefinition("BROKEN:1", "+proj=doesnotexist +units=m", null, "meters", null)))
                .isInstanceOf(CoordinateSystemException.class);
        assertThat(manager.getSystemDefinition("BROKEN:1")).isNull();
    }

    @Test
    void reset_returnsToUninitializedAndReinitializesOnDemand() {
        manager.transform(BERN_LV95, CoordinateSystems.LV95, CoordinateSystems.WGS84);

        manager.reset();

        assertThat(manager.isInitialized()).isFalse();
        assertThat(manager.cacheSize()).isZero();
        assertThat(manager.getSupportedSystems()).hasSize(4);
        assertThat(manager.isInitialized()).isTrue();
    }

    @Test
    void initialize_failsForBrokenAdditionalSystem() {
        CoordinateSystemManager broken = new CoordinateSystemManager(100, List.of(
                new CoordinateSystemDefinition("BROKEN:2", "+proj=doesnotexist", null, "meters", null)));

        assertThatThrownBy(broken::initialize).isInstanceOf(CoordinateSystemException.class);
        assertThat(broken.isInitialized()).isFalse();
    }

    @Test
    void initialize_failsWhenOverriddenSystemMissesCheckPoint() {
        // 覆盖内置 LV95：东向假原点偏移 100 km，能解析但自检点偏离 1° 以上
        CoordinateSystemManager wrong = new CoordinateSystemManager(100, List.of(
                new CoordinateSystemDefinition(CoordinateSystems.LV95,
                        "+proj=somerc +lat_0=46.95240555555556 +lon_0=7.439583333333333 +k_0=1 "
                                + "+x_0=2700000 +y_0=1200000 +ellps=bessel +towgs84=674.374,15.056,405.346,0,0,0,0 "
                                + "+units=m +no_defs",
                        null, "meters", "wrong false easting")));

        assertThatThrownBy(wrong::initialize)
                .isInstanceOf(CoordinateSystemException.class)
                .hasMessageContaining(CoordinateSystems.LV95);
        assertThat(wrong.isInitialized()).isFalse();
    }

    @Test
    @Timeout(30)
    void transform_concurrentFirstUseInitializesOnce() throws Exception {
        CoordinateSystemManager fresh = new CoordinateSystemManager();
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<CoordinatePoint>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return fresh.transform(BERN_LV95, CoordinateSystems.LV95, CoordinateSystems.CH1903_PLUS_GEOGRAPHIC);
                }));
            }
            start.countDown();

            for (Future<CoordinatePoint> future : futures) {
                CoordinatePoint result = future.get();
                assertThat(result.x()).isCloseTo(7.4396, within(1e-4));
                assertThat(result.y()).isCloseTo(46.9524, within(1e-4));
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(fresh.isInitialized()).isTrue();
        assertThat(fresh.getSupportedSystems())
                .extracting(CoordinateSystemDefinition::code)
                .containsExactly("EPSG:2056", "EPSG:21781", "EPSG:4150", "EPSG:4326");
        fresh.reset();
    }

    @Test
    void initialize_registersAdditionalSystems() {
        CoordinateSystemManager extended = new CoordinateSystemManager(100, List.of(
                new CoordinateSystemDefinition("EPSG:3857",
                        "+proj=merc +a=6378137 +b=6378137 +lat_ts=0 +lon_0=0 +x_0=0 +y_0=0 +k=1 +units=m +no_defs",
                        null, "meters", "Web Mercator")));
        extended.initialize();

        CoordinatePoint origin = extended.transform(new CoordinatePoint(0, 0), CoordinateSystems.WGS84, "EPSG:3857");

        assertThat(origin.x()).isCloseTo(0, within(1e-6));
        assertThat(origin.y()).isCloseTo(0, within(1e-6));
        assertThat(extended.getSupportedSystems()).hasSize(5);
    }
}
