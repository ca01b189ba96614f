package fr.lapetina.llm.orchestrator.domain.routing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RouteSelectorTest {

    private static final Route A = new Route("A", 50);
    private static final Route B = new Route("B", 50);

    @Nested
    @DisplayName("WeightedRouteSelector")
    class WeightedTests {

        @Test
        @DisplayName("should split evenly across independent instances")
        void shouldSplitEvenlyAcrossInstances() {
            List<Route> routes = List.of(A, B);
            // Simulates several worker processes, each with its own selector
            List<RouteSelector> processes = List.of(
                    new WeightedRouteSelector(), new WeightedRouteSelector(),
                    new WeightedRouteSelector(), new WeightedRouteSelector());

            int draws = 100_000;
            int countA = 0;
            for (int i = 0; i < draws; i++) {
                if (processes.get(i % processes.size()).select(routes).name().equals("A")) {
                    countA++;
                }
            }

            double share = countA / (double) draws;
            assertThat(share).isBetween(0.48, 0.52);
        }

        @Test
        @DisplayName("should follow 30/70 weights with a fixed seed")
        void shouldFollowUnevenWeights() {
            List<Route> routes = List.of(new Route("A", 30), new Route("B", 70));
            RouteSelector selector = new WeightedRouteSelector(new Random(42));

            int countA = 0;
            for (int i = 0; i < 1000; i++) {
                if (selector.select(routes).name().equals("A")) {
                    countA++;
                }
            }

            assertThat(countA).isBetween(250, 350);
        }

        @Test
        @DisplayName("should never pick a zero-weight route")
        void shouldSkipZeroWeight() {
            List<Route> routes = List.of(new Route("A", 0), new Route("B", 100));
            RouteSelector selector = new WeightedRouteSelector(new Random(7));

            for (int i = 0; i < 500; i++) {
                assertThat(selector.select(routes).name()).isEqualTo("B");
            }
        }

        @Test
        @DisplayName("should reject empty route list")
        void shouldRejectEmptyRoutes() {
            assertThatThrownBy(() -> new WeightedRouteSelector().select(List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should be multi-process safe")
        void shouldBeMultiProcessSafe() {
            assertThat(new WeightedRouteSelector().isMultiProcessSafe()).isTrue();
        }
    }

    @Nested
    @DisplayName("RoundRobinRouteSelector")
    class RoundRobinTests {

        @Test
        @DisplayName("should cycle through routes")
        void shouldCycle() {
            RouteSelector selector = new RoundRobinRouteSelector();
            List<Route> routes = List.of(A, B);

            assertThat(selector.select(routes)).isEqualTo(A);
            assertThat(selector.select(routes)).isEqualTo(B);
            assertThat(selector.select(routes)).isEqualTo(A);
        }

        @Test
        @DisplayName("should report process-local state")
        void shouldNotBeMultiProcessSafe() {
            assertThat(new RoundRobinRouteSelector().isMultiProcessSafe()).isFalse();
        }
    }

    @Nested
    @DisplayName("RouteSelectorFactory")
    class FactoryTests {

        @Test
        @DisplayName("should return fixed selector when routing is disabled")
        void shouldReturnFixedWhenDisabled() {
            RouteSelector selector = RouteSelectorFactory.forConfig("weighted", false, "B");

            assertThat(selector).isInstanceOf(FixedRouteSelector.class);
            assertThat(selector.select(List.of(A, B))).isEqualTo(B);
        }

        @Test
        @DisplayName("should fall back to weighted for unknown strategy")
        void shouldFallBackToWeighted() {
            RouteSelector selector = RouteSelectorFactory.forConfig("nonexistent", true, "A");

            assertThat(selector).isInstanceOf(WeightedRouteSelector.class);
        }

        @Test
        @DisplayName("should accept underscore spelling")
        void shouldNormalizeNames() {
            assertThat(RouteSelectorFactory.create("ROUND_ROBIN"))
                    .get()
                    .isInstanceOf(RoundRobinRouteSelector.class);
        }

        @Test
        @DisplayName("should fail when the fixed route is missing")
        void shouldFailOnMissingFixedRoute() {
            RouteSelector selector = RouteSelectorFactory.forConfig("disabled", true, "C");

            assertThatThrownBy(() -> selector.select(List.of(A, B)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("C");
        }
    }
}
