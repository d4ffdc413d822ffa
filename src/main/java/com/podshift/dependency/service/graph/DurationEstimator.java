package com.podshift.dependency.service.graph;

import com.podshift.dependency.model.ResolverSettings;
import com.podshift.dependency.model.graph.DependencyEdge;
import com.podshift.dependency.model.graph.DependencyGraph;
import com.podshift.dependency.model.graph.DurationEstimate;
import com.podshift.dependency.model.graph.MigrationPhase;
import com.podshift.dependency.model.graph.MigrationSequence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Timing model for a migration plan.
 *
 * Every container costs a flat number of minutes, scaled by the complexity multiplier when it
 * takes part in an ordering volume or env_reference edge. A parallel phase costs its slowest
 * member, any other phase the sum of its members. The parallel total adds up the phases; the
 * sequential total adds up every container.
 */
@Service
@Slf4j
public class DurationEstimator {

    public MigrationSequence estimate(DependencyGraph graph, List<MigrationPhase> phases, ResolverSettings settings) {
        Map<String, Double> perContainer = containerMinutes(graph, settings);

        List<MigrationPhase> estimated = new ArrayList<>(phases.size());
        List<String> startupOrder = new ArrayList<>();
        double parallelMinutes = 0;
        for (MigrationPhase phase : phases) {
            double minutes = phase.isParallel()
                    ? phase.getContainers().stream().mapToDouble(perContainer::get).max().orElse(0)
                    : phase.getContainers().stream().mapToDouble(perContainer::get).sum();
            parallelMinutes += minutes;
            estimated.add(phase.toBuilder().estimatedMinutes(minutes).build());
            startupOrder.addAll(phase.getContainers());
        }
        double sequentialMinutes = perContainer.values().stream().mapToDouble(Double::doubleValue).sum();

        DurationEstimate duration = DurationEstimate.builder()
                .totalContainers(perContainer.size())
                .sequentialMinutes(sequentialMinutes)
                .parallelMinutes(parallelMinutes)
                .sequentialHours(round(sequentialMinutes / 60))
                .parallelHours(round(parallelMinutes / 60))
                .timeSavingsPercent(savingsPercent(sequentialMinutes, parallelMinutes))
                .build();
        log.info("[duration-estimator] containers={} sequentialMinutes={} parallelMinutes={} savings={}%",
                duration.getTotalContainers(), sequentialMinutes, parallelMinutes, duration.getTimeSavingsPercent());

        return MigrationSequence.builder()
                .phases(List.copyOf(estimated))
                .startupOrder(List.copyOf(startupOrder))
                .estimatedDuration(duration)
                .build();
    }

    Map<String, Double> containerMinutes(DependencyGraph graph, ResolverSettings settings) {
        Set<String> risky = new HashSet<>();
        for (DependencyEdge edge : graph.getOrderingEdges()) {
            if (edge.getKind().isIntegrationRisk()) {
                risky.add(edge.getSource());
                risky.add(edge.getTarget());
            }
        }
        Map<String, Double> minutes = new TreeMap<>();
        for (String node : graph.getNodes()) {
            double base = settings.getMinutesPerContainer();
            minutes.put(node, risky.contains(node) ? base * settings.getComplexityMultiplier() : base);
        }
        return minutes;
    }

    static double savingsPercent(double sequentialMinutes, double parallelMinutes) {
        if (sequentialMinutes <= 0) {
            return 0;
        }
        double percent = (sequentialMinutes - parallelMinutes) / sequentialMinutes * 100;
        return round(Math.max(0, Math.min(100, percent)));
    }

    static double round(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
