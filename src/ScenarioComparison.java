import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

//Runs independent projections, one per scenario, in parallel over the shared reference data
public class ScenarioComparison {
    private static final Logger logger = LoggerFactory.getLogger(ScenarioComparison.class);

    private final Simulator simulator;
    private final int threadCount;

    public ScenarioComparison(Simulator simulator, int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("Thread count must be positive, got " + threadCount);
        }
        this.simulator = simulator;
        this.threadCount = threadCount;
    }

    //Each scenario's preset is applied to the base parameters; invalid parameters fail before any run starts
    public Map<Scenario, Projection> compare(List<Scenario> scenarios, SimulationParameters baseParameters, int startYear, int endYear) {
        Map<Scenario, SimulationParameters> parametersByScenario = new EnumMap<>(Scenario.class);
        for (Scenario scenario : scenarios) {
            parametersByScenario.put(scenario, scenario.applyTo(baseParameters).validate());
        }

        Map<Scenario, Projection> projections = new ConcurrentHashMap<>();
        Map<Scenario, RuntimeException> failures = new ConcurrentHashMap<>();
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(parametersByScenario.size());
        try {
            for (Map.Entry<Scenario, SimulationParameters> entry : parametersByScenario.entrySet()) {
                executor.execute(() -> {
                    try {
                        projections.put(entry.getKey(), simulator.project(startYear, endYear, entry.getValue()));
                    } catch (RuntimeException e) {
                        failures.put(entry.getKey(), e);
                    } finally {
                        latch.countDown();
                    }
                });
            }
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while comparing scenarios", e);
        } finally {
            executor.shutdown();
        }

        if (!failures.isEmpty()) {
            Map.Entry<Scenario, RuntimeException> failure = failures.entrySet().iterator().next();
            throw new IllegalStateException("Projection failed for scenario " + failure.getKey(), failure.getValue());
        }
        logger.info("Compared {} scenarios from {} to {}", projections.size(), startYear, endYear);
        Map<Scenario, Projection> orderedProjections = new EnumMap<>(Scenario.class);
        orderedProjections.putAll(projections);
        return orderedProjections;
    }
}
