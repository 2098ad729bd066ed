import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PopulationTest {

    private static List<Cohort> cohorts(long male, long female) {
        List<Cohort> cohorts = new ArrayList<>();
        for (int age = 0; age <= Population.OLDEST_COHORT_AGE; age++) {
            cohorts.add(new Cohort(age, male, female));
        }
        return cohorts;
    }

    @Test
    void fromCohortsRequiresEveryAgeExactlyOnce() {
        List<Cohort> missing = cohorts(1, 1);
        missing.remove(40);
        assertThrows(IllegalArgumentException.class, () -> Population.fromCohorts(2024, missing));

        List<Cohort> duplicate = cohorts(1, 1);
        duplicate.set(40, new Cohort(39, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> Population.fromCohorts(2024, duplicate));
    }

    @Test
    void cohortsRejectNegativeCountsAndAgesOutsideRange() {
        assertThrows(IllegalArgumentException.class, () -> new Cohort(10, -1, 0));
        assertThrows(IllegalArgumentException.class, () -> new Cohort(101, 0, 0));
        long[] pyramid = new long[Population.OLDEST_COHORT_AGE + 1];
        pyramid[5] = -3;
        assertThrows(IllegalArgumentException.class, () -> new Population(2024, pyramid, new long[Population.OLDEST_COHORT_AGE + 1]));
    }

    @Test
    void totalsAndBands() {
        Population population = Population.fromCohorts(2030, cohorts(3, 2));
        assertEquals(2030, population.getYear());
        assertEquals(303, population.getMalePopulation());
        assertEquals(202, population.getFemalePopulation());
        assertEquals(505, population.getTotalPopulation());
        assertEquals(75, population.getPopulationBetween(0, 14));
        assertEquals(5, population.getPopulationBetween(100, 120));
        assertEquals(5, population.getCohort(42).total());
        assertEquals(3, population.getCohort(42).count(Sex.MALE));
        assertEquals(2, population.getCohort(42).count(Sex.FEMALE));
    }

    @Test
    void medianAgeIsFirstAgeReachingHalfTheTotal() {
        long[] male = new long[Population.OLDEST_COHORT_AGE + 1];
        long[] female = new long[Population.OLDEST_COHORT_AGE + 1];
        male[10] = 40;
        female[30] = 20;
        male[70] = 40;
        Population population = new Population(2024, male, female);
        assertEquals(30, population.getMedianAge());
        assertEquals((10 * 40 + 30 * 20 + 70 * 40) / 100.0, population.getMeanAge(), 1e-9);
    }

    @Test
    void emptyPopulationHasZeroAges() {
        Population empty = new Population(2024, new long[Population.OLDEST_COHORT_AGE + 1], new long[Population.OLDEST_COHORT_AGE + 1]);
        assertEquals(0, empty.getMedianAge());
        assertEquals(0, empty.getMeanAge());
    }

    @Test
    void snapshotCannotBeChangedThroughItsViews() {
        long[] male = new long[Population.OLDEST_COHORT_AGE + 1];
        male[20] = 100;
        Population population = new Population(2024, male, new long[Population.OLDEST_COHORT_AGE + 1]);
        male[20] = 0;
        population.getMalePyramid()[20] = 0;
        assertEquals(100, population.getCount(Sex.MALE, 20));
        assertThrows(UnsupportedOperationException.class, () -> population.getCohorts().clear());
    }
}
