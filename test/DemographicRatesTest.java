import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DemographicRatesTest {
    private static DemographicRates bundledRates;

    @BeforeAll
    static void loadBundledData() {
        bundledRates = new DemographicRates(ReferenceData.loadDefault());
    }

    @Test
    void mortalityImprovesGeometrically() {
        DemographicRates rates = new DemographicRates(ReferenceDataFixtures.uniform(1000, 0.01, 0.5));
        MortalityImprovement improvement = new MortalityImprovement(0.01, 0.02);
        assertEquals(0.01, rates.mortalityProbability(40, Sex.MALE, 0, improvement), 1e-15);
        assertEquals(0.01 * Math.pow(0.99, 10), rates.mortalityProbability(40, Sex.MALE, 10, improvement), 1e-15);
        assertEquals(0.01 * Math.pow(0.98, 10), rates.mortalityProbability(40, Sex.FEMALE, 10, improvement), 1e-15);
    }

    @Test
    void terminalAgeMortalityIsNotImproved() {
        DemographicRates rates = new DemographicRates(ReferenceDataFixtures.uniform(1000, 0.01, 0.5));
        MortalityImprovement improvement = new MortalityImprovement(0.02, 0.02);
        assertEquals(0.5, rates.mortalityProbability(100, Sex.MALE, 50, improvement));
        assertEquals(0.5, rates.mortalityProbability(120, Sex.FEMALE, 50, improvement));
        assertEquals(0, rates.mortalityProbability(-1, Sex.FEMALE, 0, improvement));
    }

    @Test
    void mortalityStaysAProbability() {
        DemographicRates rates = new DemographicRates(ReferenceDataFixtures.uniform(1000, 1.0, 1.0));
        MortalityImprovement none = new MortalityImprovement(0, 0);
        for (int age = 0; age <= 100; age++) {
            double probability = rates.mortalityProbability(age, Sex.MALE, 30, none);
            assertTrue(probability >= 0 && probability <= 1);
        }
        assertEquals(1.0, rates.mortalityProbability(100, Sex.MALE, 0, none));
    }

    @Test
    void fertilityOnlyAtFertileAges() {
        assertEquals(0, bundledRates.fertilityRate(14));
        assertEquals(0, bundledRates.fertilityRate(50));
        assertTrue(bundledRates.fertilityRate(30) > 0);
        double total = 0;
        for (int age = 0; age <= 100; age++) {
            total += bundledRates.fertilityRate(age);
        }
        assertEquals(1.1515, total, 1e-9);
    }

    @Test
    void migrationWeightsSumToOneAndSkipTerminalAge() {
        for (Sex sex : Sex.values()) {
            double total = 0;
            for (int age = 0; age <= 100; age++) {
                total += bundledRates.migrationWeight(age, sex);
            }
            assertEquals(1.0, total, 1e-9);
            assertEquals(0, bundledRates.migrationWeight(100, sex));
            assertTrue(bundledRates.migrationWeight(99, sex) > 0);
        }
    }

    @Test
    void migrationBandsSpreadEvenly() {
        DemographicRates rates = new DemographicRates(ReferenceDataFixtures.uniform(1000, 0.01, 0.5));
        assertEquals(0.015, rates.migrationWeight(0, Sex.MALE), 1e-12);
        assertEquals(0.015, rates.migrationWeight(49, Sex.FEMALE), 1e-12);
        assertEquals(0.005, rates.migrationWeight(50, Sex.MALE), 1e-12);
        assertEquals(0.005, rates.migrationWeight(99, Sex.MALE), 1e-12);
    }

    @Test
    void employmentIsZeroBelowWorkingAge() {
        for (int age = 0; age < DemographicRates.MIN_WORKING_AGE; age++) {
            assertEquals(0, bundledRates.employmentRate(age, -3, -0.15));
        }
        assertEquals(0.06, bundledRates.employmentRate(15, 0, 0), 1e-12);
    }

    @Test
    void entryShiftMovesTheEffectiveAge() {
        //Later entry reads younger rates, never below the minimum working age
        assertEquals(0.06, bundledRates.employmentRate(20, 5, 0), 1e-12);
        assertEquals(0.06, bundledRates.employmentRate(16, 5, 0), 1e-12);
        //Earlier entry reads older rates
        assertEquals(0.45, bundledRates.employmentRate(17, -3, 0), 1e-12);
    }

    @Test
    void unemploymentAdjustmentScalesAndClamps() {
        assertEquals(0.45 * 0.9, bundledRates.employmentRate(22, 0, 0.10), 1e-12);
        //0.88 raised by 15% would exceed full employment
        assertEquals(1.0, bundledRates.employmentRate(40, 0, -0.15));
    }

    @Test
    void healthcareMultiplierSteps() {
        assertEquals(0.6, bundledRates.healthcareMultiplier(0));
        assertEquals(0.6, bundledRates.healthcareMultiplier(14));
        assertEquals(1.0, bundledRates.healthcareMultiplier(15));
        assertEquals(1.0, bundledRates.healthcareMultiplier(64));
        assertEquals(2.2, bundledRates.healthcareMultiplier(65));
        assertEquals(3.5, bundledRates.healthcareMultiplier(84));
        assertEquals(4.5, bundledRates.healthcareMultiplier(85));
        assertEquals(4.5, bundledRates.healthcareMultiplier(100));
        assertEquals(0, bundledRates.healthcareMultiplier(101));
    }

    @Test
    void ratesAreRepeatable() {
        MortalityImprovement improvement = new MortalityImprovement(0.01, 0.008);
        assertEquals(bundledRates.mortalityProbability(70, Sex.MALE, 25, improvement),
                bundledRates.mortalityProbability(70, Sex.MALE, 25, improvement));
        assertEquals(bundledRates.employmentRate(33, 2, 0.05), bundledRates.employmentRate(33, 2, 0.05));
    }

    @Test
    void baseYearLifeExpectancy() {
        MortalityImprovement improvement = new MortalityImprovement(0.01, 0.008);
        double male = bundledRates.lifeExpectancyAtBirth(Sex.MALE, 0, improvement);
        double female = bundledRates.lifeExpectancyAtBirth(Sex.FEMALE, 0, improvement);
        assertEquals(78.7, male, 0.3);
        assertEquals(84.0, female, 0.3);
        assertTrue(bundledRates.lifeExpectancyAtBirth(Sex.MALE, 20, improvement) > male);
    }
}
