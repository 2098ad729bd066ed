import org.apache.commons.math3.util.MathArrays;

import java.util.List;

//Age-specific rates derived from the reference tables, stateless once constructed
public class DemographicRates {
    //Minimum age at which anyone is counted as employed
    public static final int MIN_WORKING_AGE = 15;

    private final ReferenceData referenceData;

    //Age -> share of the sex's net migration, sums to 1 over ages 0..99
    private final double[] maleMigrationWeight;
    private final double[] femaleMigrationWeight;

    public DemographicRates(ReferenceData referenceData) {
        this.referenceData = referenceData;
        this.maleMigrationWeight = normalizeMigrationProfile(referenceData.getMigrationProfile(Sex.MALE));
        this.femaleMigrationWeight = normalizeMigrationProfile(referenceData.getMigrationProfile(Sex.FEMALE));
    }

    //Normalizes band weights by their sum then spreads each band evenly over its ages below the terminal age
    private static double[] normalizeMigrationProfile(List<AgeBand> profile) {
        int lastReceivingAge = Population.OLDEST_COHORT_AGE - 1;
        double[] weightByAge = new double[Population.OLDEST_COHORT_AGE + 1];
        List<AgeBand> receivingBands = profile.stream()
                .filter(band -> band.minAge() <= lastReceivingAge)
                .toList();
        double[] bandWeights = receivingBands.stream().mapToDouble(AgeBand::value).toArray();
        double[] normalizedWeights = MathArrays.normalizeArray(bandWeights, 1.0);
        for (int i = 0; i < receivingBands.size(); i++) {
            AgeBand band = receivingBands.get(i);
            int maxAge = Math.min(band.maxAge(), lastReceivingAge);
            int receivingAges = maxAge - band.minAge() + 1;
            for (int age = band.minAge(); age <= maxAge; age++) {
                weightByAge[age] += normalizedWeights[i] / receivingAges;
            }
        }
        return weightByAge;
    }

    //Annual death probability, improved over time except in the terminal age group
    public double mortalityProbability(int age, Sex sex, int yearsElapsed, MortalityImprovement improvement) {
        if (age < 0) return 0;
        double baseProbability = referenceData.getMortality(sex, Math.min(age, Population.OLDEST_COHORT_AGE));
        if (age >= Population.OLDEST_COHORT_AGE) {
            return Math.min(baseProbability, 1.0);
        }
        double improvedProbability = baseProbability * Math.pow(1 - improvement.rate(sex), yearsElapsed);
        return Math.max(0.0, Math.min(improvedProbability, 1.0));
    }

    //Births per woman per year, zero outside the fertile ages
    public double fertilityRate(int age) {
        if (age < ReferenceData.MIN_FERTILE_AGE || age > ReferenceData.MAX_FERTILE_AGE) return 0;
        return referenceData.getFertility(age);
    }

    //Share of the sex's net migration allocated to this single age
    public double migrationWeight(int age, Sex sex) {
        if (age < 0 || age > Population.OLDEST_COHORT_AGE) return 0;
        return sex == Sex.MALE ? maleMigrationWeight[age] : femaleMigrationWeight[age];
    }

    //Employment rate after shifting workforce entry and adjusting unemployment, zero below working age
    public double employmentRate(int age, int entryAgeShift, double unemploymentAdjustment) {
        if (age < MIN_WORKING_AGE || age > Population.OLDEST_COHORT_AGE) return 0;
        int effectiveAge = Math.min(Math.max(MIN_WORKING_AGE, age - entryAgeShift), Population.OLDEST_COHORT_AGE);
        double rate = referenceData.getEmploymentRate(effectiveAge) * (1 - unemploymentAdjustment);
        return Math.max(0.0, Math.min(rate, 1.0));
    }

    //Healthcare cost relative to an adult, zero for ages outside every band
    public double healthcareMultiplier(int age) {
        for (AgeBand band : referenceData.getHealthcareMultipliers()) {
            if (band.contains(age)) {
                return band.value();
            }
        }
        return 0;
    }

    //Period life expectancy at birth from the year's improved death probabilities
    public double lifeExpectancyAtBirth(Sex sex, int yearsElapsed, MortalityImprovement improvement) {
        double survivors = 1.0;
        double personYears = 0;
        for (int age = 0; age < Population.OLDEST_COHORT_AGE; age++) {
            double deaths = survivors * mortalityProbability(age, sex, yearsElapsed, improvement);
            //Infant deaths concentrate early in the first year
            double deathTiming = age == 0 ? 0.15 : 0.5;
            personYears += survivors - deaths * (1 - deathTiming);
            survivors -= deaths;
        }
        double terminalMortality = mortalityProbability(Population.OLDEST_COHORT_AGE, sex, yearsElapsed, improvement);
        personYears += terminalMortality > 0 ? survivors / terminalMortality : survivors;
        return personYears;
    }

    public ReferenceData getReferenceData() {
        return referenceData;
    }
}
