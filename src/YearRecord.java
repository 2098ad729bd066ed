//One year of projection output, immutable once created
public record YearRecord(int year, Population population, long childPopulation, long workingAgePopulation,
                         long retiredPopulation, long totalPopulation, double oldAgeDependencyRatio,
                         int medianAge, double meanAge, double maleLifeExpectancy, double femaleLifeExpectancy,
                         EconomicMetrics economic) {

    //Children are under working age, retirees at or above retirement age
    public static YearRecord summarize(Population population, int retirementAge, double maleLifeExpectancy,
                                       double femaleLifeExpectancy, EconomicMetrics economic) {
        long childPopulation = population.getPopulationBetween(0, DemographicRates.MIN_WORKING_AGE - 1);
        long workingAgePopulation = population.getPopulationBetween(DemographicRates.MIN_WORKING_AGE, retirementAge - 1);
        long retiredPopulation = population.getPopulationBetween(retirementAge, Population.OLDEST_COHORT_AGE);
        long totalPopulation = childPopulation + workingAgePopulation + retiredPopulation;
        double oldAgeDependencyRatio = workingAgePopulation > 0 ? 100.0 * retiredPopulation / workingAgePopulation : 0;
        return new YearRecord(population.getYear(), population, childPopulation, workingAgePopulation, retiredPopulation,
                totalPopulation, oldAgeDependencyRatio, population.getMedianAge(), population.getMeanAge(),
                maleLifeExpectancy, femaleLifeExpectancy, economic);
    }
}
