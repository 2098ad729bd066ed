import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

//Cohort-component step advancing a population snapshot by one year
public class PopulationProjector {
    private static final Logger logger = LoggerFactory.getLogger(PopulationProjector.class);

    private final ReferenceData referenceData;
    private final DemographicRates demographicRates;

    public PopulationProjector(DemographicRates demographicRates) {
        this.referenceData = demographicRates.getReferenceData();
        this.demographicRates = demographicRates;
    }

    public ProjectionStep projectNextYearPopulation(Population currentYearPopulation, int yearsElapsed, SimulationParameters parameters) {
        int year = currentYearPopulation.getYear();
        long[] currentMalePyramid = currentYearPopulation.getMalePyramid();
        long[] currentFemalePyramid = currentYearPopulation.getFemalePyramid();
        int oldestCohortAge = Population.OLDEST_COHORT_AGE;

        long[] nextYearMalePyramid = new long[oldestCohortAge + 1];
        long[] nextYearFemalePyramid = new long[oldestCohortAge + 1];

        //Births during the year form the new age 0 cohort
        long births = projectBirths(currentFemalePyramid, parameters.fertilityRate());
        double sexRatio = referenceData.getSexRatioAtBirth();
        long maleBirths = (long) Math.floor(births * sexRatio / (1 + sexRatio));
        long femaleBirths = births - maleBirths;
        nextYearMalePyramid[0] = maleBirths;
        nextYearFemalePyramid[0] = femaleBirths;

        //Split net migration by sex then allocate to single ages
        long maleMigration = Math.round(parameters.netMigration() * referenceData.getMigrationMaleShare());
        long femaleMigration = parameters.netMigration() - maleMigration;
        long[] maleMigrantsByAge = distributeMigration(maleMigration, Sex.MALE);
        long[] femaleMigrantsByAge = distributeMigration(femaleMigration, Sex.FEMALE);

        //Age every cohort below the terminal age by one year
        long[] maleComponents = new long[2];
        long[] femaleComponents = new long[2];
        for (int age = 0; age < oldestCohortAge; age++) {
            double maleMortality = demographicRates.mortalityProbability(age, Sex.MALE, yearsElapsed, parameters.mortalityImprovement());
            double femaleMortality = demographicRates.mortalityProbability(age, Sex.FEMALE, yearsElapsed, parameters.mortalityImprovement());
            nextYearMalePyramid[age + 1] = projectCohort(year, age, currentMalePyramid[age], maleMigrantsByAge[age], maleMortality, maleComponents);
            nextYearFemalePyramid[age + 1] = projectCohort(year, age, currentFemalePyramid[age], femaleMigrantsByAge[age], femaleMortality, femaleComponents);
        }

        //Survivors of the terminal group join those arriving from the age below
        double maleTerminalMortality = demographicRates.mortalityProbability(oldestCohortAge, Sex.MALE, yearsElapsed, parameters.mortalityImprovement());
        double femaleTerminalMortality = demographicRates.mortalityProbability(oldestCohortAge, Sex.FEMALE, yearsElapsed, parameters.mortalityImprovement());
        long maleTerminalDeaths = projectDeaths(currentMalePyramid[oldestCohortAge], maleTerminalMortality);
        long femaleTerminalDeaths = projectDeaths(currentFemalePyramid[oldestCohortAge], femaleTerminalMortality);
        nextYearMalePyramid[oldestCohortAge] += currentMalePyramid[oldestCohortAge] - maleTerminalDeaths;
        nextYearFemalePyramid[oldestCohortAge] += currentFemalePyramid[oldestCohortAge] - femaleTerminalDeaths;

        long maleDeaths = maleComponents[0] + maleTerminalDeaths;
        long femaleDeaths = femaleComponents[0] + femaleTerminalDeaths;
        long migrationDistributed = maleComponents[1] + femaleComponents[1];
        logger.debug("Year {}: {} births, {} deaths, {} of {} migrants distributed",
                year, births, maleDeaths + femaleDeaths, migrationDistributed, parameters.netMigration());

        return new ProjectionStep(new Population(year + 1, nextYearMalePyramid, nextYearFemalePyramid),
                currentYearPopulation.getTotalPopulation(), maleBirths, femaleBirths, maleDeaths, femaleDeaths,
                migrationDistributed, parameters.netMigration());
    }

    //Births from age-specific fertility scaled by the requested rate relative to the baseline total fertility
    public long projectBirths(long[] femalePyramid, double fertilityRate) {
        double fertilityScale = fertilityRate / referenceData.getBaselineFertilityRate();
        double totalBirths = 0;
        for (int age = ReferenceData.MIN_FERTILE_AGE; age <= ReferenceData.MAX_FERTILE_AGE; age++) {
            totalBirths += femalePyramid[age] * demographicRates.fertilityRate(age) * fertilityScale;
        }
        return Math.round(totalBirths);
    }

    //Whole migrants by age; fractional remainders carry forward so total loss stays under one person
    public long[] distributeMigration(long totalMigration, Sex sex) {
        int oldestCohortAge = Population.OLDEST_COHORT_AGE;
        long[] migrantsByAge = new long[oldestCohortAge + 1];
        double carry = 0;
        for (int age = 0; age < oldestCohortAge; age++) {
            double exactMigrants = totalMigration * demographicRates.migrationWeight(age, sex) + carry;
            migrantsByAge[age] = (long) Math.floor(exactMigrants);
            carry = exactMigrants - migrantsByAge[age];
        }
        //Leftover remainder goes to the group just below the terminal age
        migrantsByAge[oldestCohortAge - 1] += Math.round(carry);
        return migrantsByAge;
    }

    //Migrants arrive before mortality and are thinned by the same probability; components holds {deaths, migrants applied}
    private long projectCohort(int year, int age, long population, long migrants, double mortality, long[] components) {
        long appliedMigrants = migrants;
        if (population + migrants < 0) {
            //Emigration cannot remove more people than the cohort holds
            appliedMigrants = -population;
            logger.debug("Year {}: emigration of {} at age {} clamped to cohort size {}", year, -migrants, age, population);
        }
        long atRiskPopulation = population + appliedMigrants;
        long deaths = projectDeaths(atRiskPopulation, mortality);
        components[0] += deaths;
        components[1] += appliedMigrants;
        return atRiskPopulation - deaths;
    }

    public static long projectDeaths(long atRiskPopulation, double mortality) {
        return Math.round(atRiskPopulation * mortality);
    }
}
