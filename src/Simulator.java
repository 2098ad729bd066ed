import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

//Projects the base year population year by year and derives the economic metrics of every year
public class Simulator {
    private static final Logger logger = LoggerFactory.getLogger(Simulator.class);

    public static final int DEFAULT_START_YEAR = 2024;
    public static final int DEFAULT_END_YEAR = 2100;

    private final ReferenceData referenceData;
    private final DemographicRates demographicRates;
    private final PopulationProjector populationProjector;
    private final EconomicCalculator economicCalculator;
    private final BalanceValidator balanceValidator;

    public Simulator(ReferenceData referenceData, EconomicAssumptions economicAssumptions) {
        this(referenceData, economicAssumptions, new BalanceValidator());
    }

    public Simulator(ReferenceData referenceData, EconomicAssumptions economicAssumptions, BalanceValidator balanceValidator) {
        this.referenceData = referenceData;
        this.demographicRates = new DemographicRates(referenceData);
        this.populationProjector = new PopulationProjector(demographicRates);
        this.economicCalculator = new EconomicCalculator(demographicRates, economicAssumptions);
        this.balanceValidator = balanceValidator;
    }

    public static void main(String[] args) {
        //Usage: [scenario] [start year] [end year] [year to narrate]
        Scenario scenario = args.length > 0 ? Scenario.parse(args[0]) : Scenario.MEDIUM;
        int startYear = args.length > 1 ? Integer.parseInt(args[1]) : DEFAULT_START_YEAR;
        int endYear = args.length > 2 ? Integer.parseInt(args[2]) : DEFAULT_END_YEAR;

        Simulator simulator = new Simulator(ReferenceData.loadDefault(), EconomicAssumptions.loadDefault());
        SimulationParameters parameters = scenario.applyTo(SimulationParameters.baseline());
        Projection projection = simulator.project(startYear, endYear, parameters);

        System.out.println(scenario.getDisplayName() + " scenario: " + scenario.getDescription());
        System.out.println(String.format(Locale.ROOT, "%-6s %12s %8s %6s %10s %14s %6s",
                "Year", "Population", "OADR", "Median", "Workforce", "SS balance", "Index"));
        for (YearRecord yearRecord : projection.getYears()) {
            EconomicMetrics economic = yearRecord.economic();
            System.out.println(String.format(Locale.ROOT, "%-6d %12d %8.1f %6d %10.0f %14.0f %6.0f",
                    yearRecord.year(), yearRecord.totalPopulation(), yearRecord.oldAgeDependencyRatio(), yearRecord.medianAge(),
                    economic.actualWorkforce(), economic.ssBalance(), economic.sustainabilityIndex()));
        }

        if (args.length > 3) {
            int narratedYear = Integer.parseInt(args[3]);
            projection.getYear(narratedYear).ifPresentOrElse(
                    yearRecord -> System.out.println(AdvisoryClient.fromConfiguration(AdvisoryClient.DEFAULT_CONFIGURATION).analyze(yearRecord, parameters)),
                    () -> System.out.println("Year " + narratedYear + " is outside the projection."));
        }
    }

    //Validates every parameter before any work, then records startYear through endYear inclusive
    public Projection project(int startYear, int endYear, SimulationParameters parameters) {
        if (parameters == null) {
            throw new InvalidParameterException("parameters", "must be provided");
        }
        if (endYear < startYear) {
            throw new InvalidParameterException("endYear", "must not precede start year " + startYear + ", got " + endYear);
        }
        parameters.validate();
        logger.info("Projecting {} to {} with {}", startYear, endYear, parameters);

        List<YearRecord> years = new ArrayList<>(endYear - startYear + 1);
        List<BalanceValidator.BalanceCheck> balanceChecks = new ArrayList<>(endYear - startYear);
        Population currentPopulation = referenceData.createBasePopulation(startYear);
        for (int year = startYear; year <= endYear; year++) {
            int yearsElapsed = year - startYear;
            years.add(summarize(currentPopulation, yearsElapsed, parameters));
            if (year == endYear) break;

            ProjectionStep step = populationProjector.projectNextYearPopulation(currentPopulation, yearsElapsed, parameters);
            balanceChecks.add(balanceValidator.validate(step));
            currentPopulation = step.population();
        }

        Projection projection = new Projection(parameters, years, balanceChecks);
        logger.info("Projection complete through {} with population {}, balanced: {}", projection.getLastYear().year(),
                projection.getLastYear().totalPopulation(), projection.isBalanced());
        return projection;
    }

    private YearRecord summarize(Population population, int yearsElapsed, SimulationParameters parameters) {
        EconomicMetrics economic = economicCalculator.calculate(population, parameters.retirementAge(), yearsElapsed,
                parameters.workforceEntryAgeShift(), parameters.unemploymentAdjustment());
        double maleLifeExpectancy = demographicRates.lifeExpectancyAtBirth(Sex.MALE, yearsElapsed, parameters.mortalityImprovement());
        double femaleLifeExpectancy = demographicRates.lifeExpectancyAtBirth(Sex.FEMALE, yearsElapsed, parameters.mortalityImprovement());
        return YearRecord.summarize(population, parameters.retirementAge(), maleLifeExpectancy, femaleLifeExpectancy, economic);
    }
}
