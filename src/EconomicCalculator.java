//Workforce, social security, healthcare and sustainability metrics for one population snapshot
public class EconomicCalculator {
    //Burden at this share of the GDP proxy scores a sustainability index of 0
    public static final double FISCAL_BREAKING_POINT = 0.40;

    private final DemographicRates demographicRates;
    private final EconomicAssumptions assumptions;

    public EconomicCalculator(DemographicRates demographicRates, EconomicAssumptions assumptions) {
        this.demographicRates = demographicRates;
        this.assumptions = assumptions;
    }

    public EconomicMetrics calculate(Population population, int retirementAge, int yearsElapsed,
                                     int entryAgeShift, double unemploymentAdjustment) {
        double wageInflation = assumptions.wageInflationFactor(yearsElapsed);
        double pensionInflation = assumptions.pensionInflationFactor(yearsElapsed);
        double healthcareInflation = assumptions.healthcareInflationFactor(yearsElapsed);

        //Employed people of every age from working age, retirees who keep working draw no pension
        double actualWorkforce = 0;
        double actualPensioners = 0;
        long workingAgePopulation = 0;
        double totalHealthcareCost = 0;
        for (Cohort cohort : population.getCohorts()) {
            int age = cohort.age();
            long total = cohort.total();
            if (age >= DemographicRates.MIN_WORKING_AGE) {
                double employmentRate = demographicRates.employmentRate(age, entryAgeShift, unemploymentAdjustment);
                actualWorkforce += total * employmentRate;
                if (age >= retirementAge) {
                    actualPensioners += total * (1 - employmentRate);
                } else {
                    workingAgePopulation += total;
                }
            }
            totalHealthcareCost += total * assumptions.healthcareCostPerCapita() * demographicRates.healthcareMultiplier(age) * healthcareInflation;
        }

        double totalContributions = actualWorkforce * assumptions.averageSalary() * wageInflation * assumptions.contributionRate();
        double totalPensionPayments = actualPensioners * assumptions.averagePension() * pensionInflation;
        double ssBalance = totalContributions - totalPensionPayments;
        double ssDeficit = Math.max(0, -ssBalance);
        double publicHealthcareCost = totalHealthcareCost * assumptions.publicHealthcareShare();

        double gdpProxy = actualWorkforce * assumptions.gdpPerWorker() * wageInflation;
        double sustainabilityIndex = sustainabilityIndex(ssDeficit + publicHealthcareCost, gdpProxy);

        double laborUtilizationRate = workingAgePopulation > 0 ? actualWorkforce / workingAgePopulation : 0;
        double ssBalancePerWorker = perWorker(ssBalance, actualWorkforce);
        double healthcareCostPerWorker = perWorker(totalHealthcareCost, actualWorkforce);
        double totalBurdenPerWorker = perWorker(ssDeficit + publicHealthcareCost, actualWorkforce);

        return new EconomicMetrics(actualWorkforce, laborUtilizationRate, actualPensioners,
                totalContributions, totalPensionPayments, ssBalance, ssDeficit, ssBalancePerWorker,
                totalHealthcareCost, publicHealthcareCost, healthcareCostPerWorker, totalBurdenPerWorker,
                gdpProxy, sustainabilityIndex);
    }

    //100 for negligible burden, 0 once burden reaches the breaking point or there is no output
    public static double sustainabilityIndex(double fiscalBurden, double gdpProxy) {
        if (gdpProxy <= 0) return 0;
        double index = 100 * (1 - fiscalBurden / (gdpProxy * FISCAL_BREAKING_POINT));
        return Math.max(0, Math.min(index, 100));
    }

    private static double perWorker(double amount, double workforce) {
        return workforce > 0 ? amount / workforce : 0;
    }
}
