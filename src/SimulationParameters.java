//Caller-supplied assumptions for one projection run, immutable for the duration of the run
public record SimulationParameters(int retirementAge, double fertilityRate, long netMigration,
                                   MortalityImprovement mortalityImprovement,
                                   int workforceEntryAgeShift, double unemploymentAdjustment) {
    //Domain bounds, all inclusive
    public static final int MIN_RETIREMENT_AGE = 60;
    public static final int MAX_RETIREMENT_AGE = 75;
    public static final double MIN_FERTILITY_RATE = 0.0;
    public static final double MAX_FERTILITY_RATE = 2.5;
    public static final long MIN_NET_MIGRATION = -10000;
    public static final long MAX_NET_MIGRATION = 150000;
    public static final double MIN_MORTALITY_IMPROVEMENT = 0.0;
    public static final double MAX_MORTALITY_IMPROVEMENT = 0.02;
    public static final int MIN_ENTRY_AGE_SHIFT = -3;
    public static final int MAX_ENTRY_AGE_SHIFT = 5;
    public static final double MIN_UNEMPLOYMENT_ADJUSTMENT = -0.10;
    public static final double MAX_UNEMPLOYMENT_ADJUSTMENT = 0.15;

    //Retirement age 66 with the medium scenario and no labour market adjustment
    public static SimulationParameters baseline() {
        return Scenario.MEDIUM.applyTo(new SimulationParameters(66, 0, 0, null, 0, 0.0));
    }

    //Throws on the first parameter outside its domain
    public SimulationParameters validate() {
        if (retirementAge < MIN_RETIREMENT_AGE || retirementAge > MAX_RETIREMENT_AGE) {
            throw new InvalidParameterException("retirementAge", retirementAge, MIN_RETIREMENT_AGE, MAX_RETIREMENT_AGE);
        }
        if (!(fertilityRate >= MIN_FERTILITY_RATE && fertilityRate <= MAX_FERTILITY_RATE)) {
            throw new InvalidParameterException("fertilityRate", fertilityRate, MIN_FERTILITY_RATE, MAX_FERTILITY_RATE);
        }
        if (netMigration < MIN_NET_MIGRATION || netMigration > MAX_NET_MIGRATION) {
            throw new InvalidParameterException("netMigration", netMigration, MIN_NET_MIGRATION, MAX_NET_MIGRATION);
        }
        if (mortalityImprovement == null) {
            throw new InvalidParameterException("mortalityImprovement", "must be provided");
        }
        checkImprovement("mortalityImprovement.male", mortalityImprovement.male());
        checkImprovement("mortalityImprovement.female", mortalityImprovement.female());
        if (workforceEntryAgeShift < MIN_ENTRY_AGE_SHIFT || workforceEntryAgeShift > MAX_ENTRY_AGE_SHIFT) {
            throw new InvalidParameterException("workforceEntryAgeShift", workforceEntryAgeShift, MIN_ENTRY_AGE_SHIFT, MAX_ENTRY_AGE_SHIFT);
        }
        if (!(unemploymentAdjustment >= MIN_UNEMPLOYMENT_ADJUSTMENT && unemploymentAdjustment <= MAX_UNEMPLOYMENT_ADJUSTMENT)) {
            throw new InvalidParameterException("unemploymentAdjustment", unemploymentAdjustment, MIN_UNEMPLOYMENT_ADJUSTMENT, MAX_UNEMPLOYMENT_ADJUSTMENT);
        }
        return this;
    }

    private static void checkImprovement(String name, double rate) {
        //Negated comparison so NaN is rejected too
        if (!(rate >= MIN_MORTALITY_IMPROVEMENT && rate <= MAX_MORTALITY_IMPROVEMENT)) {
            throw new InvalidParameterException(name, rate, MIN_MORTALITY_IMPROVEMENT, MAX_MORTALITY_IMPROVEMENT);
        }
    }

    public SimulationParameters withRetirementAge(int retirementAge) {
        return new SimulationParameters(retirementAge, fertilityRate, netMigration, mortalityImprovement, workforceEntryAgeShift, unemploymentAdjustment);
    }

    public SimulationParameters withFertilityRate(double fertilityRate) {
        return new SimulationParameters(retirementAge, fertilityRate, netMigration, mortalityImprovement, workforceEntryAgeShift, unemploymentAdjustment);
    }

    public SimulationParameters withNetMigration(long netMigration) {
        return new SimulationParameters(retirementAge, fertilityRate, netMigration, mortalityImprovement, workforceEntryAgeShift, unemploymentAdjustment);
    }

    public SimulationParameters withMortalityImprovement(MortalityImprovement mortalityImprovement) {
        return new SimulationParameters(retirementAge, fertilityRate, netMigration, mortalityImprovement, workforceEntryAgeShift, unemploymentAdjustment);
    }

    public SimulationParameters withWorkforceEntryAgeShift(int workforceEntryAgeShift) {
        return new SimulationParameters(retirementAge, fertilityRate, netMigration, mortalityImprovement, workforceEntryAgeShift, unemploymentAdjustment);
    }

    public SimulationParameters withUnemploymentAdjustment(double unemploymentAdjustment) {
        return new SimulationParameters(retirementAge, fertilityRate, netMigration, mortalityImprovement, workforceEntryAgeShift, unemploymentAdjustment);
    }
}
