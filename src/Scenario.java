//Projection scenario presets, retirement age and labour market adjustments stay with the caller
public enum Scenario {
    LOW("Low", "Pessimistic: Lower fertility, reduced migration, slower mortality improvement",
            1.20, 50000, new MortalityImprovement(0.005, 0.004)),
    MEDIUM("Medium", "Baseline: Current trends continue",
            1.40, 110000, new MortalityImprovement(0.010, 0.008)),
    HIGH("High", "Optimistic: Higher fertility, strong migration, faster mortality improvement",
            1.77, 150000, new MortalityImprovement(0.015, 0.012)),
    CUSTOM("Custom", "User-defined parameters", Double.NaN, 0, null);

    private final String displayName;
    private final String description;
    private final double fertilityRate;
    private final long netMigration;
    private final MortalityImprovement mortalityImprovement;

    Scenario(String displayName, String description, double fertilityRate, long netMigration, MortalityImprovement mortalityImprovement) {
        this.displayName = displayName;
        this.description = description;
        this.fertilityRate = fertilityRate;
        this.netMigration = netMigration;
        this.mortalityImprovement = mortalityImprovement;
    }

    //Overrides fertility, migration and mortality improvement with the preset bundle
    public SimulationParameters applyTo(SimulationParameters parameters) {
        if (this == CUSTOM) {
            return parameters;
        }
        return new SimulationParameters(parameters.retirementAge(), fertilityRate, netMigration, mortalityImprovement,
                parameters.workforceEntryAgeShift(), parameters.unemploymentAdjustment());
    }

    //Case-insensitive lookup by constant or display name
    public static Scenario parse(String name) {
        for (Scenario scenario : values()) {
            if (scenario.name().equalsIgnoreCase(name) || scenario.displayName.equalsIgnoreCase(name)) {
                return scenario;
            }
        }
        throw new IllegalArgumentException("Unknown scenario " + name);
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }
}
