import java.util.Properties;

//Base year salary, pension, healthcare and growth assumptions
public record EconomicAssumptions(double averageSalary, double averagePension, double gdpPerWorker,
                                  double healthcareCostPerCapita, double contributionRate, double publicHealthcareShare,
                                  double wageGrowth, double pensionIndexation, double healthcareInflation) {
    public static final String DEFAULT_CONFIGURATION = "economy.properties";

    public EconomicAssumptions {
        if (averageSalary < 0 || averagePension < 0 || gdpPerWorker < 0 || healthcareCostPerCapita < 0) {
            throw new ReferenceDataException("Economic amounts must be non-negative");
        }
        if (contributionRate < 0 || contributionRate > 1 || publicHealthcareShare < 0 || publicHealthcareShare > 1) {
            throw new ReferenceDataException("Contribution rate and public healthcare share must be within [0, 1]");
        }
    }

    public static EconomicAssumptions loadDefault() {
        return load(DEFAULT_CONFIGURATION);
    }

    public static EconomicAssumptions load(String location) {
        Properties properties = FileUtils.readProperties(location);
        return new EconomicAssumptions(
                read(properties, "average.salary", location),
                read(properties, "average.pension", location),
                read(properties, "gdp.per.worker", location),
                read(properties, "healthcare.cost.per.capita", location),
                read(properties, "contribution.rate", location),
                read(properties, "healthcare.public.share", location),
                read(properties, "wage.growth", location),
                read(properties, "pension.indexation", location),
                read(properties, "healthcare.inflation", location));
    }

    private static double read(Properties properties, String key, String location) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new ReferenceDataException("Missing " + key + " in " + location);
        }
        return FileUtils.parseDouble(value.trim(), location);
    }

    public double wageInflationFactor(int yearsElapsed) {
        return Math.pow(1 + wageGrowth, yearsElapsed);
    }

    public double pensionInflationFactor(int yearsElapsed) {
        return Math.pow(1 + pensionIndexation, yearsElapsed);
    }

    public double healthcareInflationFactor(int yearsElapsed) {
        return Math.pow(1 + healthcareInflation, yearsElapsed);
    }
}
