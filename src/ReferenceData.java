import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

//Read-only reference tables shared by every projection run
public final class ReferenceData {
    private static final Logger logger = LoggerFactory.getLogger(ReferenceData.class);

    public static final String DEFAULT_CONFIGURATION = "reference.properties";
    public static final int MIN_FERTILE_AGE = 15;
    public static final int MAX_FERTILE_AGE = 49;

    //Base year population; age -> count
    private final long[] baseMalePopulation;
    private final long[] baseFemalePopulation;

    //Life table; age -> annual death probability (qx)
    private final double[] maleMortality;
    private final double[] femaleMortality;

    //Age -> births per woman per year
    private final double[] fertility;

    //Unnormalized migration weights by age band, the open band stops short of the terminal age
    private final List<AgeBand> maleMigrationProfile;
    private final List<AgeBand> femaleMigrationProfile;

    //Age -> base employment rate
    private final double[] employmentRate;

    //Healthcare cost multiplier relative to the adult baseline, by age band
    private final List<AgeBand> healthcareMultipliers;

    //Male births per female birth
    private final double sexRatioAtBirth;

    //Male share of net migration
    private final double migrationMaleShare;

    //Total fertility the age-specific rates are scaled against
    private final double baselineFertilityRate;

    public ReferenceData(long[] baseMalePopulation, long[] baseFemalePopulation,
                         double[] maleMortality, double[] femaleMortality, double[] fertility,
                         List<AgeBand> maleMigrationProfile, List<AgeBand> femaleMigrationProfile,
                         double[] employmentRate, List<AgeBand> healthcareMultipliers,
                         double sexRatioAtBirth, double migrationMaleShare, double baselineFertilityRate) {
        checkAgeCoverage("base male population", baseMalePopulation.length);
        checkAgeCoverage("base female population", baseFemalePopulation.length);
        checkAgeCoverage("male mortality", maleMortality.length);
        checkAgeCoverage("female mortality", femaleMortality.length);
        checkAgeCoverage("fertility", fertility.length);
        checkAgeCoverage("employment rate", employmentRate.length);
        for (int age = 0; age <= Population.OLDEST_COHORT_AGE; age++) {
            if (baseMalePopulation[age] < 0 || baseFemalePopulation[age] < 0) {
                throw new ReferenceDataException("Negative base population at age " + age);
            }
            if (!isProbability(maleMortality[age]) || !isProbability(femaleMortality[age])) {
                throw new ReferenceDataException("Death probability outside [0, 1] at age " + age);
            }
        }
        if (sexRatioAtBirth <= 0) {
            throw new ReferenceDataException("Sex ratio at birth must be positive, got " + sexRatioAtBirth);
        }
        if (!isProbability(migrationMaleShare)) {
            throw new ReferenceDataException("Male share of migration outside [0, 1], got " + migrationMaleShare);
        }
        if (!(baselineFertilityRate > 0)) {
            throw new ReferenceDataException("Baseline fertility rate must be positive, got " + baselineFertilityRate);
        }
        checkMigrationProfile("male", maleMigrationProfile);
        checkMigrationProfile("female", femaleMigrationProfile);
        this.baseMalePopulation = baseMalePopulation.clone();
        this.baseFemalePopulation = baseFemalePopulation.clone();
        this.maleMortality = maleMortality.clone();
        this.femaleMortality = femaleMortality.clone();
        this.fertility = fertility.clone();
        this.maleMigrationProfile = List.copyOf(maleMigrationProfile);
        this.femaleMigrationProfile = List.copyOf(femaleMigrationProfile);
        this.employmentRate = employmentRate.clone();
        this.healthcareMultipliers = List.copyOf(healthcareMultipliers);
        this.sexRatioAtBirth = sexRatioAtBirth;
        this.migrationMaleShare = migrationMaleShare;
        this.baselineFertilityRate = baselineFertilityRate;
    }

    public static ReferenceData loadDefault() {
        return load(DEFAULT_CONFIGURATION);
    }

    //Loads every table named in the configuration file
    public static ReferenceData load(String configurationLocation) {
        Properties configuration = FileUtils.readProperties(configurationLocation);
        String populationLocation = required(configuration, "table.population", configurationLocation);
        String mortalityLocation = required(configuration, "table.mortality", configurationLocation);
        String fertilityLocation = required(configuration, "table.fertility", configurationLocation);
        String migrationLocation = required(configuration, "table.migration", configurationLocation);
        String employmentLocation = required(configuration, "table.employment", configurationLocation);
        String healthcareLocation = required(configuration, "table.healthcare", configurationLocation);

        //Population and mortality must cover every age 0..100 exactly once
        long[][] basePopulation = new long[2][];
        double[][] mortality = new double[2][];
        parseAgeSexTable(populationLocation, basePopulation, null);
        parseAgeSexTable(mortalityLocation, null, mortality);

        //Fertility given per 1000 women, ages without rows are zero
        double[] fertility = new double[Population.OLDEST_COHORT_AGE + 1];
        List<String[]> fertilityRows = FileUtils.getCSVRows(fertilityLocation);
        for (String[] values : fertilityRows) {
            int age = (int) FileUtils.parseLong(values[0], fertilityLocation);
            if (age >= 0 && age <= Population.OLDEST_COHORT_AGE) {
                fertility[age] = FileUtils.parseDouble(values[1], fertilityLocation) / 1000;
            }
        }
        double[] fertileAges = new double[MAX_FERTILE_AGE - MIN_FERTILE_AGE + 1];
        System.arraycopy(fertility, MIN_FERTILE_AGE, fertileAges, 0, fertileAges.length);
        logger.info("Loaded {} fertility rates from {}, table total fertility {}", fertilityRows.size(), fertilityLocation,
                StatUtils.sum(fertileAges));

        //Migration bands, open band ends at the last age that receives migrants
        List<AgeBand> maleMigration = new ArrayList<>();
        List<AgeBand> femaleMigration = new ArrayList<>();
        List<String[]> migrationRows = FileUtils.getCSVRows(migrationLocation);
        for (String[] values : migrationRows) {
            int[] ageBounds = FileUtils.parseAgeGroup(values[0], Population.OLDEST_COHORT_AGE - 1);
            maleMigration.add(new AgeBand(ageBounds[0], ageBounds[1], FileUtils.parseDouble(values[1], migrationLocation)));
            femaleMigration.add(new AgeBand(ageBounds[0], ageBounds[1], FileUtils.parseDouble(values[2], migrationLocation)));
        }
        logger.info("Loaded {} migration age groups from {}", migrationRows.size(), migrationLocation);

        double[] employment = new double[Population.OLDEST_COHORT_AGE + 1];
        for (AgeBand band : parseBandTable(employmentLocation)) {
            for (int age = band.minAge(); age <= Math.min(band.maxAge(), Population.OLDEST_COHORT_AGE); age++) {
                employment[age] = band.value();
            }
        }

        List<AgeBand> healthcare = parseBandTable(healthcareLocation);

        double sexRatioAtBirth = FileUtils.parseDouble(required(configuration, "birth.sex.ratio", configurationLocation), configurationLocation);
        double migrationMaleShare = FileUtils.parseDouble(required(configuration, "migration.male.share", configurationLocation), configurationLocation);
        double baselineFertilityRate = FileUtils.parseDouble(required(configuration, "fertility.baseline.tfr", configurationLocation), configurationLocation);

        return new ReferenceData(basePopulation[0], basePopulation[1], mortality[0], mortality[1], fertility,
                maleMigration, femaleMigration, employment, healthcare, sexRatioAtBirth, migrationMaleShare, baselineFertilityRate);
    }

    //Reads Age,Male,Female table into either population counts or rates
    private static void parseAgeSexTable(String location, long[][] counts, double[][] rates) {
        List<String> headings = FileUtils.getCSVHeadings(location);
        if (headings.size() < 3) {
            throw new ReferenceDataException("Expected Age,Male,Female headings in " + location + " but found " + String.join(",", headings));
        }
        List<String[]> rows = FileUtils.getCSVRows(location);
        long[] maleCounts = new long[Population.OLDEST_COHORT_AGE + 1];
        long[] femaleCounts = new long[Population.OLDEST_COHORT_AGE + 1];
        double[] maleRates = new double[Population.OLDEST_COHORT_AGE + 1];
        double[] femaleRates = new double[Population.OLDEST_COHORT_AGE + 1];
        boolean[] seen = new boolean[Population.OLDEST_COHORT_AGE + 1];
        for (String[] values : rows) {
            if (values.length < 3) {
                throw new ReferenceDataException("Expected Age,Male,Female in " + location + " but found " + String.join(",", values));
            }
            int age = (int) FileUtils.parseLong(values[0], location);
            if (age < 0 || age > Population.OLDEST_COHORT_AGE || seen[age]) {
                throw new ReferenceDataException("Age " + age + " is out of range or repeated in " + location);
            }
            seen[age] = true;
            if (counts != null) {
                maleCounts[age] = FileUtils.parseLong(values[1], location);
                femaleCounts[age] = FileUtils.parseLong(values[2], location);
            } else {
                maleRates[age] = FileUtils.parseDouble(values[1], location);
                femaleRates[age] = FileUtils.parseDouble(values[2], location);
            }
        }
        for (int age = 0; age <= Population.OLDEST_COHORT_AGE; age++) {
            if (!seen[age]) {
                throw new ReferenceDataException("Missing age " + age + " in " + location);
            }
        }
        if (counts != null) {
            counts[0] = maleCounts;
            counts[1] = femaleCounts;
        } else {
            rates[0] = maleRates;
            rates[1] = femaleRates;
        }
        logger.info("Loaded {} ages from {}", rows.size(), location);
    }

    //Reads Group,Value table, open groups end at the terminal age
    private static List<AgeBand> parseBandTable(String location) {
        List<AgeBand> bands = new ArrayList<>();
        for (String[] values : FileUtils.getCSVRows(location)) {
            int[] ageBounds = FileUtils.parseAgeGroup(values[0], Population.OLDEST_COHORT_AGE);
            bands.add(new AgeBand(ageBounds[0], ageBounds[1], FileUtils.parseDouble(values[1], location)));
        }
        logger.info("Loaded {} age groups from {}", bands.size(), location);
        return bands;
    }

    private static String required(Properties configuration, String key, String location) {
        String value = configuration.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new ReferenceDataException("Missing " + key + " in " + location);
        }
        return value.trim();
    }

    private static void checkAgeCoverage(String table, int length) {
        if (length != Population.OLDEST_COHORT_AGE + 1) {
            throw new ReferenceDataException(table + " must cover ages 0.." + Population.OLDEST_COHORT_AGE + ", got " + length + " ages");
        }
    }

    //Weights must be non-negative with some weight on the ages that receive migrants
    private static void checkMigrationProfile(String sex, List<AgeBand> profile) {
        double receivingWeight = 0;
        for (AgeBand band : profile) {
            if (!(band.value() >= 0)) {
                throw new ReferenceDataException("Negative " + sex + " migration weight for ages " + band.minAge() + "-" + band.maxAge());
            }
            if (band.minAge() < Population.OLDEST_COHORT_AGE) {
                receivingWeight += band.value();
            }
        }
        if (receivingWeight <= 0) {
            throw new ReferenceDataException("The " + sex + " migration profile has no weight below age " + Population.OLDEST_COHORT_AGE);
        }
    }

    private static boolean isProbability(double value) {
        return value >= 0 && value <= 1;
    }

    public Population createBasePopulation(int year) {
        return new Population(year, baseMalePopulation, baseFemalePopulation);
    }

    //Base death probability for age, ages past the table use the terminal value
    public double getMortality(Sex sex, int age) {
        double[] mortality = sex == Sex.MALE ? maleMortality : femaleMortality;
        return mortality[Math.max(0, Math.min(age, Population.OLDEST_COHORT_AGE))];
    }

    public double getFertility(int age) {
        if (age < 0 || age > Population.OLDEST_COHORT_AGE) return 0;
        return fertility[age];
    }

    //Total fertility at which births follow the age-specific table unscaled
    public double getBaselineFertilityRate() {
        return baselineFertilityRate;
    }

    public List<AgeBand> getMigrationProfile(Sex sex) {
        return Collections.unmodifiableList(sex == Sex.MALE ? maleMigrationProfile : femaleMigrationProfile);
    }

    public double getEmploymentRate(int age) {
        if (age < 0 || age > Population.OLDEST_COHORT_AGE) return 0;
        return employmentRate[age];
    }

    public List<AgeBand> getHealthcareMultipliers() {
        return healthcareMultipliers;
    }

    public double getSexRatioAtBirth() {
        return sexRatioAtBirth;
    }

    public double getMigrationMaleShare() {
        return migrationMaleShare;
    }
}
