import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ReferenceDataTest {

    @Test
    void bundledTablesLoad() {
        ReferenceData referenceData = ReferenceData.loadDefault();
        Population base = referenceData.createBasePopulation(2024);
        assertEquals(2024, base.getYear());
        assertEquals(10_749_635, base.getTotalPopulation());
        assertEquals(1.05, referenceData.getSexRatioAtBirth());
        assertEquals(0.48, referenceData.getMigrationMaleShare());
        assertEquals(0.70, referenceData.getMortality(Sex.MALE, 100));
        assertEquals(0.65, referenceData.getMortality(Sex.FEMALE, 100));
        assertEquals(0.70, referenceData.getMortality(Sex.MALE, 130));
    }

    @Test
    void baselineFertilityComesFromConfiguration() {
        assertEquals(1.40, ReferenceData.loadDefault().getBaselineFertilityRate());
    }

    @Test
    void baselineFertilityMustBePositive() {
        assertThrows(ReferenceDataException.class, () -> ReferenceDataFixtures.withBaselineFertility(10, 0));
        assertThrows(ReferenceDataException.class, () -> ReferenceDataFixtures.withBaselineFertility(10, Double.NaN));
    }

    @Test
    void migrationProfileNeedsWeightBelowTerminalAge() {
        assertThrows(ReferenceDataException.class,
                () -> ReferenceDataFixtures.withMigrationProfile(10, List.of(new AgeBand(100, 100, 1.0))));
        assertThrows(ReferenceDataException.class,
                () -> ReferenceDataFixtures.withMigrationProfile(10, List.of(new AgeBand(0, 49, 0.0))));
        assertThrows(ReferenceDataException.class,
                () -> ReferenceDataFixtures.withMigrationProfile(10, List.of(new AgeBand(0, 49, 1.0), new AgeBand(50, 99, -0.1))));
    }

    @Test
    void openMigrationGroupEndsBelowTerminalAge() {
        List<AgeBand> profile = ReferenceData.loadDefault().getMigrationProfile(Sex.FEMALE);
        assertEquals(17, profile.size());
        AgeBand oldest = profile.get(profile.size() - 1);
        assertEquals(80, oldest.minAge());
        assertEquals(99, oldest.maxAge());
    }

    @Test
    void openHealthcareGroupReachesTerminalAge() {
        List<AgeBand> healthcare = ReferenceData.loadDefault().getHealthcareMultipliers();
        assertEquals(100, healthcare.get(healthcare.size() - 1).maxAge());
    }

    @Test
    void missingConfigurationFails() {
        assertThrows(ReferenceDataException.class, () -> ReferenceData.load("no-such-reference.properties"));
    }

    @Test
    void tablesMustCoverEveryAge() {
        long[] shortPopulation = new long[100];
        double[] mortality = new double[ReferenceDataFixtures.AGES];
        double[] zeros = new double[ReferenceDataFixtures.AGES];
        assertThrows(ReferenceDataException.class, () -> new ReferenceData(shortPopulation, new long[ReferenceDataFixtures.AGES],
                mortality, mortality, zeros, List.of(), List.of(), zeros, List.of(), 1.05, 0.5, 1.4));
    }

    @Test
    void deathProbabilitiesMustBeProbabilities() {
        long[] population = new long[ReferenceDataFixtures.AGES];
        double[] mortality = new double[ReferenceDataFixtures.AGES];
        mortality[40] = 1.2;
        double[] zeros = new double[ReferenceDataFixtures.AGES];
        assertThrows(ReferenceDataException.class, () -> new ReferenceData(population, population,
                mortality, zeros, zeros, List.of(), List.of(), zeros, List.of(), 1.05, 0.5, 1.4));
    }

    @Test
    void tablesLoadFromTheFileSystem(@TempDir Path directory) throws IOException {
        Path configuration = writeTables(directory, 100);
        ReferenceData referenceData = ReferenceData.load(configuration.toString());
        assertEquals(2 * 101 * 7, referenceData.createBasePopulation(2024).getTotalPopulation());
        assertEquals(0.002, referenceData.getFertility(20), 1e-12);
        assertEquals(0.5, referenceData.getEmploymentRate(30));
        assertEquals(0, referenceData.getEmploymentRate(10));
        assertEquals(0.5, referenceData.getMigrationMaleShare());
        assertEquals(1.6, referenceData.getBaselineFertilityRate());
    }

    @Test
    void missingAgeInPopulationTableFails(@TempDir Path directory) throws IOException {
        Path configuration = writeTables(directory, 99);
        ReferenceDataException exception = assertThrows(ReferenceDataException.class,
                () -> ReferenceData.load(configuration.toString()));
        assertTrue(exception.getMessage().contains("Missing age 100"), exception.getMessage());
    }

    @Test
    void malformedNumberFails(@TempDir Path directory) throws IOException {
        Path configuration = writeTables(directory, 100);
        Files.writeString(directory.resolve("fertility.csv"), "Age,Rate\n20,two\n", StandardCharsets.UTF_8);
        assertThrows(ReferenceDataException.class, () -> ReferenceData.load(configuration.toString()));
    }

    //Writes a complete set of small tables, population rows through lastAge
    private static Path writeTables(Path directory, int lastAge) throws IOException {
        StringBuilder population = new StringBuilder("Age,Male,Female\n");
        StringBuilder mortality = new StringBuilder("Age,Male,Female\n");
        for (int age = 0; age <= 100; age++) {
            if (age <= lastAge) {
                population.append(age).append(",7,7\n");
            }
            mortality.append(age).append(age == 100 ? ",0.7,0.65\n" : ",0.01,0.01\n");
        }
        Files.writeString(directory.resolve("population.csv"), population.toString(), StandardCharsets.UTF_8);
        Files.writeString(directory.resolve("mortality.csv"), mortality.toString(), StandardCharsets.UTF_8);
        Files.writeString(directory.resolve("fertility.csv"), "Age,Rate\n20,2\n30,3\n", StandardCharsets.UTF_8);
        Files.writeString(directory.resolve("migration.csv"), "Group,Male,Female\n0-49,0.6,0.6\n50+,0.4,0.4\n", StandardCharsets.UTF_8);
        Files.writeString(directory.resolve("employment.csv"), "Group,Rate\n0-14,0\n15+,0.5\n", StandardCharsets.UTF_8);
        Files.writeString(directory.resolve("healthcare.csv"), "Group,Multiplier\n0-64,1\n65+,3\n", StandardCharsets.UTF_8);
        Path configuration = directory.resolve("reference.properties");
        Files.writeString(configuration, String.join("\n",
                "table.population=" + directory.resolve("population.csv"),
                "table.mortality=" + directory.resolve("mortality.csv"),
                "table.fertility=" + directory.resolve("fertility.csv"),
                "table.migration=" + directory.resolve("migration.csv"),
                "table.employment=" + directory.resolve("employment.csv"),
                "table.healthcare=" + directory.resolve("healthcare.csv"),
                "birth.sex.ratio=1.05",
                "migration.male.share=0.5",
                "fertility.baseline.tfr=1.6"), StandardCharsets.UTF_8);
        return configuration;
    }
}
