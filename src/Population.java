import org.apache.commons.math3.stat.descriptive.moment.Mean;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

//Immutable population snapshot for one year
public final class Population {
    //Final cohort includes all ages >= this age
    public static final int OLDEST_COHORT_AGE = 100;

    //Current year
    private final int year;

    //Age -> population with 1 year age increments
    private final long[] malePyramid;
    private final long[] femalePyramid;

    public Population(int year, long[] malePyramid, long[] femalePyramid) {
        if (malePyramid.length != OLDEST_COHORT_AGE + 1 || femalePyramid.length != OLDEST_COHORT_AGE + 1) {
            throw new IllegalArgumentException("Pyramids must cover ages 0.." + OLDEST_COHORT_AGE + " exactly once, got "
                    + malePyramid.length + " male and " + femalePyramid.length + " female cohorts");
        }
        for (int age = 0; age <= OLDEST_COHORT_AGE; age++) {
            if (malePyramid[age] < 0 || femalePyramid[age] < 0) {
                throw new IllegalArgumentException("Negative population at age " + age + " in year " + year);
            }
        }
        this.year = year;
        this.malePyramid = malePyramid.clone();
        this.femalePyramid = femalePyramid.clone();
    }

    //Builds snapshot from cohorts given in any order, each age 0..100 must appear exactly once
    public static Population fromCohorts(int year, List<Cohort> cohorts) {
        long[] malePyramid = new long[OLDEST_COHORT_AGE + 1];
        long[] femalePyramid = new long[OLDEST_COHORT_AGE + 1];
        boolean[] seen = new boolean[OLDEST_COHORT_AGE + 1];
        for (Cohort cohort : cohorts) {
            if (seen[cohort.age()]) {
                throw new IllegalArgumentException("Duplicate cohort aged " + cohort.age());
            }
            seen[cohort.age()] = true;
            malePyramid[cohort.age()] = cohort.male();
            femalePyramid[cohort.age()] = cohort.female();
        }
        for (int age = 0; age <= OLDEST_COHORT_AGE; age++) {
            if (!seen[age]) {
                throw new IllegalArgumentException("Missing cohort aged " + age);
            }
        }
        return new Population(year, malePyramid, femalePyramid);
    }

    public int getYear() {
        return year;
    }

    public long[] getMalePyramid() {
        return malePyramid.clone();
    }

    public long[] getFemalePyramid() {
        return femalePyramid.clone();
    }

    public long getCount(Sex sex, int age) {
        return sex == Sex.MALE ? malePyramid[age] : femalePyramid[age];
    }

    public Cohort getCohort(int age) {
        return new Cohort(age, malePyramid[age], femalePyramid[age]);
    }

    //Ordered youngest to oldest
    public List<Cohort> getCohorts() {
        List<Cohort> cohorts = new ArrayList<>(OLDEST_COHORT_AGE + 1);
        for (int age = 0; age <= OLDEST_COHORT_AGE; age++) {
            cohorts.add(getCohort(age));
        }
        return Collections.unmodifiableList(cohorts);
    }

    public long getMalePopulation() {
        return Arrays.stream(malePyramid).sum();
    }

    public long getFemalePopulation() {
        return Arrays.stream(femalePyramid).sum();
    }

    public long getTotalPopulation() {
        return getMalePopulation() + getFemalePopulation();
    }

    //Population aged minAge through maxAge inclusive
    public long getPopulationBetween(int minAge, int maxAge) {
        long population = 0;
        for (int age = Math.max(0, minAge); age <= Math.min(maxAge, OLDEST_COHORT_AGE); age++) {
            population += malePyramid[age] + femalePyramid[age];
        }
        return population;
    }

    //Youngest age at which the cumulative population reaches half the total
    public int getMedianAge() {
        long totalPopulation = getTotalPopulation();
        long cumulative = 0;
        for (int age = 0; age <= OLDEST_COHORT_AGE; age++) {
            cumulative += malePyramid[age] + femalePyramid[age];
            if (cumulative * 2 >= totalPopulation) {
                return age;
            }
        }
        return 0;
    }

    public double getMeanAge() {
        if (getTotalPopulation() == 0) {
            return 0;
        }
        double[] ages = new double[OLDEST_COHORT_AGE + 1];
        double[] weights = new double[OLDEST_COHORT_AGE + 1];
        for (int age = 0; age <= OLDEST_COHORT_AGE; age++) {
            ages[age] = age;
            weights[age] = malePyramid[age] + femalePyramid[age];
        }
        return new Mean().evaluate(ages, weights);
    }

    @Override
    public String toString() {
        return "Population{year=" + year + ", male=" + getMalePopulation() + ", female=" + getFemalePopulation() + "}";
    }
}
