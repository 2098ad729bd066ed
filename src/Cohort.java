//Single year of age split by sex, age 100 holds everyone aged 100 and over
public record Cohort(int age, long male, long female) {
    public Cohort {
        if (age < 0 || age > Population.OLDEST_COHORT_AGE) {
            throw new IllegalArgumentException("Cohort age " + age + " outside 0.." + Population.OLDEST_COHORT_AGE);
        }
        if (male < 0 || female < 0) {
            throw new IllegalArgumentException("Negative count in cohort aged " + age + ": male " + male + ", female " + female);
        }
    }

    public long total() {
        return male + female;
    }

    public long count(Sex sex) {
        return sex == Sex.MALE ? male : female;
    }
}
