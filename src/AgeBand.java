//Value attached to ages minAge through maxAge inclusive
public record AgeBand(int minAge, int maxAge, double value) {
    public AgeBand {
        if (minAge < 0 || maxAge < minAge) {
            throw new IllegalArgumentException("Invalid age band " + minAge + "-" + maxAge);
        }
    }

    public boolean contains(int age) {
        return age >= minAge && age <= maxAge;
    }
}
