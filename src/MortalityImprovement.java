//Annual rate of decrease in age-specific mortality, by sex
public record MortalityImprovement(double male, double female) {
    public double rate(Sex sex) {
        return sex == Sex.MALE ? male : female;
    }
}
