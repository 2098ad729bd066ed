import java.util.List;
import java.util.Optional;

//Ordered, append-only result of one projection run
public final class Projection {
    private final SimulationParameters parameters;
    private final List<YearRecord> years;
    private final List<BalanceValidator.BalanceCheck> balanceChecks;

    public Projection(SimulationParameters parameters, List<YearRecord> years, List<BalanceValidator.BalanceCheck> balanceChecks) {
        this.parameters = parameters;
        this.years = List.copyOf(years);
        this.balanceChecks = List.copyOf(balanceChecks);
    }

    public SimulationParameters getParameters() {
        return parameters;
    }

    public List<YearRecord> getYears() {
        return years;
    }

    public Optional<YearRecord> getYear(int year) {
        if (years.isEmpty()) return Optional.empty();
        int index = year - years.get(0).year();
        if (index < 0 || index >= years.size()) return Optional.empty();
        return Optional.of(years.get(index));
    }

    public YearRecord getFirstYear() {
        return years.get(0);
    }

    public YearRecord getLastYear() {
        return years.get(years.size() - 1);
    }

    //One check per transition between consecutive years
    public List<BalanceValidator.BalanceCheck> getBalanceChecks() {
        return balanceChecks;
    }

    public boolean isBalanced() {
        return balanceChecks.stream().allMatch(BalanceValidator.BalanceCheck::isBalanced);
    }
}
